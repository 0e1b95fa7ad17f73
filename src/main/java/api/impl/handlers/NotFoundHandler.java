package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

public class NotFoundHandler implements IHttpHandler {
    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        String route = (req.method() + " " + req.path()).replace("\"", "'");
        res.json(404, "Not Found", "{\"error\":\"no route for " + route + "\"}");
    }
}
