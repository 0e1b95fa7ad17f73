package api.interfaces;

import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

/**
 * Serves one routed request. Bad client input is answered with a 4xx status on
 * {@code res}; anything thrown is turned into a 500 by the server loop.
 */
@FunctionalInterface
public interface IHttpHandler {
    void handle(HttpRequest req, HttpResponse res);
}
