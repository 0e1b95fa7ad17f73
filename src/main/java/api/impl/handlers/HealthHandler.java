package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import com.google.gson.Gson;
import domain.interfaces.ICoachService;
import domain.model.Snapshot;

import java.util.LinkedHashMap;
import java.util.Map;

public class HealthHandler implements IHttpHandler {
    private static final Gson gson = new Gson();
    private final ICoachService svc;

    public HealthHandler(ICoachService service) { this.svc = service; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("ingested", svc.ingestedCount());
        svc.latest().map(Snapshot::getGameClock).ifPresent(c -> body.put("gameClock", c));
        res.json(200, "OK", gson.toJson(body));
    }
}
