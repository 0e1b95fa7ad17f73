package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import domain.interfaces.ICoachService;
import org.gsicoach.insight.InsightReport;
import org.gsicoach.util.GameTime;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class InsightsHandler implements IHttpHandler {
    private final ICoachService service;
    private static final Gson gson = new GsonBuilder().serializeNulls().create();

    public InsightsHandler(ICoachService service) { this.service = service; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        Optional<InsightReport> report = service.report();
        if (report.isEmpty()) {
            res.json(404, "Not Found", "{\"error\":\"no game state received yet\"}");
            return;
        }
        InsightReport r = report.get();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("gameClock", r.gameClock());
        body.put("gameTime", GameTime.format(r.gameClock()));
        body.put("engagement", r.engagement().level().name());
        body.put("insights", r.lines());
        res.json(200, "OK", gson.toJson(body));
    }
}
