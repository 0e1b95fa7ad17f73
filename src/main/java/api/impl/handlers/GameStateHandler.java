package api.impl.handlers;

import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import domain.interfaces.ICoachService;
import domain.model.Snapshot;
import infrastructure.gsi.SnapshotParser;

import java.util.LinkedHashMap;
import java.util.Map;

/** Receives one GSI POST, converts it to a snapshot and hands it to the coach. */
public class GameStateHandler implements IHttpHandler {
    private static final Gson gson = new GsonBuilder().serializeNulls().create();

    private final ICoachService service;
    private final SnapshotParser parser;

    public GameStateHandler(ICoachService service, SnapshotParser parser) {
        this.service = service;
        this.parser = parser;
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        String payload = req.bodyText().trim();

        // 204 No Content if body empty
        if (payload.isEmpty()) {
            res.status(204, "No Content");
            res.body("");
            return;
        }

        Snapshot snapshot;
        try {
            snapshot = parser.parse(payload);
        } catch (IllegalArgumentException ex) {
            System.err.println("[Ingest] rejected payload: " + ex.getMessage());
            res.json(400, "Bad Request", "{\"error\":\"invalid json\"}");
            return;
        }

        boolean accepted = service.ingest(snapshot);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("accepted", accepted);
        body.put("gameClock", snapshot.getGameClock());
        if (!accepted) body.put("reason", "stale");
        res.json(200, "OK", gson.toJson(body));
    }
}
