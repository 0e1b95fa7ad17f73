package org.gsicoach;

import api.impl.HttpResponseImpl;
import api.impl.MinimalHttpRequest;
import api.impl.handlers.GameStateHandler;
import api.impl.handlers.HandlerFactory;
import api.impl.handlers.HealthHandler;
import api.impl.handlers.InsightsHandler;
import api.impl.handlers.NotFoundHandler;
import api.interfaces.IHandlerFactory;
import api.interfaces.IHttpHandler;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import infrastructure.impl.CoachServiceImpl;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HandlersTest {

    private static MinimalHttpRequest req(String method, String target, String body) {
        byte[] bytes = body == null ? new byte[0] : body.getBytes(StandardCharsets.UTF_8);
        return new MinimalHttpRequest(method, target, "HTTP/1.1", Map.of(), bytes);
    }

    private static HttpResponseImpl run(IHandlerFactory f, MinimalHttpRequest req) throws Exception {
        HttpResponseImpl res = new HttpResponseImpl();
        IHttpHandler h = f.route(req);
        h.handle(req, res);
        return res;
    }

    @Test
    void routing() {
        IHandlerFactory f = new HandlerFactory(new CoachServiceImpl());
        assertInstanceOf(GameStateHandler.class, f.route(req("POST", "/", "{}")));
        assertInstanceOf(GameStateHandler.class, f.route(req("post", "/gsi?x=1", "{}")));
        assertInstanceOf(InsightsHandler.class, f.route(req("GET", "/insights", null)));
        assertInstanceOf(InsightsHandler.class, f.route(req("GET", "/insights?pretty", null)));
        assertInstanceOf(HealthHandler.class, f.route(req("GET", "/health", null)));
        assertInstanceOf(NotFoundHandler.class, f.route(req("GET", "/", null)));
        assertInstanceOf(NotFoundHandler.class, f.route(req("PUT", "/", "{}")));
    }

    @Test
    void postAcceptsThenRejectsStale() throws Exception {
        CoachServiceImpl svc = new CoachServiceImpl();
        IHandlerFactory f = new HandlerFactory(svc);

        HttpResponseImpl ok = run(f, req("POST", "/", "{\"map\":{\"game_time\":120}}"));
        assertEquals(200, ok.status());
        JsonObject body = JsonParser.parseString(ok.bodyText()).getAsJsonObject();
        assertTrue(body.get("accepted").getAsBoolean());
        assertEquals(120, body.get("gameClock").getAsInt());

        HttpResponseImpl stale = run(f, req("POST", "/", "{\"map\":{\"game_time\":60}}"));
        assertEquals(200, stale.status());
        JsonObject s = JsonParser.parseString(stale.bodyText()).getAsJsonObject();
        assertFalse(s.get("accepted").getAsBoolean());
        assertEquals("stale", s.get("reason").getAsString());
        assertEquals(1, svc.ingestedCount());
    }

    @Test
    void emptyBodyIs204AndMalformedIs400() throws Exception {
        CoachServiceImpl svc = new CoachServiceImpl();
        IHandlerFactory f = new HandlerFactory(svc);

        assertEquals(204, run(f, req("POST", "/", "")).status());

        HttpResponseImpl bad = run(f, req("POST", "/", "{\"map\":"));
        assertEquals(400, bad.status());
        assertTrue(bad.bodyText().contains("invalid json"));
        assertEquals(0, svc.ingestedCount());
    }

    @Test
    void insightsBeforeAndAfterFirstSnapshot() throws Exception {
        CoachServiceImpl svc = new CoachServiceImpl();
        IHandlerFactory f = new HandlerFactory(svc);

        assertEquals(404, run(f, req("GET", "/insights", null)).status());

        run(f, req("POST", "/", "{\"map\":{\"game_time\":346},\"player\":{\"last_hits\":10}}"));
        HttpResponseImpl res = run(f, req("GET", "/insights", null));
        assertEquals(200, res.status());
        assertTrue(res.headers().get("Content-Type").startsWith("application/json"));

        JsonObject body = JsonParser.parseString(res.bodyText()).getAsJsonObject();
        assertEquals(346, body.get("gameClock").getAsInt());
        assertEquals("5:46", body.get("gameTime").getAsString());
        assertEquals("QUIET", body.get("engagement").getAsString());
        assertEquals("Early Game Phase:", body.getAsJsonArray("insights").get(0).getAsString());
    }

    @Test
    void healthReportsCounters() throws Exception {
        CoachServiceImpl svc = new CoachServiceImpl();
        IHandlerFactory f = new HandlerFactory(svc);

        JsonObject empty = JsonParser.parseString(run(f, req("GET", "/health", null)).bodyText()).getAsJsonObject();
        assertEquals("ok", empty.get("status").getAsString());
        assertEquals(0, empty.get("ingested").getAsLong());
        assertFalse(empty.has("gameClock"));

        run(f, req("POST", "/", "{\"map\":{\"game_time\":30}}"));
        JsonObject after = JsonParser.parseString(run(f, req("GET", "/health", null)).bodyText()).getAsJsonObject();
        assertEquals(1, after.get("ingested").getAsLong());
        assertEquals(30, after.get("gameClock").getAsInt());
    }

    @Test
    void unknownRouteIs404() throws Exception {
        HttpResponseImpl res = run(new HandlerFactory(new CoachServiceImpl()), req("DELETE", "/x", null));
        assertEquals(404, res.status());
        assertTrue(res.bodyText().contains("DELETE /x"));
    }
}
