package org.gsicoach;

import api.impl.handlers.HandlerFactory;
import app.CoachConfig;
import app.CoachServer;
import infrastructure.impl.CoachServiceImpl;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.gsicoach.NetTestUtils.get;
import static org.gsicoach.NetTestUtils.post;
import static org.gsicoach.NetTestUtils.sendRaw;
import static org.gsicoach.NetTestUtils.waitForPortOpen;
import static org.junit.jupiter.api.Assertions.*;

@TestMethodOrder(MethodOrderer.DisplayName.class)
class CoachServerTest {

    private CoachServiceImpl service;
    private CoachServer server;
    private ByteArrayOutputStream console;

    @BeforeEach
    void start() throws Exception {
        service = new CoachServiceImpl();
        console = new ByteArrayOutputStream();
        CoachConfig config = new CoachConfig("127.0.0.1", 0, 50L, 1024, true);
        server = new CoachServer(config, service, new HandlerFactory(service),
                new PrintStream(console, true, StandardCharsets.UTF_8));
        server.start();
        waitForPortOpen("127.0.0.1", server.port(), 5000);
    }

    @AfterEach
    void stop() throws Exception {
        server.close();
    }

    @Test
    @DisplayName("1) Empty request line → 400")
    void emptyRequest400() throws Exception {
        String resp = sendRaw(server.port(), "\r\n\r\n", null);
        assertTrue(resp.startsWith("HTTP/1.1 400 "), "Expected 400; got:\n" + resp);
    }

    @Test
    @DisplayName("2) POST game state → 200 and ingested")
    void postIngests() throws Exception {
        String resp = post(server.port(), "/", "{\"map\":{\"matchid\":\"1\",\"game_time\":95}}");
        assertTrue(resp.startsWith("HTTP/1.1 200 OK"), resp);
        assertTrue(resp.contains("\"accepted\":true"), resp);
        assertEquals(95, service.latest().orElseThrow().getGameClock());
    }

    @Test
    @DisplayName("3) Malformed JSON → 400, nothing stored")
    void malformed400() throws Exception {
        String resp = post(server.port(), "/", "{not json");
        assertTrue(resp.startsWith("HTTP/1.1 400 "), resp);
        assertEquals(0, service.ingestedCount());
    }

    @Test
    @DisplayName("4) Body above the limit → 413")
    void oversized413() throws Exception {
        // the declared length alone is enough; the server answers before reading a body
        String resp = sendRaw(server.port(),
                "POST / HTTP/1.1\r\nContent-Type: application/json\r\nContent-Length: 4096\r\n\r\n", null);
        assertTrue(resp.startsWith("HTTP/1.1 413 "), resp);
        assertEquals(0, service.ingestedCount());
    }

    @Test
    @DisplayName("5) Empty POST → 204")
    void emptyPost204() throws Exception {
        String resp = post(server.port(), "/", "");
        assertTrue(resp.startsWith("HTTP/1.1 204 "), resp);
    }

    @Test
    @DisplayName("6) GET /insights and /health after a POST")
    void insightsAndHealth() throws Exception {
        post(server.port(), "/", "{\"map\":{\"game_time\":346},\"player\":{\"last_hits\":10}}");

        String insights = get(server.port(), "/insights");
        assertTrue(insights.startsWith("HTTP/1.1 200 OK"), insights);
        assertTrue(insights.contains("Stack camps now!"), insights);

        String health = get(server.port(), "/health");
        assertTrue(health.contains("\"ingested\":1"), health);

        assertTrue(get(server.port(), "/nope").startsWith("HTTP/1.1 404 "));
    }

    @Test
    @DisplayName("7) Render thread prints the advisory frame")
    void renderPrintsFrame() throws Exception {
        post(server.port(), "/", "{\"map\":{\"game_time\":65}}");

        long end = System.currentTimeMillis() + 3000;
        while (System.currentTimeMillis() < end
                && !console.toString(StandardCharsets.UTF_8).contains("Game time 1:05")) {
            Thread.sleep(25);
        }
        String out = console.toString(StandardCharsets.UTF_8);
        assertTrue(out.contains("[Render] ===== Game time 1:05 ====="), out);
        assertTrue(out.contains("Early Game Phase:"), out);
    }

    @Test
    @DisplayName("8) Bare LF line endings are accepted")
    void bareLineFeeds() throws Exception {
        String resp = sendRaw(server.port(), "GET /health HTTP/1.1\nHost: x\n\n", null);
        assertTrue(resp.startsWith("HTTP/1.1 200 OK"), resp);
    }
}
