package org.gsicoach;

import api.impl.HttpResponseImpl;
import api.impl.HttpResponseWriter;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HttpResponseWriterTest {

    @Test
    void writesStatusHeadersAndBody() throws IOException {
        HttpResponseImpl res = new HttpResponseImpl();
        res.json(200, "OK", "{\"accepted\":true}");

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        HttpResponseWriter.write(out, res);
        String sent = out.toString(StandardCharsets.UTF_8);

        assertTrue(sent.startsWith("HTTP/1.1 200 OK\r\n"));
        assertTrue(sent.contains("Content-Type: application/json; charset=utf-8\r\n"));
        assertTrue(sent.contains("Content-Length: 17\r\n"));
        assertTrue(sent.contains("Connection: close\r\n"));
        assertTrue(sent.endsWith("\r\n\r\n{\"accepted\":true}"));
    }

    @Test
    void headerNamesAreCaseInsensitive() {
        HttpResponseImpl res = new HttpResponseImpl();
        res.header("content-type", "text/plain");
        res.header("Content-Type", "application/json");
        assertEquals(1, res.headers().size());
        assertEquals("application/json", res.header("CONTENT-TYPE"));

        res.header("Content-Type", null);
        assertNull(res.header("content-type"));
    }

    @Test
    void invalidStatusRejected() {
        HttpResponseImpl res = new HttpResponseImpl();
        assertThrows(IllegalArgumentException.class, () -> res.status(42, "?"));
        assertThrows(IllegalArgumentException.class, () -> res.header(" ", "x"));
    }

    @Test
    void plainTextForEarlyFailures() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        HttpResponseWriter.writePlain(out, 413, "Payload Too Large", "limit is 10 bytes");
        String sent = out.toString(StandardCharsets.UTF_8);
        assertTrue(sent.startsWith("HTTP/1.1 413 Payload Too Large\r\n"));
        assertTrue(sent.endsWith("limit is 10 bytes"));
    }
}
