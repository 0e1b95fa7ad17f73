package api.impl;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

public final class HttpResponseWriter {

    private HttpResponseWriter() {}

    public static void write(OutputStream out, HttpResponseImpl res) throws IOException {
        // one response per connection; the length always reflects the final body
        res.header("Content-Length", String.valueOf(res.body().length));
        if (res.header("Connection") == null) res.header("Connection", "close");

        StringBuilder head = new StringBuilder(128);
        head.append("HTTP/1.1 ").append(res.status()).append(' ').append(res.reason()).append("\r\n");
        for (Map.Entry<String, String> e : res.headers().entrySet()) {
            head.append(e.getKey()).append(": ").append(e.getValue()).append("\r\n");
        }
        head.append("\r\n");

        out.write(head.toString().getBytes(StandardCharsets.US_ASCII));
        out.write(res.body());
        out.flush();
    }

    /** Plain-text response for failures detected before a handler is chosen. */
    public static void writePlain(OutputStream out, int code, String reason, String text) throws IOException {
        HttpResponseImpl res = new HttpResponseImpl();
        res.status(code, reason);
        res.header("Content-Type", "text/plain; charset=utf-8");
        res.body(text);
        write(out, res);
    }
}
