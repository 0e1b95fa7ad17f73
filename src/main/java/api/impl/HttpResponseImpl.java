package api.impl;

import api.interfaces.http.HttpResponse;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mutable response filled in by one handler and serialized afterwards by
 * {@link HttpResponseWriter}. Header names are case-insensitive.
 */
public class HttpResponseImpl implements HttpResponse {
    private static final byte[] EMPTY = new byte[0];

    private int status = 200;
    private String reason = "OK";
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private byte[] body = EMPTY;

    @Override
    public void status(int code, String reason) {
        if (code < 100 || code > 599) {
            throw new IllegalArgumentException("not an HTTP status: " + code);
        }
        this.status = code;
        this.reason = reason == null ? "" : reason;
    }

    @Override
    public void header(String name, String value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("header name must not be blank");
        }
        if (value == null) headers.remove(name);
        else headers.put(name, value);
    }

    @Override
    public void body(String text) {
        this.body = text == null ? EMPTY : text.getBytes(StandardCharsets.UTF_8);
    }

    public int status() { return status; }
    public String reason() { return reason; }

    /** Header value regardless of the name's case, or null. */
    public String header(String name) { return headers.get(name); }

    public Map<String, String> headers() { return Collections.unmodifiableMap(headers); }
    public byte[] body() { return body; }
    public String bodyText() { return new String(body, StandardCharsets.UTF_8); }
}
