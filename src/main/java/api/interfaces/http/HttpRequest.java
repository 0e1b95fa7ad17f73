package api.interfaces.http;

import java.nio.charset.StandardCharsets;

/** Minimal request contract */
public interface HttpRequest {
    String method();
    String path();          // without the query string
    String query();         // raw query string, "" when absent

    String version();
    String header(String name);
    byte[] body();

    default String bodyText() {
        byte[] b = body();
        return b == null ? "" : new String(b, StandardCharsets.UTF_8);
    }
}
