package api.impl;

import api.interfaces.http.HttpRequest;

import java.util.Locale;
import java.util.Map;

public class MinimalHttpRequest implements HttpRequest {
    private final String method;
    private final String path;
    private final String query;
    private final String version;
    private final Map<String,String> headers;   // keys stored lower-case
    private final byte[] body;

    public MinimalHttpRequest(String method, String target, String version,
                              Map<String,String> headers, byte[] body){
        this.method = method == null ? "" : method.toUpperCase(Locale.ROOT);
        String t = (target == null || target.isEmpty()) ? "/" : target;
        int q = t.indexOf('?');
        this.path = q < 0 ? t : t.substring(0, q);
        this.query = q < 0 ? "" : t.substring(q + 1);
        this.version = version;
        this.headers = headers;
        this.body = body == null ? new byte[0] : body;
    }

    @Override public String method(){ return method; }
    @Override public String path(){ return path; }
    @Override public String query(){ return query; }
    @Override public String version(){ return version; }

    @Override
    public String header(String name){
        if (name == null) return null;
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    @Override public byte[] body() { return body; }
}
