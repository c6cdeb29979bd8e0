package org.projectstate.http;

import org.projectstate.interfaces.http.HttpRequest;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class MinimalHttpRequest implements HttpRequest {
    private final String method;
    private final String path;
    private final String version;
    private final Map<String, String> headers;
    private final Map<String, String> query;
    private final byte[] body;

    /**
     * @param target  request target as sent, e.g. {@code /projects?limit=10}
     * @param headers header map holding both the original and the lower-cased name
     */
    public MinimalHttpRequest(String method, String target, String version,
                              Map<String, String> headers, byte[] body) {
        this.method = method;
        int q = target.indexOf('?');
        this.path = q >= 0 ? target.substring(0, q) : target;
        this.query = q >= 0 ? parseQuery(target.substring(q + 1)) : Collections.emptyMap();
        this.version = version;
        this.headers = headers;
        this.body = body;
    }

    @Override public String method() { return method; }
    @Override public String path() { return path; }
    @Override public String version() { return version; }
    @Override public Map<String, String> query() { return query; }
    @Override public byte[] body() { return body; }

    @Override
    public String header(String name) {
        if (name == null) return null;
        return headers.getOrDefault(name, headers.get(name.toLowerCase()));
    }

    /** Splits {@code a=1&b=x%20y}; later duplicates win. */
    static Map<String, String> parseQuery(String raw) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String pair : raw.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String k = eq >= 0 ? pair.substring(0, eq) : pair;
            String v = eq >= 0 ? pair.substring(eq + 1) : "";
            out.put(URLDecoder.decode(k, StandardCharsets.UTF_8), URLDecoder.decode(v, StandardCharsets.UTF_8));
        }
        return out;
    }
}
