package org.projectstate.http;

import org.projectstate.interfaces.HttpHandler;
import org.projectstate.interfaces.http.HttpResponse;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Response buffered in memory until the handler returns, then written in one go by
 * {@link HttpResponseWriter}. Header names keep the case they were first set with;
 * setting the same name again in another case replaces the value.
 */
public class HttpResponseImpl implements HttpResponse {

    private int status = HttpHandler.OK;
    private final Map<String, String> names = new LinkedHashMap<>();   // lower-case -> as set
    private final Map<String, String> values = new LinkedHashMap<>();  // as set -> value
    private byte[] payload = new byte[0];

    @Override
    public void status(int code) {
        status = code;
    }

    @Override
    public void header(String name, String value) {
        String key = name.toLowerCase(Locale.ROOT);
        String previous = names.putIfAbsent(key, name);
        values.put(previous == null ? name : previous, value);
    }

    @Override
    public void body(String text) {
        payload = text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
    }

    public boolean hasHeader(String name) {
        return names.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public int status() {
        return status;
    }

    public Map<String, String> headers() {
        return Collections.unmodifiableMap(values);
    }

    public byte[] body() {
        return payload;
    }
}
