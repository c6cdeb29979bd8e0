package org.projectstate.interfaces.http;

import java.util.Map;

/** Minimal request contract */
public interface HttpRequest {
    String method();

    /** Path without the query string. */
    String path();

    String version();

    /** Case-insensitive header lookup; {@code null} when absent. */
    String header(String name);

    Map<String, String> query();

    byte[] body();
}
