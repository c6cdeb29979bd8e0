package org.projectstate.interfaces.http;

/** Minimal response contract */
public interface HttpResponse {
    void status(int code);
    void header(String name, String value);
    void body(String text);

    /** Sets status, JSON content type and body in one call. */
    default void json(int code, String json) {
        status(code);
        header("Content-Type", "application/json; charset=utf-8");
        body(json);
    }
}
