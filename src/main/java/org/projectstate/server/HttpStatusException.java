package org.projectstate.server;

/**
 * Thrown by handlers to answer with a specific status. The server writes the
 * message as {@code {"detail": "..."}}.
 */
public class HttpStatusException extends Exception {

    private final int status;

    public HttpStatusException(int status, String detail) {
        super(detail);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
