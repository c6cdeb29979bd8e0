package org.projectstate.interfaces;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Map;

/**
 * Wire-level contract for sending and receiving HTTP/1.1 messages.
 * No routing or persistence logic lives here.
 */
public interface HttpHandler {

    int OK = 200;
    int CREATED = 201;
    int NO_CONTENT = 204;
    int BAD_REQUEST = 400;
    int UNAUTHORIZED = 401;
    int FORBIDDEN = 403;
    int NOT_FOUND = 404;
    int CONFLICT = 409;
    int PAYLOAD_TOO_LARGE = 413;
    int TOO_MANY_REQUESTS = 429;
    int INTERNAL_SERVER_ERROR = 500;
    int SERVICE_UNAVAILABLE = 503;

    /** Build full HTTP/1.1 request headers (no body). */
    String buildRequest(String method,
                        String path,
                        String host,
                        int port,
                        Map<String, String> extraHeaders,
                        int contentLength);

    /** Send prepared request headers and optional body. */
    void send(OutputStream out, String requestHeaders, byte[] body) throws IOException;

    /** Read entire HTTP response (status line, headers, body) into a single string. */
    String readRawResponse(InputStream in) throws IOException;

    /** Map HTTP status codes to reason phrases. */
    String reason(int code);

    /** True for statuses worth retrying (throttling and transient server failures). */
    default boolean isRetryable(int code) {
        return code == TOO_MANY_REQUESTS || code == INTERNAL_SERVER_ERROR || code == SERVICE_UNAVAILABLE;
    }
}
