package org.projectstate.http;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.projectstate.interfaces.HttpHandler;

/**
 * DefaultHttpHandler implements low-level HTTP wire formatting for requests.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>Requests always carry {@code Content-Length}, even for empty bodies.</li>
 *   <li>Responses are read until the server closes the connection ({@code Connection: close}).</li>
 * </ul>
 */
public class DefaultHttpHandler implements HttpHandler {

    /**
     * Builds a raw HTTP/1.1 request string with headers.
     *
     * @param method         HTTP method (e.g. "GET", "PATCH").
     * @param path           resource path including any query string (must start with '/').
     * @param host           target host.
     * @param port           target port.
     * @param extraHeaders   optional map of additional headers (can be null).
     * @param contentLength  payload size in bytes.
     * @return complete HTTP request head ready to send.
     */
    @Override
    public String buildRequest(String method, String path, String host, int port,
                               Map<String, String> extraHeaders, int contentLength) {
        StringBuilder sb = new StringBuilder();
        sb.append(method).append(" ").append(path).append(" HTTP/1.1\r\n");
        sb.append("Host: ").append(host).append(":").append(port).append("\r\n");

        if (extraHeaders != null) {
            for (Map.Entry<String, String> e : extraHeaders.entrySet()) {
                sb.append(e.getKey()).append(": ").append(e.getValue()).append("\r\n");
            }
        }

        sb.append("Content-Length: ").append(contentLength).append("\r\n\r\n");
        return sb.toString();
    }

    /**
     * Writes the full request (headers + body) to the output stream.
     *
     * @param out     destination stream.
     * @param headers request headers built via {@link #buildRequest}.
     * @param body    request payload; may be empty for GET and DELETE.
     * @throws IOException if I/O fails during transmission.
     */
    @Override
    public void send(OutputStream out, String headers, byte[] body) throws IOException {
        out.write(headers.getBytes(StandardCharsets.UTF_8));
        if (body != null && body.length > 0) {
            out.write(body);
        }
        out.flush();
    }

    /** Reads the entire raw HTTP response as UTF-8 text. */
    @Override
    public String readRawResponse(InputStream in) throws IOException {
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }

    @Override
    public String reason(int code) {
        return switch (code) {
            case OK -> "OK";
            case CREATED -> "Created";
            case NO_CONTENT -> "No Content";
            case BAD_REQUEST -> "Bad Request";
            case UNAUTHORIZED -> "Unauthorized";
            case FORBIDDEN -> "Forbidden";
            case NOT_FOUND -> "Not Found";
            case CONFLICT -> "Conflict";
            case PAYLOAD_TOO_LARGE -> "Payload Too Large";
            case TOO_MANY_REQUESTS -> "Too Many Requests";
            case INTERNAL_SERVER_ERROR -> "Internal Server Error";
            case SERVICE_UNAVAILABLE -> "Service Unavailable";
            default -> "Unknown";
        };
    }
}
