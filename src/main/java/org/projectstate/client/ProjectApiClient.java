package org.projectstate.client;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.projectstate.exceptions.NetworkFailureException;
import org.projectstate.http.RawHttpResponse;
import org.projectstate.interfaces.HttpHandler;
import org.projectstate.interfaces.RetryExecutor;
import org.projectstate.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends one JSON request per connection to the project backend.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>429, 500 and 503 answers are retried through the {@link RetryExecutor}; a
 *       {@code Retry-After} header is honoured, capped at 10 s.</li>
 *   <li>When retries run out on such a status the last response is returned, so the
 *       caller still sees the server's status and detail.</li>
 *   <li>Transport failures surface as {@link NetworkFailureException}.</li>
 * </ul>
 */
public class ProjectApiClient {

    private static final Logger logger = LoggerFactory.getLogger(ProjectApiClient.class);

    private static final long MAX_RETRY_AFTER_MS = 10_000L;
    private static final int SOCKET_TIMEOUT_MS = 15_000;

    private final String host;
    private final int port;
    private final RetryExecutor retry;
    private final HttpHandler http;

    /** @param endpoint {@code host:port} or {@code http://host:port} */
    public ProjectApiClient(String endpoint, RetryExecutor retry, HttpHandler http) {
        String hostPort = endpoint.replaceFirst("^https?://", "");
        int slash = hostPort.indexOf('/');
        if (slash >= 0) hostPort = hostPort.substring(0, slash);
        int colon = hostPort.lastIndexOf(':');
        this.host = colon > 0 ? hostPort.substring(0, colon) : hostPort;
        this.port = colon > 0 ? Integer.parseInt(hostPort.substring(colon + 1)) : 4567;
        this.retry = retry;
        this.http = http;
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public HttpHandler http() {
        return http;
    }

    /**
     * @param headers extra request headers, may be {@code null}
     * @param body    serialized with Gson when not already a JSON tree; {@code null} for none
     */
    public RawHttpResponse send(String method, String path, Map<String, String> headers, Object body)
            throws NetworkFailureException {
        byte[] payload = body == null ? new byte[0]
                : (body instanceof JsonElement tree ? tree.toString() : Json.GSON.toJson(body))
                        .getBytes(StandardCharsets.UTF_8);
        Map<String, String> extra = new LinkedHashMap<>();
        extra.put("User-Agent", "ProjectStateClient/1.0");
        extra.put("Accept", "application/json");
        if (payload.length > 0) extra.put("Content-Type", "application/json; charset=utf-8");
        if (headers != null) extra.putAll(headers);
        String head = http.buildRequest(method, path, host, port, extra, payload.length);

        try {
            return retry.execute(() -> exchange(head, payload));
        } catch (RetryableStatusException e) {
            logger.warn("{} {} still answering {} after retries", method, path, e.response.status());
            return e.response;
        } catch (IOException e) {
            throw new NetworkFailureException(method + " " + path + " failed: " + e.getMessage(), e);
        } catch (Exception e) {
            throw new NetworkFailureException(method + " " + path + " failed", e);
        }
    }

    private RawHttpResponse exchange(String head, byte[] payload) throws IOException {
        try (Socket s = new Socket(host, port);
             OutputStream out = s.getOutputStream();
             InputStream in = s.getInputStream()) {
            s.setSoTimeout(SOCKET_TIMEOUT_MS);
            http.send(out, head, payload);
            RawHttpResponse r = RawHttpResponse.parse(http.readRawResponse(in));

            if (http.isRetryable(r.status())) {
                honourRetryAfter(r.header("Retry-After"));
                throw new RetryableStatusException(r);
            }
            return r;
        }
    }

    private static void honourRetryAfter(String value) throws IOException {
        if (value == null) return;
        long sec;
        try {
            sec = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.debug("Ignoring non-numeric Retry-After '{}'", value);
            return;
        }
        if (sec <= 0) return;
        try {
            Thread.sleep(Math.min(sec * 1000L, MAX_RETRY_AFTER_MS));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while honouring Retry-After", ie);
        }
    }

    /** Body of a response as a JSON object, or {@code null} when it is empty or not an object. */
    public static JsonObject bodyObject(RawHttpResponse r) {
        if (r.body() == null || r.body().isBlank()) return null;
        try {
            JsonElement e = JsonParser.parseString(r.body());
            return e.isJsonObject() ? e.getAsJsonObject() : null;
        } catch (JsonParseException e) {
            return null;
        }
    }

    /** Server-provided error text: {@code detail}, then {@code message}, then {@code "HTTP <status>"}. */
    public static String errorMessage(RawHttpResponse r) {
        JsonObject o = bodyObject(r);
        String detail = Json.string(o, "detail", null);
        if (detail != null) return detail;
        String message = Json.string(o, "message", null);
        if (message != null) return message;
        return "HTTP " + r.status();
    }

    /** Carries a retryable response through the retry executor. */
    static final class RetryableStatusException extends IOException {
        final transient RawHttpResponse response;

        RetryableStatusException(RawHttpResponse response) {
            super("HTTP " + response.status() + " retryable");
            this.response = response;
        }
    }
}
