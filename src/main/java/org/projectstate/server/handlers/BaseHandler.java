package org.projectstate.server.handlers;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.projectstate.interfaces.HttpHandler;
import org.projectstate.interfaces.RequestHandler;
import org.projectstate.interfaces.TokenAuthenticator;
import org.projectstate.interfaces.http.HttpRequest;
import org.projectstate.interfaces.http.HttpResponse;
import org.projectstate.server.HttpStatusException;
import org.projectstate.server.ProjectRepository;
import org.projectstate.util.Json;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Shared plumbing for route handlers: bearer authentication, body and query
 * parsing, JSON responses.
 */
public abstract class BaseHandler implements RequestHandler {

    protected static final int MAX_NAME_LENGTH = 255;

    protected final ProjectRepository repository;
    private final TokenAuthenticator authenticator;

    protected BaseHandler(ProjectRepository repository, TokenAuthenticator authenticator) {
        this.repository = repository;
        this.authenticator = authenticator;
    }

    /** User behind the {@code Authorization: Bearer} header, if the token is valid. */
    protected Optional<String> optionalUser(HttpRequest req) {
        String auth = req.header("Authorization");
        if (auth == null || !auth.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return Optional.empty();
        }
        return authenticator.authenticate(auth.substring(7).trim());
    }

    protected String requireUser(HttpRequest req) throws HttpStatusException {
        return optionalUser(req).orElseThrow(() ->
                new HttpStatusException(HttpHandler.UNAUTHORIZED, "Missing or invalid credentials"));
    }

    protected static JsonObject bodyObject(HttpRequest req) throws HttpStatusException {
        String text = new String(req.body(), StandardCharsets.UTF_8);
        if (text.isBlank()) {
            throw new HttpStatusException(HttpHandler.BAD_REQUEST, "Request body is required");
        }
        JsonElement parsed;
        try {
            parsed = JsonParser.parseString(text);
        } catch (JsonParseException e) {
            throw new HttpStatusException(HttpHandler.BAD_REQUEST, "Request body is not valid JSON");
        }
        if (!parsed.isJsonObject()) {
            throw new HttpStatusException(HttpHandler.BAD_REQUEST, "Request body must be a JSON object");
        }
        return parsed.getAsJsonObject();
    }

    /** Integer query parameter within {@code [min, max]}, or {@code def} when absent. */
    protected static int intParam(HttpRequest req, String name, int def, int min, int max)
            throws HttpStatusException {
        String raw = req.query().get(name);
        if (raw == null || raw.isBlank()) return def;
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new HttpStatusException(HttpHandler.BAD_REQUEST, name + " must be an integer");
        }
        if (value < min || value > max) {
            throw new HttpStatusException(HttpHandler.BAD_REQUEST,
                    name + " must be between " + min + " and " + max);
        }
        return value;
    }

    /** Optional name field: absent is fine, present must be 1..255 characters. */
    protected static String validName(JsonObject body, boolean required) throws HttpStatusException {
        JsonElement e = body.get("name");
        if (e == null || e.isJsonNull()) {
            if (required) throw new HttpStatusException(HttpHandler.BAD_REQUEST, "name is required");
            return null;
        }
        if (!e.isJsonPrimitive() || !e.getAsJsonPrimitive().isString()) {
            throw new HttpStatusException(HttpHandler.BAD_REQUEST, "name must be a string");
        }
        String name = e.getAsString();
        if (name.isEmpty() || name.length() > MAX_NAME_LENGTH) {
            throw new HttpStatusException(HttpHandler.BAD_REQUEST, "name must be 1-255 characters");
        }
        return name;
    }

    protected static JsonObject projectData(JsonObject body, boolean required) throws HttpStatusException {
        JsonElement e = body.get("project_data");
        if (e == null || e.isJsonNull()) {
            if (required) throw new HttpStatusException(HttpHandler.BAD_REQUEST, "project_data is required");
            return null;
        }
        if (!e.isJsonObject()) {
            throw new HttpStatusException(HttpHandler.BAD_REQUEST, "project_data must be an object");
        }
        return e.getAsJsonObject();
    }

    protected static void writeJson(HttpResponse res, int status, Object payload) {
        res.json(status, Json.GSON.toJson(payload));
    }

    protected static void writeDetail(HttpResponse res, int status, String detail) {
        JsonObject o = new JsonObject();
        o.addProperty("detail", detail);
        res.json(status, o.toString());
    }
}
