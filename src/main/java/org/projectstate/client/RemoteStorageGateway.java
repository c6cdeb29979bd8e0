package org.projectstate.client;

import com.google.gson.JsonObject;
import com.google.gson.reflect.TypeToken;
import org.projectstate.exceptions.NetworkFailureException;
import org.projectstate.exceptions.NotFoundException;
import org.projectstate.exceptions.PersistenceException;
import org.projectstate.exceptions.UnauthorizedException;
import org.projectstate.exceptions.VersionConflictException;
import org.projectstate.http.RawHttpResponse;
import org.projectstate.interfaces.HttpHandler;
import org.projectstate.interfaces.StorageGateway;
import org.projectstate.mode.Credential;
import org.projectstate.model.ProjectDraft;
import org.projectstate.model.ProjectRecord;
import org.projectstate.model.ProjectStats;
import org.projectstate.model.ProjectSummary;
import org.projectstate.model.ProjectUpdate;
import org.projectstate.model.ShareSettings;
import org.projectstate.util.Json;
import org.projectstate.version.SyncResult;

import java.lang.reflect.Type;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link StorageGateway} backed by the project HTTP API. The credential is read
 * from the supplier on every call, so a sign-in or sign-out applies immediately.
 */
public class RemoteStorageGateway implements StorageGateway {

    private static final Type SUMMARY_LIST = new TypeToken<List<ProjectSummary>>() {}.getType();

    private final ProjectApiClient api;
    private final Supplier<Credential> credentials;

    public RemoteStorageGateway(ProjectApiClient api, Supplier<Credential> credentials) {
        this.api = api;
        this.credentials = credentials;
    }

    @Override
    public ProjectRecord create(ProjectDraft draft) throws PersistenceException {
        RawHttpResponse r = api.send("POST", "/projects", auth(), draft);
        check(r, null);
        return record(r.body());
    }

    @Override
    public ProjectRecord read(String id) throws PersistenceException {
        RawHttpResponse r = api.send("GET", "/projects/" + enc(id), auth(), null);
        check(r, id);
        return record(r.body());
    }

    /** @throws VersionConflictException when the update's local version is stale */
    @Override
    public ProjectRecord update(String id, ProjectUpdate update) throws PersistenceException {
        RawHttpResponse r = api.send("PUT", "/projects/" + enc(id), auth(), update);
        check(r, id);
        return record(r.body());
    }

    /** Version-checked snapshot write. */
    public ProjectRecord sync(String id, JsonObject projectData, long localVersion) throws PersistenceException {
        JsonObject body = new JsonObject();
        body.add("project_data", projectData);
        body.addProperty("local_version", localVersion);
        RawHttpResponse r = api.send("POST", "/projects/" + enc(id) + "/sync", auth(), body);
        check(r, id);
        JsonObject o = ProjectApiClient.bodyObject(r);
        JsonObject project = Json.object(o, "project");
        if (project == null) {
            throw new NetworkFailureException(r.status(), "Sync response carried no project");
        }
        return Json.GSON.fromJson(project, ProjectRecord.class);
    }

    @Override
    public void delete(String id) throws PersistenceException {
        RawHttpResponse r = api.send("DELETE", "/projects/" + enc(id), auth(), null);
        if (r.status() == HttpHandler.NOT_FOUND) return;
        check(r, id);
    }

    @Override
    public List<ProjectSummary> list(int limit, int offset) throws PersistenceException {
        RawHttpResponse r = api.send("GET", "/projects?limit=" + limit + "&offset=" + offset, auth(), null);
        check(r, null);
        return summaries(r);
    }

    public List<ProjectSummary> search(String query, int limit) throws PersistenceException {
        RawHttpResponse r = api.send("GET", "/projects/search?q=" + enc(query) + "&limit=" + limit, auth(), null);
        check(r, null);
        return summaries(r);
    }

    public ProjectStats stats() throws PersistenceException {
        RawHttpResponse r = api.send("GET", "/stats", auth(), null);
        check(r, null);
        return Json.GSON.fromJson(r.body(), ProjectStats.class);
    }

    /** A public project, readable without a credential. */
    public ProjectRecord readPublic(String id) throws PersistenceException {
        RawHttpResponse r = api.send("GET", "/projects/" + enc(id) + "/public", null, null);
        check(r, id);
        return record(r.body());
    }

    /** Resolves a share token. The credential is sent when present, for shares that require sign-in. */
    public ProjectRecord readShared(String shareId) throws PersistenceException {
        RawHttpResponse r = api.send("GET", "/projects/shared/" + enc(shareId), auth(), null);
        check(r, shareId);
        return record(r.body());
    }

    public ProjectRecord updateShareSettings(String id, ShareSettings settings) throws PersistenceException {
        RawHttpResponse r = api.send("PUT", "/projects/" + enc(id) + "/share", auth(), settings);
        check(r, id);
        return record(r.body());
    }

    /** @return the health document, e.g. {@code {"status":"healthy", ...}} */
    public JsonObject health() throws PersistenceException {
        RawHttpResponse r = api.send("GET", "/health", null, null);
        check(r, null);
        return ProjectApiClient.bodyObject(r);
    }

    private Map<String, String> auth() {
        Map<String, String> h = new LinkedHashMap<>();
        Credential c = credentials == null ? null : credentials.get();
        if (c != null && c.token() != null && !c.token().isBlank()) {
            h.put("Authorization", "Bearer " + c.token());
        }
        return h;
    }

    private static void check(RawHttpResponse r, String id) throws PersistenceException {
        if (r.isSuccess()) return;
        switch (r.status()) {
            case HttpHandler.NOT_FOUND ->
                    throw new NotFoundException(id == null ? ProjectApiClient.errorMessage(r) : id);
            case HttpHandler.UNAUTHORIZED -> throw new UnauthorizedException(ProjectApiClient.errorMessage(r));
            case HttpHandler.CONFLICT ->
                    throw new VersionConflictException(Json.GSON.fromJson(r.body(), SyncResult.Conflict.class));
            default -> throw new NetworkFailureException(r.status(), ProjectApiClient.errorMessage(r));
        }
    }

    private static List<ProjectSummary> summaries(RawHttpResponse r) {
        JsonObject o = ProjectApiClient.bodyObject(r);
        if (o == null || Json.array(o, "projects") == null) return List.of();
        return Json.GSON.fromJson(o.get("projects"), SUMMARY_LIST);
    }

    private static ProjectRecord record(String body) {
        return Json.GSON.fromJson(body, ProjectRecord.class);
    }

    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
