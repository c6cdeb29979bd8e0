package org.projectstate.server.handlers;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.projectstate.exceptions.MalformedSnapshotException;
import org.projectstate.exceptions.NotFoundException;
import org.projectstate.exceptions.VersionConflictException;
import org.projectstate.interfaces.HttpHandler;
import org.projectstate.interfaces.TokenAuthenticator;
import org.projectstate.interfaces.http.HttpRequest;
import org.projectstate.interfaces.http.HttpResponse;
import org.projectstate.model.ProjectRecord;
import org.projectstate.server.HttpStatusException;
import org.projectstate.server.ProjectRepository;
import org.projectstate.util.Json;
import org.projectstate.version.SyncResult;

/** POST /projects/{id}/sync with {@code {project_data, local_version}}. */
public class SyncProjectHandler extends BaseHandler {

    private final String projectId;

    public SyncProjectHandler(ProjectRepository repository, TokenAuthenticator authenticator, String projectId) {
        super(repository, authenticator);
        this.projectId = projectId;
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) throws Exception {
        String user = requireUser(req);
        JsonObject body = bodyObject(req);
        JsonObject data = projectData(body, true);
        JsonElement lv = body.get("local_version");
        if (lv == null || !lv.isJsonPrimitive() || !lv.getAsJsonPrimitive().isNumber()) {
            throw new HttpStatusException(HttpHandler.BAD_REQUEST, "local_version is required");
        }

        try {
            ProjectRecord synced = repository.sync(user, projectId, data, lv.getAsLong());
            JsonObject o = new JsonObject();
            o.addProperty("status", SyncResult.STATUS_SYNCED);
            o.add("project", Json.GSON.toJsonTree(synced));
            res.json(HttpHandler.OK, Json.GSON.toJson(o));
        } catch (NotFoundException e) {
            throw new HttpStatusException(HttpHandler.NOT_FOUND, "Project not found");
        } catch (MalformedSnapshotException e) {
            throw new HttpStatusException(HttpHandler.BAD_REQUEST, e.getMessage());
        } catch (VersionConflictException e) {
            writeJson(res, HttpHandler.CONFLICT, e.conflict());
        }
    }
}
