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
import org.projectstate.model.ProjectUpdate;
import org.projectstate.model.ShareSettings;
import org.projectstate.server.HttpStatusException;
import org.projectstate.server.ProjectRepository;
import org.projectstate.util.Json;

import java.util.List;

/**
 * PUT /projects/{id}. A body with {@code local_version} is version-checked and
 * answers 409 with both sides when stale; without it the write is unconditional.
 */
public class UpdateProjectHandler extends BaseHandler {

    private final String projectId;

    public UpdateProjectHandler(ProjectRepository repository, TokenAuthenticator authenticator, String projectId) {
        super(repository, authenticator);
        this.projectId = projectId;
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) throws Exception {
        String user = requireUser(req);
        JsonObject body = bodyObject(req);

        Long localVersion = null;
        JsonElement lv = body.get("local_version");
        if (lv != null && !lv.isJsonNull()) {
            if (!lv.isJsonPrimitive() || !lv.getAsJsonPrimitive().isNumber()) {
                throw new HttpStatusException(HttpHandler.BAD_REQUEST, "local_version must be a number");
            }
            localVersion = lv.getAsLong();
        }
        List<String> tags = body.has("tags") ? Json.strings(body, "tags") : null;
        ProjectUpdate update = new ProjectUpdate(validName(body, false),
                Json.string(body, "description", null), projectData(body, false), tags, localVersion);

        ProjectRecord updated;
        try {
            updated = repository.update(user, projectId, update);
            if (body.has("is_public") && !body.get("is_public").isJsonNull()) {
                boolean isPublic = Json.bool(body, "is_public", updated.isPublic());
                if (isPublic != updated.isPublic()) {
                    updated = repository.updateShareSettings(user, projectId,
                            new ShareSettings(isPublic, null, null));
                }
            }
        } catch (NotFoundException e) {
            throw new HttpStatusException(HttpHandler.NOT_FOUND, "Project not found");
        } catch (MalformedSnapshotException e) {
            throw new HttpStatusException(HttpHandler.BAD_REQUEST, e.getMessage());
        } catch (VersionConflictException e) {
            writeJson(res, HttpHandler.CONFLICT, e.conflict());
            return;
        }
        writeJson(res, HttpHandler.OK, updated);
    }
}
