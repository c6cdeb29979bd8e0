package org.projectstate.server.handlers;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.projectstate.interfaces.HttpHandler;
import org.projectstate.interfaces.TokenAuthenticator;
import org.projectstate.interfaces.http.HttpRequest;
import org.projectstate.interfaces.http.HttpResponse;
import org.projectstate.server.HttpStatusException;
import org.projectstate.server.ProjectRepository;
import org.projectstate.share.PatchOutcome;
import org.projectstate.share.RejectionReason;
import org.projectstate.util.Json;

/**
 * PATCH /projects/{id}/shared-editor-patch
 *
 * <p>Authorized by the share token, not by a bearer credential. The request must
 * carry {@code X-Shared-Editor: true} and an {@code X-Share-ID} equal to the body's
 * {@code share_id}. A viewer share is refused with 403 before the headers or the
 * body are looked at.
 */
public class SharedEditorPatchHandler extends BaseHandler {

    public static final String EDITOR_HEADER = "X-Shared-Editor";
    public static final String SHARE_HEADER = "X-Share-ID";

    private final String projectId;

    public SharedEditorPatchHandler(ProjectRepository repository, TokenAuthenticator authenticator,
                                    String projectId) {
        super(repository, authenticator);
        this.projectId = projectId;
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) throws Exception {
        String headerShareId = req.header(SHARE_HEADER);
        if (repository.isViewerShare(headerShareId)) {
            throw reject(RejectionReason.NO_EDITOR_PERMISSION);
        }
        if (!"true".equalsIgnoreCase(req.header(EDITOR_HEADER))) {
            throw reject(RejectionReason.INVALID_PAYLOAD);
        }
        JsonObject body;
        try {
            body = bodyObject(req);
        } catch (HttpStatusException e) {
            throw reject(RejectionReason.INVALID_PAYLOAD);
        }
        String shareId = Json.string(body, "share_id", null);
        if (repository.isViewerShare(shareId)) {
            throw reject(RejectionReason.NO_EDITOR_PERMISSION);
        }
        if (shareId == null || !shareId.equals(headerShareId)) {
            throw reject(RejectionReason.INVALID_PAYLOAD);
        }
        JsonElement data = body.get("project_data");
        JsonObject projectData = data != null && data.isJsonObject() ? data.getAsJsonObject() : null;

        PatchOutcome outcome = repository.sharedPatch(projectId, shareId,
                Json.string(body, "name", null), projectData);
        if (outcome instanceof PatchOutcome.Rejected rejected) {
            throw reject(rejected.reason());
        }
        PatchOutcome.Ack ack = (PatchOutcome.Ack) outcome;

        JsonObject project = new JsonObject();
        project.addProperty("id", ack.projectId());
        project.addProperty("name", ack.name());
        project.addProperty("updated_at", ack.updatedAt());
        project.addProperty("server_version", ack.serverVersion());
        JsonObject o = new JsonObject();
        o.addProperty("success", true);
        o.addProperty("message", "Project updated successfully");
        o.add("project", project);
        res.json(HttpHandler.OK, Json.GSON.toJson(o));
    }

    private static HttpStatusException reject(RejectionReason reason) {
        return new HttpStatusException(reason.status(), reason.message());
    }
}
