package org.projectstate.share;

import com.google.gson.JsonObject;
import org.projectstate.client.ProjectApiClient;
import org.projectstate.exceptions.NetworkFailureException;
import org.projectstate.http.RawHttpResponse;
import org.projectstate.mode.Mode;
import org.projectstate.mode.SharedMarkers;
import org.projectstate.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collaborator write path. Local checks run first and never touch the network;
 * after that the backend decides, and its status is mapped back to a
 * {@link RejectionReason}. Never throws for expected rejections.
 */
public class SharedPatchService {

    private static final Logger logger = LoggerFactory.getLogger(SharedPatchService.class);

    static final String MSG_NOT_SHARED = "Not in shared mode";
    static final String MSG_NO_PERMISSION = "No editor permissions";
    static final String MSG_NO_SHARE_ID = "No share ID found";
    static final String MSG_NO_PROJECT_ID = "No project ID found";

    private final ProjectApiClient api;

    public SharedPatchService(ProjectApiClient api) {
        this.api = api;
    }

    /**
     * @param mode    the mode resolved for this call
     * @param markers the persisted shared-mode markers
     */
    public PatchOutcome patch(Mode mode, SharedMarkers markers, SharedPatchRequest request) {
        if (mode == null || !mode.isShared() || markers == null || !markers.active()) {
            return local(RejectionReason.NOT_IN_SHARED_MODE, MSG_NOT_SHARED);
        }
        if (!mode.canSave()) {
            return local(RejectionReason.NO_EDITOR_PERMISSION, MSG_NO_PERMISSION);
        }
        String shareId = request.shareId() != null ? request.shareId() : markers.shareId();
        if (shareId == null || shareId.isBlank()) {
            return local(RejectionReason.INVALID_PAYLOAD, MSG_NO_SHARE_ID);
        }
        String projectId = request.projectId() != null ? request.projectId() : markers.projectId();
        if (projectId == null || projectId.isBlank()) {
            return local(RejectionReason.INVALID_PAYLOAD, MSG_NO_PROJECT_ID);
        }

        JsonObject body = new JsonObject();
        body.addProperty("share_id", shareId);
        body.add("project_data", request.snapshot() == null ? null : request.snapshot().toJsonTree());
        if (request.name() != null) body.addProperty("name", request.name());

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-Shared-Editor", "true");
        headers.put("X-Share-ID", shareId);

        RawHttpResponse r;
        try {
            r = api.send("PATCH", "/projects/" + URLEncoder.encode(projectId, StandardCharsets.UTF_8)
                    + "/shared-editor-patch", headers, body);
        } catch (NetworkFailureException e) {
            logger.warn("Shared patch for {} could not reach the server: {}", projectId, e.getMessage());
            return new PatchOutcome.Rejected(RejectionReason.NETWORK_FAILURE, e.getMessage(), false);
        }

        if (r.isSuccess()) {
            JsonObject project = Json.object(ProjectApiClient.bodyObject(r), "project");
            logger.info("Shared patch accepted for {}", projectId);
            return new PatchOutcome.Ack(
                    Json.string(project, "id", projectId),
                    Json.string(project, "name", request.name()),
                    Json.string(project, "updated_at", null),
                    Json.longValue(project, "server_version", 0L));
        }
        RejectionReason reason = RejectionReason.fromStatus(r.status());
        String message = ProjectApiClient.errorMessage(r);
        logger.info("Shared patch for {} rejected with {}: {}", projectId, r.status(), message);
        return new PatchOutcome.Rejected(reason, message, false);
    }

    private static PatchOutcome local(RejectionReason reason, String message) {
        return new PatchOutcome.Rejected(reason, message, true);
    }
}
