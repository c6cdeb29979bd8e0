package org.projectstate.server.handlers;

import com.google.gson.JsonObject;
import org.projectstate.exceptions.NotFoundException;
import org.projectstate.interfaces.HttpHandler;
import org.projectstate.interfaces.TokenAuthenticator;
import org.projectstate.interfaces.http.HttpRequest;
import org.projectstate.interfaces.http.HttpResponse;
import org.projectstate.model.ShareSettings;
import org.projectstate.server.HttpStatusException;
import org.projectstate.server.ProjectRepository;

/** PUT /projects/{id}/share */
public class ShareSettingsHandler extends BaseHandler {

    private final String projectId;

    public ShareSettingsHandler(ProjectRepository repository, TokenAuthenticator authenticator, String projectId) {
        super(repository, authenticator);
        this.projectId = projectId;
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) throws Exception {
        String user = requireUser(req);
        JsonObject body = bodyObject(req);
        ShareSettings settings = new ShareSettings(
                optionalBool(body, "is_public"),
                body.has("share_permissions") && !body.get("share_permissions").isJsonNull()
                        ? body.get("share_permissions").getAsString() : null,
                optionalBool(body, "requires_auth"));
        try {
            writeJson(res, HttpHandler.OK, repository.updateShareSettings(user, projectId, settings));
        } catch (NotFoundException e) {
            throw new HttpStatusException(HttpHandler.NOT_FOUND, "Project not found");
        } catch (IllegalArgumentException e) {
            throw new HttpStatusException(HttpHandler.BAD_REQUEST, e.getMessage());
        }
    }

    private static Boolean optionalBool(JsonObject body, String name) throws HttpStatusException {
        if (!body.has(name) || body.get(name).isJsonNull()) return null;
        if (!body.get(name).isJsonPrimitive() || !body.get(name).getAsJsonPrimitive().isBoolean()) {
            throw new HttpStatusException(HttpHandler.BAD_REQUEST, name + " must be a boolean");
        }
        return body.get(name).getAsBoolean();
    }
}
