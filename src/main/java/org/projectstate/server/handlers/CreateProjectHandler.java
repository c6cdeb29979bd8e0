package org.projectstate.server.handlers;

import com.google.gson.JsonObject;
import org.projectstate.exceptions.MalformedSnapshotException;
import org.projectstate.interfaces.HttpHandler;
import org.projectstate.interfaces.TokenAuthenticator;
import org.projectstate.interfaces.http.HttpRequest;
import org.projectstate.interfaces.http.HttpResponse;
import org.projectstate.model.ProjectDraft;
import org.projectstate.server.HttpStatusException;
import org.projectstate.server.ProjectRepository;
import org.projectstate.util.Json;

/** POST /projects → 201 with the full record, including the assigned id. */
public class CreateProjectHandler extends BaseHandler {

    public CreateProjectHandler(ProjectRepository repository, TokenAuthenticator authenticator) {
        super(repository, authenticator);
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) throws Exception {
        String user = requireUser(req);
        JsonObject body = bodyObject(req);

        ProjectDraft draft = new ProjectDraft(
                validName(body, true),
                Json.string(body, "description", null),
                projectData(body, true),
                Json.strings(body, "tags"),
                Json.bool(body, "is_public", false));
        try {
            writeJson(res, HttpHandler.CREATED, repository.create(user, draft));
        } catch (MalformedSnapshotException e) {
            throw new HttpStatusException(HttpHandler.BAD_REQUEST, e.getMessage());
        }
    }
}
