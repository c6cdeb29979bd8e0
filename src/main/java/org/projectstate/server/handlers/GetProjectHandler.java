package org.projectstate.server.handlers;

import org.projectstate.interfaces.HttpHandler;
import org.projectstate.interfaces.TokenAuthenticator;
import org.projectstate.interfaces.http.HttpRequest;
import org.projectstate.interfaces.http.HttpResponse;
import org.projectstate.model.ProjectRecord;
import org.projectstate.server.HttpStatusException;
import org.projectstate.server.ProjectRepository;

/** GET /projects/{id}. Another user's project reads as 404. */
public class GetProjectHandler extends BaseHandler {

    private final String projectId;

    public GetProjectHandler(ProjectRepository repository, TokenAuthenticator authenticator, String projectId) {
        super(repository, authenticator);
        this.projectId = projectId;
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) throws Exception {
        String user = requireUser(req);
        ProjectRecord record = repository.find(user, projectId)
                .orElseThrow(() -> new HttpStatusException(HttpHandler.NOT_FOUND, "Project not found"));
        writeJson(res, HttpHandler.OK, record);
    }
}
