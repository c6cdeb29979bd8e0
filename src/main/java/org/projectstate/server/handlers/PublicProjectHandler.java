package org.projectstate.server.handlers;

import org.projectstate.interfaces.HttpHandler;
import org.projectstate.interfaces.TokenAuthenticator;
import org.projectstate.interfaces.http.HttpRequest;
import org.projectstate.interfaces.http.HttpResponse;
import org.projectstate.model.ProjectRecord;
import org.projectstate.server.HttpStatusException;
import org.projectstate.server.ProjectRepository;

/** GET /projects/{id}/public, no credential needed. */
public class PublicProjectHandler extends BaseHandler {

    private final String projectId;

    public PublicProjectHandler(ProjectRepository repository, TokenAuthenticator authenticator, String projectId) {
        super(repository, authenticator);
        this.projectId = projectId;
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) throws Exception {
        ProjectRecord record = repository.findPublic(projectId)
                .orElseThrow(() -> new HttpStatusException(HttpHandler.NOT_FOUND, "Project not found"));
        writeJson(res, HttpHandler.OK, record);
    }
}
