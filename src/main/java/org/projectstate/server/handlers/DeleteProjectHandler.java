package org.projectstate.server.handlers;

import org.projectstate.interfaces.HttpHandler;
import org.projectstate.interfaces.TokenAuthenticator;
import org.projectstate.interfaces.http.HttpRequest;
import org.projectstate.interfaces.http.HttpResponse;
import org.projectstate.server.ProjectRepository;

/** DELETE /projects/{id}: 204 whether or not the project existed. */
public class DeleteProjectHandler extends BaseHandler {

    private final String projectId;

    public DeleteProjectHandler(ProjectRepository repository, TokenAuthenticator authenticator, String projectId) {
        super(repository, authenticator);
        this.projectId = projectId;
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) throws Exception {
        String user = requireUser(req);
        repository.delete(user, projectId);
        res.status(HttpHandler.NO_CONTENT);
    }
}
