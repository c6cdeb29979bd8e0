package org.projectstate.server.handlers;

import org.projectstate.interfaces.HttpHandler;
import org.projectstate.interfaces.TokenAuthenticator;
import org.projectstate.interfaces.http.HttpRequest;
import org.projectstate.interfaces.http.HttpResponse;
import org.projectstate.server.ProjectRepository;

public class StatsHandler extends BaseHandler {

    public StatsHandler(ProjectRepository repository, TokenAuthenticator authenticator) {
        super(repository, authenticator);
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) throws Exception {
        String user = requireUser(req);
        writeJson(res, HttpHandler.OK, repository.stats(user));
    }
}
