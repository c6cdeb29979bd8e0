package org.projectstate.server.handlers;

import org.projectstate.exceptions.NotFoundException;
import org.projectstate.exceptions.UnauthorizedException;
import org.projectstate.interfaces.HttpHandler;
import org.projectstate.interfaces.TokenAuthenticator;
import org.projectstate.interfaces.http.HttpRequest;
import org.projectstate.interfaces.http.HttpResponse;
import org.projectstate.server.HttpStatusException;
import org.projectstate.server.ProjectRepository;
import org.projectstate.share.RejectionReason;

/** GET /projects/shared/{shareId} */
public class SharedProjectHandler extends BaseHandler {

    private final String shareId;

    public SharedProjectHandler(ProjectRepository repository, TokenAuthenticator authenticator, String shareId) {
        super(repository, authenticator);
        this.shareId = shareId;
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) throws Exception {
        try {
            writeJson(res, HttpHandler.OK, repository.shared(shareId, optionalUser(req).isPresent()));
        } catch (NotFoundException e) {
            throw new HttpStatusException(HttpHandler.NOT_FOUND, RejectionReason.SHARE_NOT_FOUND.message());
        } catch (UnauthorizedException e) {
            throw new HttpStatusException(HttpHandler.UNAUTHORIZED, e.getMessage());
        }
    }
}
