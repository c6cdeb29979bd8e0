package org.projectstate.server;

import org.projectstate.interfaces.HandlerFactory;
import org.projectstate.interfaces.RequestHandler;
import org.projectstate.interfaces.TokenAuthenticator;
import org.projectstate.interfaces.http.HttpRequest;
import org.projectstate.server.handlers.CreateProjectHandler;
import org.projectstate.server.handlers.DeleteProjectHandler;
import org.projectstate.server.handlers.GetProjectHandler;
import org.projectstate.server.handlers.HealthHandler;
import org.projectstate.server.handlers.ListProjectsHandler;
import org.projectstate.server.handlers.NotFoundHandler;
import org.projectstate.server.handlers.PublicProjectHandler;
import org.projectstate.server.handlers.SearchProjectsHandler;
import org.projectstate.server.handlers.ShareSettingsHandler;
import org.projectstate.server.handlers.SharedEditorPatchHandler;
import org.projectstate.server.handlers.SharedProjectHandler;
import org.projectstate.server.handlers.StatsHandler;
import org.projectstate.server.handlers.SyncProjectHandler;
import org.projectstate.server.handlers.UpdateProjectHandler;

public class ProjectHandlerFactory implements HandlerFactory {

    private final ProjectRepository repository;
    private final TokenAuthenticator auth;

    public ProjectHandlerFactory(ProjectRepository repository, TokenAuthenticator auth) {
        this.repository = repository;
        this.auth = auth;
    }

    @Override
    public RequestHandler create(HttpRequest req) {
        String m = req.method().toUpperCase();
        String[] seg = segments(req.path());

        if (seg.length == 1 && "health".equals(seg[0]) && "GET".equals(m)) return new HealthHandler(repository);
        if (seg.length == 1 && "stats".equals(seg[0]) && "GET".equals(m)) return new StatsHandler(repository, auth);
        if (seg.length == 0 || !"projects".equals(seg[0])) return new NotFoundHandler();

        if (seg.length == 1) {
            if ("GET".equals(m)) return new ListProjectsHandler(repository, auth);
            if ("POST".equals(m)) return new CreateProjectHandler(repository, auth);
            return new NotFoundHandler();
        }
        if (seg.length == 2 && "search".equals(seg[1]) && "GET".equals(m)) {
            return new SearchProjectsHandler(repository, auth);
        }
        if (seg.length == 3 && "shared".equals(seg[1]) && "GET".equals(m)) {
            return new SharedProjectHandler(repository, auth, seg[2]);
        }

        String id = seg[1];
        if (seg.length == 2) {
            return switch (m) {
                case "GET" -> new GetProjectHandler(repository, auth, id);
                case "PUT" -> new UpdateProjectHandler(repository, auth, id);
                case "DELETE" -> new DeleteProjectHandler(repository, auth, id);
                default -> new NotFoundHandler();
            };
        }
        if (seg.length == 3) {
            String action = seg[2];
            if ("public".equals(action) && "GET".equals(m)) return new PublicProjectHandler(repository, auth, id);
            if ("sync".equals(action) && "POST".equals(m)) return new SyncProjectHandler(repository, auth, id);
            if ("share".equals(action) && "PUT".equals(m)) return new ShareSettingsHandler(repository, auth, id);
            if ("shared-editor-patch".equals(action) && "PATCH".equals(m)) {
                return new SharedEditorPatchHandler(repository, auth, id);
            }
        }
        return new NotFoundHandler();
    }

    private static String[] segments(String path) {
        String trimmed = path == null ? "" : path.replaceAll("^/+|/+$", "");
        return trimmed.isEmpty() ? new String[0] : trimmed.split("/+");
    }
}
