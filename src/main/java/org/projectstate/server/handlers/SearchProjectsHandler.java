package org.projectstate.server.handlers;

import com.google.gson.JsonObject;
import org.projectstate.interfaces.HttpHandler;
import org.projectstate.interfaces.TokenAuthenticator;
import org.projectstate.interfaces.http.HttpRequest;
import org.projectstate.interfaces.http.HttpResponse;
import org.projectstate.server.HttpStatusException;
import org.projectstate.server.ProjectRepository;
import org.projectstate.util.Json;

/** GET /projects/search?q&limit(1-50, default 20) */
public class SearchProjectsHandler extends BaseHandler {

    public SearchProjectsHandler(ProjectRepository repository, TokenAuthenticator authenticator) {
        super(repository, authenticator);
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) throws Exception {
        String user = requireUser(req);
        String q = req.query().get("q");
        if (q == null || q.isBlank()) {
            throw new HttpStatusException(HttpHandler.BAD_REQUEST, "q is required");
        }
        int limit = intParam(req, "limit", 20, 1, 50);

        JsonObject o = new JsonObject();
        o.add("projects", Json.GSON.toJsonTree(repository.search(user, q.trim(), limit)));
        o.addProperty("query", q.trim());
        res.json(HttpHandler.OK, Json.GSON.toJson(o));
    }
}
