package org.projectstate.server.handlers;

import com.google.gson.JsonObject;
import org.projectstate.interfaces.HttpHandler;
import org.projectstate.interfaces.TokenAuthenticator;
import org.projectstate.interfaces.http.HttpRequest;
import org.projectstate.interfaces.http.HttpResponse;
import org.projectstate.server.ProjectRepository;
import org.projectstate.util.Json;

/** GET /projects?limit(1-100, default 50)&offset(≥0) */
public class ListProjectsHandler extends BaseHandler {

    public ListProjectsHandler(ProjectRepository repository, TokenAuthenticator authenticator) {
        super(repository, authenticator);
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) throws Exception {
        String user = requireUser(req);
        int limit = intParam(req, "limit", 50, 1, 100);
        int offset = intParam(req, "offset", 0, 0, Integer.MAX_VALUE);

        JsonObject o = new JsonObject();
        o.add("projects", Json.GSON.toJsonTree(repository.list(user, limit, offset)));
        o.addProperty("limit", limit);
        o.addProperty("offset", offset);
        res.json(HttpHandler.OK, Json.GSON.toJson(o));
    }
}
