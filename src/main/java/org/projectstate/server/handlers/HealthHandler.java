package org.projectstate.server.handlers;

import com.google.gson.JsonObject;
import org.projectstate.interfaces.HttpHandler;
import org.projectstate.interfaces.RequestHandler;
import org.projectstate.interfaces.http.HttpRequest;
import org.projectstate.interfaces.http.HttpResponse;
import org.projectstate.server.ProjectRepository;

public class HealthHandler implements RequestHandler {

    private final ProjectRepository repository;

    public HealthHandler(ProjectRepository repository) {
        this.repository = repository;
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        JsonObject o = new JsonObject();
        o.addProperty("status", "healthy");
        o.addProperty("service", "project-state");
        o.addProperty("projects", repository.size());
        res.json(HttpHandler.OK, o.toString());
    }
}
