package org.projectstate.server.handlers;

import com.google.gson.JsonObject;
import org.projectstate.interfaces.HttpHandler;
import org.projectstate.interfaces.RequestHandler;
import org.projectstate.interfaces.http.HttpRequest;
import org.projectstate.interfaces.http.HttpResponse;

public class NotFoundHandler implements RequestHandler {
    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        JsonObject o = new JsonObject();
        o.addProperty("detail", "no route for " + req.method() + " " + req.path());
        res.json(HttpHandler.NOT_FOUND, o.toString());
    }
}
