package org.projectstate.interfaces;

import org.projectstate.interfaces.http.HttpRequest;
import org.projectstate.interfaces.http.HttpResponse;

public interface RequestHandler {
    void handle(HttpRequest req, HttpResponse res) throws Exception;
}
