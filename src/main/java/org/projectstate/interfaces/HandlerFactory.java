package org.projectstate.interfaces;

import org.projectstate.interfaces.http.HttpRequest;

public interface HandlerFactory {
    RequestHandler create(HttpRequest req);
}
