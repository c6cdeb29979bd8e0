package org.projectstate.http;

import org.projectstate.interfaces.HttpHandler;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/** Serializes an {@link HttpResponseImpl} onto the socket. */
public final class HttpResponseWriter {

    private final HttpHandler http;

    public HttpResponseWriter(HttpHandler http) {
        this.http = http;
    }

    public void write(OutputStream out, HttpResponseImpl res) throws IOException {
        // one exchange per connection; the length always reflects the buffered body
        if (!res.hasHeader("Connection")) res.header("Connection", "close");
        res.header("Content-Length", Integer.toString(res.body().length));

        StringBuilder head = new StringBuilder(128)
                .append("HTTP/1.1 ").append(res.status()).append(' ')
                .append(http.reason(res.status())).append("\r\n");
        res.headers().forEach((name, value) -> head.append(name).append(": ").append(value).append("\r\n"));
        head.append("\r\n");

        out.write(head.toString().getBytes(StandardCharsets.US_ASCII));
        out.write(res.body());
        out.flush();
    }
}
