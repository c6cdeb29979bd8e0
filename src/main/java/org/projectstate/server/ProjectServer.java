package org.projectstate.server;

import com.google.gson.JsonObject;
import org.projectstate.config.PersistenceConfig;
import org.projectstate.http.DefaultHttpHandler;
import org.projectstate.http.HttpResponseImpl;
import org.projectstate.http.HttpResponseWriter;
import org.projectstate.http.MinimalHttpRequest;
import org.projectstate.interfaces.HandlerFactory;
import org.projectstate.interfaces.HttpHandler;
import org.projectstate.interfaces.RequestHandler;
import org.projectstate.persistance.FileSnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Project backend over raw HTTP/1.1 sockets: one accept thread, one worker
 * thread per connection, one request per connection.
 */
public class ProjectServer implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ProjectServer.class);

    /** Largest request body accepted; a bigger Content-Length is answered with 413 unread. */
    public static final int MAX_BODY_BYTES = 16 * 1024 * 1024;

    private final int requestedPort;
    private final HandlerFactory factory;
    private final HttpHandler http = new DefaultHttpHandler();
    private final HttpResponseWriter writer = new HttpResponseWriter(http);

    private volatile ServerSocket server;
    private volatile boolean running;
    private Thread acceptor;

    public ProjectServer(int port, HandlerFactory factory) {
        this.requestedPort = port;
        this.factory = factory;
    }

    public static void main(String[] args) throws Exception {
        PersistenceConfig config = PersistenceConfig.load();
        int port = args.length > 0 ? Integer.parseInt(args[0]) : config.serverPort();
        Clock clock = Clock.systemUTC();

        FileSnapshotStore store = new FileSnapshotStore(Paths.get(config.serverDataDir()), "projects",
                config.serverHistoryLimit(), clock);
        ProjectRepository repository = new ProjectRepository(store, clock);
        int restored = repository.restore();
        logger.info("Restored {} projects from {}", restored, config.serverDataDir());

        InMemoryTokenAuthenticator auth = InMemoryTokenAuthenticator.fromSpec(config.serverTokens(), clock);
        ProjectServer srv = new ProjectServer(port, new ProjectHandlerFactory(repository, auth));
        srv.start();
        Runtime.getRuntime().addShutdownHook(new Thread(srv::close, "shutdown"));
        srv.acceptor.join();
    }

    /** Binds and starts accepting. Port 0 picks a free port, see {@link #port()}. */
    public synchronized void start() throws IOException {
        if (running) return;
        server = new ServerSocket(requestedPort);
        running = true;
        acceptor = new Thread(this::acceptLoop, "project-server-accept");
        acceptor.start();
        logger.info("Project server listening on port {}", server.getLocalPort());
    }

    public int port() {
        ServerSocket s = server;
        return s == null ? requestedPort : s.getLocalPort();
    }

    @Override
    public synchronized void close() {
        if (!running) return;
        running = false;
        try {
            server.close();
        } catch (IOException e) {
            logger.warn("Closing server socket failed: {}", e.getMessage());
        }
        logger.info("Project server on port {} stopped", server.getLocalPort());
    }

    private void acceptLoop() {
        while (running) {
            Socket client;
            try {
                client = server.accept();
            } catch (IOException e) {
                if (running) logger.error("Accept failed", e);
                continue;
            }
            Thread worker = new Thread(() -> serve(client), "project-server-conn");
            worker.setDaemon(true);
            worker.start();
        }
    }

    private void serve(Socket socket) {
        try (Socket client = socket;
             InputStream rawIn = client.getInputStream();
             BufferedInputStream bin = new BufferedInputStream(rawIn);
             OutputStream out = client.getOutputStream()) {

            String start = readLineAscii(bin); // e.g. "PUT /projects/abc HTTP/1.1"
            if (start == null || start.isEmpty()) {
                writer.write(out, detail(HttpHandler.BAD_REQUEST, "empty request line"));
                return;
            }
            String[] p = start.split(" ", 3);
            String method = p.length > 0 ? p[0] : "";
            String target = p.length > 1 ? p[1] : "/";
            String ver = p.length > 2 ? p[2] : "HTTP/1.1";

            Map<String, String> headers = new LinkedHashMap<>();
            String line;
            while ((line = readLineAscii(bin)) != null && !line.isEmpty()) {
                int idx = line.indexOf(':');
                if (idx > 0) {
                    String k = line.substring(0, idx).trim();
                    String v = line.substring(idx + 1).trim();
                    headers.put(k, v);
                    headers.put(k.toLowerCase(), v);
                }
            }

            String expect = headers.get("expect");
            if (expect != null && expect.equalsIgnoreCase("100-continue")) {
                OutputStreamWriter w100 = new OutputStreamWriter(out, StandardCharsets.US_ASCII);
                w100.write("HTTP/1.1 100 Continue\r\n\r\n");
                w100.flush();
            }

            int len;
            try {
                len = Integer.parseInt(headers.getOrDefault("content-length", "0").trim());
            } catch (NumberFormatException e) {
                writer.write(out, detail(HttpHandler.BAD_REQUEST, "invalid Content-Length"));
                return;
            }
            if (len > MAX_BODY_BYTES) {
                logger.warn("{} {} refused: Content-Length {} over limit", method, target, len);
                writer.write(out, detail(HttpHandler.PAYLOAD_TOO_LARGE, "Request body too large"));
                return;
            }
            byte[] body = new byte[Math.max(0, len)];
            int total = 0;
            while (total < body.length) {
                int n = bin.read(body, total, body.length - total);
                if (n < 0) break;
                total += n;
            }

            MinimalHttpRequest req = new MinimalHttpRequest(method, target, ver, headers, body);
            HttpResponseImpl res = new HttpResponseImpl();
            RequestHandler handler = factory.create(req);
            try {
                handler.handle(req, res);
            } catch (HttpStatusException e) {
                res = detail(e.status(), e.getMessage());
            } catch (Exception e) {
                logger.error("{} {} failed", method, req.path(), e);
                res = detail(HttpHandler.INTERNAL_SERVER_ERROR, "Internal server error");
            }
            logger.debug("{} {} -> {}", method, req.path(), res.status());
            writer.write(out, res);

        } catch (SocketException se) {
            String msg = String.valueOf(se.getMessage()).toLowerCase();
            if (!(msg.contains("connection reset") || msg.contains("broken pipe")
                    || msg.contains("socket closed"))) {
                logger.warn("Socket error: {}", se.getMessage());
            }
        } catch (IOException e) {
            logger.warn("Connection error: {}", e.getMessage());
        }
    }

    private static HttpResponseImpl detail(int status, String message) {
        JsonObject o = new JsonObject();
        o.addProperty("detail", message);
        HttpResponseImpl res = new HttpResponseImpl();
        res.json(status, o.toString());
        return res;
    }

    private static String readLineAscii(BufferedInputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int prev = -1, b;
        while ((b = in.read()) != -1) {
            if (prev == '\r' && b == '\n') {
                byte[] bytes = buf.toByteArray();
                int len = Math.max(0, bytes.length - 1);
                return new String(bytes, 0, len, StandardCharsets.US_ASCII);
            }
            buf.write(b);
            prev = b;
        }
        return (buf.size() == 0) ? null : new String(buf.toByteArray(), StandardCharsets.US_ASCII);
    }
}
