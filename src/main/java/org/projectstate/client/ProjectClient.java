package org.projectstate.client;

import org.projectstate.config.PersistenceConfig;
import org.projectstate.exceptions.PersistenceException;
import org.projectstate.http.DefaultHttpHandler;
import org.projectstate.mode.Credential;
import org.projectstate.util.Json;
import org.projectstate.util.SimpleRetryExecutor;

import java.io.IOException;

/**
 * Command-line access to a running project server.
 * <pre>
 * ProjectClient [host:port] list | get &lt;id&gt; | delete &lt;id&gt; | health
 * </pre>
 * The bearer token is taken from {@code -Dprojectstate.token} or {@code PROJECTSTATE_TOKEN}.
 */
public final class ProjectClient {

    private ProjectClient() {}

    public static void main(String[] args) throws Exception {
        PersistenceConfig config = PersistenceConfig.load();
        int i = 0;
        String endpoint = config.clientEndpoint();
        if (args.length > 1 && args[0].contains(":")) {
            endpoint = args[i++];
        }
        if (args.length <= i) {
            usage();
            return;
        }

        String token = System.getProperty("projectstate.token", System.getenv("PROJECTSTATE_TOKEN"));
        SimpleRetryExecutor retry = new SimpleRetryExecutor(config.retryMaxAttempts(), config.retryBaseDelayMs(),
                config.retryMaxDelayMs(), config.retryJitterMs(), e -> e instanceof IOException);
        RemoteStorageGateway gateway = new RemoteStorageGateway(
                new ProjectApiClient(endpoint, retry, new DefaultHttpHandler()),
                () -> token == null ? null : new Credential(token, null));

        String command = args[i++];
        try {
            switch (command) {
                case "list" -> System.out.println(Json.PRETTY.toJson(gateway.list(50, 0)));
                case "get" -> System.out.println(Json.PRETTY.toJson(gateway.read(requireArg(args, i))));
                case "delete" -> {
                    String id = requireArg(args, i);
                    gateway.delete(id);
                    System.out.println("Deleted " + id);
                }
                case "health" -> System.out.println(Json.PRETTY.toJson(gateway.health()));
                default -> usage();
            }
        } catch (PersistenceException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    private static String requireArg(String[] args, int i) {
        if (args.length <= i) {
            throw new IllegalArgumentException("missing project id");
        }
        return args[i];
    }

    private static void usage() {
        System.out.println("Usage: ProjectClient [host:port] list | get <id> | delete <id> | health");
    }
}
