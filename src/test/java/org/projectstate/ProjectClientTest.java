package org.projectstate;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.projectstate.client.ProjectApiClient;
import org.projectstate.client.ProjectClient;
import org.projectstate.http.DefaultHttpHandler;
import org.projectstate.http.RawHttpResponse;
import org.projectstate.model.ProjectDraft;
import org.projectstate.util.SimpleRetryExecutor;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectClientTest {

    @TempDir Path tmp;

    private TestServer srv;
    private final PrintStream originalOut = System.out;
    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() throws Exception {
        srv = TestServer.start(tmp);
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.clearProperty("projectstate.token");
        srv.close();
    }

    @Test
    void healthPrintsTheServerStatus() throws Exception {
        ProjectClient.main(new String[]{"localhost:" + srv.port(), "health"});
        assertTrue(output().contains("\"healthy\""), output());
    }

    @Test
    void listAndDeleteUseTheConfiguredToken() throws Exception {
        String id = srv.repository.create("alice",
                new ProjectDraft("From CLI", null, Fixtures.snapshotJson(null, "From CLI"), List.of(), false)).id();
        System.setProperty("projectstate.token", TestServer.ALICE_TOKEN);

        ProjectClient.main(new String[]{"localhost:" + srv.port(), "list"});
        assertTrue(output().contains("From CLI"), output());

        ProjectClient.main(new String[]{"localhost:" + srv.port(), "delete", id});
        assertTrue(output().contains("Deleted " + id));
        assertEquals(0, srv.repository.size());
    }

    @Test
    void unknownCommandPrintsUsage() throws Exception {
        ProjectClient.main(new String[]{"localhost:" + srv.port(), "frobnicate"});
        assertTrue(output().startsWith("Usage:"));
    }

    @Test
    void endpointParsingAcceptsSchemeAndPath() {
        ProjectApiClient c = new ProjectApiClient("http://example.org:8123/api", new SimpleRetryExecutor(1, 0, 0, 0),
                new DefaultHttpHandler());
        assertEquals("example.org", c.host());
        assertEquals(8123, c.port());
        assertEquals(4567, new ProjectApiClient("example.org", new SimpleRetryExecutor(1, 0, 0, 0),
                new DefaultHttpHandler()).port());
    }

    @Test
    void errorMessagePrefersDetailThenMessage() {
        assertEquals("nope", ProjectApiClient.errorMessage(
                RawHttpResponse.parse("HTTP/1.1 404 Not Found\r\n\r\n{\"detail\":\"nope\",\"message\":\"m\"}")));
        assertEquals("m", ProjectApiClient.errorMessage(
                RawHttpResponse.parse("HTTP/1.1 400 Bad Request\r\n\r\n{\"message\":\"m\"}")));
        assertEquals("HTTP 503", ProjectApiClient.errorMessage(
                RawHttpResponse.parse("HTTP/1.1 503 Service Unavailable\r\n\r\nnot json")));
    }

    private String output() {
        return captured.toString(StandardCharsets.UTF_8);
    }
}
