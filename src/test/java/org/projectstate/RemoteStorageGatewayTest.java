package org.projectstate;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.projectstate.client.ProjectApiClient;
import org.projectstate.client.RemoteStorageGateway;
import org.projectstate.exceptions.NetworkFailureException;
import org.projectstate.exceptions.NotFoundException;
import org.projectstate.exceptions.UnauthorizedException;
import org.projectstate.exceptions.VersionConflictException;
import org.projectstate.http.DefaultHttpHandler;
import org.projectstate.mode.Credential;
import org.projectstate.model.ProjectDraft;
import org.projectstate.model.ProjectRecord;
import org.projectstate.model.ProjectSummary;
import org.projectstate.model.ProjectUpdate;
import org.projectstate.model.ShareSettings;
import org.projectstate.util.SimpleRetryExecutor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RemoteStorageGatewayTest {

    @TempDir Path tmp;

    private TestServer srv;
    private RemoteStorageGateway alice;

    @BeforeEach
    void start() throws IOException {
        srv = TestServer.start(tmp);
        alice = new RemoteStorageGateway(srv.client(), () -> new Credential(TestServer.ALICE_TOKEN, null));
    }

    @AfterEach
    void stop() {
        srv.close();
    }

    @Test
    void createReadAndSyncRoundTripThroughTheServer() throws Exception {
        ProjectRecord created = alice.create(draft("Doc A"));
        assertEquals(1, created.serverVersion());

        ProjectRecord read = alice.read(created.id());
        assertEquals("Doc A", read.name());
        assertEquals(created.id(), read.projectData().get("id").getAsString());

        ProjectRecord synced = alice.sync(created.id(), Fixtures.snapshotJson(created.id(), "Doc A", 2), 1);
        assertEquals(2, synced.serverVersion());
    }

    @Test
    void staleSyncSurfacesTheConflict() throws Exception {
        ProjectRecord created = alice.create(draft("Doc A"));
        alice.sync(created.id(), Fixtures.snapshotJson(created.id(), "Doc A", 2), 1);

        VersionConflictException e = assertThrows(VersionConflictException.class,
                () -> alice.update(created.id(), new ProjectUpdate(null, null,
                        Fixtures.snapshotJson(created.id(), "Doc A", 5), null, 1L)));
        assertEquals(1, e.conflict().localVersion());
        assertEquals(2, e.conflict().serverVersion());
        assertNotNull(e.conflict().serverData());
    }

    @Test
    void missingProjectIsNotFoundAndDeleteStaysQuiet() throws Exception {
        assertThrows(NotFoundException.class, () -> alice.read("does-not-exist"));
        assertDoesNotThrow(() -> alice.delete("does-not-exist"));

        ProjectRecord created = alice.create(draft("Doc"));
        alice.delete(created.id());
        assertThrows(NotFoundException.class, () -> alice.read(created.id()));
    }

    @Test
    void wrongCredentialIsUnauthorized() {
        RemoteStorageGateway anonymous = new RemoteStorageGateway(srv.client(), () -> null);
        assertThrows(UnauthorizedException.class, () -> anonymous.list(10, 0));
    }

    @Test
    void listSearchAndStats() throws Exception {
        alice.create(draft("Annual report"));
        alice.create(draft("Menu"));

        assertEquals(2, alice.list(50, 0).size());
        List<ProjectSummary> hits = alice.search("annual", 20);
        assertEquals(1, hits.size());
        assertEquals("Annual report", hits.get(0).name());
        assertEquals(2, alice.stats().totalProjects());
        assertEquals("healthy", alice.health().get("status").getAsString());
    }

    @Test
    void sharedReadFollowsTheShareSettings() throws Exception {
        ProjectRecord created = alice.create(draft("Doc"));
        ProjectRecord shared = alice.updateShareSettings(created.id(), new ShareSettings(true, "editor", true));
        assertEquals("editor", shared.sharePermissions());

        RemoteStorageGateway anonymous = new RemoteStorageGateway(srv.client(), () -> null);
        assertThrows(UnauthorizedException.class, () -> anonymous.readShared(shared.shareId()));

        RemoteStorageGateway bob = new RemoteStorageGateway(srv.client(), () -> new Credential(TestServer.BOB_TOKEN, null));
        assertEquals(created.id(), bob.readShared(shared.shareId()).id());
        assertEquals(created.id(), anonymous.readPublic(created.id()).id());

        alice.updateShareSettings(created.id(), new ShareSettings(false, null, null));
        assertThrows(NotFoundException.class, () -> bob.readShared(shared.shareId()));
    }

    @Test
    void unreachableServerIsANetworkFailure() throws Exception {
        ProjectApiClient dead = new ProjectApiClient("localhost:" + NetTestUtils.freePort(),
                new SimpleRetryExecutor(2, 1, 2, 0), new DefaultHttpHandler());
        RemoteStorageGateway gw = new RemoteStorageGateway(dead, () -> new Credential(TestServer.ALICE_TOKEN, null));
        assertThrows(NetworkFailureException.class, () -> gw.read("x"));
    }

    private static ProjectDraft draft(String name) {
        return new ProjectDraft(name, null, Fixtures.snapshotJson(null, name), List.of(), false);
    }
}
