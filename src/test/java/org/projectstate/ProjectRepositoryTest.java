package org.projectstate;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.projectstate.exceptions.MalformedSnapshotException;
import org.projectstate.exceptions.NotFoundException;
import org.projectstate.exceptions.UnauthorizedException;
import org.projectstate.exceptions.VersionConflictException;
import org.projectstate.interfaces.SnapshotStore;
import org.projectstate.model.ProjectDraft;
import org.projectstate.model.ProjectRecord;
import org.projectstate.model.ProjectUpdate;
import org.projectstate.model.ShareSettings;
import org.projectstate.persistance.FileSnapshotStore;
import org.projectstate.server.ProjectRepository;
import org.projectstate.share.PatchOutcome;
import org.projectstate.share.RejectionReason;
import org.projectstate.util.ShareIdGenerator;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectRepositoryTest {

    @TempDir Path tmp;

    private ProjectRepository repo;

    @BeforeEach
    void setUp() {
        repo = new ProjectRepository(new FileSnapshotStore(tmp, "projects", 5, Fixtures.CLOCK), Fixtures.CLOCK);
    }

    @Test
    void createStartsAtVersionOneAndStampsId() throws Exception {
        ProjectRecord r = create("alice", "Doc A");

        assertEquals(1, r.serverVersion());
        assertEquals(1, r.localVersion());
        assertEquals("synced", r.syncStatus());
        assertEquals(r.id(), r.projectData().get("id").getAsString());
        assertEquals("alice", r.userId());
    }

    @Test
    void staleRetryConflictsAndLeavesRecordUntouched() throws Exception {
        ProjectRecord r = create("alice", "Doc A");

        ProjectRecord v2 = repo.sync("alice", r.id(), Fixtures.snapshotJson(r.id(), "Doc A", 3), 1);
        assertEquals(2, v2.serverVersion());

        VersionConflictException e = assertThrows(VersionConflictException.class,
                () -> repo.sync("alice", r.id(), Fixtures.snapshotJson(r.id(), "Doc A", 3), 1));
        assertEquals(1, e.conflict().localVersion());
        assertEquals(2, e.conflict().serverVersion());
        assertEquals(v2, repo.find("alice", r.id()).orElseThrow());
    }

    @Test
    void everyAcceptedWriteIncrementsByExactlyOne() throws Exception {
        ProjectRecord r = create("alice", "Doc A");
        long version = r.serverVersion();
        for (int i = 0; i < 5; i++) {
            version = repo.sync("alice", r.id(), Fixtures.snapshotJson(r.id(), "Doc A", i), version).serverVersion();
        }
        assertEquals(6, version);

        ProjectRecord unconditional = repo.update("alice", r.id(), new ProjectUpdate("Renamed", null, null, null, null));
        assertEquals(7, unconditional.serverVersion());
        assertEquals("Renamed", unconditional.name());
        assertEquals("Renamed", unconditional.projectData().get("name").getAsString());
    }

    @Test
    void updateKeepsDurableCreationTime() throws Exception {
        ProjectRecord r = create("alice", "Doc A");
        JsonObject data = Fixtures.snapshotJson(r.id(), "Doc A");
        data.addProperty("createdAt", "1999-01-01T00:00:00Z");

        ProjectRecord updated = repo.sync("alice", r.id(), data, 1);
        assertEquals(r.createdAt(), updated.projectData().get("createdAt").getAsString());
    }

    @Test
    void malformedSnapshotIsRefused() throws Exception {
        JsonObject noDoc = Fixtures.snapshotJson(null, "Doc");
        noDoc.remove("documentState");
        assertThrows(MalformedSnapshotException.class,
                () -> repo.create("alice", new ProjectDraft("Doc", null, noDoc, List.of(), false)));
        assertEquals(0, repo.size());
    }

    @Test
    void otherUsersCannotSeeOrDelete() throws Exception {
        ProjectRecord r = create("alice", "Doc A");

        assertTrue(repo.find("bob", r.id()).isEmpty());
        assertFalse(repo.delete("bob", r.id()));
        assertThrows(NotFoundException.class,
                () -> repo.update("bob", r.id(), new ProjectUpdate("x", null, null, null, null)));

        assertTrue(repo.delete("alice", r.id()));
        assertFalse(repo.delete("alice", r.id()));
    }

    @Test
    void deletingAProjectReleasesItsLock() throws Exception {
        ProjectRecord a = create("alice", "Doc A");
        ProjectRecord b = create("alice", "Doc B");
        repo.sync("alice", a.id(), Fixtures.snapshotJson(a.id(), "Doc A"), 1);
        repo.sync("alice", b.id(), Fixtures.snapshotJson(b.id(), "Doc B"), 1);
        assertEquals(2, repo.lockCount());

        assertTrue(repo.delete("alice", a.id()));
        assertEquals(1, repo.lockCount());
        assertTrue(repo.delete("alice", b.id()));
        assertEquals(0, repo.lockCount());
    }

    @Test
    void tableSurvivesRestart() throws Exception {
        ProjectRecord r = create("alice", "Doc A");
        repo.sync("alice", r.id(), Fixtures.snapshotJson(r.id(), "Doc A"), 1);

        ProjectRepository restarted = new ProjectRepository(
                new FileSnapshotStore(tmp, "projects", 5, Fixtures.CLOCK), Fixtures.CLOCK);
        assertEquals(1, restarted.restore());
        assertEquals(2, restarted.find("alice", r.id()).orElseThrow().serverVersion());
    }

    @Test
    void failedPersistRollsBack() throws Exception {
        SnapshotStore broken = new SnapshotStore() {
            @Override public String load() { return null; }
            @Override public void save(String json) throws IOException { throw new IOException("disk full"); }
        };
        ProjectRepository failing = new ProjectRepository(broken, Fixtures.CLOCK);

        assertThrows(IOException.class, () -> failing.create("alice",
                new ProjectDraft("Doc", null, Fixtures.snapshotJson(null, "Doc"), List.of(), false)));
        assertEquals(0, failing.size());
    }

    @Test
    void publishingAssignsShareIdAndUnpublishingRevokesIt() throws Exception {
        ProjectRecord r = create("alice", "Doc A");

        ProjectRecord shared = repo.updateShareSettings("alice", r.id(), new ShareSettings(true, "editor", true));
        assertTrue(shared.isPublic());
        assertTrue(ShareIdGenerator.isWellFormed(shared.shareId()));
        assertEquals("editor", shared.sharePermissions());
        assertTrue(shared.requiresAuth());
        assertEquals(r.serverVersion(), shared.serverVersion());

        ProjectRecord again = repo.updateShareSettings("alice", r.id(), new ShareSettings(true, null, null));
        assertEquals(shared.shareId(), again.shareId());

        ProjectRecord revoked = repo.updateShareSettings("alice", r.id(), new ShareSettings(false, null, null));
        assertNull(revoked.shareId());
        assertEquals("viewer", revoked.sharePermissions());
        assertFalse(revoked.requiresAuth());
        assertThrows(NotFoundException.class, () -> repo.shared(shared.shareId(), true));

        assertThrows(IllegalArgumentException.class,
                () -> repo.updateShareSettings("alice", r.id(), new ShareSettings(true, "owner", null)));
    }

    @Test
    void sharedReadHonoursRequiresAuth() throws Exception {
        ProjectRecord r = create("alice", "Doc A");
        String shareId = repo.updateShareSettings("alice", r.id(), new ShareSettings(true, "viewer", true)).shareId();

        assertThrows(UnauthorizedException.class, () -> repo.shared(shareId, false));
        assertEquals(r.id(), repo.shared(shareId, true).id());
        assertThrows(NotFoundException.class, () -> repo.shared("unknown", true));
    }

    @Test
    void viewerPatchIsAlwaysRejected() throws Exception {
        ProjectRecord r = create("alice", "Doc A");
        String shareId = repo.updateShareSettings("alice", r.id(), new ShareSettings(true, "viewer", false)).shareId();

        assertTrue(repo.isViewerShare(shareId));
        assertFalse(repo.isViewerShare("unknown"));
        assertEquals(RejectionReason.NO_EDITOR_PERMISSION,
                reason(repo.sharedPatch(r.id(), shareId, "x", Fixtures.snapshotJson(r.id(), "x"))));
        assertEquals(RejectionReason.NO_EDITOR_PERMISSION, reason(repo.sharedPatch(r.id(), shareId, null, null)));
        assertEquals(RejectionReason.NO_EDITOR_PERMISSION,
                reason(repo.sharedPatch("other", shareId, null, new JsonObject())));
        assertEquals(1, repo.find("alice", r.id()).orElseThrow().serverVersion());
    }

    @Test
    void patchRejectionsAreDistinct() throws Exception {
        ProjectRecord r = create("alice", "Doc A");
        String shareId = repo.updateShareSettings("alice", r.id(), new ShareSettings(true, "editor", false)).shareId();

        assertEquals(RejectionReason.SHARE_NOT_FOUND,
                reason(repo.sharedPatch(r.id(), "zzzzzzzzzzzzzzzzzzzz", null, Fixtures.snapshotJson(r.id(), "x"))));
        assertEquals(RejectionReason.INVALID_PAYLOAD,
                reason(repo.sharedPatch(r.id(), "", null, Fixtures.snapshotJson(r.id(), "x"))));
        assertEquals(RejectionReason.INVALID_PAYLOAD,
                reason(repo.sharedPatch("another-project", shareId, null, Fixtures.snapshotJson(r.id(), "x"))));
        assertEquals(RejectionReason.INVALID_PAYLOAD,
                reason(repo.sharedPatch(r.id(), shareId, null, Fixtures.snapshotJson("someone-else", "x"))));

        JsonObject noDoc = Fixtures.snapshotJson(r.id(), "x");
        noDoc.remove("documentState");
        assertEquals(RejectionReason.INVALID_PAYLOAD, reason(repo.sharedPatch(r.id(), shareId, null, noDoc)));
    }

    @Test
    void editorPatchChangesOnlyNameAndData() throws Exception {
        ProjectRecord r = repo.create("alice",
                new ProjectDraft("Doc A", "desc", Fixtures.snapshotJson(null, "Doc A"), List.of("t1"), false));
        String shareId = repo.updateShareSettings("alice", r.id(), new ShareSettings(true, "editor", false)).shareId();

        PatchOutcome out = repo.sharedPatch(r.id(), shareId, "Edited", Fixtures.snapshotJson(r.id(), "Edited", 9));

        PatchOutcome.Ack ack = assertInstanceOf(PatchOutcome.Ack.class, out);
        assertEquals(2, ack.serverVersion());
        ProjectRecord after = repo.find("alice", r.id()).orElseThrow();
        assertEquals("Edited", after.name());
        assertEquals("alice", after.userId());
        assertEquals(List.of("t1"), after.tags());
        assertEquals("desc", after.description());
        assertTrue(after.isPublic());
        assertEquals(shareId, after.shareId());
    }

    @Test
    void listSearchAndStatsAreScopedToOwner() throws Exception {
        create("alice", "Quarterly report");
        create("alice", "Letter");
        create("bob", "Quarterly plan");

        assertEquals(2, repo.list("alice", 50, 0).size());
        assertEquals(1, repo.list("alice", 1, 1).size());
        assertEquals(List.of("Quarterly report"),
                repo.search("alice", "QUARTER", 20).stream().map(s -> s.name()).toList());
        assertEquals(2, repo.stats("alice").totalProjects());
        assertEquals(2, repo.stats("alice").workflowStepCounts().get("unknown"));
    }

    private ProjectRecord create(String user, String name) throws Exception {
        return repo.create(user, new ProjectDraft(name, null, Fixtures.snapshotJson(null, name), List.of(), false));
    }

    private static RejectionReason reason(PatchOutcome outcome) {
        return assertInstanceOf(PatchOutcome.Rejected.class, outcome).reason();
    }
}
