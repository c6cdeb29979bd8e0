package org.projectstate;

import org.junit.jupiter.api.Test;
import org.projectstate.model.ProjectSnapshot;
import org.projectstate.version.SyncResult;
import org.projectstate.version.VersionReconciler;
import org.projectstate.version.VersionedRecord;

import static org.junit.jupiter.api.Assertions.*;

class VersionReconcilerTest {

    private final VersionReconciler reconciler = new VersionReconciler();

    @Test
    void currentLocalVersionIsAcceptedAndIncrementsByOne() throws Exception {
        VersionedRecord durable = record("Doc v3", 3);
        ProjectSnapshot incoming = ProjectSnapshot.fromJson(Fixtures.snapshotJson("p1", "Doc v4"));

        SyncResult r = reconciler.reconcile(durable, incoming, 3);

        SyncResult.Synced synced = assertInstanceOf(SyncResult.Synced.class, r);
        assertEquals(4, synced.record().serverVersion());
        assertEquals(4, synced.record().localVersion());
        assertEquals("Doc v4", synced.record().snapshot().name());
    }

    @Test
    void staleLocalVersionConflictsWithBothSides() throws Exception {
        VersionedRecord durable = record("Server", 2);
        ProjectSnapshot incoming = ProjectSnapshot.fromJson(Fixtures.snapshotJson("p1", "Mine"));

        SyncResult.Conflict c = assertInstanceOf(SyncResult.Conflict.class, reconciler.reconcile(durable, incoming, 1));
        assertEquals(SyncResult.STATUS_CONFLICT, c.status());
        assertEquals(1, c.localVersion());
        assertEquals(2, c.serverVersion());
        assertEquals("Mine", c.localData().get("name").getAsString());
        assertEquals("Server", c.serverData().get("name").getAsString());
    }

    @Test
    void overwriteAlwaysIncrements() throws Exception {
        VersionedRecord durable = record("Doc", 7);
        ProjectSnapshot incoming = ProjectSnapshot.fromJson(Fixtures.snapshotJson("p1", "Doc"));
        assertEquals(8, reconciler.overwrite(durable, incoming).serverVersion());
    }

    private static VersionedRecord record(String name, long version) throws Exception {
        return new VersionedRecord("p1", ProjectSnapshot.fromJson(Fixtures.snapshotJson("p1", name)), version, version);
    }
}
