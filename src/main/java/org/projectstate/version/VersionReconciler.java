package org.projectstate.version;

import org.projectstate.model.ProjectSnapshot;

/**
 * Decides whether a write may replace the durable snapshot.
 * <ul>
 *   <li>A write whose local version is behind the durable version is rejected with both
 *       representations. Nothing is merged.</li>
 *   <li>An accepted write moves the version up by exactly one; the caller adopts the
 *       returned version as its new local version.</li>
 * </ul>
 * The reconciler is stateless. Callers apply the result atomically per project.
 */
public final class VersionReconciler {

    public SyncResult reconcile(VersionedRecord durable, ProjectSnapshot incoming, long localVersion) {
        if (durable.serverVersion() > localVersion) {
            return new SyncResult.Conflict(
                    incoming.toJsonTree(),
                    durable.snapshot().toJsonTree(),
                    localVersion,
                    durable.serverVersion());
        }
        long next = durable.serverVersion() + 1;
        return new SyncResult.Synced(new VersionedRecord(durable.id(), incoming, next, next));
    }

    /** Unconditional owner write (no local version supplied). */
    public VersionedRecord overwrite(VersionedRecord durable, ProjectSnapshot incoming) {
        long next = durable.serverVersion() + 1;
        return new VersionedRecord(durable.id(), incoming, next, next);
    }
}
