package org.projectstate.exceptions;

import org.projectstate.version.SyncResult;

/**
 * Raised by gateway updates that carried a stale local version. The conflict
 * holds both representations so the caller can choose a resolution.
 */
public class VersionConflictException extends PersistenceException {

    private final SyncResult.Conflict conflict;

    public VersionConflictException(SyncResult.Conflict conflict) {
        super("Version conflict: local " + conflict.localVersion()
                + " behind server " + conflict.serverVersion());
        this.conflict = conflict;
    }

    public SyncResult.Conflict conflict() {
        return conflict;
    }
}
