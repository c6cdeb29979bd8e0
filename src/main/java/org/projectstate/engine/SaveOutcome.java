package org.projectstate.engine;

import org.projectstate.mode.Mode;
import org.projectstate.share.RejectionReason;
import org.projectstate.version.SyncResult;

/**
 * Result of one save attempt. Only {@link Status#SAVED} changes the session.
 *
 * @param conflict set for {@link Status#CONFLICT}
 * @param reason   set for {@link Status#REJECTED}
 */
public record SaveOutcome(
        Status status,
        Mode.Kind mode,
        String projectId,
        long serverVersion,
        String message,
        SyncResult.Conflict conflict,
        RejectionReason reason) {

    public enum Status { SAVED, CONFLICT, REJECTED, FAILED, SKIPPED, DISCARDED }

    static SaveOutcome saved(Mode.Kind mode, String projectId, long serverVersion) {
        return new SaveOutcome(Status.SAVED, mode, projectId, serverVersion, null, null, null);
    }

    static SaveOutcome conflict(String projectId, SyncResult.Conflict conflict) {
        return new SaveOutcome(Status.CONFLICT, Mode.Kind.OWNER, projectId, conflict.serverVersion(),
                "Project was changed elsewhere", conflict, null);
    }

    static SaveOutcome rejected(String projectId, RejectionReason reason, String message) {
        return new SaveOutcome(Status.REJECTED, Mode.Kind.SHARED_COLLABORATIVE, projectId, 0, message, null, reason);
    }

    static SaveOutcome failed(Mode.Kind mode, String projectId, String message) {
        return new SaveOutcome(Status.FAILED, mode, projectId, 0, message, null, null);
    }

    static SaveOutcome skipped() {
        return new SaveOutcome(Status.SKIPPED, null, null, 0, "A save or load is already in progress", null, null);
    }

    static SaveOutcome discarded() {
        return new SaveOutcome(Status.DISCARDED, null, null, 0, "Session closed", null, null);
    }

    public boolean isSaved() {
        return status == Status.SAVED;
    }
}
