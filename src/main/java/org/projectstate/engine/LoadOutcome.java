package org.projectstate.engine;

import org.projectstate.mode.Mode;

/** Result of one load attempt. A session is only touched on {@link Status#LOADED}. */
public record LoadOutcome(Status status, Mode.Kind mode, String projectId, long serverVersion, String message) {

    public enum Status { LOADED, NOT_FOUND, MALFORMED, FAILED, SKIPPED, DISCARDED }

    static LoadOutcome loaded(Mode.Kind mode, String projectId, long serverVersion) {
        return new LoadOutcome(Status.LOADED, mode, projectId, serverVersion, null);
    }

    static LoadOutcome of(Status status, Mode.Kind mode, String projectId, String message) {
        return new LoadOutcome(status, mode, projectId, 0, message);
    }

    static LoadOutcome skipped() {
        return of(Status.SKIPPED, null, null, "A save or load is already in progress");
    }

    static LoadOutcome discarded() {
        return of(Status.DISCARDED, null, null, "Session closed");
    }

    public boolean isLoaded() {
        return status == Status.LOADED;
    }
}
