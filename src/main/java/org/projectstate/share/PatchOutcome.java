package org.projectstate.share;

/**
 * Result of a shared-editor patch: either {@link Ack} or {@link Rejected}.
 */
public interface PatchOutcome {

    boolean accepted();

    record Ack(String projectId, String name, String updatedAt, long serverVersion) implements PatchOutcome {
        @Override
        public boolean accepted() {
            return true;
        }
    }

    /**
     * @param message human-readable cause, surfaced verbatim to the collaborator
     * @param local   true when the request never left the client
     */
    record Rejected(RejectionReason reason, String message, boolean local) implements PatchOutcome {
        @Override
        public boolean accepted() {
            return false;
        }
    }
}
