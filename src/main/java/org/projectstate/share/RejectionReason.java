package org.projectstate.share;

import org.projectstate.interfaces.HttpHandler;

/** Why a shared-editor patch was refused. */
public enum RejectionReason {
    NOT_IN_SHARED_MODE(HttpHandler.BAD_REQUEST, "Not in shared mode"),
    NO_EDITOR_PERMISSION(HttpHandler.FORBIDDEN, "You don't have editor permissions for this shared project"),
    SHARE_NOT_FOUND(HttpHandler.NOT_FOUND, "Shared project not found or no longer available"),
    INVALID_PAYLOAD(HttpHandler.BAD_REQUEST, "Invalid project data or share ID"),
    NETWORK_FAILURE(HttpHandler.SERVICE_UNAVAILABLE, "Shared project could not be reached");

    private final int status;
    private final String message;

    RejectionReason(int status, String message) {
        this.status = status;
        this.message = message;
    }

    /** HTTP status the server answers with for this reason. */
    public int status() {
        return status;
    }

    public String message() {
        return message;
    }

    /** Maps a patch response status back to a reason; anything unexpected counts as a network failure. */
    public static RejectionReason fromStatus(int status) {
        return switch (status) {
            case HttpHandler.FORBIDDEN -> NO_EDITOR_PERMISSION;
            case HttpHandler.NOT_FOUND -> SHARE_NOT_FOUND;
            case HttpHandler.BAD_REQUEST -> INVALID_PAYLOAD;
            default -> NETWORK_FAILURE;
        };
    }
}
