package org.projectstate.engine;

/** Caller's answer to a version conflict. */
public enum ConflictResolution {
    /** Resubmit the local snapshot on top of the server's version. */
    ACCEPT_LOCAL,
    /** Install the server snapshot and adopt its version. */
    ACCEPT_REMOTE
}
