package org.projectstate.exceptions;

/** A stored snapshot lacks a required field or is not a JSON object. */
public class MalformedSnapshotException extends PersistenceException {

    public MalformedSnapshotException(String message) {
        super(message);
    }

    public MalformedSnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
