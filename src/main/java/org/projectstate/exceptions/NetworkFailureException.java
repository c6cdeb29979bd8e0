package org.projectstate.exceptions;

/** Transport failure or a server error that survived every retry. */
public class NetworkFailureException extends PersistenceException {

    private final int status;

    public NetworkFailureException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    public NetworkFailureException(int status, String message) {
        super(message);
        this.status = status;
    }

    /** @return the HTTP status that caused the failure, or -1 for transport errors */
    public int status() {
        return status;
    }
}
