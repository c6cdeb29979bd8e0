package org.projectstate.exceptions;

/** The backend refused the caller's credential (missing, unknown or expired). */
public class UnauthorizedException extends PersistenceException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
