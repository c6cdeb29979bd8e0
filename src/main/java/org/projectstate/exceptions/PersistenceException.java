package org.projectstate.exceptions;

/**
 * Root of every failure the persistence engine reports. Subclasses name the
 * failure kind so callers can decide between retrying, prompting and giving up.
 */
public class PersistenceException extends Exception {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
