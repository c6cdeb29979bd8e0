package org.projectstate.interfaces;

import java.util.concurrent.Callable;

/** Runs a network exchange, repeating it while the failure looks transient. */
public interface RetryExecutor {

    /**
     * @return whatever the last successful attempt returned
     * @throws Exception the last failure once attempts run out, or the first failure that is not transient
     */
    <T> T execute(Callable<T> op) throws Exception;
}
