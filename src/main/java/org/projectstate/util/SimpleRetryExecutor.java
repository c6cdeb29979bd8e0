package org.projectstate.util;

import org.projectstate.interfaces.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * SimpleRetryExecutor retries an operation with exponential backoff plus random jitter.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>Attempt count and delays are bounded; {@code maxDelayMs} caps the backoff.</li>
 *   <li>A predicate decides which failures are transient. Anything else is rethrown at once.</li>
 *   <li>Thread sleep is intentional; callers run this off the session thread.</li>
 * </ul>
 */
public final class SimpleRetryExecutor implements RetryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(SimpleRetryExecutor.class);

    /** Maximum number of attempts (inclusive of first try). */
    private final int maxAttempts;     // e.g., 4

    /** Initial delay before retrying, in milliseconds. */
    private final long baseDelayMs;    // e.g., 200

    /** Maximum allowed delay between retries, in milliseconds. */
    private final long maxDelayMs;     // e.g., 1600

    /** Maximum random jitter applied to each delay, in milliseconds. */
    private final long jitterMs;       // e.g., 100

    private final Predicate<Exception> retryable;

    /** Retries every exception. */
    public SimpleRetryExecutor(int maxAttempts, long baseDelayMs, long maxDelayMs, long jitterMs) {
        this(maxAttempts, baseDelayMs, maxDelayMs, jitterMs, e -> true);
    }

    /**
     * @param maxAttempts maximum number of attempts (minimum 1)
     * @param baseDelayMs base delay in milliseconds before first retry
     * @param maxDelayMs  maximum delay cap for exponential backoff
     * @param jitterMs    random jitter range in milliseconds (adds up to this amount)
     * @param retryable   returns true for failures worth another attempt
     */
    public SimpleRetryExecutor(int maxAttempts, long baseDelayMs, long maxDelayMs, long jitterMs,
                               Predicate<Exception> retryable) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxDelayMs  = Math.max(this.baseDelayMs, maxDelayMs);
        this.jitterMs    = Math.max(0, jitterMs);
        this.retryable   = retryable;
    }

    /**
     * Executes {@code op}, sleeping 200 → 400 → 800 → 1600 ms (for the default settings)
     * between attempts.
     */
    @Override
    public <T> T execute(Callable<T> op) throws Exception {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return op.call();
            } catch (Exception e) {
                if (attempt >= maxAttempts || !retryable.test(e)) {
                    if (attempt > 1) {
                        logger.warn("Giving up after {} attempt(s): {}", attempt, e.getMessage());
                    }
                    throw e;
                }

                long delay = baseDelayMs << Math.max(0, attempt - 1);
                if (delay > maxDelayMs) delay = maxDelayMs;
                long sleep = delay + (jitterMs > 0 ? ThreadLocalRandom.current().nextLong(jitterMs) : 0L);

                logger.debug("Retry attempt {} in {}ms (error: {})", attempt + 1, sleep, e.getMessage());

                try {
                    Thread.sleep(sleep);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }
}
