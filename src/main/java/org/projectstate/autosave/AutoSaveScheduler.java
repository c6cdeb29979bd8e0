package org.projectstate.autosave;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Debounced single-shot save timer.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>Each {@link #schedule} call cancels the pending timer and arms a new one, so a
 *       burst of edits produces one save once edits pause for the debounce window.</li>
 *   <li>Arming is refused unless the guard says so (shared-collaborative mode); the
 *       guard is checked again when the timer fires.</li>
 *   <li>A fire that finds another save in flight is re-armed once, so the last edit of
 *       a burst is not lost to a slow save. A second skip is dropped.</li>
 *   <li>After {@link #close()} nothing is armed again.</li>
 * </ul>
 */
public class AutoSaveScheduler implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(AutoSaveScheduler.class);

    /** One deferred save. */
    @FunctionalInterface
    public interface SaveTask {
        /** @return false when the save was skipped because another save was in flight */
        boolean runSave() throws Exception;
    }

    private final ScheduledExecutorService timer;
    private final long debounceMs;
    private final BooleanSupplier armGuard;

    private ScheduledFuture<?> pending;   // guarded by this
    private long generation;              // guarded by this
    private boolean closed;               // guarded by this

    public AutoSaveScheduler(ScheduledExecutorService timer, long debounceMs, BooleanSupplier armGuard) {
        this.timer = timer;
        this.debounceMs = Math.max(0, debounceMs);
        this.armGuard = armGuard;
    }

    /**
     * Arms (or re-arms) the timer for {@code task}.
     *
     * @return false when nothing was armed: closed, or the guard refused
     */
    public synchronized boolean schedule(SaveTask task) {
        if (closed || !armGuard.getAsBoolean()) {
            return false;
        }
        arm(task, false);
        return true;
    }

    /** Drops the pending timer, if any. Later {@link #schedule} calls still work. */
    public synchronized void cancel() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
            generation++;
        }
    }

    public synchronized boolean isPending() {
        return pending != null;
    }

    @Override
    public synchronized void close() {
        closed = true;
        cancel();
    }

    private void arm(SaveTask task, boolean retry) {
        if (pending != null) {
            pending.cancel(false);
        }
        long armedAt = ++generation;
        pending = timer.schedule(() -> fire(task, armedAt, retry), debounceMs, TimeUnit.MILLISECONDS);
    }

    private void fire(SaveTask task, long armedAt, boolean retry) {
        synchronized (this) {
            // superseded by a later schedule() or cancelled after the timer started
            if (closed || armedAt != generation) return;
            pending = null;
            if (!armGuard.getAsBoolean()) {
                logger.debug("Auto-save fired outside shared mode, dropped");
                return;
            }
        }

        boolean ran;
        try {
            ran = task.runSave();
        } catch (Exception e) {
            logger.warn("Auto-save failed: {}", e.getMessage(), e);
            return;
        }
        if (ran) return;

        synchronized (this) {
            if (retry || closed || pending != null) {
                logger.debug("Auto-save skipped, save already in flight");
                return;
            }
            logger.debug("Auto-save skipped while another save was in flight, re-arming once");
            arm(task, true);
        }
    }
}
