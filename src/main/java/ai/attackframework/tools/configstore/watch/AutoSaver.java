package ai.attackframework.tools.configstore.watch;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import ai.attackframework.tools.configstore.utils.Logger;

/**
 * Periodically persists the in-memory config when it differs from what was last written.
 * Lets callers mutate a config object in place without saving after every change.
 */
public final class AutoSaver {

    /** What the auto-saver persists. */
    public interface Target {
        /** True when the in-memory value differs from the last value written. */
        boolean hasUnsavedChanges();

        /** Writes the in-memory value. */
        void saveCurrent();
    }

    private final long intervalMs;
    private final Target target;
    private final String logPrefix;
    private final Object tickLock = new Object();
    private ScheduledFuture<?> task;

    public AutoSaver(String configId, long intervalMs, Target target) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be > 0: " + intervalMs);
        }
        this.intervalMs = intervalMs;
        this.target = Objects.requireNonNull(target, "target");
        this.logPrefix = Logger.prefix(configId);
    }

    /**
     * Schedules ticks with a fixed delay of the configured interval.
     *
     * @throws IllegalStateException when already started
     */
    public synchronized void start(ScheduledExecutorService scheduler) {
        if (task != null) {
            throw new IllegalStateException("Auto-save already started");
        }
        task = scheduler.scheduleWithFixedDelay(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        Logger.logInfo(logPrefix + "Auto-save every " + intervalMs + " ms.");
    }

    /** Cancels future ticks and waits for a tick in progress to finish. Idempotent. */
    public void stop() {
        ScheduledFuture<?> t;
        synchronized (this) {
            t = task;
        }
        if (t == null || t.isCancelled()) return;
        t.cancel(false);
        synchronized (tickLock) {
            Logger.logDebug(logPrefix + "Auto-save stopped.");
        }
    }

    /**
     * One auto-save check. Failures are logged so later ticks still run.
     */
    void tick() {
        synchronized (tickLock) {
            try {
                if (target.hasUnsavedChanges()) {
                    Logger.logDebug(logPrefix + "Unsaved changes detected; auto-saving.");
                    target.saveCurrent();
                }
            } catch (RuntimeException e) {
                Logger.logError(logPrefix + "Auto-save failed", e);
            }
        }
    }
}
