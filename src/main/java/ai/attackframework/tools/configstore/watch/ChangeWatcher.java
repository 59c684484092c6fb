package ai.attackframework.tools.configstore.watch;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import ai.attackframework.tools.configstore.utils.Logger;

/**
 * Watches the config file's directory and invokes a callback once a burst of changes to
 * the file has settled.
 *
 * <p>Editors often write a file in several steps; after the first event the watcher sleeps
 * for the debounce period and discards the events that piled up meanwhile, so the callback
 * runs once per burst. The callback is expected to compare file fingerprints itself.</p>
 *
 * <p>One instance runs once: {@link #start(ExecutorService)} then {@link #stop()}.</p>
 */
public final class ChangeWatcher {

    private static final long STOP_WAIT_SECONDS = 5;

    private final Path configFile;
    private final long debounceMs;
    private final Runnable onChange;
    private final String logPrefix;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final CountDownLatch ready = new CountDownLatch(1);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile boolean stopRequested;
    private volatile WatchService watchService;
    private volatile Future<?> task;

    public ChangeWatcher(String configId, Path configFile, long debounceMs, Runnable onChange) {
        if (debounceMs < 0) {
            throw new IllegalArgumentException("debounceMs must be >= 0: " + debounceMs);
        }
        this.configFile = Objects.requireNonNull(configFile, "configFile").toAbsolutePath();
        this.debounceMs = debounceMs;
        this.onChange = Objects.requireNonNull(onChange, "onChange");
        this.logPrefix = Logger.prefix(configId);
    }

    /**
     * Submits the watch loop to {@code executor}.
     *
     * @throws IllegalStateException when already started
     */
    public void start(ExecutorService executor) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Watcher already started");
        }
        task = executor.submit(this::watchLoop);
    }

    /**
     * Waits until the directory is registered and events are being observed.
     *
     * @return {@code true} when ready within the timeout; {@code false} on timeout or when
     *         setup failed
     */
    public boolean awaitReady(long timeout, TimeUnit unit) throws InterruptedException {
        return ready.await(timeout, unit) && !stopRequested;
    }

    /** True between successful registration and loop exit. */
    public boolean isRunning() {
        return ready.getCount() == 0 && stopped.getCount() > 0;
    }

    /**
     * Requests the loop to stop and waits (bounded) for it to exit. Idempotent.
     */
    public void stop() {
        stopRequested = true;
        WatchService ws = watchService;
        if (ws != null) {
            try {
                ws.close();
            } catch (IOException e) {
                Logger.logWarn(logPrefix + "Closing watch service failed", e);
            }
        }
        Future<?> f = task;
        if (f != null) {
            f.cancel(true);
        }
        if (running.get()) {
            try {
                if (!stopped.await(STOP_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    Logger.logWarn(logPrefix + "Watcher did not stop within " + STOP_WAIT_SECONDS + "s.");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /* ----------------------- loop ----------------------- */

    private void watchLoop() {
        running.set(true);
        try {
            if (stopRequested) return;

            Path dir = configFile.getParent();
            WatchService ws;
            try {
                ws = dir.getFileSystem().newWatchService();
                dir.register(ws, StandardWatchEventKinds.ENTRY_CREATE, StandardWatchEventKinds.ENTRY_MODIFY);
            } catch (IOException | RuntimeException e) {
                Logger.logError(logPrefix + "Could not set up file watcher for " + dir, e);
                return;
            }
            watchService = ws;
            if (stopRequested) {
                ws.close();
                return;
            }
            ready.countDown();
            Logger.logInfo(logPrefix + "Watching " + configFile.getFileName() + " for changes.");

            try (ws) {
                while (!stopRequested && !Thread.currentThread().isInterrupted()) {
                    WatchKey key = ws.take();
                    boolean relevant = concernsConfigFile(key);
                    if (!key.reset()) {
                        Logger.logWarn(logPrefix + "Config directory is no longer accessible; stopping watcher.");
                        break;
                    }
                    if (relevant) {
                        settle(ws);
                        fire();
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ClosedWatchServiceException e) {
            Logger.logDebug(logPrefix + "Watch service closed.");
        } catch (IOException e) {
            Logger.logWarn(logPrefix + "Closing watch service failed", e);
        } finally {
            Logger.logInfo(logPrefix + "Stopping config file watcher.");
            stopped.countDown();
        }
    }

    private boolean concernsConfigFile(WatchKey key) {
        boolean relevant = false;
        for (WatchEvent<?> event : key.pollEvents()) {
            if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                relevant = true; // events were lost; assume ours was among them
            } else if (configFile.getFileName().equals(event.context())) {
                relevant = true;
            }
        }
        return relevant;
    }

    // Debounce: wait, then drop whatever queued up meanwhile.
    private void settle(WatchService ws) throws InterruptedException {
        if (debounceMs > 0) {
            Thread.sleep(debounceMs);
        }
        WatchKey more;
        while ((more = ws.poll()) != null) {
            more.pollEvents();
            more.reset();
        }
    }

    private void fire() {
        try {
            onChange.run();
        } catch (RuntimeException e) {
            Logger.logError(logPrefix + "Handling config file change failed", e);
        }
    }
}
