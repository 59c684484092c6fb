package ai.attackframework.tools.configstore.watch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.attackframework.tools.configstore.utils.Logger;
import ai.attackframework.tools.configstore.utils.config.ConfigKeys;

class ChangeWatcherTest {

    @TempDir
    Path dir;

    private Path configFile;
    private ExecutorService executor;
    private ChangeWatcher watcher;

    @BeforeEach
    void setUp() {
        configFile = dir.resolve(ConfigKeys.CONFIG_FILE_NAME);
        executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ChangeWatcherTest");
            t.setDaemon(true);
            return t;
        });
    }

    @AfterEach
    void tearDown() {
        if (watcher != null) watcher.stop();
        executor.shutdownNow();
    }

    @Test
    void modifyingConfigFile_invokesCallback() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        watcher = new ChangeWatcher("test", configFile, 50, fired::countDown);
        watcher.start(executor);
        assertThat(watcher.awaitReady(5, TimeUnit.SECONDS)).isTrue();

        Files.writeString(configFile, "{}");

        assertThat(fired.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(watcher.isRunning()).isTrue();
    }

    @Test
    void burstOfWrites_isDebouncedIntoOneCallback() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch fired = new CountDownLatch(1);
        watcher = new ChangeWatcher("test", configFile, 500, () -> {
            calls.incrementAndGet();
            fired.countDown();
        });
        watcher.start(executor);
        assertThat(watcher.awaitReady(5, TimeUnit.SECONDS)).isTrue();

        for (int i = 0; i < 5; i++) {
            Files.writeString(configFile, "{\"n\": " + i + "}");
        }

        assertThat(fired.await(10, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(700);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void otherFilesInDirectory_doNotInvokeCallback() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        watcher = new ChangeWatcher("test", configFile, 0, calls::incrementAndGet);
        watcher.start(executor);
        assertThat(watcher.awaitReady(5, TimeUnit.SECONDS)).isTrue();

        Files.writeString(dir.resolve("unrelated.txt"), "x");
        Thread.sleep(500);

        assertThat(calls.get()).isZero();
    }

    @Test
    void failingCallback_keepsWatching() throws Exception {
        CountDownLatch second = new CountDownLatch(2);
        watcher = new ChangeWatcher("test", configFile, 0, () -> {
            second.countDown();
            throw new IllegalStateException("boom");
        });
        watcher.start(executor);
        assertThat(watcher.awaitReady(5, TimeUnit.SECONDS)).isTrue();

        Files.writeString(configFile, "{}");
        Thread.sleep(300);
        Files.writeString(configFile, "{\"a\": 1}");

        assertThat(second.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(watcher.isRunning()).isTrue();
    }

    @Test
    void stop_endsLoop_andIsIdempotent() throws Exception {
        watcher = new ChangeWatcher("test", configFile, 0, () -> { });
        watcher.start(executor);
        assertThat(watcher.awaitReady(5, TimeUnit.SECONDS)).isTrue();

        watcher.stop();
        watcher.stop();

        assertThat(watcher.isRunning()).isFalse();
    }

    @Test
    void missingParentDirectory_logsError_andExits() throws Exception {
        List<String> errors = new CopyOnWriteArrayList<>();
        Logger.LogListener listener = (level, message) -> {
            if ("ERROR".equals(level)) errors.add(message);
        };
        Logger.registerListener(listener);
        try {
            AtomicInteger calls = new AtomicInteger();
            watcher = new ChangeWatcher("test", dir.resolve("absent").resolve(ConfigKeys.CONFIG_FILE_NAME),
                    0, calls::incrementAndGet);
            watcher.start(executor);

            assertThat(watcher.awaitReady(1, TimeUnit.SECONDS)).isFalse();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (errors.isEmpty() && System.nanoTime() < deadline) {
                Thread.sleep(20);
            }

            long begin = System.nanoTime();
            watcher.stop();
            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin)).isLessThan(2_000);

            assertThat(watcher.isRunning()).isFalse();
            assertThat(errors).anySatisfy(m -> assertThat(m).contains("Could not set up file watcher"));
            assertThat(calls.get()).isZero();
        } finally {
            Logger.unregisterListener(listener);
        }
    }

    @Test
    void stop_beforeStart_isHarmless() {
        watcher = new ChangeWatcher("test", configFile, 0, () -> { });

        watcher.stop();

        assertThat(watcher.isRunning()).isFalse();
    }

    @Test
    void start_twice_throws() {
        watcher = new ChangeWatcher("test", configFile, 0, () -> { });
        watcher.start(executor);

        assertThatThrownBy(() -> watcher.start(executor)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void negativeDebounce_isRejected() {
        assertThatThrownBy(() -> new ChangeWatcher("test", configFile, -1, () -> { }))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
