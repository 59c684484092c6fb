package ai.attackframework.tools.configstore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ai.attackframework.tools.configstore.backup.BackupStore;
import ai.attackframework.tools.configstore.migration.MigrationEngine;
import ai.attackframework.tools.configstore.migration.MigrationResult;
import ai.attackframework.tools.configstore.utils.FileUtil;
import ai.attackframework.tools.configstore.utils.Logger;
import ai.attackframework.tools.configstore.utils.config.ConfigData;
import ai.attackframework.tools.configstore.utils.config.ConfigKeys;
import ai.attackframework.tools.configstore.utils.config.ConfigMetadata;
import ai.attackframework.tools.configstore.utils.config.WatcherSettings;
import ai.attackframework.tools.configstore.utils.jsonc.CommentIndex;
import ai.attackframework.tools.configstore.utils.jsonc.JsoncCodec;
import ai.attackframework.tools.configstore.utils.jsonc.ParsedJsonc;
import ai.attackframework.tools.configstore.watch.AutoSaver;
import ai.attackframework.tools.configstore.watch.ChangeWatcher;
import ai.attackframework.tools.configstore.watch.FileFingerprint;

/**
 * Keeps a typed, versioned config object in sync with a commented JSONC file.
 *
 * <p>Files live at {@code {configDir}/{configId}/config.jsonc} with snapshots under
 * {@code {configDir}/{configId}/backups/}. The store never lets an invalid file become the
 * current value: content that cannot be read is backed up and replaced by the newest
 * backup, the last valid value, or the default, in that order. Files written under another
 * version are reconciled by {@link MigrationEngine} and rewritten.</p>
 *
 * <p>Threading: {@link #getCurrentConfig()} never blocks. Reload, save, migration,
 * recovery and auto-save run one at a time under a single write lock. The file watcher and
 * auto-saver run on a private two-thread scheduler that {@link #cleanup()} shuts down.</p>
 *
 * <p>The value returned by {@link #getCurrentConfig()} is the live instance; callers may
 * mutate it in place and rely on {@link #save()} or auto-save to persist it. A reload that
 * picks up an external edit replaces such unsaved mutations.</p>
 *
 * @param <T> config type
 */
public final class ConfigStore<T extends ConfigData> implements AutoCloseable {

    private static final long SHUTDOWN_WAIT_SECONDS = 5;

    private final String configId;
    private final String currentVersion;
    private final Class<T> type;
    private final T defaultConfig;
    private final String defaultHash;
    private final WatcherSettings settings;
    private final Path configFile;
    private final Path backupDir;
    private final String logPrefix;

    private final JsoncCodec codec;
    private final BackupStore<T> backups;
    private final MigrationEngine<T> migrations;
    private final ScheduledExecutorService executor;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicReference<T> current = new AtomicReference<>();
    private final AtomicReference<T> lastValid = new AtomicReference<>();
    private final AtomicReference<String> lastSavedHash = new AtomicReference<>();
    private final AtomicReference<FileFingerprint> lastObserved = new AtomicReference<>(FileFingerprint.NONE);
    private final AtomicReference<CommentIndex> comments = new AtomicReference<>(CommentIndex.empty());
    private final List<ConfigChangeListener<T>> listeners = new CopyOnWriteArrayList<>();

    // guarded by this
    private ChangeWatcher watcher;
    private AutoSaver autoSaver;
    private volatile boolean closed;

    /**
     * Creates a store whose config type is the runtime class of {@code defaultConfig}.
     */
    @SuppressWarnings("unchecked")
    public ConfigStore(String currentVersion, T defaultConfig, Path configDir, ConfigMetadata metadata) {
        this(currentVersion, defaultConfig,
                (Class<T>) Objects.requireNonNull(defaultConfig, "defaultConfig").getClass(),
                configDir, metadata);
    }

    /**
     * Creates a store with {@link ConfigMetadata#defaultFor(String)} metadata.
     */
    public ConfigStore(String currentVersion, T defaultConfig, Class<T> type, Path configDir) {
        this(currentVersion, defaultConfig, type, configDir,
                ConfigMetadata.defaultFor(Objects.requireNonNull(defaultConfig, "defaultConfig").getConfigId()));
    }

    /**
     * Creates the store, prepares its directories, then loads the file (or writes the
     * default when there is none) and starts the background tasks that {@code metadata}
     * enables.
     *
     * @param currentVersion schema version of this build
     * @param defaultConfig  compiled-in default; never mutated, its copies carry
     *                       {@code currentVersion}
     * @param type           config class used for data binding
     * @param configDir      root directory holding one sub-directory per config id
     * @param metadata       formatting and watcher settings
     */
    public ConfigStore(String currentVersion, T defaultConfig, Class<T> type,
                       Path configDir, ConfigMetadata metadata) {
        this(currentVersion, defaultConfig, type, configDir, metadata, Clock.systemDefaultZone());
    }

    ConfigStore(String currentVersion, T defaultConfig, Class<T> type,
                Path configDir, ConfigMetadata metadata, Clock clock) {
        Objects.requireNonNull(defaultConfig, "defaultConfig");
        Objects.requireNonNull(configDir, "configDir");
        Objects.requireNonNull(metadata, "metadata");
        if (currentVersion == null || currentVersion.isBlank()) {
            throw new IllegalArgumentException("currentVersion must not be blank");
        }
        String id = defaultConfig.getConfigId();
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("configId must not be blank");
        }

        this.configId = id;
        this.currentVersion = currentVersion;
        this.type = Objects.requireNonNull(type, "type");
        this.settings = metadata.watcherSettings();
        this.logPrefix = Logger.prefix(id);

        Path root = configDir.resolve(id);
        this.configFile = root.resolve(ConfigKeys.CONFIG_FILE_NAME);
        this.backupDir = root.resolve(ConfigKeys.BACKUP_DIR_NAME);

        this.codec = new JsoncCodec(currentVersion, metadata, clock);
        this.defaultConfig = codec.withCurrentVersion(defaultConfig, type);
        this.defaultHash = codec.hash(this.defaultConfig);
        this.backups = new BackupStore<>(id, configFile, backupDir, codec, type, clock);
        this.migrations = new MigrationEngine<>(id, codec, type, backups);

        AtomicInteger threadNo = new AtomicInteger(1);
        this.executor = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "ConfigStore-" + id + "-" + threadNo.getAndIncrement());
            t.setDaemon(true);
            return t;
        });

        current.set(freshDefault());
        lastValid.set(freshDefault());

        try {
            FileUtil.ensureDirectories(root, backupDir);
        } catch (IOException e) {
            Logger.logError(logPrefix + "Could not create config directories under " + root, e);
        }
        Logger.internalInfo(logPrefix + "Config store at " + configFile);

        reload();

        if (settings.enabled()) enableWatcher();
        if (settings.autoSaveEnabled()) enableAutoSave();
    }

    /* ======================== READ SIDE ======================== */

    /** Current value; never {@code null}, never blocks. */
    public T getCurrentConfig() {
        return current.get();
    }

    /** True when the current value differs from what was last written or read. */
    public boolean hasUnsavedChanges() {
        return !codec.hash(current.get()).equals(lastSavedHash.get());
    }

    /** Property comments carried from the last successful read. */
    public CommentIndex getComments() {
        return comments.get();
    }

    /** Path of the live config file, {@code {configDir}/{configId}/config.jsonc}. */
    public Path getConfigFile() {
        return configFile;
    }

    /** Directory holding this config's snapshots. */
    public Path getBackupDirectory() {
        return backupDir;
    }

    /**
     * Registers a listener for changes of the current value.
     *
     * <p>Listeners run on the thread that caused the change. A listener that throws is
     * logged and does not stop the others. Null and already-registered listeners are
     * ignored.</p>
     *
     * @param listener receives the new value and its {@link ChangeCause}
     */
    public void addListener(ConfigChangeListener<T> listener) {
        if (listener != null && !listeners.contains(listener)) listeners.add(listener);
    }

    /**
     * Unregisters a listener; unknown listeners are ignored.
     *
     * @param listener listener previously passed to {@link #addListener}
     */
    public void removeListener(ConfigChangeListener<T> listener) {
        listeners.remove(listener);
    }

    /* ======================== RELOAD ======================== */

    /**
     * Brings the current value in line with the file.
     *
     * <p>A missing file is replaced by the default. An unchanged file (same modification
     * time and size as last observed) is not read again. Invalid content triggers recovery.
     * Never throws.</p>
     */
    public void reload() {
        if (closed) {
            Logger.logWarn(logPrefix + "Store is closed; reload ignored.");
            return;
        }
        writeLock.lock();
        try {
            doReload();
        } finally {
            writeLock.unlock();
        }
    }

    /** {@link #reload()} with an audit line. */
    public void reloadManually() {
        Logger.logInfo(logPrefix + "Manual reload requested.");
        reload();
    }

    private void doReload() {
        try {
            if (!Files.exists(configFile)) {
                Logger.logInfo(logPrefix + "Config file not found. Writing defaults to " + configFile);
                adopt(freshDefault(), ChangeCause.RESET);
                return;
            }

            FileFingerprint fingerprint = FileFingerprint.of(configFile);
            if (fingerprint.equals(lastObserved.get())) {
                Logger.internalDebug(logPrefix + "Config file unchanged; nothing to reload.");
                return;
            }

            String content = FileUtil.readString(configFile);
            ParsedJsonc parsed = codec.parse(content);
            ObjectNode tree = codec.readObject(parsed);

            String fileVersion = versionOf(tree);
            if (!currentVersion.equals(fileVersion)) {
                migrate(tree, parsed.comments());
                return;
            }

            T loaded = codec.toConfig(tree, type);
            lastObserved.set(fingerprint);
            comments.set(parsed.comments());
            lastValid.set(codec.copy(loaded, type));
            lastSavedHash.set(codec.hash(loaded));
            current.set(loaded);
            Logger.logInfo(logPrefix + "Config reloaded from " + configFile.getFileName());
            notifyListeners(loaded, ChangeCause.RELOAD);
        } catch (ConfigLoadException e) {
            recover(e.reason(), e.getMessage());
        } catch (IOException | RuntimeException e) {
            Logger.logError(logPrefix + "Reload failed", e);
            recover(FailureReason.RELOAD_ERROR, e.toString());
        }
    }

    private void migrate(ObjectNode tree, CommentIndex fileComments) throws ConfigLoadException {
        MigrationResult<T> result = migrations.migrate(tree, current.get(), defaultConfig);
        T migrated = result.migratedConfig();
        comments.set(fileComments);
        lastValid.set(codec.copy(migrated, type));
        adopt(migrated, ChangeCause.MIGRATION);
    }

    /**
     * Snapshots the bad file, then adopts the first available of: newest backup (when it
     * carries the current version), last valid value (when it is not just the default),
     * default.
     */
    private void recover(FailureReason reason, String detail) {
        Logger.logWarn(logPrefix + "Config file is invalid (" + reason.tag() + "): " + detail
                + ". Attempting recovery.");
        backups.snapshot(reason.tag());

        Optional<T> restored = backups.restoreLatestValid();
        if (restored.isPresent() && !currentVersion.equals(restored.get().getVersion())) {
            Logger.logWarn(logPrefix + "Newest backup has version " + restored.get().getVersion()
                    + "; not using it.");
            restored = Optional.empty();
        }

        T recovered;
        if (restored.isPresent()) {
            recovered = restored.get();
            lastValid.set(codec.copy(recovered, type));
            Logger.logInfo(logPrefix + "Recovered config from backup.");
        } else if (!defaultHash.equals(codec.hash(lastValid.get()))) {
            recovered = codec.copy(lastValid.get(), type);
            Logger.logInfo(logPrefix + "Recovered last valid config.");
        } else {
            recovered = freshDefault();
            Logger.logInfo(logPrefix + "No usable backup; falling back to default config.");
        }
        adopt(recovered, ChangeCause.SELF_HEAL);
    }

    /* ======================== SAVE ======================== */

    /**
     * Makes {@code config} the current value and writes it. Write failures are logged;
     * the value stays current and {@link #hasUnsavedChanges()} reports it.
     */
    public void save(T config) {
        Objects.requireNonNull(config, "config");
        if (closed) {
            Logger.logWarn(logPrefix + "Store is closed; save ignored.");
            return;
        }
        writeLock.lock();
        try {
            current.set(config);
            if (persist(config)) {
                Logger.logInfo(logPrefix + "Config saved.");
                notifyListeners(config, ChangeCause.SAVE);
            }
        } finally {
            writeLock.unlock();
        }
    }

    /** Writes the current value. */
    public void save() {
        save(current.get());
    }

    // Auto-save: check and write under one lock hold.
    private void saveIfChanged() {
        if (closed) return;
        writeLock.lock();
        try {
            if (!hasUnsavedChanges()) return;
            T config = current.get();
            if (persist(config)) {
                Logger.logDebug(logPrefix + "Auto-saved config.");
                notifyListeners(config, ChangeCause.SAVE);
            }
        } finally {
            writeLock.unlock();
        }
    }

    private void adopt(T config, ChangeCause cause) {
        current.set(config);
        persist(config);
        notifyListeners(config, cause);
    }

    // Records hash and fingerprint of our own write so the watcher event it causes is a no-op.
    private boolean persist(T config) {
        try {
            String content = codec.serialize(config, comments.get());
            FileUtil.writeStringAtomic(configFile, content);
            lastSavedHash.set(codec.hash(config));
            lastObserved.set(FileFingerprint.of(configFile));
            return true;
        } catch (IOException | RuntimeException e) {
            Logger.logError(logPrefix + "Failed to write " + configFile, e);
            return false;
        }
    }

    /* ======================== BACKGROUND TASKS ======================== */

    /**
     * Starts the file watcher. No-op when already running.
     *
     * @throws IllegalStateException after {@link #cleanup()}
     */
    public synchronized void enableWatcher() {
        ensureOpen();
        if (watcher != null) return;
        ChangeWatcher w = new ChangeWatcher(configId, configFile, settings.debounceMs(), this::onFileChanged);
        w.start(executor);
        watcher = w;
        Logger.logInfo(logPrefix + "File watcher enabled.");
    }

    /** Stops the file watcher and waits for it to exit. No-op when not running. */
    public void disableWatcher() {
        ChangeWatcher w;
        synchronized (this) {
            w = watcher;
            watcher = null;
        }
        if (w != null) {
            w.stop();
            Logger.logInfo(logPrefix + "File watcher disabled.");
        }
    }

    public synchronized boolean isWatcherEnabled() {
        return watcher != null;
    }

    /**
     * Starts periodic auto-save. No-op when already running.
     *
     * @throws IllegalStateException after {@link #cleanup()}
     */
    public synchronized void enableAutoSave() {
        ensureOpen();
        if (autoSaver != null) return;
        AutoSaver saver = new AutoSaver(configId, settings.autoSaveIntervalMs(), new AutoSaver.Target() {
            @Override public boolean hasUnsavedChanges() { return ConfigStore.this.hasUnsavedChanges(); }
            @Override public void saveCurrent() { saveIfChanged(); }
        });
        saver.start(executor);
        autoSaver = saver;
    }

    /** Stops auto-save and waits for a tick in progress. No-op when not running. */
    public void disableAutoSave() {
        AutoSaver s;
        synchronized (this) {
            s = autoSaver;
            autoSaver = null;
        }
        if (s != null) {
            s.stop();
            Logger.logInfo(logPrefix + "Auto-save disabled.");
        }
    }

    public synchronized boolean isAutoSaveEnabled() {
        return autoSaver != null;
    }

    /** Waits until the file watcher observes events; for tests. */
    boolean awaitWatcherReady(long timeout, TimeUnit unit) throws InterruptedException {
        ChangeWatcher w;
        synchronized (this) {
            w = watcher;
        }
        return w != null && w.awaitReady(timeout, unit);
    }

    private void onFileChanged() {
        if (!closed) reload();
    }

    /* ======================== LIFECYCLE ======================== */

    /**
     * Stops background tasks and shuts the scheduler down. Afterwards {@code reload} and
     * {@code save} are ignored and {@code enable*} throw. Idempotent.
     */
    public void cleanup() {
        synchronized (this) {
            if (closed) return;
            closed = true;
        }
        disableWatcher();
        disableAutoSave();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                Logger.logWarn(logPrefix + "Background tasks did not finish; forcing shutdown.");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        Logger.logInfo(logPrefix + "Config store closed.");
    }

    @Override
    public void close() {
        cleanup();
    }

    /* ======================== HELPERS ======================== */

    private T freshDefault() {
        return codec.copy(defaultConfig, type);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Config store '" + configId + "' is closed");
        }
    }

    private void notifyListeners(T config, ChangeCause cause) {
        for (ConfigChangeListener<T> l : listeners) {
            try {
                l.onConfigChanged(config, cause);
            } catch (RuntimeException e) {
                Logger.logWarn(logPrefix + "Config listener failed", e);
            }
        }
    }

    private static String versionOf(ObjectNode tree) {
        JsonNode v = tree.get(ConfigKeys.FIELD_VERSION);
        return v == null || v.isNull() ? null : v.asText();
    }
}
