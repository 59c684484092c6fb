package ai.attackframework.tools.configstore.utils.config;

/**
 * File watcher and auto-save behavior for a store.
 *
 * @param enabled            whether the file watcher runs
 * @param debounceMs         delay after a change event before reloading; {@code >= 0}
 * @param autoSaveEnabled    whether periodic auto-save runs
 * @param autoSaveIntervalMs auto-save period; {@code > 0}
 */
public record WatcherSettings(
        boolean enabled,
        long debounceMs,
        boolean autoSaveEnabled,
        long autoSaveIntervalMs
) {
    public static final long DEFAULT_DEBOUNCE_MS = 1_000L;
    public static final long DEFAULT_AUTOSAVE_INTERVAL_MS = 30_000L;

    public WatcherSettings {
        if (debounceMs < 0) {
            throw new IllegalArgumentException("debounceMs must be >= 0: " + debounceMs);
        }
        if (autoSaveIntervalMs <= 0) {
            throw new IllegalArgumentException("autoSaveIntervalMs must be > 0: " + autoSaveIntervalMs);
        }
    }

    /** Watcher and auto-save both disabled. */
    public WatcherSettings() {
        this(false, DEFAULT_DEBOUNCE_MS, false, DEFAULT_AUTOSAVE_INTERVAL_MS);
    }

    /**
     * Defaults overridden by the {@code configstore.*} system properties where set.
     * Unparseable numbers keep the default.
     */
    public static WatcherSettings fromSystemProperties() {
        WatcherSettings d = new WatcherSettings();
        return new WatcherSettings(
                Boolean.parseBoolean(System.getProperty(ConfigKeys.PROP_WATCHER_ENABLED, String.valueOf(d.enabled()))),
                longProperty(ConfigKeys.PROP_WATCHER_DEBOUNCE_MS, d.debounceMs()),
                Boolean.parseBoolean(System.getProperty(ConfigKeys.PROP_AUTOSAVE_ENABLED, String.valueOf(d.autoSaveEnabled()))),
                longProperty(ConfigKeys.PROP_AUTOSAVE_INTERVAL, d.autoSaveIntervalMs())
        );
    }

    public WatcherSettings withEnabled(boolean watcherEnabled) {
        return new WatcherSettings(watcherEnabled, debounceMs, autoSaveEnabled, autoSaveIntervalMs);
    }

    public WatcherSettings withAutoSaveEnabled(boolean autoSave) {
        return new WatcherSettings(enabled, debounceMs, autoSave, autoSaveIntervalMs);
    }

    private static long longProperty(String key, long fallback) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
