package ai.attackframework.tools.configstore.utils.config;

/**
 * Shared names for files, markers, fields and system properties used across the store.
 *
 * <p>Centralizing avoids drift in literals between codec, backups, store, and tests.</p>
 */
public final class ConfigKeys {
    private ConfigKeys() {}

    // File layout
    public static final String FILE_EXTENSION   = "jsonc";
    public static final String CONFIG_FILE_NAME = "config." + FILE_EXTENSION;
    public static final String BACKUP_DIR_NAME  = "backups";
    public static final int    MAX_BACKUPS      = 50;

    // File markers
    public static final String SECTION_START_MARKER = "CONFIG_SECTION";
    public static final String SECTION_END_MARKER   = "END_CONFIG_SECTION";

    // Mandatory payload fields
    public static final String FIELD_VERSION   = "version";
    public static final String FIELD_CONFIG_ID = "configId";

    // Backup reason not tied to a failure
    public static final String REASON_PRE_MIGRATION = "pre_migration";

    // System property overrides for watcher defaults
    public static final String PROP_WATCHER_ENABLED     = "configstore.watcher.enabled";
    public static final String PROP_WATCHER_DEBOUNCE_MS = "configstore.watcher.debounceMs";
    public static final String PROP_AUTOSAVE_ENABLED    = "configstore.autosave.enabled";
    public static final String PROP_AUTOSAVE_INTERVAL   = "configstore.autosave.intervalMs";
}
