package ai.attackframework.tools.configstore.migration;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ai.attackframework.tools.configstore.ConfigLoadException;
import ai.attackframework.tools.configstore.backup.BackupStore;
import ai.attackframework.tools.configstore.utils.Logger;
import ai.attackframework.tools.configstore.utils.config.ConfigKeys;
import ai.attackframework.tools.configstore.utils.jsonc.JsoncCodec;

/**
 * Reconciles a config written under an older schema version with the in-memory value and
 * the compiled-in default.
 *
 * <p>The merge is shallow: for each top-level key the old file's value wins when present,
 * otherwise the in-memory value, otherwise the default. Nested objects are replaced as a
 * whole by the winning side. An explicit JSON {@code null} is a present value. The
 * result always carries the current version.</p>
 *
 * @param <T> config type
 */
public final class MigrationEngine<T> {

    private final JsoncCodec codec;
    private final Class<T> type;
    private final BackupStore<T> backups;
    private final String logPrefix;

    public MigrationEngine(String configId, JsoncCodec codec, Class<T> type, BackupStore<T> backups) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.type = Objects.requireNonNull(type, "type");
        this.backups = Objects.requireNonNull(backups, "backups");
        this.logPrefix = Logger.prefix(configId);
    }

    /**
     * Snapshots the live file as {@code pre_migration}, then reconciles.
     *
     * @param onDisk   JSON object read from the old file
     * @param current  value currently held in memory
     * @param defaults compiled-in default
     * @return reconciled value and a field report
     * @throws ConfigLoadException {@code PARSE_ERROR} when the reconciled tree does not bind
     *                             (for example an old value of the wrong type)
     */
    public MigrationResult<T> migrate(ObjectNode onDisk, T current, T defaults) throws ConfigLoadException {
        String from = versionOf(onDisk);
        Logger.logWarn(logPrefix + "Config version mismatch. Migrating from v" + from
                + " to v" + codec.currentVersion() + ".");
        backups.snapshot(ConfigKeys.REASON_PRE_MIGRATION);

        MigrationResult<T> result = reconcile(onDisk, current, defaults);
        Logger.logInfo(logPrefix + "Migration complete. Carried over " + result.migratedFields().size()
                + " field(s); skipped " + result.skippedFields().size() + " unknown field(s)"
                + (result.skippedFields().isEmpty() ? "." : ": " + result.skippedFields()));
        return result;
    }

    /**
     * Computes {@code merge(merge(old, current), default)} without touching the filesystem.
     */
    public MigrationResult<T> reconcile(ObjectNode onDisk, T current, T defaults) throws ConfigLoadException {
        ObjectNode merged = merge(merge(onDisk, codec.toTree(current)), codec.toTree(defaults));
        T config = codec.toConfig(merged, type);

        Set<String> migrated = new LinkedHashSet<>();
        Set<String> skipped = new LinkedHashSet<>();
        Iterator<Map.Entry<String, JsonNode>> it = onDisk.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String key = e.getKey();
            if (ConfigKeys.FIELD_VERSION.equals(key)) continue;
            if (merged.has(key)) {
                migrated.add(key);
            } else {
                skipped.add(key);
            }
        }
        return new MigrationResult<>(config, versionOf(onDisk), migrated, skipped);
    }

    /**
     * Copy of {@code b} where each top-level key of {@code a} that {@code b} also has takes
     * {@code a}'s value; {@code version} is excluded and then forced to the current version.
     */
    ObjectNode merge(ObjectNode a, ObjectNode b) {
        ObjectNode out = b.deepCopy();
        Iterator<Map.Entry<String, JsonNode>> it = a.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String key = e.getKey();
            if (!ConfigKeys.FIELD_VERSION.equals(key) && out.has(key)) {
                out.set(key, e.getValue().deepCopy());
            }
        }
        out.put(ConfigKeys.FIELD_VERSION, codec.currentVersion());
        return out;
    }

    private static String versionOf(ObjectNode tree) {
        JsonNode v = tree.get(ConfigKeys.FIELD_VERSION);
        return v == null || v.isNull() ? null : v.asText();
    }
}
