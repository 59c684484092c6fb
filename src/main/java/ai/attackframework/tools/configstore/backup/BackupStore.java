package ai.attackframework.tools.configstore.backup;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import ai.attackframework.tools.configstore.ConfigLoadException;
import ai.attackframework.tools.configstore.utils.FileUtil;
import ai.attackframework.tools.configstore.utils.Logger;
import ai.attackframework.tools.configstore.utils.config.ConfigKeys;
import ai.attackframework.tools.configstore.utils.jsonc.JsoncCodec;

/**
 * Timestamped snapshots of a config file.
 *
 * <p>Snapshots are named {@code {configId}_{reason}_{yyyyMMdd_HHmmss}.jsonc} and live in the
 * config's backup directory. At most {@link ConfigKeys#MAX_BACKUPS} are kept; the oldest are
 * deleted first. Failures are logged and never propagated: a failed snapshot or restore
 * is treated as "no backup available".</p>
 *
 * @param <T> config type restored from snapshots
 */
public final class BackupStore<T> {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final Pattern STAMP_SUFFIX =
            Pattern.compile("_(\\d{8}_\\d{6})\\." + ConfigKeys.FILE_EXTENSION + "$");
    private static final Pattern UNSAFE_REASON_CHARS = Pattern.compile("[^A-Za-z0-9_-]");

    // Embedded timestamp first, name as tie-break; reason does not influence age.
    private static final Comparator<Path> NEWEST_FIRST =
            Comparator.<Path, String>comparing(BackupStore::stampOf)
                    .thenComparing(p -> p.getFileName().toString())
                    .reversed();

    private final String configId;
    private final Path configFile;
    private final Path backupDir;
    private final JsoncCodec codec;
    private final Class<T> type;
    private final Clock clock;
    private final String logPrefix;

    public BackupStore(String configId, Path configFile, Path backupDir, JsoncCodec codec, Class<T> type) {
        this(configId, configFile, backupDir, codec, type, Clock.systemDefaultZone());
    }

    public BackupStore(String configId, Path configFile, Path backupDir,
                       JsoncCodec codec, Class<T> type, Clock clock) {
        this.configId = Objects.requireNonNull(configId, "configId");
        this.configFile = Objects.requireNonNull(configFile, "configFile");
        this.backupDir = Objects.requireNonNull(backupDir, "backupDir");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.type = Objects.requireNonNull(type, "type");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.logPrefix = Logger.prefix(configId);
    }

    public Path directory() {
        return backupDir;
    }

    /**
     * Copies the live config file into the backup directory, then prunes old snapshots.
     *
     * @param reason tag embedded in the file name (characters outside {@code [A-Za-z0-9_-]}
     *               are replaced by {@code _})
     * @return the snapshot written, or empty when there was nothing to copy or the copy failed
     */
    public Optional<Path> snapshot(String reason) {
        if (!Files.exists(configFile)) {
            Logger.logDebug(logPrefix + "No config file to back up for reason '" + reason + "'.");
            return Optional.empty();
        }
        try {
            Files.createDirectories(backupDir);
            String stamp = LocalDateTime.now(clock).format(STAMP);
            Path target = backupDir.resolve(String.format("%s_%s_%s.%s",
                    configId, sanitize(reason), stamp, ConfigKeys.FILE_EXTENSION));
            Files.copy(configFile, target, StandardCopyOption.REPLACE_EXISTING);
            Logger.logInfo(logPrefix + "Created backup " + target.getFileName());

            int pruned = prune();
            if (pruned > 0) {
                Logger.logDebug(logPrefix + "Pruned " + pruned + " old backup(s).");
            }
            return Optional.of(target);
        } catch (IOException | RuntimeException e) {
            Logger.logError(logPrefix + "Backup failed for reason '" + reason + "'", e);
            return Optional.empty();
        }
    }

    /**
     * Snapshots of this config, newest first. Empty when the directory does not exist.
     *
     * @throws IOException when the directory cannot be listed
     */
    public List<Path> list() throws IOException {
        if (!Files.isDirectory(backupDir)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(backupDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isOwnBackup)
                    .sorted(NEWEST_FIRST)
                    .toList();
        }
    }

    /**
     * Deletes all but the newest {@link ConfigKeys#MAX_BACKUPS} snapshots.
     *
     * @return number of files deleted
     * @throws IOException when listing or deleting fails
     */
    public int prune() throws IOException {
        List<Path> backups = list();
        int deleted = 0;
        for (int i = ConfigKeys.MAX_BACKUPS; i < backups.size(); i++) {
            if (Files.deleteIfExists(backups.get(i))) {
                deleted++;
            }
        }
        return deleted;
    }

    /**
     * Reads the snapshot with the greatest last-modified time.
     *
     * @return the decoded config, or empty when there is no snapshot or the newest one is
     *         blank, unreadable or not a valid config
     */
    public Optional<T> restoreLatestValid() {
        try {
            List<Path> backups = list();
            if (backups.isEmpty()) {
                Logger.logInfo(logPrefix + "No backups found in " + backupDir);
                return Optional.empty();
            }

            Path latest = latestModified(backups);
            String content = FileUtil.readString(latest);
            if (content.isBlank()) {
                Logger.logWarn(logPrefix + "Backup file is empty: " + latest.getFileName());
                return Optional.empty();
            }

            T restored = codec.decode(content, type);
            Logger.logInfo(logPrefix + "Restored config from backup " + latest.getFileName());
            return Optional.of(restored);
        } catch (ConfigLoadException e) {
            Logger.logWarn(logPrefix + "Newest backup is not a valid config (" + e.reason().tag() + "): " + e.getMessage());
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            Logger.logError(logPrefix + "Failed to restore from backup", e);
            return Optional.empty();
        }
    }

    /* ----------------------- helpers ----------------------- */

    // Ties keep list order, which is already newest-by-name first.
    private static Path latestModified(List<Path> backups) throws IOException {
        Path best = backups.get(0);
        long bestTime = Files.getLastModifiedTime(best).toMillis();
        for (int i = 1; i < backups.size(); i++) {
            long t = Files.getLastModifiedTime(backups.get(i)).toMillis();
            if (t > bestTime) {
                best = backups.get(i);
                bestTime = t;
            }
        }
        return best;
    }

    private boolean isOwnBackup(Path p) {
        String name = p.getFileName().toString();
        return name.startsWith(configId + "_") && name.endsWith("." + ConfigKeys.FILE_EXTENSION);
    }

    private static String stampOf(Path p) {
        Matcher m = STAMP_SUFFIX.matcher(p.getFileName().toString());
        return m.find() ? m.group(1) : "";
    }

    private static String sanitize(String reason) {
        if (reason == null || reason.isBlank()) return "manual";
        return UNSAFE_REASON_CHARS.matcher(reason.trim()).replaceAll("_");
    }
}
