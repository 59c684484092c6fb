package ai.attackframework.tools.configstore.migration;

import java.util.Set;

/**
 * Outcome of reconciling an old-version config with the current schema.
 *
 * @param migratedConfig  reconciled value, tagged with the current version
 * @param fromVersion     version found in the old file (nullable when absent)
 * @param migratedFields  top-level keys whose values were carried over from the old file
 * @param skippedFields   top-level keys of the old file that the current schema does not have
 * @param <T> config type
 */
public record MigrationResult<T>(
        T migratedConfig,
        String fromVersion,
        Set<String> migratedFields,
        Set<String> skippedFields
) {
    public MigrationResult {
        migratedFields = migratedFields == null ? Set.of() : Set.copyOf(migratedFields);
        skippedFields  = skippedFields  == null ? Set.of() : Set.copyOf(skippedFields);
    }
}
