package ai.attackframework.tools.configstore.utils.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Formatting and behavior settings for a config file: header/footer comment lines,
 * per-property section comments keyed by dotted path, banner flags and watcher settings.
 * Immutable; collections are copied on construction.
 */
public record ConfigMetadata(
        List<String> headerComments,
        List<String> footerComments,
        Map<String, String> sectionComments,
        boolean includeTimestamp,
        boolean includeVersion,
        WatcherSettings watcherSettings
) {
    public ConfigMetadata {
        headerComments  = headerComments  == null ? List.of() : List.copyOf(headerComments);
        footerComments  = footerComments  == null ? List.of() : List.copyOf(footerComments);
        // keep caller order for predictable iteration; still unmodifiable
        sectionComments = sectionComments == null
                ? Map.of()
                : java.util.Collections.unmodifiableMap(new LinkedHashMap<>(sectionComments));
        watcherSettings = watcherSettings == null ? new WatcherSettings() : watcherSettings;
    }

    /**
     * Standard header lines, version and timestamp banners on, watcher settings from
     * system properties.
     *
     * @param configId id named in the header
     * @return default metadata
     */
    public static ConfigMetadata defaultFor(String configId) {
        return new ConfigMetadata(
                List.of(
                        "Configuration file for " + configId,
                        "This file is automatically managed - custom comments will be preserved"
                ),
                List.of(),
                Map.of(),
                true,
                true,
                WatcherSettings.fromSystemProperties()
        );
    }

    /** Section comment for a dotted path, or {@code null}. */
    public String sectionComment(String path) {
        return sectionComments.get(path);
    }

    public ConfigMetadata withWatcherSettings(WatcherSettings settings) {
        return new ConfigMetadata(headerComments, footerComments, sectionComments,
                includeTimestamp, includeVersion, settings);
    }
}
