package ai.attackframework.tools.configstore.utils.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ConfigMetadataTest {

    @Test
    void defaultFor_usesStandardHeaderAndBanners() {
        ConfigMetadata m = ConfigMetadata.defaultFor("proxy");

        assertThat(m.headerComments()).containsExactly(
                "Configuration file for proxy",
                "This file is automatically managed - custom comments will be preserved");
        assertThat(m.footerComments()).isEmpty();
        assertThat(m.includeTimestamp()).isTrue();
        assertThat(m.includeVersion()).isTrue();
    }

    @Test
    void collections_areCopiedAndUnmodifiable() {
        List<String> header = new ArrayList<>(List.of("h"));
        Map<String, String> sections = new HashMap<>(Map.of("a", "about a"));

        ConfigMetadata m = new ConfigMetadata(header, null, sections, false, false, null);
        header.add("late");
        sections.put("b", "late");

        assertThat(m.headerComments()).containsExactly("h");
        assertThat(m.sectionComment("a")).isEqualTo("about a");
        assertThat(m.sectionComment("b")).isNull();
        assertThat(m.watcherSettings()).isEqualTo(new WatcherSettings());
        assertThatThrownBy(() -> m.sectionComments().put("c", "x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void withWatcherSettings_replacesOnlySettings() {
        ConfigMetadata m = ConfigMetadata.defaultFor("x");
        WatcherSettings on = new WatcherSettings(true, 10, true, 10);

        ConfigMetadata changed = m.withWatcherSettings(on);

        assertThat(changed.watcherSettings()).isEqualTo(on);
        assertThat(changed.headerComments()).isEqualTo(m.headerComments());
    }
}
