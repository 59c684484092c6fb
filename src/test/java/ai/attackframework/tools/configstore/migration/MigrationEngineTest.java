package ai.attackframework.tools.configstore.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ai.attackframework.tools.configstore.ConfigLoadException;
import ai.attackframework.tools.configstore.FailureReason;
import ai.attackframework.tools.configstore.TestConfig;
import ai.attackframework.tools.configstore.backup.BackupStore;
import ai.attackframework.tools.configstore.utils.config.ConfigKeys;
import ai.attackframework.tools.configstore.utils.config.ConfigMetadata;
import ai.attackframework.tools.configstore.utils.jsonc.JsoncCodec;

class MigrationEngineTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private JsoncCodec codec;
    private BackupStore<TestConfig> backups;
    private MigrationEngine<TestConfig> engine;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        codec = new JsoncCodec("1.0", ConfigMetadata.defaultFor("test"));
        backups = mock(BackupStore.class);
        engine = new MigrationEngine<>("test", codec, TestConfig.class, backups);
    }

    private static ObjectNode tree(String json) throws Exception {
        return (ObjectNode) JSON.readTree(json);
    }

    @Test
    void migrate_snapshotsFirst_keepsOldValues_andTakesNewFieldsFromDefault() throws Exception {
        ObjectNode old = tree("""
                {"version": "0.9", "configId": "test", "testSetting": "custom", "legacyFlag": true}
                """);

        MigrationResult<TestConfig> result = engine.migrate(old, new TestConfig(), new TestConfig());

        verify(backups).snapshot(ConfigKeys.REASON_PRE_MIGRATION);
        TestConfig migrated = result.migratedConfig();
        assertThat(migrated.getVersion()).isEqualTo("1.0");
        assertThat(migrated.getTestSetting()).isEqualTo("custom");
        assertThat(migrated.getNumericSetting()).isEqualTo(42);
        assertThat(result.fromVersion()).isEqualTo("0.9");
        assertThat(result.migratedFields()).containsExactlyInAnyOrder("configId", "testSetting");
        assertThat(result.skippedFields()).containsExactly("legacyFlag");
    }

    @Test
    void reconcile_inMemoryValueFillsKeysMissingFromOldFile() throws Exception {
        TestConfig current = new TestConfig("1.0", "in-memory", 7);

        MigrationResult<TestConfig> result = engine.reconcile(tree("{\"version\": \"0.9\"}"), current, new TestConfig());

        assertThat(result.migratedConfig().getTestSetting()).isEqualTo("in-memory");
        assertThat(result.migratedConfig().getNumericSetting()).isEqualTo(7);
        assertThat(result.migratedFields()).isEmpty();
        verifyNoInteractions(backups);
    }

    @Test
    void reconcile_explicitNullInOldFile_winsOverDefault() throws Exception {
        MigrationResult<TestConfig> result = engine.reconcile(
                tree("{\"version\": \"0.9\", \"testSetting\": null}"), new TestConfig(), new TestConfig());

        assertThat(result.migratedConfig().getTestSetting()).isNull();
        assertThat(result.migratedFields()).containsExactly("testSetting");
    }

    @Test
    void reconcile_nullInMemoryValue_winsOverDefault() throws Exception {
        TestConfig current = new TestConfig("1.0", null, 7);

        MigrationResult<TestConfig> result = engine.reconcile(tree("{\"version\": \"0.9\"}"), current, new TestConfig());

        assertThat(result.migratedConfig().getTestSetting()).isNull();
        assertThat(result.migratedConfig().getNumericSetting()).isEqualTo(7);
    }

    @Test
    void reconcile_missingVersion_reportsNullSource_andSetsCurrent() throws Exception {
        MigrationResult<TestConfig> result = engine.reconcile(
                tree("{\"testSetting\": \"x\"}"), new TestConfig(), new TestConfig());

        assertThat(result.fromVersion()).isNull();
        assertThat(result.migratedConfig().getVersion()).isEqualTo("1.0");
    }

    @Test
    void merge_replacesNestedObjectsWholesale() throws Exception {
        ObjectNode old = tree("{\"version\": \"0.9\", \"nested\": {\"host\": \"old-host\"}}");
        ObjectNode defaults = codec.toTree(new TestConfig());

        ObjectNode merged = engine.merge(old, defaults);

        assertThat(merged.get("nested").has("port")).isFalse();
        assertThat(merged.get("nested").get("host").asText()).isEqualTo("old-host");
        assertThat(merged.get("version").asText()).isEqualTo("1.0");
        assertThat(defaults.get("nested").has("port")).isTrue();
    }

    @Test
    void merge_ignoresKeysTheTargetShapeLacks() throws Exception {
        ObjectNode merged = engine.merge(tree("{\"gone\": 1}"), tree("{\"kept\": 2}"));

        assertThat(merged.has("gone")).isFalse();
        assertThat(merged.get("kept").asInt()).isEqualTo(2);
    }

    @Test
    void reconcile_oldValueOfWrongType_isParseError() {
        assertThatThrownBy(() -> engine.reconcile(
                tree("{\"version\": \"0.9\", \"numericSetting\": \"lots\"}"), new TestConfig(), new TestConfig()))
                .isInstanceOfSatisfying(ConfigLoadException.class,
                        e -> assertThat(e.reason()).isEqualTo(FailureReason.PARSE_ERROR));
    }
}
