package ai.attackframework.tools.configstore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import ai.attackframework.tools.configstore.utils.config.ConfigData;

/**
 * Config type shared by the tests: scalar fields, a nested section and a list.
 */
public class TestConfig implements ConfigData {

    private String version = "1.0";
    private String configId = "test";
    private String testSetting = "default";
    private int numericSetting = 42;
    private Section nested = new Section();
    private List<String> tags = new ArrayList<>(List.of("alpha", "beta"));

    public TestConfig() {
    }

    public TestConfig(String version, String testSetting, int numericSetting) {
        this.version = version;
        this.testSetting = testSetting;
        this.numericSetting = numericSetting;
    }

    @Override public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    @Override public String getConfigId() { return configId; }
    public void setConfigId(String configId) { this.configId = configId; }

    public String getTestSetting() { return testSetting; }
    public void setTestSetting(String testSetting) { this.testSetting = testSetting; }

    public int getNumericSetting() { return numericSetting; }
    public void setNumericSetting(int numericSetting) { this.numericSetting = numericSetting; }

    public Section getNested() { return nested; }
    public void setNested(Section nested) { this.nested = nested; }

    public List<String> getTags() { return tags; }
    public void setTags(List<String> tags) { this.tags = tags; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TestConfig other)) return false;
        return numericSetting == other.numericSetting
                && Objects.equals(version, other.version)
                && Objects.equals(configId, other.configId)
                && Objects.equals(testSetting, other.testSetting)
                && Objects.equals(nested, other.nested)
                && Objects.equals(tags, other.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, configId, testSetting, numericSetting, nested, tags);
    }

    @Override
    public String toString() {
        return "TestConfig{version=" + version + ", configId=" + configId + ", testSetting=" + testSetting
                + ", numericSetting=" + numericSetting + ", nested=" + nested + ", tags=" + tags + "}";
    }

    public static class Section {
        private String host = "localhost";
        private int port = 8080;

        public Section() {
        }

        public Section(String host, int port) {
            this.host = host;
            this.port = port;
        }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Section other)) return false;
            return port == other.port && Objects.equals(host, other.host);
        }

        @Override
        public int hashCode() {
            return Objects.hash(host, port);
        }

        @Override
        public String toString() {
            return host + ":" + port;
        }
    }
}
