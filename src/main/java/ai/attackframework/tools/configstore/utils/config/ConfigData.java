package ai.attackframework.tools.configstore.utils.config;

/**
 * Contract for application config types managed by a
 * {@link ai.attackframework.tools.configstore.ConfigStore}.
 *
 * <p>Implementations are plain Jackson-bindable beans (no-arg constructor, getters and
 * setters). Properties are written in declared field order. The store reads and writes
 * the type only through data binding and never interprets other fields.</p>
 */
public interface ConfigData {

    /** Schema version the value was written under. */
    String getVersion();

    /** Stable identifier used for file and directory naming. */
    String getConfigId();
}
