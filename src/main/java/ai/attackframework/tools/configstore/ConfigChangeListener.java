package ai.attackframework.tools.configstore;

import ai.attackframework.tools.configstore.utils.config.ConfigData;

/**
 * Callback for config adoptions. Invoked on the thread that performed the change while
 * the store's write lock is held; implementations must not call back into
 * {@code reload} or {@code save} from another thread and wait for it.
 *
 * @param <T> config type
 */
@FunctionalInterface
public interface ConfigChangeListener<T extends ConfigData> {
    void onConfigChanged(T config, ChangeCause cause);
}
