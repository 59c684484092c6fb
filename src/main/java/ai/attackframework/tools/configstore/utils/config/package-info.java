/**
 * Config model shared by the store and its collaborators.
 *
 * <p>Includes the {@link ai.attackframework.tools.configstore.utils.config.ConfigData} contract
 * for application config types, file-format metadata, watcher settings and key constants.
 * These are pure data holders and are safe to use from background threads.</p>
 */
package ai.attackframework.tools.configstore.utils.config;
