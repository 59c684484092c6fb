/**
 * Snapshot creation, retention and restore for config files.
 */
package ai.attackframework.tools.configstore.backup;
