/**
 * Self-healing, comment-preserving config persistence.
 *
 * <p>{@link ai.attackframework.tools.configstore.ConfigStore} is the entry point. Supporting
 * packages:</p>
 * <ul>
 *   <li>{@code utils.jsonc}: reading and writing commented config files</li>
 *   <li>{@code backup}: timestamped snapshots and restore</li>
 *   <li>{@code migration}: reconciling files written under older versions</li>
 *   <li>{@code watch}: file watcher and auto-save</li>
 * </ul>
 */
package ai.attackframework.tools.configstore;
