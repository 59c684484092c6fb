/**
 * Background tasks of a store: the file change watcher and the auto-saver.
 *
 * <p>Both run on the store's executor and are cancelled independently. A failure inside one
 * task is logged and does not affect the other.</p>
 */
package ai.attackframework.tools.configstore.watch;
