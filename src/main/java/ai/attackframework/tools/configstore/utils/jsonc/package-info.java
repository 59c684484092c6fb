/**
 * JSON-with-comments handling for config files.
 *
 * <p>{@link ai.attackframework.tools.configstore.utils.jsonc.JsoncCodec} is the entry point;
 * the reader and writer are package-private. Only the subset needed to round-trip config
 * files with their commentary is supported. JSON values themselves are handled by Jackson.</p>
 */
package ai.attackframework.tools.configstore.utils.jsonc;
