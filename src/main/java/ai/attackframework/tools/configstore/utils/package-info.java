/**
 * Common utilities shared across the store.
 *
 * <p>Includes logging ({@link ai.attackframework.tools.configstore.utils.Logger}), filesystem
 * helpers and content hashing. These classes hold no store state; callers may use them from
 * background threads as needed.</p>
 */
package ai.attackframework.tools.configstore.utils;
