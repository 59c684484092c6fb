/**
 * Schema-version migration for config files.
 *
 * <p>Migration works on Jackson trees so keys that an old file never had can be told apart
 * from keys it set explicitly.</p>
 */
package ai.attackframework.tools.configstore.migration;
