/**
 * Agent configuration: the immutable
 * {@link com.logsentinel.core.config.AgentConfig}, the YAML/JSON definition
 * POJOs and {@link com.logsentinel.core.config.AgentConfigLoader}.
 *
 * <p>
 * Definitions are validated when they are converted, so configuration
 * problems surface as a {@link com.logsentinel.core.config.ConfigException}
 * before any agent is created.
 * </p>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.config;
