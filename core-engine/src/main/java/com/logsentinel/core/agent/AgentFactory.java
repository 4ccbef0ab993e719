package com.logsentinel.core.agent;

import com.logsentinel.core.config.AgentConfig;
import com.logsentinel.core.config.AgentStrategy;
import com.logsentinel.core.config.ConfigException;

import java.util.Objects;

/**
 * Builds the agent implementation for a configuration's strategy.
 *
 * @since 1.0.0
 */
public final class AgentFactory {

    private AgentFactory() {
        // utility class
    }

    /**
     * @param config  validated agent configuration
     * @param context shared collaborators
     * @return a new, not yet started agent
     * @throws ConfigException if a model-backed strategy has no model manager
     */
    public static Agent create(AgentConfig config, AgentContext context) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(context, "context must not be null");
        AgentStrategy strategy = config.getStrategy();
        if (strategy != AgentStrategy.RULE && context.getModelManager() == null) {
            throw new ConfigException("Agent '" + config.getId() + "' uses strategy "
                    + strategy.getConfigName() + " but no model lifecycle manager is configured");
        }
        return switch (strategy) {
            case RULE -> new RuleAgent(config, context);
            case ML -> new MlAgent(config, context);
            case HYBRID -> new HybridAgent(config, context);
        };
    }
}
