package com.logsentinel.service;

import com.logsentinel.core.agent.AgentContext;
import com.logsentinel.core.agent.AgentRegistry;
import com.logsentinel.core.config.AgentConfig;
import com.logsentinel.core.config.AgentConfigLoader;
import com.logsentinel.core.config.ConfigException;
import com.logsentinel.core.lifecycle.ModelLifecycleManager;
import com.logsentinel.core.port.StatusPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point of the Log Sentinel process.
 *
 * <h3>Wiring</h3>
 *
 * <pre>
 *   ServiceConfig (environment)
 *     -&gt; ModelLifecycleManager (MODEL_STORE_DIR)
 *     -&gt; AgentRegistry (JSON-lines log source, anomaly sink, status file)
 *     -&gt; one agent per definition in the agent config file
 *     -&gt; AnalysisDriver ticking every TICK_INTERVAL_SECONDS
 * </pre>
 * <p>
 * An agent whose definition is rejected at construction is logged and left
 * out; the others still run. The process stops on SIGTERM through a shutdown
 * hook that closes the registry.
 * </p>
 *
 * @since 1.0.0
 */
public final class LogSentinelService {

    private static final Logger LOG = LoggerFactory.getLogger(LogSentinelService.class);

    private LogSentinelService() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Log Sentinel with config: {}", config);

        List<AgentConfig> agentConfigs = loadAgents(config);
        if (agentConfigs.isEmpty()) {
            throw new IllegalStateException("No agents defined. Provide definitions via "
                    + AgentConfigLoader.ENV_AGENT_CONFIG_PATH + " or a classpath "
                    + AgentConfigLoader.DEFAULT_RESOURCE + " file.");
        }

        // 2. Core components
        AgentRegistry registry = start(config, agentConfigs);

        // 3. Run until terminated
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down Log Sentinel");
            registry.close();
            stopped.countDown();
        }, "sentinel-shutdown"));
        stopped.await();
    }

    /**
     * Build the core components, create every agent and start scheduling.
     *
     * @return the running registry; the caller closes it
     */
    static AgentRegistry start(ServiceConfig config, List<AgentConfig> agentConfigs) {
        StatusPublisher statusPublisher = new JsonLinesStatusPublisher(config.getStatusOutputPath());
        ModelLifecycleManager modelManager = new ModelLifecycleManager(config.getModelStoreDir(), statusPublisher);

        AgentContext context = AgentContext.builder()
                .logSource(new JsonLinesLogSource(config.getLogSourcePath()))
                .anomalySink(new JsonLinesAnomalySink(config.getAnomalyOutputPath()))
                .statusPublisher(statusPublisher)
                .modelManager(modelManager)
                .build();
        AgentRegistry registry = new AgentRegistry(context, config.getWorkerThreads());

        int created = 0;
        for (AgentConfig agentConfig : agentConfigs) {
            try {
                registry.createAgent(agentConfig);
                created++;
            } catch (ConfigException e) {
                LOG.error("Agent [{}] not started: {}", agentConfig.getId(), e.getMessage());
            }
        }
        LOG.info("Started {} of {} agent(s); {} model version(s) registered", created, agentConfigs.size(),
                modelManager.listVersions().size());

        registry.startScheduling(config.getTickInterval());
        return registry;
    }

    private static List<AgentConfig> loadAgents(ServiceConfig config) {
        String path = config.getAgentConfigPath();
        if (path != null && !path.isBlank()) {
            return AgentConfigLoader.fromFile(path);
        }
        return AgentConfigLoader.load();
    }
}
