package com.logsentinel.core.agent;

import com.logsentinel.core.config.AgentConfig;
import com.logsentinel.core.lifecycle.ModelLifecycleManager;
import com.logsentinel.core.lifecycle.ModelReferenceChecker;
import com.logsentinel.core.model.StatusRecord;
import com.logsentinel.core.port.StatusPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the registered agents and drives their analysis cycles.
 *
 * <h3>Scheduling</h3>
 * <p>
 * {@link #tick()} walks the agents once and hands every due, schedulable
 * agent to a worker pool, so a slow or failing agent never delays another.
 * An agent is due when it has never run or its last run is at least
 * {@code analysisIntervalSeconds} old. An agent still in flight (or already
 * queued) is skipped, never queued twice. {@link #startScheduling(Duration)}
 * runs the tick from a single {@link AnalysisDriver}.
 * </p>
 *
 * <h3>Model references</h3>
 * <p>
 * Registered with the model manager as its {@link ModelReferenceChecker}: a
 * version is referenced while an agent that has not been stopped scores with
 * it or pins a path inside its bundle.
 * </p>
 *
 * @since 1.0.0
 */
public class AgentRegistry implements ModelReferenceChecker, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AgentRegistry.class);

    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(30);

    private final AgentContext context;
    private final ExecutorService workers;
    private final boolean ownsWorkers;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final Set<String> dispatched = ConcurrentHashMap.newKeySet();

    private AnalysisDriver driver;
    private volatile boolean closed;

    /**
     * @param context       shared collaborators
     * @param workerThreads size of the cycle worker pool
     */
    public AgentRegistry(AgentContext context, int workerThreads) {
        this(context, newWorkerPool(workerThreads), true);
    }

    /**
     * @param context shared collaborators
     * @param workers executor for analysis cycles; not shut down by
     *                {@link #close()}
     */
    public AgentRegistry(AgentContext context, ExecutorService workers) {
        this(context, workers, false);
    }

    private AgentRegistry(AgentContext context, ExecutorService workers, boolean ownsWorkers) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.workers = Objects.requireNonNull(workers, "workers must not be null");
        this.ownsWorkers = ownsWorkers;
        if (context.getModelManager() != null) {
            context.getModelManager().setReferenceChecker(this);
        }
    }

    private static ExecutorService newWorkerPool(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1, got: " + threads);
        }
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "agent-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ---------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------

    /**
     * Build the agent for {@code config}, register and start it.
     *
     * @throws IllegalStateException if an agent with the same id exists, or
     *                               (as {@code ConfigException}) if the agent
     *                               cannot be built
     */
    public Agent createAgent(AgentConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        lock.lock();
        try {
            requireOpen();
            if (agents.containsKey(config.getId())) {
                throw new IllegalStateException("Agent already registered: " + config.getId());
            }
            Agent agent = AgentFactory.create(config, context);
            agents.put(agent.getId(), agent);
            agent.start();
            LOG.info("Created agent [{}] ({}), status {}", agent.getId(), config.getStrategy().getConfigName(),
                    agent.getStatus().getValue());
            return agent;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Register an already built agent without starting it.
     *
     * @throws IllegalStateException if an agent with the same id exists
     */
    public void registerAgent(Agent agent) {
        Objects.requireNonNull(agent, "agent must not be null");
        lock.lock();
        try {
            requireOpen();
            if (agents.putIfAbsent(agent.getId(), agent) != null) {
                throw new IllegalStateException("Agent already registered: " + agent.getId());
            }
            LOG.info("Registered agent [{}]", agent.getId());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop and remove an agent, then publish {@code unregistered}.
     *
     * @return {@code false} if no such agent was registered
     */
    public boolean unregisterAgent(String agentId) {
        Agent agent;
        lock.lock();
        try {
            agent = agents.remove(agentId);
        } finally {
            lock.unlock();
        }
        if (agent == null) {
            return false;
        }
        agent.stop();
        publishUnregistered(agent);
        LOG.info("Unregistered agent [{}]", agentId);
        return true;
    }

    /**
     * Stop an agent, wait for its in-flight cycle and start it again. The
     * configuration and registration are kept.
     *
     * @throws IllegalArgumentException if the agent is unknown
     */
    public Agent restartAgent(String agentId) {
        lock.lock();
        try {
            Agent agent = require(agentId);
            agent.stop();
            awaitIdle(agent);
            agent.start();
            LOG.info("Restarted agent [{}], status {}", agentId, agent.getStatus().getValue());
            return agent;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replace an agent's configuration: the new agent is built first, then
     * the old one is stopped and the new one started under the same id.
     *
     * @throws IllegalArgumentException if the agent is unknown
     */
    public Agent replaceConfig(AgentConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        lock.lock();
        try {
            Agent old = require(config.getId());
            Agent fresh = AgentFactory.create(config, context);
            old.stop();
            awaitIdle(old);
            agents.put(fresh.getId(), fresh);
            fresh.start();
            LOG.info("Replaced configuration of agent [{}]", config.getId());
            return fresh;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Agent> getAgent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    /**
     * @return registered agents ordered by id
     */
    public List<Agent> listAgents() {
        List<Agent> list = new ArrayList<>(agents.values());
        list.sort(Comparator.comparing(Agent::getId));
        return List.copyOf(list);
    }

    // ---------------------------------------------------------------
    // ModelReferenceChecker
    // ---------------------------------------------------------------

    /** Stopped agents do not hold a version, even while still registered. */
    @Override
    public boolean isModelReferenced(String versionId) {
        Path bundleDir = bundleDirectory(versionId);
        for (Agent agent : agents.values()) {
            if (isStopped(agent)) {
                continue;
            }
            if (agent.getModelVersion().filter(versionId::equals).isPresent()) {
                return true;
            }
            String modelPath = agent.getConfig().getModelPath();
            if (bundleDir != null && modelPath != null && pointsInto(modelPath, bundleDir)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isStopped(Agent agent) {
        AgentRuntimeState state = agent.getState();
        return state.getStatus() == AgentStatus.INACTIVE && CycleRunner.STOPPED_REASON.equals(state.getReason());
    }

    private Path bundleDirectory(String versionId) {
        ModelLifecycleManager manager = context.getModelManager();
        if (manager == null) {
            return null;
        }
        return manager.findVersion(versionId)
                .map(v -> manager.directoryOf(v).toAbsolutePath().normalize())
                .orElse(null);
    }

    private static boolean pointsInto(String modelPath, Path bundleDir) {
        try {
            return Path.of(modelPath).toAbsolutePath().normalize().startsWith(bundleDir);
        } catch (InvalidPathException e) {
            LOG.debug("Ignoring unparseable model path {}: {}", modelPath, e.getMessage());
            return false;
        }
    }

    // ---------------------------------------------------------------
    // Scheduling
    // ---------------------------------------------------------------

    /**
     * Dispatch every due agent once.
     *
     * @return number of cycles dispatched
     */
    public int tick() {
        if (closed) {
            return 0;
        }
        Instant now = context.getClock().instant();
        int count = 0;
        for (Agent agent : listAgents()) {
            if (!agent.getStatus().isSchedulable() || agent.isRunning() || !isDue(agent, now)) {
                continue;
            }
            if (!dispatched.add(agent.getId())) {
                continue;
            }
            try {
                workers.execute(() -> runCycle(agent));
                count++;
            } catch (RejectedExecutionException e) {
                dispatched.remove(agent.getId());
                LOG.warn("Worker pool rejected cycle of agent [{}]: {}", agent.getId(), e.getMessage());
            }
        }
        if (count > 0) {
            LOG.debug("Tick dispatched {} agent cycle(s)", count);
        }
        return count;
    }

    static boolean isDue(Agent agent, Instant now) {
        Instant lastRunAt = agent.getState().getLastRunAt();
        return lastRunAt == null
                || !lastRunAt.plusSeconds(agent.getConfig().getAnalysisIntervalSeconds()).isAfter(now);
    }

    private void runCycle(Agent agent) {
        try {
            agent.runAnalysisCycle();
        } catch (RuntimeException e) {
            LOG.error("Agent [{}] cycle escaped with an exception", agent.getId(), e);
        } finally {
            dispatched.remove(agent.getId());
        }
    }

    /**
     * Start the single driver loop calling {@link #tick()} every
     * {@code tickInterval}.
     *
     * @throws IllegalStateException if scheduling is already running
     */
    public void startScheduling(Duration tickInterval) {
        lock.lock();
        try {
            requireOpen();
            if (driver != null) {
                throw new IllegalStateException("Scheduling already started");
            }
            driver = new AnalysisDriver(this::tick, tickInterval);
            driver.start();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop the driver and every agent, waiting for in-flight cycles.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            if (driver != null) {
                driver.close();
            }
            for (Agent agent : listAgents()) {
                agent.stop();
                awaitIdle(agent);
            }
            if (ownsWorkers) {
                workers.shutdown();
                try {
                    if (!workers.awaitTermination(DEFAULT_STOP_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                        workers.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    workers.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
            LOG.info("Agent registry closed ({} agent(s))", agents.size());
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Agent require(String agentId) {
        Agent agent = agents.get(agentId);
        if (agent == null) {
            throw new IllegalArgumentException("Unknown agent: " + agentId);
        }
        return agent;
    }

    private void requireOpen() {
        if (closed) {
            throw new IllegalStateException("Agent registry is closed");
        }
    }

    private static void awaitIdle(Agent agent) {
        try {
            if (!agent.awaitIdle(DEFAULT_STOP_TIMEOUT)) {
                LOG.warn("Agent [{}] still analysing after {}", agent.getId(), DEFAULT_STOP_TIMEOUT);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for agent [{}] to go idle", agent.getId());
        }
    }

    private void publishUnregistered(Agent agent) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("name", agent.getConfig().getDisplayName());
        attrs.put("agentType", agent.getConfig().getStrategy().getConfigName());
        try {
            context.getStatusPublisher().publish(StatusPublisher.agentKey(agent.getId()),
                    new StatusRecord(agent.getId(), "unregistered", context.getClock().instant(), attrs));
        } catch (RuntimeException e) {
            LOG.warn("Failed to publish unregistration of agent [{}]: {}", agent.getId(), e.getMessage());
        }
    }
}
