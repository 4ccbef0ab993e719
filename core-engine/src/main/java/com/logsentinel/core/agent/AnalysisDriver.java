package com.logsentinel.core.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * The single periodic driver loop. One daemon thread invokes the tick at a
 * fixed rate; a failing tick is logged and the loop continues.
 *
 * @since 1.0.0
 */
public final class AnalysisDriver implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisDriver.class);

    private final Runnable tick;
    private final Duration interval;
    private ScheduledExecutorService scheduler;

    public AnalysisDriver(Runnable tick, Duration interval) {
        this.tick = Objects.requireNonNull(tick, "tick must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("tick interval must be positive, got: " + interval);
        }
    }

    /**
     * @throws IllegalStateException if already started
     */
    public synchronized void start() {
        if (scheduler != null) {
            throw new IllegalStateException("Analysis driver already started");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "analysis-driver");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::runTick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Analysis driver started with tick interval {}", interval);
    }

    public synchronized boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    void runTick() {
        try {
            tick.run();
        } catch (RuntimeException e) {
            // an escaping exception would cancel the fixed-rate task
            LOG.error("Analysis tick failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Analysis driver stopped");
    }
}
