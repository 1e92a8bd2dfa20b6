package com.patternsentinel.core.engine;

import com.patternsentinel.core.model.Anomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically runs {@code learnPatterns → learnCorrelations → detect} on an
 * engine.
 *
 * <p>
 * Passes run on a single daemon thread with a fixed delay between the end of
 * one pass and the start of the next, so passes never overlap. A failing pass
 * is logged and the schedule continues. {@link #close()} interrupts a running
 * pass, which then stops at the next entity boundary.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionScheduler.class);

    static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final AnomalyDetectionEngine engine;
    private final Duration interval;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong completedPasses = new AtomicLong();
    private final AtomicLong failedPasses = new AtomicLong();

    private ScheduledExecutorService executor;

    /**
     * @param engine   engine to drive
     * @param interval delay between passes; must be positive
     */
    public DetectionScheduler(AnomalyDetectionEngine engine, Duration interval) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, got: " + interval);
        }
    }

    /**
     * Create a scheduler using the engine's configured detection interval.
     */
    public DetectionScheduler(AnomalyDetectionEngine engine) {
        this(engine, Duration.ofSeconds(engine.getConfig().getDetectionIntervalSeconds()));
    }

    /**
     * Start scheduling. The first pass runs after one interval.
     *
     * @throws IllegalStateException if already started
     */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Detection scheduler already started");
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "anomaly-detection");
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        executor.scheduleWithFixedDelay(this::runPass, millis, millis, TimeUnit.MILLISECONDS);
        LOG.info("Detection scheduler started, interval {}", interval);
    }

    /**
     * Run one pass on the calling thread.
     *
     * @return anomalies found by the pass; empty if it failed or was cancelled
     */
    public List<Anomaly> runPass() {
        long start = System.nanoTime();
        try {
            int profiles = engine.learnPatterns();
            int pairs = engine.learnCorrelations();
            List<Anomaly> found = engine.detect();
            completedPasses.incrementAndGet();
            LOG.debug("Detection pass finished in {} ms: {} profile(s), {} pair(s), {} anomaly(ies)",
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), profiles, pairs, found.size());
            return found;
        } catch (CancellationException e) {
            LOG.info("Detection pass cancelled: {}", e.getMessage());
            return List.of();
        } catch (RuntimeException e) {
            failedPasses.incrementAndGet();
            LOG.error("Detection pass failed, continuing with next scheduled pass", e);
            return List.of();
        }
    }

    /**
     * Stop scheduling and interrupt a running pass.
     */
    @Override
    public synchronized void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Detection pass did not stop within {} s", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("Detection scheduler stopped after {} pass(es)", completedPasses.get());
    }

    public boolean isRunning() {
        return running.get();
    }

    public long completedPasses() {
        return completedPasses.get();
    }

    public long failedPasses() {
        return failedPasses.get();
    }

    public Duration getInterval() {
        return interval;
    }
}
