package com.phillippitts.vibedj.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the DJ pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Pick outcomes (chosen, skip, none, error)</li>
 *   <li>Queue retries by reason</li>
 *   <li>Oracle latency and failures per oracle</li>
 *   <li>Shortlist pool and sample sizes</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
public class DjMetrics {

    private static final String METRIC_PREFIX = "vibedj";

    private final MeterRegistry registry;

    public DjMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome chosen, skip, none or error
     */
    public void recordPick(String outcome, long durationNanos) {
        Counter.builder(METRIC_PREFIX + ".pick")
                .description("Number of pick attempts by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".pick.latency")
                .description("Time taken for a full pick")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementQueueRetry(String reason) {
        Counter.builder(METRIC_PREFIX + ".queue.retry")
                .description("Number of queue retry cooldowns scheduled")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementQueued(String reason) {
        Counter.builder(METRIC_PREFIX + ".queue.success")
                .description("Number of tracks queued on the player")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param oracleName vibe or recommender
     */
    public void recordOracleLatency(String oracleName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".oracle.latency")
                .description("Time taken by an oracle call")
                .tag("oracle", oracleName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementOracleFailure(String oracleName) {
        Counter.builder(METRIC_PREFIX + ".oracle.failure")
                .description("Number of failed oracle calls")
                .tag("oracle", oracleName)
                .register(registry)
                .increment();
    }

    public void recordShortlist(int poolSize, int sampleSize) {
        DistributionSummary.builder(METRIC_PREFIX + ".shortlist.pool")
                .description("Filtered shortlist pool size")
                .register(registry)
                .record(poolSize);
        DistributionSummary.builder(METRIC_PREFIX + ".shortlist.sample")
                .description("Number of tracks provided to the recommender")
                .register(registry)
                .record(sampleSize);
    }

    /**
     * @param outcome value of the planner's recheck outcome
     */
    public void incrementVibeRecheck(String outcome) {
        Counter.builder(METRIC_PREFIX + ".vibe.recheck")
                .description("Vibe plan recheck decisions by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
