package com.phillippitts.audiofetch.service.metrics;

import com.phillippitts.audiofetch.domain.AcquisitionFailure;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for searches and acquisitions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Search latency and outcome (accepted early, best-effort fallback, no match)</li>
 *   <li>Acquisition latency</li>
 *   <li>Acquisition success and failure counts, by failure reason</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class AcquisitionMetrics {

    private static final String METRIC_PREFIX = "audiofetch";

    /** Search outcome tag values. */
    public static final String SEARCH_ACCEPTED = "accepted";
    public static final String SEARCH_FALLBACK = "fallback";
    public static final String SEARCH_NO_MATCH = "no_match";

    private final MeterRegistry registry;

    public AcquisitionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one completed search with the number of provider calls it took.
     *
     * @param outcome one of {@link #SEARCH_ACCEPTED}, {@link #SEARCH_FALLBACK}, {@link #SEARCH_NO_MATCH}
     * @param attempts provider calls made
     * @param durationNanos wall-clock duration
     */
    public void recordSearch(String outcome, int attempts, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".search.latency")
                .description("Time taken to choose a candidate")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(METRIC_PREFIX + ".search.attempts")
                .description("Search provider calls made")
                .tag("outcome", outcome)
                .register(registry)
                .increment(attempts);
    }

    public void recordAcquisitionLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".acquisition.latency")
                .description("Time taken to fetch and validate an artifact")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param reused whether an existing valid artifact was returned without fetching
     */
    public void incrementSuccess(boolean reused) {
        Counter.builder(METRIC_PREFIX + ".acquisition.success")
                .description("Number of successful acquisitions")
                .tag("reused", Boolean.toString(reused))
                .register(registry)
                .increment();
    }

    public void incrementFailure(AcquisitionFailure reason) {
        Counter.builder(METRIC_PREFIX + ".acquisition.failure")
                .description("Number of failed acquisitions")
                .tag("reason", reason.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }
}
