package com.phillippitts.audiofetch.service.metrics;

import com.phillippitts.audiofetch.domain.AcquisitionFailure;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AcquisitionMetricsTest {

    private SimpleMeterRegistry registry;
    private AcquisitionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AcquisitionMetrics(registry);
    }

    @Test
    void searchRecordsLatencyAndAttemptsByOutcome() {
        metrics.recordSearch(AcquisitionMetrics.SEARCH_FALLBACK, 5, TimeUnit.MILLISECONDS.toNanos(1200));

        Timer timer = registry.find("audiofetch.search.latency").tag("outcome", "fallback").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(1200.0);
        assertThat(registry.counter("audiofetch.search.attempts", "outcome", "fallback").count()).isEqualTo(5.0);
    }

    @Test
    void failuresAreTaggedByReason() {
        metrics.incrementFailure(AcquisitionFailure.FETCH_TIMEOUT);
        metrics.incrementFailure(AcquisitionFailure.FETCH_TIMEOUT);
        metrics.incrementFailure(AcquisitionFailure.NO_MATCH);

        assertThat(registry.counter("audiofetch.acquisition.failure", "reason", "fetch_timeout").count())
                .isEqualTo(2.0);
        assertThat(registry.counter("audiofetch.acquisition.failure", "reason", "no_match").count())
                .isEqualTo(1.0);
    }

    @Test
    void successesDistinguishReusedArtifacts() {
        metrics.incrementSuccess(true);
        metrics.incrementSuccess(false);
        metrics.incrementSuccess(false);

        assertThat(registry.counter("audiofetch.acquisition.success", "reused", "true").count()).isEqualTo(1.0);
        assertThat(registry.counter("audiofetch.acquisition.success", "reused", "false").count()).isEqualTo(2.0);
    }

    @Test
    void acquisitionLatencyIsRecorded() {
        metrics.recordAcquisitionLatency(TimeUnit.SECONDS.toNanos(3));

        assertThat(registry.find("audiofetch.acquisition.latency").timer().totalTime(TimeUnit.SECONDS))
                .isEqualTo(3.0);
    }
}
