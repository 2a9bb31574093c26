package com.phillippitts.audiofetch.service.catalog;

import com.phillippitts.audiofetch.config.properties.RetryProperties;
import com.phillippitts.audiofetch.exception.UpstreamFailure;
import com.phillippitts.audiofetch.exception.UpstreamUnavailableException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private static final UpstreamUnavailableException TRANSIENT =
            new UpstreamUnavailableException(UpstreamFailure.TRANSIENT, "timeout");

    @Test
    void delayDoublesPerRetry() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100), false);

        assertThat(policy.delayBefore(TRANSIENT, 0)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.delayBefore(TRANSIENT, 1)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.delayBefore(TRANSIENT, 3)).isEqualTo(Duration.ofMillis(800));
    }

    @Test
    void jitterAddsUpToHalfTheDelay() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1000), true, () -> 1.0);

        assertThat(policy.delayBefore(TRANSIENT, 0)).isEqualTo(Duration.ofMillis(1500));
    }

    @Test
    void rateLimitWithoutHintFallsBackToExponentialDelay() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1000), false);
        UpstreamUnavailableException limited = UpstreamUnavailableException.rateLimited("429", null);

        assertThat(policy.delayBefore(limited, 1)).isEqualTo(Duration.ofMillis(2000));
    }

    @Test
    void onlyRetryableKindsAreRetriedWithinAttempts() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ZERO, false);

        assertThat(policy.shouldRetry(TRANSIENT, 1)).isTrue();
        assertThat(policy.shouldRetry(TRANSIENT, 3)).isFalse();
        assertThat(policy.shouldRetry(new UpstreamUnavailableException(UpstreamFailure.NOT_FOUND, "404"), 1))
                .isFalse();
    }

    @Test
    void builtFromPropertiesDefaults() {
        RetryPolicy policy = RetryPolicy.from(new RetryProperties());

        assertThat(policy.maxAttempts()).isEqualTo(3);
        assertThat(policy.delayBefore(TRANSIENT, 0)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(1, Duration.ofMillis(-1), false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
