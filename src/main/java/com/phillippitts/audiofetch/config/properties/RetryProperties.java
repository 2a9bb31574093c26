package com.phillippitts.audiofetch.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Retry policy for catalog calls (prefix {@code audiofetch.catalog.retry}).
 */
@Validated
@ConfigurationProperties(prefix = "audiofetch.catalog.retry")
public class RetryProperties {

    @Positive
    private final int maxAttempts;

    @Min(0)
    private final long baseDelayMs;

    /** Adds up to 50% random jitter on top of each exponential delay. */
    private final boolean jitter;

    @ConstructorBinding
    public RetryProperties(Integer maxAttempts, Long baseDelayMs, Boolean jitter) {
        this.maxAttempts = maxAttempts == null ? 3 : maxAttempts;
        this.baseDelayMs = baseDelayMs == null ? 1000L : baseDelayMs;
        this.jitter = jitter != null && jitter;
    }

    public RetryProperties() {
        this(null, null, null);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public boolean isJitter() {
        return jitter;
    }
}
