package com.phillippitts.audiofetch.service.catalog;

import com.phillippitts.audiofetch.config.properties.RetryProperties;
import com.phillippitts.audiofetch.exception.UpstreamFailure;
import com.phillippitts.audiofetch.exception.UpstreamUnavailableException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Decides whether a failed catalog call is retried and how long to wait first.
 *
 * <p>Delay before retry {@code n} (zero-based) is {@code baseDelay * 2^n}, plus up to 50% random
 * jitter when enabled. A rate-limit failure carrying a retry-after hint waits for that hint instead.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final boolean jitter;
    private final DoubleSupplier random;

    public RetryPolicy(int maxAttempts, Duration baseDelay, boolean jitter) {
        this(maxAttempts, baseDelay, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryPolicy(int maxAttempts, Duration baseDelay, boolean jitter, DoubleSupplier random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        Objects.requireNonNull(baseDelay, "baseDelay");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.jitter = jitter;
        this.random = Objects.requireNonNull(random, "random");
    }

    public static RetryPolicy from(RetryProperties props) {
        return new RetryPolicy(props.getMaxAttempts(), Duration.ofMillis(props.getBaseDelayMs()), props.isJitter());
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * @param failure  failure of the attempt that just ran
     * @param attempts attempts made so far (1 after the first call)
     */
    public boolean shouldRetry(UpstreamUnavailableException failure, int attempts) {
        return attempts < maxAttempts && failure.getKind() != null && failure.getKind().isRetryable();
    }

    /**
     * @param failure    failure being retried
     * @param retryIndex zero-based index of the retry about to happen
     */
    public Duration delayBefore(UpstreamUnavailableException failure, int retryIndex) {
        if (failure.getKind() == UpstreamFailure.RATE_LIMITED && failure.getRetryAfter().isPresent()) {
            return failure.getRetryAfter().get();
        }
        long base = baseDelay.toMillis() * (1L << Math.min(retryIndex, 30));
        if (jitter) {
            base += (long) (base * 0.5 * random.getAsDouble());
        }
        return Duration.ofMillis(base);
    }
}
