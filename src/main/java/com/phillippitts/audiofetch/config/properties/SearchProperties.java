package com.phillippitts.audiofetch.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tuning for the search orchestrator and match scorer.
 *
 * <p>Example application.properties:
 * <pre>
 * audiofetch.search.max-retries=5
 * audiofetch.search.max-results=10
 * audiofetch.search.backoff-ms=300
 * audiofetch.search.min-accept-score=0.3
 * audiofetch.search.duration-tolerance=0.30
 * audiofetch.search.timeout-seconds=30
 * </pre>
 *
 * <p>{@code min-accept-score} is the early-accept bar: the first attempt whose best candidate reaches
 * it ends the search, even if a later query might have produced a stronger match. Raising it trades
 * extra search calls for better matches.
 */
@ConfigurationProperties(prefix = "audiofetch.search")
@Validated
public class SearchProperties {

    /** Number of generated queries tried before falling back to the best candidate seen. */
    @Positive(message = "Max retries must be positive")
    private int maxRetries = 5;

    /** Results requested from the search provider per query. */
    @Positive(message = "Max results must be positive")
    private int maxResults = 10;

    /** Pause between attempts that did not end the search. */
    @Min(value = 0, message = "Backoff must not be negative")
    private long backoffMs = 300;

    @DecimalMin(value = "0.0", message = "Accept score must be in [0,1]")
    @DecimalMax(value = "1.0", message = "Accept score must be in [0,1]")
    private double minAcceptScore = 0.3;

    /** Relative duration difference still credited by the scorer (0.30 = 30%). */
    @DecimalMin(value = "0.0", inclusive = false, message = "Duration tolerance must be positive")
    private double durationTolerance = 0.30;

    /** Timeout for a single search call. */
    @Positive(message = "Search timeout must be positive")
    private int timeoutSeconds = 30;

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(int maxResults) {
        this.maxResults = maxResults;
    }

    public long getBackoffMs() {
        return backoffMs;
    }

    public void setBackoffMs(long backoffMs) {
        this.backoffMs = backoffMs;
    }

    public double getMinAcceptScore() {
        return minAcceptScore;
    }

    public void setMinAcceptScore(double minAcceptScore) {
        this.minAcceptScore = minAcceptScore;
    }

    public double getDurationTolerance() {
        return durationTolerance;
    }

    public void setDurationTolerance(double durationTolerance) {
        this.durationTolerance = durationTolerance;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }
}
