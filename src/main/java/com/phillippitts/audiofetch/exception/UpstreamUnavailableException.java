package com.phillippitts.audiofetch.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * Thrown when the catalog or search collaborator cannot serve a request (authentication,
 * connectivity, rate limiting or missing content).
 *
 * <p>Rate-limit failures may carry the server-provided retry hint.
 */
public class UpstreamUnavailableException extends AudioFetchException {

    private final UpstreamFailure kind;
    private final Duration retryAfter;

    public UpstreamUnavailableException(UpstreamFailure kind, String message) {
        this(kind, message, null, null);
    }

    public UpstreamUnavailableException(UpstreamFailure kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public UpstreamUnavailableException(UpstreamFailure kind, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryAfter = retryAfter;
    }

    public static UpstreamUnavailableException rateLimited(String message, Duration retryAfter) {
        return new UpstreamUnavailableException(UpstreamFailure.RATE_LIMITED, message, retryAfter, null);
    }

    public UpstreamFailure getKind() {
        return kind;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
