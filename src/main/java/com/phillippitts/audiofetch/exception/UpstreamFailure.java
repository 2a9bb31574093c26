package com.phillippitts.audiofetch.exception;

/**
 * Categories of catalog or search collaborator failures.
 */
public enum UpstreamFailure {
    AUTHENTICATION(false),
    RATE_LIMITED(true),
    TRANSIENT(true),
    NOT_FOUND(false),
    UNAVAILABLE(false);

    private final boolean retryable;

    UpstreamFailure(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
