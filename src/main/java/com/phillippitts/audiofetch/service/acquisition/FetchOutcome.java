package com.phillippitts.audiofetch.service.acquisition;

/**
 * Result of one fetch-tool run.
 *
 * @param status      success, nonzero exit or timeout
 * @param exitCode    tool exit code ({@code -1} on timeout)
 * @param diagnostics stderr snippet for failures (empty on success)
 */
public record FetchOutcome(Status status, int exitCode, String diagnostics) {

    public enum Status { SUCCESS, FAILED, TIMED_OUT }

    public FetchOutcome {
        diagnostics = diagnostics == null ? "" : diagnostics;
    }

    public static FetchOutcome success() {
        return new FetchOutcome(Status.SUCCESS, 0, "");
    }

    public static FetchOutcome failed(int exitCode, String diagnostics) {
        return new FetchOutcome(Status.FAILED, exitCode, diagnostics);
    }

    public static FetchOutcome timedOut(String diagnostics) {
        return new FetchOutcome(Status.TIMED_OUT, -1, diagnostics);
    }
}
