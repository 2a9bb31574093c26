package com.phillippitts.audiofetch.exception;

/**
 * Thrown when an external tool exits with a nonzero status or exceeds its timeout.
 */
public class FetchFailedException extends AudioFetchException {

    private final String tool;
    private final int exitCode;
    private final boolean timedOut;

    public FetchFailedException(String message) {
        this(message, "unknown", -1, false);
    }

    public FetchFailedException(String message, String tool, int exitCode, boolean timedOut) {
        super(message + " (tool: " + tool + ")");
        this.tool = tool;
        this.exitCode = exitCode;
        this.timedOut = timedOut;
    }

    public FetchFailedException(String message, String tool, int exitCode, boolean timedOut, Throwable cause) {
        super(message + " (tool: " + tool + ")", cause);
        this.tool = tool;
        this.exitCode = exitCode;
        this.timedOut = timedOut;
    }

    public String getTool() {
        return tool;
    }

    public int getExitCode() {
        return exitCode;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
