package com.phillippitts.audiofetch.util;

import java.time.Duration;

/**
 * Standard timeout values for external process and reader-thread management.
 *
 * <p><b>Usage:</b> Used by {@link com.phillippitts.audiofetch.service.process.ProcessRunner}
 * when terminating timed-out tools and collecting their output.
 *
 * @see com.phillippitts.audiofetch.service.process.ProcessRunner
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Time allowed for stream reader threads to flush output after the process has exited.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Time allowed for stream reader threads to stop during cleanup. They are daemon threads,
     * so a reader that does not stop in time does not keep the JVM alive.
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Wait after {@link Process#destroy()} before escalating to a forcible kill.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Wait after {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Maximum stderr retained per process run; enough for yt-dlp and ffprobe diagnostics.
     */
    public static final int STDERR_MAX_BYTES = 64 * 1024;

    /**
     * Maximum stderr characters copied into error messages.
     */
    public static final int ERROR_SNIPPET_MAX_CHARS = 500;

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
