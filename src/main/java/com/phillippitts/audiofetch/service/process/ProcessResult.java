package com.phillippitts.audiofetch.service.process;

/**
 * Captured outcome of one external tool run.
 *
 * @param exitCode   process exit code, {@code -1} when the process timed out
 * @param stdout     captured stdout (capped)
 * @param stderr     captured stderr (capped)
 * @param timedOut   whether the run was terminated for exceeding its timeout
 * @param durationMs wall-clock duration of the run
 */
public record ProcessResult(int exitCode, String stdout, String stderr, boolean timedOut, long durationMs) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
