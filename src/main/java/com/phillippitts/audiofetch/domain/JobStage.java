package com.phillippitts.audiofetch.domain;

/**
 * Coarse stages of a download job, in their only permitted order.
 *
 * <p>{@link #ERROR} can be entered from any non-terminal stage. {@link #COMPLETE} and
 * {@link #ERROR} are terminal.
 */
public enum JobStage {
    STARTING(0, "Initializing..."),
    AUTHENTICATING(10, "Connecting to catalog..."),
    FETCHING(20, "Fetching track metadata..."),
    SEARCHING(40, "Searching for audio source..."),
    DOWNLOADING(60, "Downloading audio..."),
    PROCESSING(85, "Adding metadata and album art..."),
    COMPLETE(100, "Download complete!"),
    ERROR(-1, "Download failed");

    private final int progressPercent;
    private final String defaultMessage;

    JobStage(int progressPercent, String defaultMessage) {
        this.progressPercent = progressPercent;
        this.defaultMessage = defaultMessage;
    }

    /**
     * Progress reported on entering this stage; {@code -1} for {@link #ERROR}, which keeps the
     * progress of the stage that failed.
     */
    public int progressPercent() {
        return progressPercent;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }

    /**
     * Whether a job currently in this stage may move to {@code next}.
     */
    public boolean canTransitionTo(JobStage next) {
        if (isTerminal()) {
            return false;
        }
        if (next == ERROR) {
            return true;
        }
        return next.ordinal() > ordinal();
    }
}
