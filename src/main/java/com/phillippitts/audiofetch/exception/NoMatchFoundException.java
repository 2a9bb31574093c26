package com.phillippitts.audiofetch.exception;

/**
 * Thrown when every search attempt for a track came back without a usable candidate.
 */
public class NoMatchFoundException extends AudioFetchException {

    private final String trackName;

    public NoMatchFoundException(String trackName) {
        super("Could not find a matching audio source for: " + trackName);
        this.trackName = trackName;
    }

    public String getTrackName() {
        return trackName;
    }
}
