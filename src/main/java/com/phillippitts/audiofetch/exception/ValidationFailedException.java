package com.phillippitts.audiofetch.exception;

/**
 * Thrown when a downloaded artifact is below the configured size or bitrate threshold.
 * Always carries the measured values.
 */
public class ValidationFailedException extends AudioFetchException {

    private final long fileSizeBytes;
    private final int bitrateKbps;

    public ValidationFailedException(long fileSizeBytes, int bitrateKbps) {
        super("File validation failed (size: " + fileSizeBytes + ", bitrate: " + bitrateKbps + ")");
        this.fileSizeBytes = fileSizeBytes;
        this.bitrateKbps = bitrateKbps;
    }

    public long getFileSizeBytes() {
        return fileSizeBytes;
    }

    public int getBitrateKbps() {
        return bitrateKbps;
    }
}
