package com.phillippitts.audiofetch.domain;

import java.nio.file.Path;

/**
 * Outcome of a single acquisition attempt.
 *
 * <p>{@code artifactPath} is set only on success; {@code error} and {@code failure} only on failure.
 * Size and bitrate are reported in both cases when they were measured (diagnostics for validation
 * failures).
 *
 * @param success       whether a valid artifact is available
 * @param artifactPath  canonical artifact location (success only)
 * @param fileSizeBytes measured size in bytes, 0 when not measured
 * @param bitrateKbps   measured or estimated bitrate, 0 when not measured
 * @param error         human-readable failure description (failure only)
 * @param failure       failure category (failure only)
 */
public record AcquisitionResult(
        boolean success,
        Path artifactPath,
        long fileSizeBytes,
        int bitrateKbps,
        String error,
        AcquisitionFailure failure
) {

    public AcquisitionResult {
        if (success) {
            if (artifactPath == null) {
                throw new IllegalArgumentException("Successful result requires an artifact path");
            }
            if (error != null || failure != null) {
                throw new IllegalArgumentException("Successful result must not carry an error");
            }
        } else {
            if (artifactPath != null) {
                throw new IllegalArgumentException("Failed result must not carry an artifact path");
            }
            if (failure == null || error == null || error.isBlank()) {
                throw new IllegalArgumentException("Failed result requires a failure reason and message");
            }
        }
    }

    public static AcquisitionResult success(Path artifactPath, long fileSizeBytes, int bitrateKbps) {
        return new AcquisitionResult(true, artifactPath, fileSizeBytes, bitrateKbps, null, null);
    }

    public static AcquisitionResult failure(AcquisitionFailure failure, String error) {
        return new AcquisitionResult(false, null, 0, 0, error, failure);
    }

    public static AcquisitionResult failure(AcquisitionFailure failure, String error,
                                            long fileSizeBytes, int bitrateKbps) {
        return new AcquisitionResult(false, null, fileSizeBytes, bitrateKbps, error, failure);
    }
}
