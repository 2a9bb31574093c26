package com.phillippitts.audiofetch.domain;

/**
 * Reason an acquisition attempt did not produce a usable artifact.
 */
public enum AcquisitionFailure {
    /** No search result was good enough to fetch. */
    NO_MATCH,
    /** Fetch collaborator exited with a nonzero status. */
    FETCH_FAILED,
    /** Fetch collaborator exceeded its timeout and was terminated. */
    FETCH_TIMEOUT,
    /** Fetch reported success but no artifact could be located. */
    ARTIFACT_MISSING,
    /** Artifact was present but below the size or bitrate threshold. */
    VALIDATION_FAILED,
    /** Any other error raised while acquiring. */
    UNEXPECTED
}
