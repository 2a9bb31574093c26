package com.phillippitts.audiofetch.domain;

import java.util.Objects;

/**
 * A scored search result considered as the audio source for a track.
 *
 * @param sourceUrl   URL handed to the fetch collaborator
 * @param title       result title
 * @param durationSec duration in seconds (target duration when the provider did not report one)
 * @param popularity  view count, 0 when unknown
 * @param score       match score in [0.1, 1.0]
 */
public record SearchCandidate(
        String sourceUrl,
        String title,
        int durationSec,
        long popularity,
        double score
) {

    public SearchCandidate {
        Objects.requireNonNull(sourceUrl, "Source URL must not be null");
        Objects.requireNonNull(title, "Title must not be null");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0, got: " + score);
        }
    }
}
