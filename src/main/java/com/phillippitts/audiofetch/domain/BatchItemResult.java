package com.phillippitts.audiofetch.domain;

import java.util.Objects;

/**
 * Result of one batch item, tied to the track it was produced for.
 *
 * @param descriptor track the result belongs to
 * @param result     acquisition outcome
 */
public record BatchItemResult(TrackDescriptor descriptor, AcquisitionResult result) {

    public BatchItemResult {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(result, "result must not be null");
    }

    public boolean succeeded() {
        return result.success();
    }
}
