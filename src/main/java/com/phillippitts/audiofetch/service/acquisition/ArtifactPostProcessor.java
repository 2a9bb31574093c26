package com.phillippitts.audiofetch.service.acquisition;

import com.phillippitts.audiofetch.domain.TrackDescriptor;

import java.nio.file.Path;

/**
 * Hook run on a validated artifact before a job completes (tag embedding, normalization).
 */
@FunctionalInterface
public interface ArtifactPostProcessor {

    /**
     * @param artifact validated artifact
     * @param track    track the artifact belongs to
     * @throws com.phillippitts.audiofetch.exception.AudioFetchException when processing fails
     */
    void process(Path artifact, TrackDescriptor track);
}
