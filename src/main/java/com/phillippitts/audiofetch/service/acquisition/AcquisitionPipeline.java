package com.phillippitts.audiofetch.service.acquisition;

import com.phillippitts.audiofetch.domain.AcquisitionResult;
import com.phillippitts.audiofetch.domain.SearchCandidate;
import com.phillippitts.audiofetch.domain.TrackDescriptor;

import java.nio.file.Path;

/**
 * Fetches, locates and validates the audio artifact for a chosen candidate.
 * Implementations report every failure through the returned result and never throw for an item.
 */
public interface AcquisitionPipeline {

    /**
     * Acquires the artifact for {@code track} from {@code candidate}.
     *
     * <p>An already present, valid artifact at the canonical path is returned without fetching.
     *
     * @return success with path and metrics, or a failure with reason and message
     */
    AcquisitionResult acquire(SearchCandidate candidate, TrackDescriptor track);

    /**
     * Deterministic artifact location for {@code track}.
     */
    Path canonicalPath(TrackDescriptor track);

    /**
     * Deletes every file in the output directory that fails validation.
     *
     * @return number of files removed
     */
    int cleanupInvalidArtifacts();
}
