package com.phillippitts.audiofetch.service.search;

import com.phillippitts.audiofetch.domain.SearchCandidate;
import com.phillippitts.audiofetch.domain.TrackDescriptor;
import com.phillippitts.audiofetch.exception.NoMatchFoundException;

import java.util.Optional;

/**
 * Chooses the audio source for a track by escalating through query variants.
 */
public interface SearchOrchestrator {

    /**
     * Searches for the best candidate for {@code track}.
     *
     * @return the first candidate that clears the acceptance score, otherwise the best candidate seen
     *         across all attempts, or empty when no attempt returned anything
     */
    Optional<SearchCandidate> search(TrackDescriptor track);

    /**
     * Same as {@link #search(TrackDescriptor)} but fails when nothing was found.
     *
     * @throws NoMatchFoundException when every attempt came back empty
     */
    default SearchCandidate searchOrThrow(TrackDescriptor track) {
        return search(track).orElseThrow(() -> new NoMatchFoundException(track.name()));
    }
}
