package com.phillippitts.audiofetch.service.catalog;

import com.phillippitts.audiofetch.domain.TrackDescriptor;

import java.util.List;

/**
 * Music catalog that turns track, album and playlist URLs into {@link TrackDescriptor}s.
 *
 * <p>All methods signal failure with
 * {@link com.phillippitts.audiofetch.exception.UpstreamUnavailableException}, whose
 * {@link com.phillippitts.audiofetch.exception.UpstreamFailure kind} tells callers whether a retry
 * makes sense.
 */
public interface CatalogClient {

    /**
     * Obtains or refreshes credentials. Idempotent.
     */
    void authenticate();

    TrackDescriptor resolveTrack(String trackUrl);

    /**
     * Resolves every track of an album or playlist, in catalog order.
     */
    List<TrackDescriptor> resolveCollection(String collectionUrl);
}
