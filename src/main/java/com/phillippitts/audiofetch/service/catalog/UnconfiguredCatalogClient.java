package com.phillippitts.audiofetch.service.catalog;

import com.phillippitts.audiofetch.domain.TrackDescriptor;
import com.phillippitts.audiofetch.exception.UpstreamFailure;
import com.phillippitts.audiofetch.exception.UpstreamUnavailableException;

import java.util.List;

/**
 * Placeholder used when no catalog integration is on the classpath. Every call fails with
 * {@link UpstreamFailure#UNAVAILABLE}; jobs submitted with a ready {@link TrackDescriptor} still work.
 */
public final class UnconfiguredCatalogClient implements CatalogClient {

    static final String MESSAGE = "No catalog client configured";

    @Override
    public void authenticate() {
        throw unavailable();
    }

    @Override
    public TrackDescriptor resolveTrack(String trackUrl) {
        throw unavailable();
    }

    @Override
    public List<TrackDescriptor> resolveCollection(String collectionUrl) {
        throw unavailable();
    }

    private static UpstreamUnavailableException unavailable() {
        return new UpstreamUnavailableException(UpstreamFailure.UNAVAILABLE, MESSAGE);
    }
}
