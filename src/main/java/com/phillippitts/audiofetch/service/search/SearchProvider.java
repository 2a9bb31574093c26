package com.phillippitts.audiofetch.service.search;

import com.phillippitts.audiofetch.domain.RawSearchResult;
import com.phillippitts.audiofetch.exception.UpstreamUnavailableException;

import java.util.List;

/**
 * Third-party search capability queried by the orchestrator.
 *
 * <p>Implementations bound each call by a timeout and return an empty list when nothing was found.
 */
public interface SearchProvider {

    /**
     * Searches for audio sources.
     *
     * @param query      free-text query
     * @param maxResults maximum number of results to return
     * @return results in provider order; empty when nothing matched
     * @throws UpstreamUnavailableException when the provider cannot be reached at all
     */
    List<RawSearchResult> search(String query, int maxResults);
}
