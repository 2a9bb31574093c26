package com.phillippitts.audiofetch.service.search;

import com.phillippitts.audiofetch.config.properties.SearchProperties;
import com.phillippitts.audiofetch.domain.RawSearchResult;
import com.phillippitts.audiofetch.domain.SearchCandidate;
import com.phillippitts.audiofetch.domain.TrackDescriptor;
import com.phillippitts.audiofetch.exception.UpstreamUnavailableException;
import com.phillippitts.audiofetch.service.metrics.AcquisitionMetrics;
import com.phillippitts.audiofetch.util.Sleeper;
import com.phillippitts.audiofetch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Default search policy.
 *
 * <p>For each of the first {@code maxRetries} generated queries:
 * <ol>
 *   <li>call the {@link SearchProvider} for up to {@code maxResults} results</li>
 *   <li>no results: back off, next query</li>
 *   <li>score all results, keep this attempt's best and the overall best</li>
 *   <li>attempt best at or above {@code minAcceptScore}: return it immediately</li>
 *   <li>otherwise back off, next query</li>
 * </ol>
 * When the budget runs out the overall best candidate is returned, if there is one.
 *
 * <p>Early acceptance means a weak first match that just clears the bar wins over a stronger one a
 * later query might have found. The bar is configurable through
 * {@code audiofetch.search.min-accept-score}.
 */
public class DefaultSearchOrchestrator implements SearchOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultSearchOrchestrator.class);

    private final SearchProvider provider;
    private final QueryGenerator queryGenerator;
    private final MatchScorer scorer;
    private final SearchProperties properties;
    private final AcquisitionMetrics metrics;
    private final Sleeper sleeper;

    public DefaultSearchOrchestrator(SearchProvider provider,
                                     QueryGenerator queryGenerator,
                                     MatchScorer scorer,
                                     SearchProperties properties,
                                     AcquisitionMetrics metrics,
                                     Sleeper sleeper) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.queryGenerator = Objects.requireNonNull(queryGenerator, "queryGenerator");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public Optional<SearchCandidate> search(TrackDescriptor track) {
        Objects.requireNonNull(track, "track");
        long start = System.nanoTime();

        List<String> queries = queryGenerator.generate(track);
        int budget = Math.min(properties.getMaxRetries(), queries.size());
        SearchCandidate overallBest = null;
        int attempts = 0;

        for (int i = 0; i < budget; i++) {
            String query = queries.get(i);
            attempts++;
            LOG.info("Searching ({}/{}): {}", i + 1, budget, query);

            List<RawSearchResult> results = callProvider(query);
            if (results.isEmpty()) {
                if (i + 1 < budget && !backOff()) {
                    break;
                }
                continue;
            }

            Optional<SearchCandidate> attemptBest = scorer.best(results, track);
            if (attemptBest.isPresent()) {
                SearchCandidate candidate = attemptBest.get();
                if (overallBest == null || candidate.score() > overallBest.score()) {
                    overallBest = candidate;
                }
                if (candidate.score() >= properties.getMinAcceptScore()) {
                    LOG.info("Found match: {} (score: {})", candidate.title(), format(candidate.score()));
                    metrics.recordSearch(AcquisitionMetrics.SEARCH_ACCEPTED, attempts, TimeUtils.elapsedNanos(start));
                    return attemptBest;
                }
            }

            if (i + 1 < budget && !backOff()) {
                break;
            }
        }

        if (overallBest != null) {
            LOG.info("Using best available match: {} (score: {})", overallBest.title(), format(overallBest.score()));
            metrics.recordSearch(AcquisitionMetrics.SEARCH_FALLBACK, attempts, TimeUtils.elapsedNanos(start));
            return Optional.of(overallBest);
        }

        LOG.warn("No match found for: {}", track.name());
        metrics.recordSearch(AcquisitionMetrics.SEARCH_NO_MATCH, attempts, TimeUtils.elapsedNanos(start));
        return Optional.empty();
    }

    private List<RawSearchResult> callProvider(String query) {
        try {
            List<RawSearchResult> results = provider.search(query, properties.getMaxResults());
            return results == null ? List.of() : results;
        } catch (UpstreamUnavailableException e) {
            LOG.warn("Search attempt failed for '{}': {}", query, e.getMessage());
            return List.of();
        }
    }

    /**
     * @return false when interrupted, in which case the search stops with what it has
     */
    private boolean backOff() {
        try {
            sleeper.sleep(Duration.ofMillis(properties.getBackoffMs()));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Search interrupted during backoff");
            return false;
        }
    }

    static String format(double score) {
        return String.format(Locale.ROOT, "%.2f", score);
    }
}
