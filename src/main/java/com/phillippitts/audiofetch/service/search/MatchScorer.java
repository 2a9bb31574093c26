package com.phillippitts.audiofetch.service.search;

import com.phillippitts.audiofetch.config.properties.SearchProperties;
import com.phillippitts.audiofetch.domain.RawSearchResult;
import com.phillippitts.audiofetch.domain.SearchCandidate;
import com.phillippitts.audiofetch.domain.TrackDescriptor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Scores how well a search result matches the requested track.
 *
 * <p>The score is a weighted sum of four parts:
 * <ul>
 *   <li><b>Title relevance (0.50):</b> +0.25 per artist or track word longer than two characters
 *       found in the result title, capped at 1.0</li>
 *   <li><b>Duration (0.25):</b> linear from 1.0 (exact) to 0.0 at the tolerance; beyond it
 *       {@code max(0, 0.5 - 0.3 * diff)}. Unknown duration adds a flat 0.1.</li>
 *   <li><b>Popularity (0.15):</b> {@code min(1, log10(views + 1) / 8)}. Unknown adds a flat 0.05.</li>
 *   <li><b>Keywords (0.10):</b> from 0.5, +0.1 per quality keyword, -0.15 per unwanted-version keyword
 *       that is not part of the track name itself</li>
 * </ul>
 * The total is clamped to [0.1, 1.0], so every result stays rankable.
 */
@Component
public class MatchScorer {

    private static final Logger LOG = LogManager.getLogger(MatchScorer.class);

    public static final double MIN_SCORE = 0.1;
    public static final double MAX_SCORE = 1.0;

    static final double TITLE_WEIGHT = 0.50;
    static final double DURATION_WEIGHT = 0.25;
    static final double POPULARITY_WEIGHT = 0.15;
    static final double KEYWORD_WEIGHT = 0.10;

    static final double UNKNOWN_DURATION_CREDIT = 0.1;
    static final double UNKNOWN_POPULARITY_CREDIT = 0.05;

    private static final List<String> QUALITY_KEYWORDS =
            List.of("official", "audio", "lyrics", "hd", "hq", "full");
    private static final List<String> VERSION_KEYWORDS =
            List.of("cover", "remix", "live", "karaoke", "instrumental", "acoustic", "slowed", "reverb");

    private final double durationTolerance;

    @Autowired
    public MatchScorer(SearchProperties properties) {
        this(properties.getDurationTolerance());
    }

    /**
     * @param durationTolerance relative duration difference still credited (e.g. 0.30)
     * @throws IllegalArgumentException if the tolerance is not positive
     */
    public MatchScorer(double durationTolerance) {
        if (durationTolerance <= 0.0) {
            throw new IllegalArgumentException("durationTolerance must be positive");
        }
        this.durationTolerance = durationTolerance;
    }

    /**
     * Scores a single result.
     *
     * @param result raw search result
     * @param track  requested track
     * @return score in [0.1, 1.0]
     */
    public double score(RawSearchResult result, TrackDescriptor track) {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(track, "track");

        String title = result.title().toLowerCase(Locale.ROOT);
        String trackName = track.name().toLowerCase(Locale.ROOT);

        double score = titleScore(title, track.artist().toLowerCase(Locale.ROOT), trackName) * TITLE_WEIGHT;

        double target = track.durationSeconds();
        if (result.hasDuration() && target > 0) {
            score += durationScore(result.durationSec(), target) * DURATION_WEIGHT;
        } else {
            score += UNKNOWN_DURATION_CREDIT;
        }

        if (result.hasPopularity()) {
            score += popularityScore(result.popularity()) * POPULARITY_WEIGHT;
        } else {
            score += UNKNOWN_POPULARITY_CREDIT;
        }

        score += keywordScore(title, trackName) * KEYWORD_WEIGHT;

        return Math.min(MAX_SCORE, Math.max(MIN_SCORE, score));
    }

    /**
     * Scores every result and returns the best one as a candidate.
     *
     * <p>Results that cannot be scored are skipped. Ties keep the earlier result.
     *
     * @param results raw results of one search call
     * @param track   requested track
     * @return best candidate, or empty when nothing could be scored
     */
    public Optional<SearchCandidate> best(List<RawSearchResult> results, TrackDescriptor track) {
        SearchCandidate best = null;
        for (RawSearchResult result : results) {
            try {
                SearchCandidate candidate = toCandidate(result, track, score(result, track));
                if (best == null || candidate.score() > best.score()) {
                    best = candidate;
                }
            } catch (RuntimeException e) {
                LOG.debug("Skipping unscorable result '{}': {}", result.title(), e.toString());
            }
        }
        return Optional.ofNullable(best);
    }

    static double titleScore(String title, String artist, String trackName) {
        double score = wordHits(title, artist) + wordHits(title, trackName);
        return Math.min(1.0, score);
    }

    private static double wordHits(String title, String text) {
        double score = 0.0;
        for (String word : text.split("\\s+")) {
            if (word.length() > 2 && title.contains(word)) {
                score += 0.25;
            }
        }
        return score;
    }

    double durationScore(double candidateSec, double targetSec) {
        double diff = Math.abs(candidateSec - targetSec) / Math.max(targetSec, 1.0);
        if (diff <= durationTolerance) {
            return 1.0 - (diff / durationTolerance);
        }
        return Math.max(0.0, 0.5 - (diff * 0.3));
    }

    static double popularityScore(long popularity) {
        return Math.min(1.0, Math.log10(popularity + 1.0) / 8.0);
    }

    static double keywordScore(String title, String trackName) {
        double score = 0.5;
        for (String keyword : QUALITY_KEYWORDS) {
            if (title.contains(keyword)) {
                score = Math.min(1.0, score + 0.1);
            }
        }
        for (String keyword : VERSION_KEYWORDS) {
            if (title.contains(keyword) && !trackName.contains(keyword)) {
                score = Math.max(0.0, score - 0.15);
            }
        }
        return score;
    }

    private static SearchCandidate toCandidate(RawSearchResult result, TrackDescriptor track, double score) {
        int duration = result.hasDuration()
                ? (int) Math.round(result.durationSec())
                : (int) track.durationSeconds();
        long popularity = result.hasPopularity() ? result.popularity() : 0L;
        String title = result.title().isEmpty() ? "Unknown" : result.title();
        return new SearchCandidate(sourceUrl(result), title, duration, popularity, score);
    }

    static String sourceUrl(RawSearchResult result) {
        if (result.url() != null && !result.url().isBlank()) {
            return result.url();
        }
        if (result.id() != null && !result.id().isBlank()) {
            return "https://www.youtube.com/watch?v=" + result.id();
        }
        throw new IllegalArgumentException("Result has neither url nor id");
    }
}
