package com.phillippitts.audiofetch.service.search;

import com.phillippitts.audiofetch.config.properties.SearchProperties;
import com.phillippitts.audiofetch.config.properties.ToolProperties;
import com.phillippitts.audiofetch.domain.RawSearchResult;
import com.phillippitts.audiofetch.exception.FetchFailedException;
import com.phillippitts.audiofetch.exception.UpstreamFailure;
import com.phillippitts.audiofetch.exception.UpstreamUnavailableException;
import com.phillippitts.audiofetch.service.process.ProcessResult;
import com.phillippitts.audiofetch.service.process.ProcessRunner;
import com.phillippitts.audiofetch.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * {@link SearchProvider} backed by the yt-dlp command-line tool.
 *
 * <p>CLI contract:
 * <pre>
 * ${yt-dlp} ytsearch${maxResults}:${query} --dump-json --flat-playlist --no-warnings --quiet
 * </pre>
 *
 * <p>A nonzero exit or a timeout is logged and reported as "no results" so that the orchestrator
 * simply moves on to its next query. Failing to start the tool at all is an
 * {@link UpstreamUnavailableException}.
 */
public class YtDlpSearchProvider implements SearchProvider {

    private static final Logger LOG = LogManager.getLogger(YtDlpSearchProvider.class);
    private static final String TOOL = "yt-dlp";

    private final ProcessRunner runner;
    private final ToolProperties tools;
    private final Duration timeout;

    public YtDlpSearchProvider(ProcessRunner runner, ToolProperties tools, SearchProperties search) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.tools = Objects.requireNonNull(tools, "tools");
        this.timeout = Duration.ofSeconds(search.getTimeoutSeconds());
    }

    @Override
    public List<RawSearchResult> search(String query, int maxResults) {
        Objects.requireNonNull(query, "query");
        List<String> command = List.of(
                tools.ytDlpPath(),
                "ytsearch" + maxResults + ":" + query,
                "--dump-json",
                "--flat-playlist",
                "--no-warnings",
                "--quiet");

        ProcessResult result;
        try {
            result = runner.run(TOOL, command, null, timeout);
        } catch (FetchFailedException e) {
            throw new UpstreamUnavailableException(UpstreamFailure.UNAVAILABLE,
                    "Search tool could not be started: " + e.getMessage(), e);
        }

        if (result.timedOut()) {
            LOG.warn("Search timed out after {}s for query '{}'", timeout.toSeconds(), query);
            return List.of();
        }
        if (result.exitCode() != 0) {
            LOG.warn("Search exited with {} for query '{}': {}", result.exitCode(), query,
                    LogSanitizer.singleLine(result.stderr(), 200));
            return List.of();
        }
        List<RawSearchResult> parsed = YtDlpJsonParser.parse(result.stdout());
        LOG.debug("Search '{}' returned {} results in {} ms", query, parsed.size(), result.durationMs());
        return parsed;
    }
}
