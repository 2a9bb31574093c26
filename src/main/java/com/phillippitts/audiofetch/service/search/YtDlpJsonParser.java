package com.phillippitts.audiofetch.service.search;

import com.phillippitts.audiofetch.domain.RawSearchResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the JSON-lines output of {@code yt-dlp --dump-json --flat-playlist}.
 *
 * <p>Each non-blank line is one result object. Lines that are not valid JSON are skipped.
 * Fields read: {@code id}, {@code url}, {@code title}, {@code duration}, {@code view_count}.
 */
public final class YtDlpJsonParser {

    private static final Logger LOG = LogManager.getLogger(YtDlpJsonParser.class);

    private YtDlpJsonParser() {
        // Prevent instantiation
    }

    /**
     * @param stdout raw tool output (may be null or blank)
     * @return parsed results, in output order
     */
    public static List<RawSearchResult> parse(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            return List.of();
        }
        List<RawSearchResult> results = new ArrayList<>();
        for (String line : stdout.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                results.add(toResult(new JSONObject(line)));
            } catch (JSONException e) {
                LOG.debug("Skipping malformed search result line: {}", e.getMessage());
            }
        }
        return List.copyOf(results);
    }

    private static RawSearchResult toResult(JSONObject json) {
        String id = json.optString("id", null);
        String url = json.optString("url", null);
        String title = json.optString("title", "");
        Double duration = json.isNull("duration") ? null : positiveOrNull(json.optDouble("duration", 0.0));
        Long views = json.isNull("view_count") ? null : json.optLong("view_count", 0L);
        return new RawSearchResult(id, url, title, duration, views);
    }

    private static Double positiveOrNull(double value) {
        return Double.isNaN(value) || value <= 0 ? null : value;
    }
}
