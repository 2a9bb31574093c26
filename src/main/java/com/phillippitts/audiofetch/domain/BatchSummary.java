package com.phillippitts.audiofetch.domain;

import java.util.List;
import java.util.Map;

/**
 * Aggregate outcome of a batch download.
 *
 * @param total      number of items submitted
 * @param succeeded  number of items with a valid artifact
 * @param failed     number of failed items
 * @param totalBytes combined size of the successful artifacts
 * @param failures   failed track filename mapped to its error, in result order
 */
public record BatchSummary(
        int total,
        int succeeded,
        int failed,
        long totalBytes,
        List<Map.Entry<String, String>> failures
) {

    public BatchSummary {
        failures = List.copyOf(failures);
    }
}
