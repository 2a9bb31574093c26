package com.phillippitts.audiofetch.service.batch;

import com.phillippitts.audiofetch.domain.BatchItemResult;
import com.phillippitts.audiofetch.domain.BatchSummary;
import com.phillippitts.audiofetch.domain.SearchCandidate;
import com.phillippitts.audiofetch.domain.TrackDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs acquisitions for many (candidate, track) pairs with bounded parallelism.
 */
public interface BatchCoordinator {

    /**
     * A chosen candidate and the track it should be acquired for.
     */
    record BatchItem(SearchCandidate candidate, TrackDescriptor descriptor) {
        public BatchItem {
            Objects.requireNonNull(candidate, "candidate must not be null");
            Objects.requireNonNull(descriptor, "descriptor must not be null");
        }
    }

    /**
     * Acquires all items with the default concurrency.
     */
    List<BatchItemResult> acquireAll(List<BatchItem> items);

    /**
     * Acquires all items with at most {@code concurrency} acquisitions in flight.
     *
     * @return exactly one result per item, in completion order
     * @throws IllegalArgumentException if {@code concurrency < 1}
     */
    List<BatchItemResult> acquireAll(List<BatchItem> items, int concurrency);

    /**
     * Counts successes and failures and sums the size of the acquired artifacts.
     */
    static BatchSummary summarize(List<BatchItemResult> results) {
        int succeeded = 0;
        long totalBytes = 0;
        List<Map.Entry<String, String>> failures = new ArrayList<>();
        for (BatchItemResult item : results) {
            if (item.succeeded()) {
                succeeded++;
                totalBytes += item.result().fileSizeBytes();
            } else {
                failures.add(Map.entry(item.descriptor().filename(), item.result().error()));
            }
        }
        return new BatchSummary(results.size(), succeeded, results.size() - succeeded, totalBytes, failures);
    }
}
