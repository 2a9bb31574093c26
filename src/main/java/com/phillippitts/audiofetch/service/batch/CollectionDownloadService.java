package com.phillippitts.audiofetch.service.batch;

import com.phillippitts.audiofetch.domain.AcquisitionFailure;
import com.phillippitts.audiofetch.domain.AcquisitionResult;
import com.phillippitts.audiofetch.domain.BatchItemResult;
import com.phillippitts.audiofetch.domain.BatchSummary;
import com.phillippitts.audiofetch.domain.SearchCandidate;
import com.phillippitts.audiofetch.domain.TrackDescriptor;
import com.phillippitts.audiofetch.exception.NoMatchFoundException;
import com.phillippitts.audiofetch.service.catalog.CatalogClient;
import com.phillippitts.audiofetch.service.search.SearchOrchestrator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Downloads a whole album or playlist.
 *
 * <p>Tracks are searched one after another; only the downloads run in parallel, through the
 * {@link BatchCoordinator}. Tracks without a match are reported as {@link AcquisitionFailure#NO_MATCH}
 * failures, so the report always holds one result per input track.
 */
public class CollectionDownloadService {

    private static final Logger LOG = LogManager.getLogger(CollectionDownloadService.class);

    /**
     * All per-track results of a collection download and their summary.
     */
    public record CollectionReport(List<BatchItemResult> results, BatchSummary summary) {
        public CollectionReport {
            results = List.copyOf(results);
            Objects.requireNonNull(summary, "summary");
        }
    }

    private final CatalogClient catalogClient;
    private final SearchOrchestrator searchOrchestrator;
    private final BatchCoordinator batchCoordinator;

    public CollectionDownloadService(CatalogClient catalogClient,
                                     SearchOrchestrator searchOrchestrator,
                                     BatchCoordinator batchCoordinator) {
        this.catalogClient = Objects.requireNonNull(catalogClient, "catalogClient");
        this.searchOrchestrator = Objects.requireNonNull(searchOrchestrator, "searchOrchestrator");
        this.batchCoordinator = Objects.requireNonNull(batchCoordinator, "batchCoordinator");
    }

    /**
     * Resolves an album or playlist through the catalog, then downloads every track.
     *
     * @throws com.phillippitts.audiofetch.exception.UpstreamUnavailableException if the catalog fails
     */
    public CollectionReport download(String collectionUrl) {
        catalogClient.authenticate();
        List<TrackDescriptor> tracks = catalogClient.resolveCollection(collectionUrl);
        LOG.info("Resolved {} tracks from {}", tracks.size(), collectionUrl);
        return download(tracks);
    }

    public CollectionReport download(List<TrackDescriptor> tracks) {
        Objects.requireNonNull(tracks, "tracks");
        List<BatchItemResult> results = new ArrayList<>(tracks.size());
        List<BatchCoordinator.BatchItem> found = new ArrayList<>();

        for (int i = 0; i < tracks.size(); i++) {
            TrackDescriptor track = tracks.get(i);
            LOG.info("Searching [{}/{}]: {}", i + 1, tracks.size(), track.filename());
            try {
                SearchCandidate candidate = searchOrchestrator.searchOrThrow(track);
                found.add(new BatchCoordinator.BatchItem(candidate, track));
            } catch (NoMatchFoundException e) {
                LOG.warn("No match for {}", track.filename());
                results.add(new BatchItemResult(track,
                        AcquisitionResult.failure(AcquisitionFailure.NO_MATCH, e.getMessage())));
            }
        }

        results.addAll(batchCoordinator.acquireAll(found));
        BatchSummary summary = BatchCoordinator.summarize(results);
        LOG.info("Collection finished: {} succeeded, {} failed, {} bytes", summary.succeeded(), summary.failed(),
                summary.totalBytes());
        return new CollectionReport(results, summary);
    }
}
