package com.phillippitts.audiofetch.service.batch;

import com.phillippitts.audiofetch.domain.AcquisitionFailure;
import com.phillippitts.audiofetch.domain.AcquisitionResult;
import com.phillippitts.audiofetch.domain.BatchItemResult;
import com.phillippitts.audiofetch.domain.SearchCandidate;
import com.phillippitts.audiofetch.domain.TrackDescriptor;
import com.phillippitts.audiofetch.exception.NoMatchFoundException;
import com.phillippitts.audiofetch.service.catalog.CatalogClient;
import com.phillippitts.audiofetch.service.search.SearchOrchestrator;
import com.phillippitts.audiofetch.testutil.Tracks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CollectionDownloadServiceTest {

    private CatalogClient catalog;
    private SearchOrchestrator orchestrator;
    private BatchCoordinator coordinator;
    private CollectionDownloadService service;

    private final TrackDescriptor found = Tracks.named("Artist", "Found");
    private final TrackDescriptor missing = Tracks.named("Artist", "Missing");
    private final SearchCandidate candidate = new SearchCandidate("https://x", "Artist - Found", 180, 10, 0.8);

    @BeforeEach
    void setUp() {
        catalog = mock(CatalogClient.class);
        orchestrator = mock(SearchOrchestrator.class);
        coordinator = mock(BatchCoordinator.class);
        service = new CollectionDownloadService(catalog, orchestrator, coordinator);

        when(orchestrator.searchOrThrow(found)).thenReturn(candidate);
        when(orchestrator.searchOrThrow(missing)).thenThrow(new NoMatchFoundException(missing.name()));
        when(coordinator.acquireAll(anyList())).thenAnswer(inv -> {
            List<BatchCoordinator.BatchItem> items = inv.getArgument(0);
            return items.stream()
                    .map(i -> new BatchItemResult(i.descriptor(),
                            AcquisitionResult.success(Path.of("Artist - Found.mp3"), 2_000_000, 320)))
                    .toList();
        });
    }

    @Test
    void reportsEveryTrackIncludingThoseWithoutMatch() {
        CollectionDownloadService.CollectionReport report = service.download(List.of(found, missing));

        assertThat(report.results()).hasSize(2);
        assertThat(report.results()).filteredOn(r -> !r.succeeded()).singleElement().satisfies(r -> {
            assertThat(r.descriptor()).isEqualTo(missing);
            assertThat(r.result().failure()).isEqualTo(AcquisitionFailure.NO_MATCH);
            assertThat(r.result().error()).contains("Missing");
        });
        assertThat(report.summary().succeeded()).isEqualTo(1);
        assertThat(report.summary().failed()).isEqualTo(1);
        assertThat(report.summary().totalBytes()).isEqualTo(2_000_000);
    }

    @Test
    void resolvesCollectionThroughCatalog() {
        when(catalog.resolveCollection("https://open.spotify.com/album/x")).thenReturn(List.of(found));

        CollectionDownloadService.CollectionReport report = service.download("https://open.spotify.com/album/x");

        assertThat(report.summary().total()).isEqualTo(1);
        InOrder order = inOrder(catalog);
        order.verify(catalog).authenticate();
        order.verify(catalog).resolveCollection("https://open.spotify.com/album/x");
    }
}
