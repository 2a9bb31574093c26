package com.phillippitts.audiofetch.service.job;

import com.phillippitts.audiofetch.config.ThreadPoolConfig;
import com.phillippitts.audiofetch.config.properties.ThreadPoolProperties;
import com.phillippitts.audiofetch.domain.AcquisitionFailure;
import com.phillippitts.audiofetch.domain.AcquisitionResult;
import com.phillippitts.audiofetch.domain.JobStage;
import com.phillippitts.audiofetch.domain.JobStatus;
import com.phillippitts.audiofetch.domain.SearchCandidate;
import com.phillippitts.audiofetch.domain.TrackDescriptor;
import com.phillippitts.audiofetch.exception.NoMatchFoundException;
import com.phillippitts.audiofetch.exception.UpstreamFailure;
import com.phillippitts.audiofetch.exception.UpstreamUnavailableException;
import com.phillippitts.audiofetch.service.acquisition.AcquisitionPipeline;
import com.phillippitts.audiofetch.service.acquisition.ArtifactPostProcessor;
import com.phillippitts.audiofetch.service.catalog.CatalogClient;
import com.phillippitts.audiofetch.service.search.SearchOrchestrator;
import com.phillippitts.audiofetch.testutil.SyncExecutor;
import com.phillippitts.audiofetch.testutil.Tracks;
import org.apache.logging.log4j.ThreadContext;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DownloadJobServiceTest {

    private static final String URL = "https://open.spotify.com/track/0VjIjW4GlUZAMYd2vXMi3b";

    private final TrackDescriptor track = Tracks.blindingLights();
    private final SearchCandidate candidate = new SearchCandidate("https://yt/abc", "Blinding Lights", 200, 10, 0.9);
    private final Path artifact = Path.of("downloads/The Weeknd - Blinding Lights.mp3");

    private JobStatusTracker tracker;
    private CatalogClient catalog;
    private SearchOrchestrator orchestrator;
    private AcquisitionPipeline pipeline;
    private ArtifactPostProcessor postProcessor;
    private DownloadJobService service;

    @BeforeEach
    void setUp() {
        tracker = new JobStatusTracker();
        catalog = mock(CatalogClient.class);
        orchestrator = mock(SearchOrchestrator.class);
        pipeline = mock(AcquisitionPipeline.class);
        postProcessor = mock(ArtifactPostProcessor.class);
        service = new DownloadJobService(tracker, catalog, orchestrator, pipeline, postProcessor, new SyncExecutor());

        when(catalog.resolveTrack(URL)).thenReturn(track);
        when(orchestrator.searchOrThrow(track)).thenReturn(candidate);
        when(pipeline.acquire(candidate, track)).thenReturn(AcquisitionResult.success(artifact, 5_000_000, 320));
    }

    private JobStatus status(String jobId) {
        return service.getStatus(jobId).orElseThrow();
    }

    @Test
    void catalogUrlJobCompletesWithArtifact() {
        String jobId = service.submit(URL);

        JobStatus status = status(jobId);
        assertThat(status.stage()).isEqualTo(JobStage.COMPLETE);
        assertThat(status.progressPercent()).isEqualTo(100);
        assertThat(status.artifactPath()).isEqualTo(artifact);
        verify(catalog).authenticate();
        verify(postProcessor).process(artifact, track);
    }

    @Test
    void descriptorJobSkipsCatalog() {
        String jobId = service.submit(track);

        assertThat(status(jobId).stage()).isEqualTo(JobStage.COMPLETE);
        verify(catalog, never()).authenticate();
    }

    @Test
    void authenticationFailureEndsInError() {
        doThrow(new UpstreamUnavailableException(UpstreamFailure.AUTHENTICATION, "invalid client"))
                .when(catalog).authenticate();

        JobStatus status = status(service.submit(URL));

        assertThat(status.stage()).isEqualTo(JobStage.ERROR);
        assertThat(status.progressPercent()).isEqualTo(10);
        assertThat(status.error()).startsWith("Failed to authenticate with catalog").contains("invalid client");
        verify(orchestrator, never()).searchOrThrow(any());
    }

    @Test
    void unresolvableTrackEndsInError() {
        when(catalog.resolveTrack(URL)).thenThrow(new UpstreamUnavailableException(UpstreamFailure.NOT_FOUND, "404"));

        JobStatus status = status(service.submit(URL));

        assertThat(status.stage()).isEqualTo(JobStage.ERROR);
        assertThat(status.error()).startsWith("Could not fetch track information");
    }

    @Test
    void noMatchEndsInError() {
        when(orchestrator.searchOrThrow(track)).thenThrow(new NoMatchFoundException(track.name()));

        JobStatus status = status(service.submit(track));

        assertThat(status.stage()).isEqualTo(JobStage.ERROR);
        assertThat(status.progressPercent()).isEqualTo(40);
        assertThat(status.error()).isEqualTo("Could not find a matching audio source");
        verify(pipeline, never()).acquire(any(), any());
    }

    @Test
    void failedAcquisitionReportsItsError() {
        when(pipeline.acquire(candidate, track)).thenReturn(
                AcquisitionResult.failure(AcquisitionFailure.VALIDATION_FAILED,
                        "File validation failed (size: 1000, bitrate: 0)", 1000, 0));

        JobStatus status = status(service.submit(track));

        assertThat(status.stage()).isEqualTo(JobStage.ERROR);
        assertThat(status.progressPercent()).isEqualTo(60);
        assertThat(status.error()).isEqualTo("File validation failed (size: 1000, bitrate: 0)");
        verify(postProcessor, never()).process(any(), any());
    }

    @Test
    void postProcessingFailureEndsInError() {
        doThrow(new IllegalStateException("tag write failed")).when(postProcessor).process(artifact, track);

        JobStatus status = status(service.submit(track));

        assertThat(status.stage()).isEqualTo(JobStage.ERROR);
        assertThat(status.progressPercent()).isEqualTo(85);
        assertThat(status.error()).isEqualTo("tag write failed");
    }

    @Test
    void jobIdIsInThreadContextWhileRunning() {
        List<String> seen = new CopyOnWriteArrayList<>();
        doAnswer(inv -> {
            seen.add(ThreadContext.get("jobId"));
            return candidate;
        }).when(orchestrator).searchOrThrow(track);

        String jobId = service.submit(track);

        assertThat(seen).containsExactly(jobId);
        assertThat(ThreadContext.get("jobId")).isNull();
    }

    @Test
    void rejectedJobIsFailedImmediately() {
        service = new DownloadJobService(tracker, catalog, orchestrator, pipeline, postProcessor, command -> {
            throw new RejectedExecutionException("full");
        });

        JobStatus status = status(service.submit(track));

        assertThat(status.stage()).isEqualTo(JobStage.ERROR);
        assertThat(status.error()).isEqualTo("Job could not be scheduled");
    }

    @Test
    void jobSubmittedToShutDownPoolIsFailed() {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).jobExecutor();
        executor.shutdown();
        service = new DownloadJobService(tracker, catalog, orchestrator, pipeline, postProcessor, executor);

        JobStatus status = status(service.submit(track));

        assertThat(status.isTerminal()).isTrue();
        assertThat(status.stage()).isEqualTo(JobStage.ERROR);
        assertThat(status.error()).isEqualTo("Job could not be scheduled");
        verify(orchestrator, never()).searchOrThrow(any());
    }

    @Test
    void jobsRunAsynchronouslyOnExecutor() {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            service = new DownloadJobService(tracker, catalog, orchestrator, pipeline, postProcessor, executor);

            String jobId = service.submit(track);

            Awaitility.await().atMost(2, TimeUnit.SECONDS)
                    .until(() -> status(jobId).isTerminal());
            assertThat(status(jobId).stage()).isEqualTo(JobStage.COMPLETE);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void blankUrlIsRejected() {
        assertThatThrownBy(() -> service.submit(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownJobHasNoStatus() {
        assertThat(service.getStatus("nope")).isEmpty();
    }
}
