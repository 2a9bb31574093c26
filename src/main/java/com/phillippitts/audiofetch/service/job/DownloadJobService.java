package com.phillippitts.audiofetch.service.job;

import com.phillippitts.audiofetch.domain.AcquisitionResult;
import com.phillippitts.audiofetch.domain.JobStage;
import com.phillippitts.audiofetch.domain.JobStatus;
import com.phillippitts.audiofetch.domain.SearchCandidate;
import com.phillippitts.audiofetch.domain.TrackDescriptor;
import com.phillippitts.audiofetch.exception.NoMatchFoundException;
import com.phillippitts.audiofetch.exception.UpstreamUnavailableException;
import com.phillippitts.audiofetch.service.acquisition.AcquisitionPipeline;
import com.phillippitts.audiofetch.service.acquisition.ArtifactPostProcessor;
import com.phillippitts.audiofetch.service.catalog.CatalogClient;
import com.phillippitts.audiofetch.service.search.SearchOrchestrator;
import com.phillippitts.audiofetch.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs single-track download jobs in the background and exposes their progress.
 *
 * <p><b>Job flow:</b>
 * <ol>
 *   <li>AUTHENTICATING / FETCHING: resolve the catalog URL (skipped for a ready descriptor)</li>
 *   <li>SEARCHING: choose a candidate</li>
 *   <li>DOWNLOADING: acquire and validate the artifact</li>
 *   <li>PROCESSING: post-process the artifact</li>
 *   <li>COMPLETE with the artifact path, or ERROR with a readable message</li>
 * </ol>
 *
 * <p>Every job reaches a terminal stage. While a job runs its id is in the Log4j2
 * {@link ThreadContext} under {@value #MDC_JOB_ID}.
 */
public class DownloadJobService {

    private static final Logger LOG = LogManager.getLogger(DownloadJobService.class);

    static final String MDC_JOB_ID = "jobId";
    static final String AUTH_FAILED = "Failed to authenticate with catalog";
    static final String TRACK_UNAVAILABLE = "Could not fetch track information";
    static final String NO_MATCH = "Could not find a matching audio source";
    static final String DOWNLOAD_FAILED = "Download failed";
    static final String JOB_REJECTED = "Job could not be scheduled";

    private final JobStatusTracker tracker;
    private final CatalogClient catalogClient;
    private final SearchOrchestrator searchOrchestrator;
    private final AcquisitionPipeline pipeline;
    private final ArtifactPostProcessor postProcessor;
    private final Executor executor;

    public DownloadJobService(JobStatusTracker tracker,
                              CatalogClient catalogClient,
                              SearchOrchestrator searchOrchestrator,
                              AcquisitionPipeline pipeline,
                              ArtifactPostProcessor postProcessor,
                              Executor executor) {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.catalogClient = Objects.requireNonNull(catalogClient, "catalogClient");
        this.searchOrchestrator = Objects.requireNonNull(searchOrchestrator, "searchOrchestrator");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.postProcessor = Objects.requireNonNull(postProcessor, "postProcessor");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Starts a job that resolves {@code catalogUrl} through the catalog first.
     *
     * @return job id to poll with {@link #getStatus}
     * @throws IllegalArgumentException if the URL is blank
     */
    public String submit(String catalogUrl) {
        if (catalogUrl == null || catalogUrl.isBlank()) {
            throw new IllegalArgumentException("catalogUrl must not be blank");
        }
        return start(jobId -> {
            TrackDescriptor track = resolve(jobId, catalogUrl);
            if (track != null) {
                acquire(jobId, track);
            }
        });
    }

    /**
     * Starts a job for an already resolved track; the job begins at SEARCHING.
     */
    public String submit(TrackDescriptor track) {
        Objects.requireNonNull(track, "track");
        return start(jobId -> acquire(jobId, track));
    }

    public Optional<JobStatus> getStatus(String jobId) {
        return tracker.get(jobId);
    }

    private String start(JobBody body) {
        String jobId = tracker.create().jobId();
        try {
            executor.execute(() -> run(jobId, body));
        } catch (RejectedExecutionException e) {
            LOG.warn("Job {} rejected: {}", jobId, e.getMessage());
            tracker.fail(jobId, JOB_REJECTED);
        }
        return jobId;
    }

    private void run(String jobId, JobBody body) {
        ThreadContext.put(MDC_JOB_ID, jobId);
        try {
            body.execute(jobId);
        } catch (RuntimeException e) {
            LOG.error("Job failed", e);
            failQuietly(jobId, describe(e));
        } finally {
            JobStatus last = tracker.get(jobId).orElse(null);
            if (last != null && !last.isTerminal()) {
                LOG.warn("Job ended in {} without finishing, marking it failed", last.stage());
                failQuietly(jobId, "Job ended unexpectedly");
            }
            ThreadContext.remove(MDC_JOB_ID);
        }
    }

    private TrackDescriptor resolve(String jobId, String catalogUrl) {
        tracker.advance(jobId, JobStage.AUTHENTICATING);
        try {
            catalogClient.authenticate();
        } catch (UpstreamUnavailableException e) {
            LOG.warn("Catalog authentication failed: {}", e.getMessage());
            tracker.fail(jobId, AUTH_FAILED + ": " + describe(e));
            return null;
        }

        tracker.advance(jobId, JobStage.FETCHING);
        try {
            TrackDescriptor track = catalogClient.resolveTrack(catalogUrl);
            if (track == null) {
                tracker.fail(jobId, TRACK_UNAVAILABLE);
            }
            return track;
        } catch (UpstreamUnavailableException e) {
            LOG.warn("Could not resolve {}: {}", catalogUrl, e.getMessage());
            tracker.fail(jobId, TRACK_UNAVAILABLE + ": " + describe(e));
            return null;
        }
    }

    private void acquire(String jobId, TrackDescriptor track) {
        tracker.advance(jobId, JobStage.SEARCHING);
        SearchCandidate candidate;
        try {
            candidate = searchOrchestrator.searchOrThrow(track);
        } catch (NoMatchFoundException e) {
            LOG.warn("{}", e.getMessage());
            tracker.fail(jobId, NO_MATCH);
            return;
        }

        tracker.advance(jobId, JobStage.DOWNLOADING);
        AcquisitionResult result = pipeline.acquire(candidate, track);
        if (!result.success()) {
            tracker.fail(jobId, result.error() != null ? result.error() : DOWNLOAD_FAILED);
            return;
        }

        tracker.advance(jobId, JobStage.PROCESSING);
        postProcessor.process(result.artifactPath(), track);

        tracker.complete(jobId, result.artifactPath());
        LOG.info("Job complete: {}", result.artifactPath().getFileName());
    }

    private void failQuietly(String jobId, String error) {
        try {
            tracker.fail(jobId, error);
        } catch (IllegalStateException e) {
            LOG.debug("Job already finished: {}", e.getMessage());
        }
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        if (message == null || message.isBlank()) {
            return t.getClass().getSimpleName();
        }
        return LogSanitizer.singleLine(message, 500);
    }

    @FunctionalInterface
    private interface JobBody {
        void execute(String jobId);
    }
}
