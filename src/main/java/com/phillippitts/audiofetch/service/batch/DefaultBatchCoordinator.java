package com.phillippitts.audiofetch.service.batch;

import com.phillippitts.audiofetch.domain.AcquisitionFailure;
import com.phillippitts.audiofetch.domain.AcquisitionResult;
import com.phillippitts.audiofetch.domain.BatchItemResult;
import com.phillippitts.audiofetch.service.acquisition.AcquisitionPipeline;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Fans a batch out over a shared executor, one {@link CompletableFuture} per item, with a
 * per-call {@link Semaphore} limiting how many acquisitions run at once.
 *
 * <p>Results are queued as items finish, so the returned list is in completion order. An
 * acquisition that throws is recorded as an {@link AcquisitionFailure#UNEXPECTED} failure for its
 * item, and so is an item the executor refuses to schedule; the returned list always has one entry
 * per submitted item.
 */
public class DefaultBatchCoordinator implements BatchCoordinator {

    private static final Logger LOG = LogManager.getLogger(DefaultBatchCoordinator.class);

    private final AcquisitionPipeline pipeline;
    private final Executor executor;
    private final int defaultConcurrency;

    public DefaultBatchCoordinator(AcquisitionPipeline pipeline, Executor executor, int defaultConcurrency) {
        if (defaultConcurrency < 1) {
            throw new IllegalArgumentException("defaultConcurrency must be >= 1, got: " + defaultConcurrency);
        }
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.defaultConcurrency = defaultConcurrency;
    }

    @Override
    public List<BatchItemResult> acquireAll(List<BatchItem> items) {
        return acquireAll(items, defaultConcurrency);
    }

    @Override
    public List<BatchItemResult> acquireAll(List<BatchItem> items, int concurrency) {
        Objects.requireNonNull(items, "items");
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1, got: " + concurrency);
        }
        if (items.isEmpty()) {
            return List.of();
        }

        LOG.info("Downloading {} tracks with {} workers", items.size(), concurrency);
        Semaphore permits = new Semaphore(concurrency);
        BlockingQueue<BatchItemResult> completed = new LinkedBlockingQueue<>();

        List<CompletableFuture<Void>> futures = new ArrayList<>(items.size());
        for (BatchItem item : items) {
            try {
                CompletableFuture<Void> future = CompletableFuture
                        .supplyAsync(() -> acquireWithPermit(item, permits), executor)
                        .exceptionally(t -> unexpected(item, t))
                        .thenAccept(completed::add);
                futures.add(future);
            } catch (RejectedExecutionException e) {
                LOG.warn("Could not schedule {}: {}", item.descriptor().filename(), e.getMessage());
                completed.add(new BatchItemResult(item.descriptor(),
                        AcquisitionResult.failure(AcquisitionFailure.UNEXPECTED, "Download could not be scheduled")));
            }
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<BatchItemResult> results = new ArrayList<>(items.size());
        completed.drainTo(results);
        int succeeded = (int) results.stream().filter(BatchItemResult::succeeded).count();
        LOG.info("Batch finished: {}/{} succeeded", succeeded, results.size());
        return results;
    }

    private BatchItemResult acquireWithPermit(BatchItem item, Semaphore permits) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new BatchItemResult(item.descriptor(),
                    AcquisitionResult.failure(AcquisitionFailure.UNEXPECTED, "Interrupted before download started"));
        }
        try {
            AcquisitionResult result = pipeline.acquire(item.candidate(), item.descriptor());
            if (result == null) {
                result = AcquisitionResult.failure(AcquisitionFailure.UNEXPECTED, "Pipeline returned no result");
            }
            return new BatchItemResult(item.descriptor(), result);
        } finally {
            permits.release();
        }
    }

    private static BatchItemResult unexpected(BatchItem item, Throwable t) {
        Throwable cause = t.getCause() != null ? t.getCause() : t;
        LOG.error("Acquisition of {} failed unexpectedly", item.descriptor().filename(), cause);
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new BatchItemResult(item.descriptor(), AcquisitionResult.failure(AcquisitionFailure.UNEXPECTED, message));
    }
}
