package com.phillippitts.audiofetch.service.job;

import com.phillippitts.audiofetch.domain.JobStage;
import com.phillippitts.audiofetch.domain.JobStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Thread-safe store of download job progress.
 *
 * <p><b>Stage transitions:</b>
 * <pre>
 * STARTING → AUTHENTICATING → FETCHING → SEARCHING → DOWNLOADING → PROCESSING → COMPLETE
 *     any non-terminal stage → ERROR
 * </pre>
 * Stages may be skipped but never revisited. Terminal jobs cannot be updated.
 *
 * <p><b>Thread Safety:</b> writes to one job are serialized by that job's {@link ReentrantLock};
 * readers never lock and always see a complete immutable {@link JobStatus} snapshot. Jobs are
 * never removed.
 */
@Component
public class JobStatusTracker {

    private static final Logger LOG = LogManager.getLogger(JobStatusTracker.class);

    private final Map<String, JobStatus> statuses = new ConcurrentHashMap<>();
    private final Map<String, Lock> locks = new ConcurrentHashMap<>();
    private final Clock clock;

    public JobStatusTracker() {
        this(Clock.systemUTC());
    }

    JobStatusTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Registers a new job in {@link JobStage#STARTING}.
     *
     * @return initial snapshot carrying the generated job id
     */
    public JobStatus create() {
        String jobId = UUID.randomUUID().toString();
        JobStatus status = new JobStatus(jobId, JobStage.STARTING, JobStage.STARTING.progressPercent(),
                JobStage.STARTING.defaultMessage(), null, null, Instant.now(clock));
        locks.put(jobId, new ReentrantLock());
        statuses.put(jobId, status);
        LOG.debug("Created job {}", jobId);
        return status;
    }

    public JobStatus advance(String jobId, JobStage stage) {
        return advance(jobId, stage, stage.defaultMessage());
    }

    /**
     * Moves a job forward to a non-terminal stage.
     *
     * @throws IllegalArgumentException if {@code stage} is terminal (use {@link #complete} or {@link #fail})
     * @throws IllegalStateException    if the move would go backwards or the job has finished
     * @throws NoSuchElementException   if the job is unknown
     */
    public JobStatus advance(String jobId, JobStage stage, String message) {
        if (stage.isTerminal()) {
            throw new IllegalArgumentException("Use complete() or fail() to finish a job, got: " + stage);
        }
        return transition(jobId, stage, current -> new JobStatus(jobId, stage, stage.progressPercent(),
                message, null, null, Instant.now(clock)));
    }

    /**
     * @throws NullPointerException if {@code artifactPath} is null
     */
    public JobStatus complete(String jobId, Path artifactPath) {
        if (artifactPath == null) {
            throw new NullPointerException("artifactPath cannot be null");
        }
        return transition(jobId, JobStage.COMPLETE, current -> new JobStatus(jobId, JobStage.COMPLETE,
                JobStage.COMPLETE.progressPercent(), JobStage.COMPLETE.defaultMessage(), artifactPath, null,
                Instant.now(clock)));
    }

    /**
     * Ends a job in {@link JobStage#ERROR}, keeping the progress it had reached.
     *
     * @throws IllegalArgumentException if {@code error} is blank
     */
    public JobStatus fail(String jobId, String error) {
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("error must not be blank");
        }
        return transition(jobId, JobStage.ERROR, current -> new JobStatus(jobId, JobStage.ERROR,
                current.progressPercent(), JobStage.ERROR.defaultMessage(), null, error, Instant.now(clock)));
    }

    public Optional<JobStatus> get(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(statuses.get(jobId));
    }

    /**
     * @return copy of all job snapshots at the time of the call
     */
    public Collection<JobStatus> snapshot() {
        return List.copyOf(statuses.values());
    }

    private JobStatus transition(String jobId, JobStage next, UnaryOperator<JobStatus> update) {
        Lock lock = locks.get(jobId);
        if (lock == null) {
            throw new NoSuchElementException("Unknown job: " + jobId);
        }
        lock.lock();
        try {
            JobStatus current = statuses.get(jobId);
            if (!current.stage().canTransitionTo(next)) {
                throw new IllegalStateException("Job " + jobId + " cannot move from " + current.stage() + " to " + next);
            }
            JobStatus updated = update.apply(current);
            statuses.put(jobId, updated);
            LOG.debug("Job {}: {} -> {} ({}%)", jobId, current.stage(), next, updated.progressPercent());
            return updated;
        } finally {
            lock.unlock();
        }
    }
}
