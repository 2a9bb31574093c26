package com.phillippitts.audiofetch.domain;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a job's progress.
 *
 * <p>A {@link JobStage#COMPLETE} snapshot always carries the artifact path; an {@link JobStage#ERROR}
 * snapshot always carries a non-blank error.
 *
 * @param jobId           job identifier
 * @param stage           current stage
 * @param progressPercent progress in percent (0-100)
 * @param message         short description of the current action
 * @param artifactPath    artifact location (complete jobs only)
 * @param error           failure description (failed jobs only)
 * @param updatedAt       time of the last transition
 */
public record JobStatus(
        String jobId,
        JobStage stage,
        int progressPercent,
        String message,
        Path artifactPath,
        String error,
        Instant updatedAt
) {

    public JobStatus {
        Objects.requireNonNull(jobId, "Job id must not be null");
        Objects.requireNonNull(stage, "Stage must not be null");
        Objects.requireNonNull(message, "Message must not be null");
        Objects.requireNonNull(updatedAt, "Timestamp must not be null");
        if (progressPercent < 0 || progressPercent > 100) {
            throw new IllegalArgumentException("Progress must be between 0 and 100, got: " + progressPercent);
        }
        if (stage == JobStage.COMPLETE && artifactPath == null) {
            throw new IllegalArgumentException("Complete job requires an artifact path");
        }
        if (stage == JobStage.ERROR && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("Failed job requires an error description");
        }
    }

    public static JobStatus starting(String jobId) {
        return new JobStatus(jobId, JobStage.STARTING, JobStage.STARTING.progressPercent(),
                JobStage.STARTING.defaultMessage(), null, null, Instant.now());
    }

    public boolean isTerminal() {
        return stage.isTerminal();
    }
}
