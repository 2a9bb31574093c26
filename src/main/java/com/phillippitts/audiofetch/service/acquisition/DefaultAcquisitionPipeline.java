package com.phillippitts.audiofetch.service.acquisition;

import com.phillippitts.audiofetch.config.properties.AcquisitionProperties;
import com.phillippitts.audiofetch.domain.AcquisitionFailure;
import com.phillippitts.audiofetch.domain.AcquisitionResult;
import com.phillippitts.audiofetch.domain.SearchCandidate;
import com.phillippitts.audiofetch.domain.TrackDescriptor;
import com.phillippitts.audiofetch.exception.ArtifactMissingException;
import com.phillippitts.audiofetch.exception.FetchExceptionBuilder;
import com.phillippitts.audiofetch.exception.FetchFailedException;
import com.phillippitts.audiofetch.exception.ValidationFailedException;
import com.phillippitts.audiofetch.service.metrics.AcquisitionMetrics;
import com.phillippitts.audiofetch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Default acquisition flow.
 *
 * <ol>
 *   <li>Reuse: a valid artifact at {@code {outputDir}/{filename}.{format}} is returned as is; an
 *       invalid one is deleted.</li>
 *   <li>Fetch through the {@link FetchProvider} with the configured timeout. Nonzero exit and
 *       timeout are reported as distinct failures.</li>
 *   <li>Locate: when the tool wrote under another name, the first file sharing the filename prefix
 *       and carrying the audio extension is renamed to the canonical path.</li>
 *   <li>Validate size and bitrate through {@link ArtifactValidator}; a failing artifact is deleted.</li>
 * </ol>
 *
 * <p>Every failure path removes what the fetch left behind for this track, so a file found at the
 * canonical path has always passed validation at some point.
 *
 * <p>Acquisitions that resolve to the same canonical path (the same track listed twice, or names
 * that sanitize alike) run one at a time; the later one reuses the artifact the earlier one
 * produced.
 */
public class DefaultAcquisitionPipeline implements AcquisitionPipeline {

    private static final Logger LOG = LogManager.getLogger(DefaultAcquisitionPipeline.class);

    private final FetchProvider fetchProvider;
    private final ArtifactValidator validator;
    private final AcquisitionProperties props;
    private final AcquisitionMetrics metrics;
    private final ConcurrentMap<Path, ReentrantLock> pathLocks = new ConcurrentHashMap<>();

    public DefaultAcquisitionPipeline(FetchProvider fetchProvider,
                                      ArtifactValidator validator,
                                      AcquisitionProperties props,
                                      AcquisitionMetrics metrics) {
        this.fetchProvider = Objects.requireNonNull(fetchProvider, "fetchProvider");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public Path canonicalPath(TrackDescriptor track) {
        return props.outputPath().resolve(track.filename() + "." + props.getAudioFormat());
    }

    @Override
    public AcquisitionResult acquire(SearchCandidate candidate, TrackDescriptor track) {
        Objects.requireNonNull(candidate, "candidate");
        Objects.requireNonNull(track, "track");

        Path finalPath = canonicalPath(track);
        ReentrantLock lock = pathLocks.computeIfAbsent(finalPath.toAbsolutePath().normalize(),
                key -> new ReentrantLock());
        lock.lock();
        try {
            return acquireLocked(candidate, track, finalPath);
        } finally {
            lock.unlock();
        }
    }

    private AcquisitionResult acquireLocked(SearchCandidate candidate, TrackDescriptor track, Path finalPath) {
        long start = System.nanoTime();
        AcquisitionResult result = null;
        try {
            Files.createDirectories(props.outputPath());

            Optional<AcquisitionResult> existing = reuseExisting(finalPath, track);
            if (existing.isPresent()) {
                result = existing.get();
                metrics.incrementSuccess(true);
                return result;
            }

            fetch(candidate, track);
            locateArtifact(track, finalPath);
            ArtifactValidator.Report report = validator.validate(finalPath);

            LOG.info("Downloaded: {} ({} bytes, {} kbps)", track.filename(), report.fileSizeBytes(),
                    report.bitrateKbps());
            result = AcquisitionResult.success(finalPath, report.fileSizeBytes(), report.bitrateKbps());
            metrics.incrementSuccess(false);
            return result;
        } catch (FetchFailedException e) {
            result = failure(e.isTimedOut() ? AcquisitionFailure.FETCH_TIMEOUT : AcquisitionFailure.FETCH_FAILED,
                    e.getMessage(), 0, 0);
            return result;
        } catch (ArtifactMissingException e) {
            result = failure(AcquisitionFailure.ARTIFACT_MISSING, e.getMessage(), 0, 0);
            return result;
        } catch (ValidationFailedException e) {
            result = failure(AcquisitionFailure.VALIDATION_FAILED, e.getMessage(),
                    e.getFileSizeBytes(), e.getBitrateKbps());
            return result;
        } catch (IOException | RuntimeException e) {
            LOG.error("Unexpected error acquiring {}", track.filename(), e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            result = failure(AcquisitionFailure.UNEXPECTED, message, 0, 0);
            return result;
        } finally {
            if (result == null || !result.success()) {
                removeLeftovers(track, finalPath);
            }
            metrics.recordAcquisitionLatency(TimeUtils.elapsedNanos(start));
        }
    }

    private Optional<AcquisitionResult> reuseExisting(Path finalPath, TrackDescriptor track) throws IOException {
        if (!Files.exists(finalPath)) {
            return Optional.empty();
        }
        ArtifactValidator.Report report = validator.inspect(finalPath);
        if (report.valid()) {
            LOG.info("Already exists: {}", track.filename());
            return Optional.of(AcquisitionResult.success(finalPath, report.fileSizeBytes(), report.bitrateKbps()));
        }
        LOG.info("Replacing invalid existing artifact {} (size: {}, bitrate: {})", finalPath,
                report.fileSizeBytes(), report.bitrateKbps());
        Files.deleteIfExists(finalPath);
        return Optional.empty();
    }

    private void fetch(SearchCandidate candidate, TrackDescriptor track) {
        Path template = props.outputPath().resolve(track.filename() + ".%(ext)s");
        Duration timeout = Duration.ofSeconds(props.getFetchTimeoutSeconds());
        long start = System.nanoTime();

        FetchOutcome outcome = fetchProvider.fetch(candidate.sourceUrl(), template, timeout);
        long durationMs = TimeUtils.elapsedMillis(start);
        switch (outcome.status()) {
            case SUCCESS -> {
                // fall through to locating the artifact
            }
            case TIMED_OUT -> throw FetchExceptionBuilder
                    .create("Download timed out after " + TimeUtils.seconds(timeout))
                    .tool("fetch")
                    .timedOut()
                    .durationMs(durationMs)
                    .metadata("url", candidate.sourceUrl())
                    .build();
            case FAILED -> throw FetchExceptionBuilder.create("Download failed")
                    .tool("fetch")
                    .exitCode(outcome.exitCode())
                    .durationMs(durationMs)
                    .metadata("url", candidate.sourceUrl())
                    .metadata("stderr", outcome.diagnostics().isEmpty() ? null : outcome.diagnostics())
                    .build();
        }
    }

    private void locateArtifact(TrackDescriptor track, Path finalPath) throws IOException {
        if (Files.exists(finalPath)) {
            return;
        }
        String prefix = prefixOf(track.filename());
        String extension = "." + props.getAudioFormat();
        List<Path> matches = filesWithPrefix(prefix);
        if (!matches.isEmpty()) {
            Path candidate = matches.get(0);
            if (candidate.getFileName().toString().endsWith(extension)) {
                LOG.info("Renaming {} to {}", candidate.getFileName(), finalPath.getFileName());
                Files.move(candidate, finalPath, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        if (!Files.exists(finalPath)) {
            throw new ArtifactMissingException(finalPath);
        }
    }

    /**
     * Deletes the canonical artifact and any partial download ({@code .part}, {@code .ytdl},
     * intermediate container) written for this track.
     */
    private void removeLeftovers(TrackDescriptor track, Path finalPath) {
        try {
            Files.deleteIfExists(finalPath);
            String stem = track.filename() + ".";
            for (Path leftover : filesWithPrefix(stem)) {
                Files.deleteIfExists(leftover);
                LOG.debug("Removed partial artifact {}", leftover.getFileName());
            }
        } catch (IOException e) {
            LOG.warn("Could not remove partial artifacts for {}: {}", track.filename(), e.toString());
        }
    }

    private List<Path> filesWithPrefix(String prefix) throws IOException {
        if (!Files.isDirectory(props.outputPath())) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(props.outputPath())) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().startsWith(prefix))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private String prefixOf(String filename) {
        return filename.substring(0, Math.min(props.getPrefixMatchLength(), filename.length()));
    }

    private AcquisitionResult failure(AcquisitionFailure reason, String message, long size, int bitrate) {
        LOG.warn("Failed: {} ({})", reason, message);
        metrics.incrementFailure(reason);
        return AcquisitionResult.failure(reason, message, size, bitrate);
    }

    @Override
    public int cleanupInvalidArtifacts() {
        int removed = 0;
        List<Path> files;
        try {
            files = filesWithPrefix("");
        } catch (IOException e) {
            LOG.warn("Cannot list {}: {}", props.outputPath(), e.toString());
            return 0;
        }
        for (Path file : files) {
            if (!validator.isValid(file)) {
                try {
                    Files.deleteIfExists(file);
                    removed++;
                } catch (IOException e) {
                    LOG.warn("Could not remove {}: {}", file, e.toString());
                }
            }
        }
        LOG.info("Removed {} invalid artifacts from {}", removed, props.outputPath());
        return removed;
    }
}
