package com.phillippitts.audiofetch.service.acquisition;

import com.phillippitts.audiofetch.config.properties.AcquisitionProperties;
import com.phillippitts.audiofetch.exception.ValidationFailedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Checks a downloaded artifact against the minimum size and bitrate thresholds.
 *
 * <p>Bitrate is measured by the {@link AudioProbe}. When the probe cannot report a bitrate it is
 * estimated as {@code size * 8 / duration}; when duration is unknown as well the configured fallback
 * (192 kbps) is assumed, so missing instrumentation alone never fails validation.
 */
public class ArtifactValidator {

    private static final Logger LOG = LogManager.getLogger(ArtifactValidator.class);

    private final AudioProbe probe;
    private final AcquisitionProperties props;

    /**
     * Measured properties of an artifact and whether they meet the thresholds.
     *
     * @param valid         size and bitrate at or above the thresholds
     * @param fileSizeBytes measured size
     * @param bitrateKbps   measured or estimated bitrate; 0 when the size check already failed
     */
    public record Report(boolean valid, long fileSizeBytes, int bitrateKbps) {}

    public ArtifactValidator(AudioProbe probe, AcquisitionProperties props) {
        this.probe = Objects.requireNonNull(probe, "probe");
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * Measures {@code file}. The size check runs first and skips probing when it fails.
     *
     * @param file artifact to check
     * @return measured report; an unreadable file is reported as invalid with size 0
     */
    public Report inspect(Path file) {
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            LOG.debug("Cannot read size of {}: {}", file, e.toString());
            return new Report(false, 0, 0);
        }
        if (size < props.getMinFileSizeBytes()) {
            return new Report(false, size, 0);
        }
        int bitrate = measureBitrateKbps(file, size);
        return new Report(bitrate >= props.getMinBitrateKbps(), size, bitrate);
    }

    /**
     * Validates {@code file}.
     *
     * @return the passing report
     * @throws ValidationFailedException with the measured values when a threshold is not met
     */
    public Report validate(Path file) {
        Report report = inspect(file);
        if (!report.valid()) {
            throw new ValidationFailedException(report.fileSizeBytes(), report.bitrateKbps());
        }
        return report;
    }

    public boolean isValid(Path file) {
        return inspect(file).valid();
    }

    int measureBitrateKbps(Path file, long size) {
        OptionalInt measured = probe.probeBitrateKbps(file);
        if (measured.isPresent()) {
            return measured.getAsInt();
        }
        OptionalDouble duration = probe.probeDurationSec(file);
        if (duration.isPresent() && duration.getAsDouble() > 0) {
            return (int) ((size * 8) / (duration.getAsDouble() * 1000));
        }
        LOG.debug("Bitrate of {} unknown; assuming {} kbps", file, props.getFallbackBitrateKbps());
        return props.getFallbackBitrateKbps();
    }
}
