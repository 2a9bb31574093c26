package com.phillippitts.audiofetch.service.acquisition;

import com.phillippitts.audiofetch.config.properties.AcquisitionProperties;
import com.phillippitts.audiofetch.exception.ValidationFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalDouble;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ArtifactValidatorTest {

    @TempDir
    Path dir;

    private AudioProbe probe;
    private ArtifactValidator validator;

    @BeforeEach
    void setUp() {
        probe = mock(AudioProbe.class);
        validator = new ArtifactValidator(probe, new AcquisitionProperties());
    }

    private Path file(int size) throws IOException {
        return Files.write(dir.resolve("Artist - Song.mp3"), new byte[size]);
    }

    @Test
    void undersizedFileFailsWithoutProbing() throws IOException {
        Path artifact = file(1000);

        ArtifactValidator.Report report = validator.inspect(artifact);

        assertThat(report.valid()).isFalse();
        assertThat(report.fileSizeBytes()).isEqualTo(1000);
        assertThat(report.bitrateKbps()).isZero();
        verifyNoInteractions(probe);
    }

    @Test
    void lowBitrateFailsWithMeasuredValues() throws IOException {
        Path artifact = file(600_000);
        when(probe.probeBitrateKbps(any())).thenReturn(OptionalInt.of(96));

        assertThatThrownBy(() -> validator.validate(artifact))
                .isInstanceOf(ValidationFailedException.class)
                .hasMessage("File validation failed (size: 600000, bitrate: 96)");
    }

    @Test
    void bitrateIsEstimatedFromDurationWhenProbeHasNone() throws IOException {
        Path artifact = file(600_000);
        when(probe.probeBitrateKbps(any())).thenReturn(OptionalInt.empty());
        when(probe.probeDurationSec(any())).thenReturn(OptionalDouble.of(30.0));

        ArtifactValidator.Report report = validator.validate(artifact);

        assertThat(report.bitrateKbps()).isEqualTo(160);
        assertThat(report.valid()).isTrue();
    }

    @Test
    void fallbackBitrateIsAssumedWhenNothingIsKnown() throws IOException {
        Path artifact = file(600_000);
        when(probe.probeBitrateKbps(any())).thenReturn(OptionalInt.empty());
        when(probe.probeDurationSec(any())).thenReturn(OptionalDouble.empty());

        assertThat(validator.inspect(artifact).bitrateKbps()).isEqualTo(192);
        assertThat(validator.isValid(artifact)).isTrue();
    }

    @Test
    void missingFileIsInvalid() {
        assertThat(validator.isValid(dir.resolve("nope.mp3"))).isFalse();
    }
}
