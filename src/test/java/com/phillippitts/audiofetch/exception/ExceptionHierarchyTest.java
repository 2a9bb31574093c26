package com.phillippitts.audiofetch.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExceptionHierarchyTest {

    @Test
    void audioFetchExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        AudioFetchException ex = new AudioFetchException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void noMatchFoundExceptionShouldNameTrack() {
        NoMatchFoundException ex = new NoMatchFoundException("Blinding Lights");

        assertThat(ex).isInstanceOf(AudioFetchException.class);
        assertThat(ex.getMessage()).isEqualTo("Could not find a matching audio source for: Blinding Lights");
        assertThat(ex.getTrackName()).isEqualTo("Blinding Lights");
    }

    @Test
    void fetchFailedExceptionShouldIncludeTool() {
        FetchFailedException ex = new FetchFailedException("Download failed", "yt-dlp", 1, false);

        assertThat(ex.getMessage()).isEqualTo("Download failed (tool: yt-dlp)");
        assertThat(ex.getExitCode()).isEqualTo(1);
        assertThat(ex.isTimedOut()).isFalse();
    }

    @Test
    void fetchFailedExceptionDefaultsToUnknownTool() {
        FetchFailedException ex = new FetchFailedException("boom");

        assertThat(ex.getTool()).isEqualTo("unknown");
        assertThat(ex.getExitCode()).isEqualTo(-1);
    }

    @Test
    void validationFailedExceptionShouldCarryMeasurements() {
        ValidationFailedException ex = new ValidationFailedException(420_000, 96);

        assertThat(ex.getMessage()).isEqualTo("File validation failed (size: 420000, bitrate: 96)");
        assertThat(ex.getFileSizeBytes()).isEqualTo(420_000);
        assertThat(ex.getBitrateKbps()).isEqualTo(96);
    }

    @Test
    void artifactMissingExceptionShouldIncludePath() {
        Path expected = Path.of("downloads/Artist - Song.mp3");
        ArtifactMissingException ex = new ArtifactMissingException(expected);

        assertThat(ex.getMessage()).contains("Output file not found after download").contains("Artist - Song.mp3");
        assertThat(ex.getExpectedPath()).isEqualTo(expected);
    }

    @Test
    void upstreamUnavailableExceptionShouldCarryKindAndRetryHint() {
        UpstreamUnavailableException limited = UpstreamUnavailableException.rateLimited("429", Duration.ofSeconds(3));
        UpstreamUnavailableException missing = new UpstreamUnavailableException(UpstreamFailure.NOT_FOUND, "404");

        assertThat(limited.getKind()).isEqualTo(UpstreamFailure.RATE_LIMITED);
        assertThat(limited.getRetryAfter()).contains(Duration.ofSeconds(3));
        assertThat(missing.getRetryAfter()).isEmpty();
        assertThat(UpstreamFailure.RATE_LIMITED.isRetryable()).isTrue();
        assertThat(UpstreamFailure.TRANSIENT.isRetryable()).isTrue();
        assertThat(UpstreamFailure.NOT_FOUND.isRetryable()).isFalse();
    }

    @Test
    void builderShouldAssembleDetailedMessage() {
        IOException cause = new IOException("broken pipe");
        FetchFailedException ex = FetchExceptionBuilder.create("Download failed")
                .tool("yt-dlp")
                .exitCode(2)
                .durationMs(1500)
                .metadata("stderr", "ERROR: 403")
                .metadata("ignored", null)
                .cause(cause)
                .build();

        assertThat(ex.getMessage())
                .isEqualTo("Download failed (exitCode=2, durationMs=1500, stderr=ERROR: 403) (tool: yt-dlp)");
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getExitCode()).isEqualTo(2);
    }

    @Test
    void builderShouldMarkTimeouts() {
        FetchFailedException ex = FetchExceptionBuilder.create("Download timed out").timedOut().build();

        assertThat(ex.isTimedOut()).isTrue();
        assertThat(ex.getTool()).isEqualTo("unknown");
        assertThat(ex.getMessage()).isEqualTo("Download timed out (tool: unknown)");
    }

    @Test
    void builderShouldRejectEmptyMessage() {
        assertThatThrownBy(() -> FetchExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
