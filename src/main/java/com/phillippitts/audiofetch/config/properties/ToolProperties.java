package com.phillippitts.audiofetch.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Locations and limits of the external command-line tools.
 * Binds to properties prefixed with "audiofetch.tools".
 *
 * <p>Example application.properties:
 * <pre>
 * audiofetch.tools.yt-dlp-path=yt-dlp
 * audiofetch.tools.ffprobe-path=ffprobe
 * audiofetch.tools.ffmpeg-location=/opt/ffmpeg/bin
 * audiofetch.tools.probe-timeout-seconds=10
 * audiofetch.tools.max-stdout-bytes=4194304
 * </pre>
 *
 * @param ytDlpPath           yt-dlp executable (name on PATH or absolute path)
 * @param ffprobePath         ffprobe executable
 * @param ffmpegLocation      directory holding ffmpeg, passed to yt-dlp; blank to rely on PATH
 * @param probeTimeoutSeconds timeout for each ffprobe call
 * @param maxStdoutBytes      stdout accumulation cap per process run
 */
@ConfigurationProperties(prefix = "audiofetch.tools")
@Validated
public record ToolProperties(
        @NotBlank(message = "yt-dlp path must not be blank")
        String ytDlpPath,

        @NotBlank(message = "ffprobe path must not be blank")
        String ffprobePath,

        String ffmpegLocation,

        @Positive(message = "Probe timeout must be positive")
        int probeTimeoutSeconds,

        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes
) {

    @ConstructorBinding
    public ToolProperties(@DefaultValue("yt-dlp") String ytDlpPath,
                          @DefaultValue("ffprobe") String ffprobePath,
                          @DefaultValue("") String ffmpegLocation,
                          @DefaultValue("10") int probeTimeoutSeconds,
                          @DefaultValue("4194304") int maxStdoutBytes) {
        this.ytDlpPath = ytDlpPath;
        this.ffprobePath = ffprobePath;
        this.ffmpegLocation = ffmpegLocation;
        this.probeTimeoutSeconds = probeTimeoutSeconds;
        this.maxStdoutBytes = maxStdoutBytes;
    }

    /**
     * Defaults: tools resolved from PATH, 10s probe timeout, 4 MiB stdout cap.
     */
    public ToolProperties() {
        this("yt-dlp", "ffprobe", "", 10, 4 * 1024 * 1024);
    }

    public boolean hasFfmpegLocation() {
        return ffmpegLocation != null && !ffmpegLocation.isBlank();
    }
}
