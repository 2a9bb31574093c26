package com.phillippitts.audiofetch.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Output location and quality thresholds for downloaded artifacts.
 * Defaults: at least 500 KB and 128 kbps; 192 kbps assumed when the bitrate cannot be measured.
 */
@ConfigurationProperties(prefix = "audiofetch.acquisition")
@Validated
public class AcquisitionProperties {

    @NotBlank(message = "Output directory must not be blank")
    private String outputDir = "downloads";

    /** Extension of the canonical artifact and the format requested from the fetch tool. */
    @NotBlank(message = "Audio format must not be blank")
    private String audioFormat = "mp3";

    /** Quality passed to the fetch tool ("0" = best). */
    @NotBlank(message = "Audio quality must not be blank")
    private String audioQuality = "0";

    @Positive(message = "Fetch timeout must be positive")
    private int fetchTimeoutSeconds = 300;

    @Positive(message = "Minimum file size must be positive")
    private long minFileSizeBytes = 500_000;

    @Positive(message = "Minimum bitrate must be positive")
    private int minBitrateKbps = 128;

    /** Bitrate assumed when neither bitrate nor duration can be probed. */
    @Positive(message = "Fallback bitrate must be positive")
    private int fallbackBitrateKbps = 192;

    /** Concurrent acquisitions in batch mode. */
    @Positive(message = "Batch concurrency must be positive")
    private int batchConcurrency = 4;

    /** Filename prefix length used to find an artifact the fetch tool wrote under another name. */
    @Positive(message = "Prefix match length must be positive")
    private int prefixMatchLength = 20;

    public Path outputPath() {
        return Path.of(outputDir);
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getAudioFormat() {
        return audioFormat;
    }

    public void setAudioFormat(String audioFormat) {
        this.audioFormat = audioFormat;
    }

    public String getAudioQuality() {
        return audioQuality;
    }

    public void setAudioQuality(String audioQuality) {
        this.audioQuality = audioQuality;
    }

    public int getFetchTimeoutSeconds() {
        return fetchTimeoutSeconds;
    }

    public void setFetchTimeoutSeconds(int fetchTimeoutSeconds) {
        this.fetchTimeoutSeconds = fetchTimeoutSeconds;
    }

    public long getMinFileSizeBytes() {
        return minFileSizeBytes;
    }

    public void setMinFileSizeBytes(long minFileSizeBytes) {
        this.minFileSizeBytes = minFileSizeBytes;
    }

    public int getMinBitrateKbps() {
        return minBitrateKbps;
    }

    public void setMinBitrateKbps(int minBitrateKbps) {
        this.minBitrateKbps = minBitrateKbps;
    }

    public int getFallbackBitrateKbps() {
        return fallbackBitrateKbps;
    }

    public void setFallbackBitrateKbps(int fallbackBitrateKbps) {
        this.fallbackBitrateKbps = fallbackBitrateKbps;
    }

    public int getBatchConcurrency() {
        return batchConcurrency;
    }

    public void setBatchConcurrency(int batchConcurrency) {
        this.batchConcurrency = batchConcurrency;
    }

    public int getPrefixMatchLength() {
        return prefixMatchLength;
    }

    public void setPrefixMatchLength(int prefixMatchLength) {
        this.prefixMatchLength = prefixMatchLength;
    }
}
