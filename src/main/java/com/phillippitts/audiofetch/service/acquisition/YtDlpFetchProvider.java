package com.phillippitts.audiofetch.service.acquisition;

import com.phillippitts.audiofetch.config.properties.AcquisitionProperties;
import com.phillippitts.audiofetch.config.properties.ToolProperties;
import com.phillippitts.audiofetch.service.process.ProcessResult;
import com.phillippitts.audiofetch.service.process.ProcessRunner;
import com.phillippitts.audiofetch.util.LogSanitizer;
import com.phillippitts.audiofetch.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link FetchProvider} backed by yt-dlp, extracting audio through ffmpeg.
 *
 * <p>CLI contract:
 * <pre>
 * ${yt-dlp} ${url} -x -f bestaudio/best --audio-format ${format} --audio-quality ${quality}
 *     [--ffmpeg-location ${dir}] --postprocessor-args "ffmpeg:-b:a 192k" -o ${template}
 *     --no-playlist --no-warnings --quiet --concurrent-fragments 8
 * </pre>
 */
public class YtDlpFetchProvider implements FetchProvider {

    private static final Logger LOG = LogManager.getLogger(YtDlpFetchProvider.class);
    private static final String TOOL = "yt-dlp";

    private final ProcessRunner runner;
    private final ToolProperties tools;
    private final AcquisitionProperties acquisition;

    public YtDlpFetchProvider(ProcessRunner runner, ToolProperties tools, AcquisitionProperties acquisition) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.tools = Objects.requireNonNull(tools, "tools");
        this.acquisition = Objects.requireNonNull(acquisition, "acquisition");
    }

    @Override
    public FetchOutcome fetch(String sourceUrl, Path outputTemplate, Duration timeout) {
        List<String> command = buildCommand(sourceUrl, outputTemplate);
        ProcessResult result = runner.run(TOOL, command, outputTemplate.toAbsolutePath().getParent(), timeout);

        String diagnostics = LogSanitizer.singleLine(result.stderr(), ProcessTimeouts.ERROR_SNIPPET_MAX_CHARS);
        if (result.timedOut()) {
            return FetchOutcome.timedOut(diagnostics);
        }
        if (result.exitCode() != 0) {
            return FetchOutcome.failed(result.exitCode(), diagnostics);
        }
        LOG.debug("Fetched {} in {} ms", sourceUrl, result.durationMs());
        return FetchOutcome.success();
    }

    List<String> buildCommand(String sourceUrl, Path outputTemplate) {
        List<String> cmd = new ArrayList<>();
        cmd.add(tools.ytDlpPath());
        cmd.add(sourceUrl);
        cmd.add("-x");
        cmd.add("-f");
        cmd.add("bestaudio/best");
        cmd.add("--audio-format");
        cmd.add(acquisition.getAudioFormat());
        cmd.add("--audio-quality");
        cmd.add(acquisition.getAudioQuality());
        if (tools.hasFfmpegLocation()) {
            cmd.add("--ffmpeg-location");
            cmd.add(tools.ffmpegLocation());
        }
        cmd.add("--postprocessor-args");
        cmd.add("ffmpeg:-b:a 192k");
        cmd.add("-o");
        cmd.add(outputTemplate.toAbsolutePath().toString());
        cmd.add("--no-playlist");
        cmd.add("--no-warnings");
        cmd.add("--quiet");
        cmd.add("--concurrent-fragments");
        cmd.add("8");
        return cmd;
    }
}
