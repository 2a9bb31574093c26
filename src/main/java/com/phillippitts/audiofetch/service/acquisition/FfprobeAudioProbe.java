package com.phillippitts.audiofetch.service.acquisition;

import com.phillippitts.audiofetch.config.properties.ToolProperties;
import com.phillippitts.audiofetch.exception.FetchFailedException;
import com.phillippitts.audiofetch.service.process.ProcessResult;
import com.phillippitts.audiofetch.service.process.ProcessRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * {@link AudioProbe} backed by ffprobe.
 *
 * <p>Bitrate: {@code -select_streams a:0 -show_entries stream=bit_rate} (bits per second, converted
 * to kbps). Duration: {@code -show_entries format=duration} (seconds).
 */
public class FfprobeAudioProbe implements AudioProbe {

    private static final Logger LOG = LogManager.getLogger(FfprobeAudioProbe.class);
    private static final String TOOL = "ffprobe";

    private final ProcessRunner runner;
    private final ToolProperties tools;

    public FfprobeAudioProbe(ProcessRunner runner, ToolProperties tools) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.tools = Objects.requireNonNull(tools, "tools");
    }

    @Override
    public OptionalInt probeBitrateKbps(Path file) {
        Optional<String> out = probe(file, "-select_streams", "a:0", "-show_entries", "stream=bit_rate");
        if (out.isEmpty()) {
            return OptionalInt.empty();
        }
        try {
            long bps = Long.parseLong(out.get());
            return bps > 0 ? OptionalInt.of((int) (bps / 1000)) : OptionalInt.empty();
        } catch (NumberFormatException e) {
            LOG.debug("Unparseable bitrate '{}' for {}", out.get(), file);
            return OptionalInt.empty();
        }
    }

    @Override
    public OptionalDouble probeDurationSec(Path file) {
        Optional<String> out = probe(file, "-show_entries", "format=duration");
        if (out.isEmpty()) {
            return OptionalDouble.empty();
        }
        try {
            double seconds = Double.parseDouble(out.get());
            return seconds > 0 ? OptionalDouble.of(seconds) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            LOG.debug("Unparseable duration '{}' for {}", out.get(), file);
            return OptionalDouble.empty();
        }
    }

    /**
     * Runs ffprobe with the given selection and returns the first output line, if any.
     */
    private Optional<String> probe(Path file, String... selection) {
        List<String> command = new ArrayList<>();
        command.add(tools.ffprobePath());
        command.add("-v");
        command.add("error");
        command.addAll(List.of(selection));
        command.add("-of");
        command.add("default=noprint_wrappers=1:nokey=1");
        command.add(file.toAbsolutePath().toString());

        ProcessResult result;
        try {
            result = runner.run(TOOL, command, null, Duration.ofSeconds(tools.probeTimeoutSeconds()));
        } catch (FetchFailedException e) {
            LOG.debug("ffprobe unavailable: {}", e.getMessage());
            return Optional.empty();
        }
        if (!result.succeeded()) {
            return Optional.empty();
        }
        return result.stdout().lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty() && !"N/A".equals(line))
                .findFirst();
    }
}
