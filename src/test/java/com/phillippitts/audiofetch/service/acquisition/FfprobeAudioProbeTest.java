package com.phillippitts.audiofetch.service.acquisition;

import com.phillippitts.audiofetch.config.properties.ToolProperties;
import com.phillippitts.audiofetch.service.process.ProcessRunner;
import com.phillippitts.audiofetch.testutil.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.audiofetch.testutil.ProcessTestDoubles.StubProcessFactory;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FfprobeAudioProbeTest {

    private static final Path FILE = Path.of("/music/Artist - Song.mp3");

    private static FfprobeAudioProbe probe(StubProcessFactory factory) {
        return new FfprobeAudioProbe(new ProcessRunner(factory, 4096), new ToolProperties());
    }

    @Test
    void convertsStreamBitrateToKbps() {
        StubProcessFactory factory = new StubProcessFactory(ProcessBehavior.exits(0, "192000\n", ""));

        assertThat(probe(factory).probeBitrateKbps(FILE)).hasValue(192);
        assertThat(factory.lastCommand())
                .startsWith("ffprobe", "-v", "error")
                .contains("a:0", "stream=bit_rate")
                .endsWith(FILE.toAbsolutePath().toString());
    }

    @Test
    void notAvailableBitrateIsUnknown() {
        StubProcessFactory factory = new StubProcessFactory(ProcessBehavior.exits(0, "N/A", ""));

        assertThat(probe(factory).probeBitrateKbps(FILE)).isEmpty();
    }

    @Test
    void failedProbeIsUnknown() {
        StubProcessFactory factory = new StubProcessFactory(ProcessBehavior.exits(1, "", "Invalid data found"));

        assertThat(probe(factory).probeBitrateKbps(FILE)).isEmpty();
        assertThat(probe(factory).probeDurationSec(FILE)).isEmpty();
    }

    @Test
    void missingToolIsUnknown() {
        assertThat(probe(StubProcessFactory.failingToStart()).probeDurationSec(FILE)).isEmpty();
    }

    @Test
    void parsesFormatDuration() {
        StubProcessFactory factory = new StubProcessFactory(ProcessBehavior.exits(0, "215.512000\n", ""));

        assertThat(probe(factory).probeDurationSec(FILE)).hasValue(215.512);
        assertThat(factory.lastCommand()).contains("format=duration");
    }
}
