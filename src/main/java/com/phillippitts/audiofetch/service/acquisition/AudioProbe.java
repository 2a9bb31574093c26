package com.phillippitts.audiofetch.service.acquisition;

import java.nio.file.Path;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Measures properties of an audio file. Empty results mean "could not be measured".
 */
public interface AudioProbe {

    OptionalInt probeBitrateKbps(Path file);

    OptionalDouble probeDurationSec(Path file);
}
