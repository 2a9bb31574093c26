package com.phillippitts.audiofetch.exception;

import java.nio.file.Path;

/**
 * Thrown when the fetch tool reported success but no artifact could be located.
 */
public class ArtifactMissingException extends AudioFetchException {

    private final Path expectedPath;

    public ArtifactMissingException(Path expectedPath) {
        super("Output file not found after download: " + expectedPath);
        this.expectedPath = expectedPath;
    }

    public Path getExpectedPath() {
        return expectedPath;
    }
}
