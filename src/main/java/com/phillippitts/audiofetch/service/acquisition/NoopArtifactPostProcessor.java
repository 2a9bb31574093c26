package com.phillippitts.audiofetch.service.acquisition;

import com.phillippitts.audiofetch.domain.TrackDescriptor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;

/**
 * Default {@link ArtifactPostProcessor}: leaves the artifact untouched.
 */
public final class NoopArtifactPostProcessor implements ArtifactPostProcessor {

    private static final Logger LOG = LogManager.getLogger(NoopArtifactPostProcessor.class);

    @Override
    public void process(Path artifact, TrackDescriptor track) {
        LOG.debug("No post-processing configured for {}", artifact.getFileName());
    }
}
