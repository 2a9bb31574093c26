package com.phillippitts.audiofetch.service.acquisition;

import com.phillippitts.audiofetch.exception.FetchFailedException;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Downloads a single audio artifact for a source URL.
 */
public interface FetchProvider {

    /**
     * Fetches {@code sourceUrl} into a file named after {@code outputTemplate}.
     *
     * @param sourceUrl      URL of the chosen candidate
     * @param outputTemplate output path where {@code %(ext)s} is replaced by the produced extension
     * @param timeout        overall time limit
     * @return outcome distinguishing success, nonzero exit and timeout
     * @throws FetchFailedException if the tool cannot be started at all
     */
    FetchOutcome fetch(String sourceUrl, Path outputTemplate, Duration timeout);
}
