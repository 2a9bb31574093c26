/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.audiofetch.exception.AudioFetchException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.audiofetch.exception.NoMatchFoundException} - search exhausted
 *       with nothing usable</li>
 *   <li>{@link com.phillippitts.audiofetch.exception.FetchFailedException} - external tool
 *       exited nonzero or timed out</li>
 *   <li>{@link com.phillippitts.audiofetch.exception.ValidationFailedException} - artifact below
 *       size or bitrate thresholds</li>
 *   <li>{@link com.phillippitts.audiofetch.exception.ArtifactMissingException} - fetch succeeded
 *       but produced no file</li>
 *   <li>{@link com.phillippitts.audiofetch.exception.UpstreamUnavailableException} - catalog or
 *       search collaborator unavailable</li>
 * </ul>
 *
 * <p>All are unchecked. The acquisition pipeline converts them into failed
 * {@code AcquisitionResult}s and the job runner into the {@code ERROR} stage.
 *
 * @since 1.0
 */
package com.phillippitts.audiofetch.exception;
