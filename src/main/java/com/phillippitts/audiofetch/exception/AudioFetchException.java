package com.phillippitts.audiofetch.exception;

/**
 * Base exception for all audioFetch application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class AudioFetchException extends RuntimeException {

    public AudioFetchException(String message) {
        super(message);
    }

    public AudioFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    public AudioFetchException(Throwable cause) {
        super(cause);
    }
}
