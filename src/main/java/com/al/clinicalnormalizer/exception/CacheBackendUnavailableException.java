package com.al.clinicalnormalizer.exception;

/**
 * The terminology cache cannot be read or written. Callers resolve directly against the
 * concept store instead.
 */
public class CacheBackendUnavailableException extends RuntimeException {

    public CacheBackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
