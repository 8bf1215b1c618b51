package com.al.clinicalnormalizer.exception;

/**
 * The concept catalogue could not answer a lookup (backend error or timeout).
 */
public class ConceptStoreException extends RuntimeException {

    public ConceptStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
