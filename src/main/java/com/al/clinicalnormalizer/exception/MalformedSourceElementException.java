package com.al.clinicalnormalizer.exception;

import lombok.Getter;

/**
 * A single source element lacks a field required to build an entry. The element is
 * skipped; extraction of the rest of the section continues.
 */
@Getter
public class MalformedSourceElementException extends RuntimeException {

    private final String field;

    public MalformedSourceElementException(String field, String message) {
        super(message);
        this.field = field;
    }
}
