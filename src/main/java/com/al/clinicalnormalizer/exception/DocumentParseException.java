package com.al.clinicalnormalizer.exception;

import com.al.clinicalnormalizer.model.enums.SourceType;
import lombok.Getter;

/**
 * Raised when a raw document cannot be parsed in its declared format.
 */
@Getter
public class DocumentParseException extends RuntimeException {

    private final SourceType sourceType;

    public DocumentParseException(SourceType sourceType, String message, Throwable cause) {
        super(message, cause);
        this.sourceType = sourceType;
    }
}
