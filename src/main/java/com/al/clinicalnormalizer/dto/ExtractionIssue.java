package com.al.clinicalnormalizer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A problem encountered while extracting a section. Issues never abort a pipeline run;
 * they explain why a section is missing from the result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionIssue {

    /**
     * Section the issue belongs to, or null for document level problems
     */
    private String sectionId;

    /**
     * Error code for programmatic handling
     */
    private String errorCode;

    /**
     * Human-readable message
     */
    private String message;

    private Severity severity;

    /**
     * The original exception class name (for debugging)
     */
    private String exceptionType;

    public enum Severity {
        ERROR,
        WARNING,
        INFORMATION
    }

    public static ExtractionIssue extractorFailure(String sectionId, Throwable cause) {
        return ExtractionIssue.builder()
                .sectionId(sectionId)
                .message(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName())
                .severity(Severity.WARNING)
                .errorCode("EXTRACTOR_FAILURE")
                .exceptionType(cause.getClass().getName())
                .build();
    }

    public static ExtractionIssue documentError(String message, Throwable cause) {
        return ExtractionIssue.builder()
                .message(message)
                .severity(Severity.ERROR)
                .errorCode("DOCUMENT_PARSE_ERROR")
                .exceptionType(cause != null ? cause.getClass().getName() : null)
                .build();
    }

    public static ExtractionIssue invalidRequest(String message) {
        return ExtractionIssue.builder()
                .message(message)
                .severity(Severity.ERROR)
                .errorCode("INVALID_REQUEST")
                .build();
    }

    public static ExtractionIssue unknownSection(String sectionId) {
        return ExtractionIssue.builder()
                .sectionId(sectionId)
                .message("No extractor registered for section '" + sectionId + "'")
                .severity(Severity.WARNING)
                .errorCode("UNKNOWN_SECTION")
                .build();
    }
}
