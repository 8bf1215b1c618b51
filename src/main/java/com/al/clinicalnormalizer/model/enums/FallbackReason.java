package com.al.clinicalnormalizer.model.enums;

public enum FallbackReason {
    UNSUPPORTED_CODE_SYSTEM,
    CONCEPT_NOT_FOUND,
    LOOKUP_FAILED
}
