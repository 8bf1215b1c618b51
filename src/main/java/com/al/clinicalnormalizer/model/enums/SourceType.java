package com.al.clinicalnormalizer.model.enums;

/**
 * Wire format of an incoming clinical document. Always chosen explicitly by the caller.
 */
public enum SourceType {
    CDA,
    FHIR
}
