package com.al.clinicalnormalizer.model.enums;

public enum ConceptStatus {
    ACTIVE,
    INACTIVE;

    public static ConceptStatus fromValue(String value) {
        if (value != null && "active".equalsIgnoreCase(value.trim())) {
            return ACTIVE;
        }
        return INACTIVE;
    }
}
