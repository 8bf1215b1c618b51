package com.al.clinicalnormalizer.model;

import com.al.clinicalnormalizer.model.enums.ConceptStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Catalogue view of a concept. Owned by the external terminology import; read-only here.
 */
@Value
@Builder
public class ConceptRecord {
    String id;
    String code;
    String codeSystemOid;
    String valueSetOid;
    ConceptStatus status;
    String defaultDisplay;

    public boolean isActive() {
        return status == ConceptStatus.ACTIVE;
    }
}
