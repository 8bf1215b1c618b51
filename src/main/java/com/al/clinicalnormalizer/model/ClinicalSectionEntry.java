package com.al.clinicalnormalizer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One normalized row of a clinical section. Optional fields are null when the source
 * document does not carry them.
 */
@Value
@Builder
public class ClinicalSectionEntry {
    String entryId;
    String displayText;
    @Singular
    List<ResolvedTerm> codedConcepts;
    String clinicalStatus;
    String verificationStatus;
    String onsetDate;
    String recordedDate;
    String severity;
    String category;
    @Singular
    List<String> notes;
    /** Domain specific values (route, dosage, value, lot_number, ...), in insertion order */
    @Singular
    Map<String, String> details;
    String sourceReference;
}
