package com.al.clinicalnormalizer.model;

import com.al.clinicalnormalizer.model.enums.SourceType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Format-agnostic clinical section. This is the only structure handed to presentation
 * layers; no XML or FHIR model objects leak through it.
 */
@Value
@Builder
public class NormalizedSection {
    String sectionId;
    String title;
    String sectionCode;
    boolean hasEntries;
    int entryCount;
    List<ClinicalSectionEntry> entries;
    List<String> columns;
    Map<String, Object> displayConfig;
    List<ResolvedTerm> codedConcepts;
    boolean isCodedSection;
    SourceType dataSource;
}
