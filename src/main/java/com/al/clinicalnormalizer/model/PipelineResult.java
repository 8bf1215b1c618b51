package com.al.clinicalnormalizer.model;

import com.al.clinicalnormalizer.dto.ExtractionIssue;
import com.al.clinicalnormalizer.model.enums.SourceType;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one pipeline run. Sections are always ordered by section id, independent of
 * the order in which extraction tasks completed.
 */
@Value
public class PipelineResult {

    SourceType sourceType;
    List<NormalizedSection> sections;
    Map<String, NormalizedSection> sectionsBySectionId;
    List<ExtractionIssue> issues;

    public PipelineResult(SourceType sourceType, List<NormalizedSection> sections, List<ExtractionIssue> issues) {
        List<NormalizedSection> sorted = new ArrayList<>(sections);
        sorted.sort(Comparator.comparing(NormalizedSection::getSectionId));
        Map<String, NormalizedSection> byId = new LinkedHashMap<>();
        for (NormalizedSection section : sorted) {
            byId.put(section.getSectionId(), section);
        }
        this.sourceType = sourceType;
        this.sections = Collections.unmodifiableList(sorted);
        this.sectionsBySectionId = Collections.unmodifiableMap(byId);
        this.issues = List.copyOf(issues);
    }

    public static PipelineResult empty(SourceType sourceType, List<ExtractionIssue> issues) {
        return new PipelineResult(sourceType, List.of(), issues);
    }

    public int getSectionsCount() {
        return sections.size();
    }

    public int getSectionsWithData() {
        return (int) sections.stream().filter(NormalizedSection::isHasEntries).count();
    }

    public int getTotalEntries() {
        return sections.stream().mapToInt(NormalizedSection::getEntryCount).sum();
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
