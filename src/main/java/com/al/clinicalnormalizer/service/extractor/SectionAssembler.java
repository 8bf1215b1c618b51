package com.al.clinicalnormalizer.service.extractor;

import com.al.clinicalnormalizer.exception.MalformedSourceElementException;
import com.al.clinicalnormalizer.model.ClinicalSectionEntry;
import com.al.clinicalnormalizer.model.NormalizedSection;
import com.al.clinicalnormalizer.model.ResolvedTerm;
import com.al.clinicalnormalizer.model.enums.ClinicalSectionType;
import com.al.clinicalnormalizer.model.enums.SourceType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shared assembly steps of all extractors: per-element error isolation and construction of
 * the section header from {@link ClinicalSectionType}, so both source formats produce the
 * same section shape.
 */
@Slf4j
public final class SectionAssembler {

    private SectionAssembler() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    @FunctionalInterface
    public interface EntryMapper<T> {
        ClinicalSectionEntry map(T element, int index);
    }

    /**
     * Map every source element to an entry. Elements that fail are logged and skipped.
     */
    public static <T> List<ClinicalSectionEntry> collect(ClinicalSectionType type, List<T> elements,
            EntryMapper<T> mapper) {
        List<ClinicalSectionEntry> entries = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            try {
                ClinicalSectionEntry entry = mapper.map(elements.get(i), i);
                if (entry != null) {
                    entries.add(entry);
                }
            } catch (MalformedSourceElementException e) {
                log.warn("Skipping malformed {} element #{} ({}): {}", type.getSectionId(), i, e.getField(),
                        e.getMessage());
            } catch (RuntimeException e) {
                log.error("Failed to map {} element #{}, skipping it", type.getSectionId(), i, e);
            }
        }
        return entries;
    }

    public static NormalizedSection build(ClinicalSectionType type, SourceType sourceType,
            List<ClinicalSectionEntry> entries) {
        List<ResolvedTerm> concepts = new ArrayList<>();
        for (ClinicalSectionEntry entry : entries) {
            concepts.addAll(entry.getCodedConcepts());
        }
        return NormalizedSection.builder()
                .sectionId(type.getSectionId())
                .title(type.getTitle())
                .sectionCode(type.getLoincCode())
                .hasEntries(!entries.isEmpty())
                .entryCount(entries.size())
                .entries(Collections.unmodifiableList(new ArrayList<>(entries)))
                .columns(type.getColumns())
                .displayConfig(type.getDisplayConfig())
                .codedConcepts(Collections.unmodifiableList(concepts))
                .isCodedSection(!concepts.isEmpty())
                .dataSource(sourceType)
                .build();
    }

    public static NormalizedSection empty(ClinicalSectionType type, SourceType sourceType) {
        return build(type, sourceType, List.of());
    }
}
