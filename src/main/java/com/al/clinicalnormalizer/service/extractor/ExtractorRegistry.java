package com.al.clinicalnormalizer.service.extractor;

import com.al.clinicalnormalizer.model.enums.SourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Lookup of section extractors by source format and section id, built once from every
 * extractor bean.
 */
@Slf4j
@Service
public class ExtractorRegistry {

    private final Map<String, CdaSectionExtractor> cdaExtractors;
    private final Map<String, FhirSectionExtractor> fhirExtractors;

    public ExtractorRegistry(List<CdaSectionExtractor> cdaExtractors, List<FhirSectionExtractor> fhirExtractors) {
        this.cdaExtractors = Collections.unmodifiableMap(index(cdaExtractors));
        this.fhirExtractors = Collections.unmodifiableMap(index(fhirExtractors));
        log.info("Registered section extractors: CDA={}, FHIR={}", this.cdaExtractors.keySet(),
                this.fhirExtractors.keySet());
    }

    public Map<String, CdaSectionExtractor> getCdaExtractors() {
        return cdaExtractors;
    }

    public Map<String, FhirSectionExtractor> getFhirExtractors() {
        return fhirExtractors;
    }

    public Optional<? extends SectionExtractor<?>> find(SourceType sourceType, String sectionId) {
        if (sourceType == SourceType.CDA) {
            return Optional.ofNullable(cdaExtractors.get(sectionId));
        }
        return Optional.ofNullable(fhirExtractors.get(sectionId));
    }

    private static <E extends SectionExtractor<?>> Map<String, E> index(List<E> extractors) {
        Map<String, E> bySectionId = new TreeMap<>();
        for (E extractor : extractors) {
            E previous = bySectionId.put(extractor.getSectionId(), extractor);
            if (previous != null) {
                log.warn("Duplicate {} extractor for section '{}': {} replaces {}", extractor.getSourceType(),
                        extractor.getSectionId(), extractor.getClass().getSimpleName(),
                        previous.getClass().getSimpleName());
            }
        }
        return bySectionId;
    }
}
