package com.al.clinicalnormalizer.service.extractor;

import com.al.clinicalnormalizer.model.NormalizedSection;
import com.al.clinicalnormalizer.model.enums.ClinicalSectionType;
import com.al.clinicalnormalizer.model.enums.SourceType;

/**
 * Builds one normalized clinical section from a parsed source document.
 *
 * @param <D> parsed document type of the source format
 */
public interface SectionExtractor<D> {

    ClinicalSectionType getSectionType();

    SourceType getSourceType();

    /**
     * Extracts the section. A document without the section yields an empty section, not
     * an error.
     *
     * @param document parsed source document, shared read-only between extractors
     * @param context  language and correlation settings of the current run
     * @return the section, never null
     */
    NormalizedSection extract(D document, ExtractionContext context);

    default String getSectionId() {
        return getSectionType().getSectionId();
    }
}
