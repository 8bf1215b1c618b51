package com.al.clinicalnormalizer.service.extractor;

import com.al.clinicalnormalizer.config.NormalizerProperties;
import lombok.Builder;
import lombok.Value;

/**
 * Per-document settings shared by all extractors of one pipeline run.
 */
@Value
@Builder
public class ExtractionContext {
    /** Correlation id used in logs */
    String documentId;
    String language;
    String country;

    public static ExtractionContext from(NormalizerProperties properties, String documentId) {
        return ExtractionContext.builder()
                .documentId(documentId)
                .language(properties.getTargetLanguage())
                .country(properties.getTargetCountry())
                .build();
    }
}
