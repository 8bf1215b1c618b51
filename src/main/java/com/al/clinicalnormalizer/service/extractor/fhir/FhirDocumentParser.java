package com.al.clinicalnormalizer.service.extractor.fhir;

import ca.uhn.fhir.context.FhirContext;
import ca.uhn.fhir.parser.DataFormatException;
import ca.uhn.fhir.parser.IParser;
import com.al.clinicalnormalizer.exception.DocumentParseException;
import com.al.clinicalnormalizer.model.enums.SourceType;
import lombok.extern.slf4j.Slf4j;
import org.hl7.fhir.r4.model.Bundle;
import org.springframework.stereotype.Component;

/**
 * Parses FHIR R4 Bundle JSON with the shared {@link FhirContext}.
 */
@Slf4j
@Component
public class FhirDocumentParser {

    private final FhirContext fhirContext;

    public FhirDocumentParser(FhirContext fhirContext) {
        this.fhirContext = fhirContext;
    }

    public Bundle parse(String json) {
        if (json == null || json.isBlank()) {
            throw new DocumentParseException(SourceType.FHIR, "FHIR document is empty", null);
        }
        try {
            IParser parser = fhirContext.newJsonParser();
            return parser.parseResource(Bundle.class, json);
        } catch (DataFormatException | ClassCastException e) {
            throw new DocumentParseException(SourceType.FHIR, "Invalid FHIR Bundle: " + e.getMessage(), e);
        }
    }
}
