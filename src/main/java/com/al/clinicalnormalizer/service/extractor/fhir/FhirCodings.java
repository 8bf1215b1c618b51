package com.al.clinicalnormalizer.service.extractor.fhir;

import com.al.clinicalnormalizer.model.ClinicalCode;
import com.al.clinicalnormalizer.service.terminology.CodeSystemRegistry;
import com.al.clinicalnormalizer.util.DateTimeUtil;
import com.al.clinicalnormalizer.util.DisplaySanitizer;
import org.hl7.fhir.r4.model.BaseDateTimeType;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.Quantity;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversions from HAPI R4 datatypes to the normalized model.
 */
public final class FhirCodings {

    private FhirCodings() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Every coding of the concept that has both a code and a system, with the system URI
     * normalized to an OID.
     */
    public static List<ClinicalCode> codes(CodeableConcept concept, CodeSystemRegistry registry) {
        List<ClinicalCode> codes = new ArrayList<>();
        if (concept == null) {
            return codes;
        }
        for (Coding coding : concept.getCoding()) {
            if (coding.hasCode() && coding.hasSystem()) {
                codes.add(ClinicalCode.of(coding.getCode(), registry.normalizeSystem(coding.getSystem()),
                        coding.getDisplay()));
            }
        }
        return codes;
    }

    public static String text(CodeableConcept concept) {
        return concept != null && concept.hasText() ? DisplaySanitizer.sanitize(concept.getText()) : null;
    }

    /**
     * Display of a status-like concept: display of the first coding, else its code, else
     * the concept text.
     */
    public static String statusText(CodeableConcept concept) {
        if (concept == null || concept.isEmpty()) {
            return null;
        }
        for (Coding coding : concept.getCoding()) {
            if (coding.hasDisplay()) {
                return DisplaySanitizer.sanitize(coding.getDisplay());
            }
            if (coding.hasCode()) {
                return coding.getCode();
            }
        }
        return text(concept);
    }

    public static String date(BaseDateTimeType value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        return DateTimeUtil.normalizeFhirDateTimeOrNull(value.getValueAsString());
    }

    public static String quantity(Quantity quantity) {
        if (quantity == null || !quantity.hasValue()) {
            return null;
        }
        String value = quantity.getValue().toPlainString();
        String unit = quantity.hasUnit() ? quantity.getUnit() : quantity.getCode();
        return unit != null && !unit.isBlank() && !"1".equals(unit) ? value + " " + unit : value;
    }
}
