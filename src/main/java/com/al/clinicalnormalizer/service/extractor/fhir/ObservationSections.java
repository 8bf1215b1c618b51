package com.al.clinicalnormalizer.service.extractor.fhir;

import com.al.clinicalnormalizer.model.enums.ClinicalSectionType;
import com.al.clinicalnormalizer.util.ClinicalVocabulary;
import com.al.clinicalnormalizer.util.MappingConstants;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.Observation;

/**
 * Routes a FHIR Observation to exactly one section. The category decides first, then the
 * observation code; everything else is a result.
 */
final class ObservationSections {

    private ObservationSections() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    static ClinicalSectionType classify(Observation observation) {
        for (CodeableConcept category : observation.getCategory()) {
            for (Coding coding : category.getCoding()) {
                if (MappingConstants.CATEGORY_SOCIAL_HISTORY.equals(coding.getCode())) {
                    return ClinicalSectionType.SOCIAL_HISTORY;
                }
                if (MappingConstants.CATEGORY_FUNCTIONAL_STATUS.equals(coding.getCode())) {
                    return ClinicalSectionType.FUNCTIONAL_STATUS;
                }
            }
        }
        for (Coding coding : observation.getCode().getCoding()) {
            String code = coding.getCode();
            if (code == null) {
                continue;
            }
            if (MappingConstants.CODES_PREGNANCY.contains(code)) {
                return ClinicalSectionType.PREGNANCY_HISTORY;
            }
            if (ClinicalVocabulary.socialHistoryCategory(code).isPresent()) {
                return ClinicalSectionType.SOCIAL_HISTORY;
            }
            if (ClinicalVocabulary.functionalCategory(code).isPresent()) {
                return ClinicalSectionType.FUNCTIONAL_STATUS;
            }
        }
        return ClinicalSectionType.OBSERVATIONS;
    }

    static String start(Observation observation) {
        if (observation.hasEffectiveDateTimeType()) {
            return FhirCodings.date(observation.getEffectiveDateTimeType());
        }
        if (observation.hasEffectivePeriod()) {
            return FhirCodings.date(observation.getEffectivePeriod().getStartElement());
        }
        return null;
    }

    static String end(Observation observation) {
        if (observation.hasEffectivePeriod()) {
            return FhirCodings.date(observation.getEffectivePeriod().getEndElement());
        }
        return null;
    }
}
