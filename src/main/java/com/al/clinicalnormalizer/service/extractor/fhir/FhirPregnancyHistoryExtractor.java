package com.al.clinicalnormalizer.service.extractor.fhir;

import com.al.clinicalnormalizer.model.ClinicalSectionEntry;
import com.al.clinicalnormalizer.model.ResolvedTerm;
import com.al.clinicalnormalizer.model.enums.ClinicalSectionType;
import com.al.clinicalnormalizer.service.extractor.ExtractionContext;
import com.al.clinicalnormalizer.service.terminology.CodeSystemRegistry;
import com.al.clinicalnormalizer.service.terminology.TerminologyResolver;
import com.al.clinicalnormalizer.util.ClinicalVocabulary;
import com.al.clinicalnormalizer.util.MappingConstants;
import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.Observation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Pregnancy observations. A coded value is the outcome and leads the coded concepts;
 * gestational age and birth weight are read from the observation components.
 */
@Component
public class FhirPregnancyHistoryExtractor extends AbstractFhirSectionExtractor<Observation> {

    public FhirPregnancyHistoryExtractor(TerminologyResolver resolver, CodeSystemRegistry codeSystemRegistry) {
        super(resolver, codeSystemRegistry, Observation.class);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.PREGNANCY_HISTORY;
    }

    @Override
    protected boolean accepts(Observation observation) {
        return ObservationSections.classify(observation) == ClinicalSectionType.PREGNANCY_HISTORY;
    }

    @Override
    protected ClinicalSectionEntry toEntry(Observation observation, int index, Bundle bundle,
            ExtractionContext context) {
        boolean codedOutcome = observation.hasValueCodeableConcept();
        List<ResolvedTerm> concepts = new ArrayList<>();
        CodeableConcept primary = observation.getCode();
        if (codedOutcome) {
            primary = observation.getValueCodeableConcept();
            concepts.addAll(resolveAll(primary, context));
        }
        concepts.addAll(resolveAll(observation.getCode(), context));

        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(observation, index))
                .displayText(displayText(concepts, primary, "pregnancy"))
                .codedConcepts(concepts)
                .clinicalStatus(observation.hasStatus()
                        ? ClinicalVocabulary.eventStatusOrCode(observation.getStatus().toCode()) : null)
                .onsetDate(ObservationSections.start(observation))
                .recordedDate(observation.hasIssued() ? FhirCodings.date(observation.getIssuedElement()) : null);

        if (!codedOutcome) {
            putDetail(builder, MappingConstants.DETAIL_VALUE, observationValue(observation.getValue(), context, null));
        }
        putDetail(builder, MappingConstants.DETAIL_GESTATIONAL_AGE,
                componentQuantity(observation, MappingConstants.CODES_GESTATIONAL_AGE));
        putDetail(builder, MappingConstants.DETAIL_BIRTH_WEIGHT,
                componentQuantity(observation, MappingConstants.CODES_BIRTH_WEIGHT));
        addNotes(builder, observation.getNote());
        return builder.build();
    }

    private static String componentQuantity(Observation observation, Set<String> codes) {
        for (Observation.ObservationComponentComponent component : observation.getComponent()) {
            for (Coding coding : component.getCode().getCoding()) {
                if (coding.hasCode() && codes.contains(coding.getCode()) && component.hasValueQuantity()) {
                    return FhirCodings.quantity(component.getValueQuantity());
                }
            }
        }
        return null;
    }
}
