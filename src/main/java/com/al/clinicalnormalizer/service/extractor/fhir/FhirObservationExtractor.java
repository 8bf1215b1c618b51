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
import org.hl7.fhir.r4.model.Observation;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class FhirObservationExtractor extends AbstractFhirSectionExtractor<Observation> {

    public FhirObservationExtractor(TerminologyResolver resolver, CodeSystemRegistry codeSystemRegistry) {
        super(resolver, codeSystemRegistry, Observation.class);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.OBSERVATIONS;
    }

    /**
     * Observations routed to social history, functional status or pregnancy history are
     * left to those sections.
     */
    @Override
    protected boolean accepts(Observation observation) {
        return ObservationSections.classify(observation) == ClinicalSectionType.OBSERVATIONS;
    }

    @Override
    protected ClinicalSectionEntry toEntry(Observation observation, int index, Bundle bundle,
            ExtractionContext context) {
        List<ResolvedTerm> concepts = resolveAll(observation.getCode(), context);

        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(observation, index))
                .displayText(displayText(concepts, observation.getCode(), "observation"))
                .codedConcepts(concepts)
                .clinicalStatus(observation.hasStatus()
                        ? ClinicalVocabulary.eventStatusOrCode(observation.getStatus().toCode()) : null);

        builder.onsetDate(ObservationSections.start(observation));
        if (observation.hasIssued()) {
            builder.recordedDate(FhirCodings.date(observation.getIssuedElement()));
        }
        if (observation.hasCategory()) {
            builder.category(displayOf(observation.getCategoryFirstRep(), context));
        }

        putDetail(builder, MappingConstants.DETAIL_VALUE, observationValue(observation.getValue(), context, null));
        if (observation.hasInterpretation()) {
            putDetail(builder, MappingConstants.DETAIL_INTERPRETATION,
                    displayOf(observation.getInterpretationFirstRep(), context));
        }
        addNotes(builder, observation.getNote());
        return builder.build();
    }
}
