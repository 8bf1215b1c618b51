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

import java.util.ArrayList;
import java.util.List;

@Component
public class FhirFunctionalStatusExtractor extends AbstractFhirSectionExtractor<Observation> {

    public FhirFunctionalStatusExtractor(TerminologyResolver resolver, CodeSystemRegistry codeSystemRegistry) {
        super(resolver, codeSystemRegistry, Observation.class);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.FUNCTIONAL_STATUS;
    }

    @Override
    protected boolean accepts(Observation observation) {
        return ObservationSections.classify(observation) == ClinicalSectionType.FUNCTIONAL_STATUS;
    }

    @Override
    protected ClinicalSectionEntry toEntry(Observation observation, int index, Bundle bundle,
            ExtractionContext context) {
        List<ResolvedTerm> concepts = new ArrayList<>(resolveAll(observation.getCode(), context));
        String displayText = displayText(concepts, observation.getCode(), "functional assessment");

        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(observation, index))
                .displayText(displayText)
                .category(vocabularyValue(observation.getCode(), ClinicalVocabulary::functionalCategory)
                        .orElse(displayText))
                .clinicalStatus(observation.hasStatus()
                        ? ClinicalVocabulary.eventStatusOrCode(observation.getStatus().toCode()) : null)
                .onsetDate(ObservationSections.start(observation))
                .recordedDate(observation.hasIssued() ? FhirCodings.date(observation.getIssuedElement()) : null);

        if (observation.hasValueQuantity()) {
            putDetail(builder, MappingConstants.DETAIL_SCORE, FhirCodings.quantity(observation.getValueQuantity()));
        } else {
            String level = observationValue(observation.getValue(), context, concepts);
            putDetail(builder, MappingConstants.DETAIL_LEVEL, level);
            ClinicalVocabulary.independence(level).ifPresent(independence -> {
                builder.detail(MappingConstants.DETAIL_INDEPENDENCE, independence);
                ClinicalVocabulary.assistanceRequired(independence)
                        .ifPresent(assistance -> builder.detail(MappingConstants.DETAIL_ASSISTANCE, assistance));
            });
        }
        addNotes(builder, observation.getNote());
        return builder.codedConcepts(concepts).build();
    }
}
