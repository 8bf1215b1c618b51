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
public class FhirSocialHistoryExtractor extends AbstractFhirSectionExtractor<Observation> {

    public FhirSocialHistoryExtractor(TerminologyResolver resolver, CodeSystemRegistry codeSystemRegistry) {
        super(resolver, codeSystemRegistry, Observation.class);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.SOCIAL_HISTORY;
    }

    @Override
    protected boolean accepts(Observation observation) {
        return ObservationSections.classify(observation) == ClinicalSectionType.SOCIAL_HISTORY;
    }

    @Override
    protected ClinicalSectionEntry toEntry(Observation observation, int index, Bundle bundle,
            ExtractionContext context) {
        List<ResolvedTerm> concepts = new ArrayList<>(resolveAll(observation.getCode(), context));
        String displayText = displayText(concepts, observation.getCode(), "social history observation");

        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(observation, index))
                .displayText(displayText)
                .category(vocabularyValue(observation.getCode(), ClinicalVocabulary::socialHistoryCategory)
                        .orElse(displayText))
                .clinicalStatus(observation.hasStatus()
                        ? ClinicalVocabulary.eventStatusOrCode(observation.getStatus().toCode()) : null)
                .onsetDate(ObservationSections.start(observation))
                .recordedDate(observation.hasIssued() ? FhirCodings.date(observation.getIssuedElement()) : null);

        putDetail(builder, MappingConstants.DETAIL_VALUE, observationValue(observation.getValue(), context, concepts));
        putDetail(builder, MappingConstants.DETAIL_END_DATE, ObservationSections.end(observation));
        addNotes(builder, observation.getNote());
        return builder.codedConcepts(concepts).build();
    }
}
