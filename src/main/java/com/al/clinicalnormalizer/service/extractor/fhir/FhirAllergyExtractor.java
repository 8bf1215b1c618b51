package com.al.clinicalnormalizer.service.extractor.fhir;

import com.al.clinicalnormalizer.model.ClinicalSectionEntry;
import com.al.clinicalnormalizer.model.ResolvedTerm;
import com.al.clinicalnormalizer.model.enums.ClinicalSectionType;
import com.al.clinicalnormalizer.service.extractor.ExtractionContext;
import com.al.clinicalnormalizer.service.terminology.CodeSystemRegistry;
import com.al.clinicalnormalizer.service.terminology.TerminologyResolver;
import com.al.clinicalnormalizer.util.ClinicalVocabulary;
import com.al.clinicalnormalizer.util.MappingConstants;
import org.hl7.fhir.r4.model.AllergyIntolerance;
import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class FhirAllergyExtractor extends AbstractFhirSectionExtractor<AllergyIntolerance> {

    public FhirAllergyExtractor(TerminologyResolver resolver, CodeSystemRegistry codeSystemRegistry) {
        super(resolver, codeSystemRegistry, AllergyIntolerance.class);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.ALLERGIES;
    }

    @Override
    protected ClinicalSectionEntry toEntry(AllergyIntolerance allergy, int index, Bundle bundle,
            ExtractionContext context) {
        List<ResolvedTerm> concepts = new ArrayList<>(resolveAll(allergy.getCode(), context));
        String displayText = displayText(concepts, allergy.getCode(), "allergen");

        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(allergy, index))
                .displayText(displayText)
                .clinicalStatus(vocabularyDisplay(allergy.getClinicalStatus(), ClinicalVocabulary::clinicalStatus))
                .verificationStatus(vocabularyDisplay(allergy.getVerificationStatus(),
                        ClinicalVocabulary::verificationStatus))
                .recordedDate(FhirCodings.date(allergy.getRecordedDateElement()));

        if (allergy.hasOnsetDateTimeType()) {
            builder.onsetDate(FhirCodings.date(allergy.getOnsetDateTimeType()));
        } else if (allergy.hasOnsetPeriod()) {
            builder.onsetDate(FhirCodings.date(allergy.getOnsetPeriod().getStartElement()));
        }
        if (allergy.hasCategory() && allergy.getCategory().get(0).getValue() != null) {
            builder.category(allergy.getCategory().get(0).getValue().toCode());
        }
        if (allergy.hasCriticality()) {
            String criticality = allergy.getCriticality().toCode();
            putDetail(builder, MappingConstants.DETAIL_CRITICALITY,
                    ClinicalVocabulary.criticality(criticality).orElse(criticality));
        }

        // Reactions: every manifestation coding is a coded concept of the entry
        List<String> reactions = new ArrayList<>();
        String severity = null;
        for (AllergyIntolerance.AllergyIntoleranceReactionComponent reaction : allergy.getReaction()) {
            for (CodeableConcept manifestation : reaction.getManifestation()) {
                List<ResolvedTerm> terms = resolveAll(manifestation, context);
                if (!terms.isEmpty()) {
                    concepts.add(terms.get(0));
                    reactions.add(terms.get(0).getDisplay());
                } else if (FhirCodings.text(manifestation) != null) {
                    reactions.add(FhirCodings.text(manifestation));
                }
            }
            if (severity == null && reaction.hasSeverity()) {
                String code = reaction.getSeverity().toCode();
                severity = ClinicalVocabulary.severity(code).orElse(code);
            }
        }
        builder.severity(severity);
        putDetail(builder, MappingConstants.DETAIL_REACTION, reactions.isEmpty() ? null : String.join("; ", reactions));
        if (allergy.hasLastOccurrence()) {
            putDetail(builder, MappingConstants.DETAIL_END_DATE, FhirCodings.date(allergy.getLastOccurrenceElement()));
        }
        addNotes(builder, allergy.getNote());

        return builder.codedConcepts(concepts).build();
    }
}
