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
import org.hl7.fhir.r4.model.Condition;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class FhirConditionExtractor extends AbstractFhirSectionExtractor<Condition> {

    public FhirConditionExtractor(TerminologyResolver resolver, CodeSystemRegistry codeSystemRegistry) {
        super(resolver, codeSystemRegistry, Condition.class);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.CONDITIONS;
    }

    @Override
    protected ClinicalSectionEntry toEntry(Condition condition, int index, Bundle bundle, ExtractionContext context) {
        List<ResolvedTerm> concepts = resolveAll(condition.getCode(), context);

        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(condition, index))
                .displayText(displayText(concepts, condition.getCode(), "problem"))
                .codedConcepts(concepts)
                .clinicalStatus(clinicalStatus(condition))
                .verificationStatus(vocabularyDisplay(condition.getVerificationStatus(),
                        ClinicalVocabulary::verificationStatus))
                .severity(vocabularyValue(condition.getSeverity(), ClinicalVocabulary::severity)
                        .orElseGet(() -> displayOf(condition.getSeverity(), context)))
                .recordedDate(FhirCodings.date(condition.getRecordedDateElement()));

        if (condition.hasOnsetDateTimeType()) {
            builder.onsetDate(FhirCodings.date(condition.getOnsetDateTimeType()));
        } else if (condition.hasOnsetPeriod()) {
            builder.onsetDate(FhirCodings.date(condition.getOnsetPeriod().getStartElement()));
        }
        if (condition.hasAbatementDateTimeType()) {
            putDetail(builder, MappingConstants.DETAIL_ABATEMENT_DATE,
                    FhirCodings.date(condition.getAbatementDateTimeType()));
        } else if (condition.hasAbatementPeriod()) {
            putDetail(builder, MappingConstants.DETAIL_ABATEMENT_DATE,
                    FhirCodings.date(condition.getAbatementPeriod().getEndElement()));
        }
        if (condition.hasCategory()) {
            builder.category(displayOf(condition.getCategoryFirstRep(), context));
        }
        if (condition.hasBodySite()) {
            putDetail(builder, MappingConstants.DETAIL_BODY_SITE, displayOf(condition.getBodySiteFirstRep(), context));
        }
        addNotes(builder, condition.getNote());
        return builder.build();
    }

    /**
     * A condition without clinical status but with an abatement has resolved.
     */
    private static String clinicalStatus(Condition condition) {
        if (!condition.hasClinicalStatus() && condition.hasAbatement()) {
            return ClinicalVocabulary.RESOLVED;
        }
        return vocabularyDisplay(condition.getClinicalStatus(), ClinicalVocabulary::clinicalStatus);
    }
}
