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
import org.hl7.fhir.r4.model.Procedure;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class FhirProcedureExtractor extends AbstractFhirSectionExtractor<Procedure> {

    public FhirProcedureExtractor(TerminologyResolver resolver, CodeSystemRegistry codeSystemRegistry) {
        super(resolver, codeSystemRegistry, Procedure.class);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.PROCEDURES;
    }

    @Override
    protected ClinicalSectionEntry toEntry(Procedure procedure, int index, Bundle bundle, ExtractionContext context) {
        List<ResolvedTerm> concepts = resolveAll(procedure.getCode(), context);

        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(procedure, index))
                .displayText(displayText(concepts, procedure.getCode(), "procedure"))
                .codedConcepts(concepts)
                .clinicalStatus(procedure.hasStatus()
                        ? ClinicalVocabulary.eventStatusOrCode(procedure.getStatus().toCode()) : null);

        if (procedure.hasPerformedDateTimeType()) {
            builder.onsetDate(FhirCodings.date(procedure.getPerformedDateTimeType()));
        } else if (procedure.hasPerformedPeriod()) {
            builder.onsetDate(FhirCodings.date(procedure.getPerformedPeriod().getStartElement()));
            putDetail(builder, MappingConstants.DETAIL_END_DATE,
                    FhirCodings.date(procedure.getPerformedPeriod().getEndElement()));
        }
        if (procedure.hasCategory()) {
            builder.category(displayOf(procedure.getCategory(), context));
        }
        if (procedure.hasBodySite()) {
            putDetail(builder, MappingConstants.DETAIL_BODY_SITE, displayOf(procedure.getBodySiteFirstRep(), context));
        }
        addNotes(builder, procedure.getNote());
        return builder.build();
    }
}
