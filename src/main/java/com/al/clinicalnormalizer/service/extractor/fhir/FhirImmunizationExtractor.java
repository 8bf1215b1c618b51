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
import org.hl7.fhir.r4.model.Immunization;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class FhirImmunizationExtractor extends AbstractFhirSectionExtractor<Immunization> {

    public FhirImmunizationExtractor(TerminologyResolver resolver, CodeSystemRegistry codeSystemRegistry) {
        super(resolver, codeSystemRegistry, Immunization.class);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.IMMUNIZATIONS;
    }

    @Override
    protected ClinicalSectionEntry toEntry(Immunization immunization, int index, Bundle bundle,
            ExtractionContext context) {
        List<ResolvedTerm> concepts = resolveAll(immunization.getVaccineCode(), context);

        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(immunization, index))
                .displayText(displayText(concepts, immunization.getVaccineCode(), "vaccine"))
                .codedConcepts(concepts)
                .clinicalStatus(immunization.hasStatus()
                        ? ClinicalVocabulary.eventStatusOrCode(immunization.getStatus().toCode()) : null)
                .recordedDate(FhirCodings.date(immunization.getRecordedElement()));

        if (immunization.hasOccurrenceDateTimeType()) {
            builder.onsetDate(FhirCodings.date(immunization.getOccurrenceDateTimeType()));
        }

        if (immunization.hasProtocolApplied()) {
            Immunization.ImmunizationProtocolAppliedComponent protocol = immunization.getProtocolAppliedFirstRep();
            if (protocol.hasDoseNumberPositiveIntType()) {
                putDetail(builder, MappingConstants.DETAIL_DOSE_NUMBER,
                        String.valueOf(protocol.getDoseNumberPositiveIntType().getValue()));
            } else if (protocol.hasDoseNumberStringType()) {
                putDetail(builder, MappingConstants.DETAIL_DOSE_NUMBER, protocol.getDoseNumberStringType().getValue());
            }
        }
        putDetail(builder, MappingConstants.DETAIL_LOT_NUMBER, immunization.getLotNumber());
        if (immunization.hasRoute()) {
            putDetail(builder, MappingConstants.DETAIL_ROUTE, displayOf(immunization.getRoute(), context));
        }
        addNotes(builder, immunization.getNote());
        return builder.build();
    }
}
