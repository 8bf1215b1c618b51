package com.al.clinicalnormalizer.service.extractor.fhir;

import com.al.clinicalnormalizer.model.ClinicalSectionEntry;
import com.al.clinicalnormalizer.model.ResolvedTerm;
import com.al.clinicalnormalizer.model.enums.ClinicalSectionType;
import com.al.clinicalnormalizer.service.extractor.ExtractionContext;
import com.al.clinicalnormalizer.service.terminology.CodeSystemRegistry;
import com.al.clinicalnormalizer.service.terminology.TerminologyResolver;
import com.al.clinicalnormalizer.util.ClinicalVocabulary;
import com.al.clinicalnormalizer.util.DisplaySanitizer;
import com.al.clinicalnormalizer.util.MappingConstants;
import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.DomainResource;
import org.hl7.fhir.r4.model.Dosage;
import org.hl7.fhir.r4.model.Medication;
import org.hl7.fhir.r4.model.MedicationRequest;
import org.hl7.fhir.r4.model.MedicationStatement;
import org.hl7.fhir.r4.model.Reference;
import org.hl7.fhir.r4.model.Type;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Medication summary from MedicationStatement and MedicationRequest resources. A
 * {@code medicationReference} is followed to a contained or bundled Medication.
 */
@Component
public class FhirMedicationExtractor extends AbstractFhirSectionExtractor<DomainResource> {

    public FhirMedicationExtractor(TerminologyResolver resolver, CodeSystemRegistry codeSystemRegistry) {
        super(resolver, codeSystemRegistry, DomainResource.class);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.MEDICATIONS;
    }

    @Override
    protected ClinicalSectionEntry toEntry(DomainResource resource, int index, Bundle bundle,
            ExtractionContext context) {
        if (resource instanceof MedicationStatement) {
            return fromStatement((MedicationStatement) resource, index, bundle, context);
        }
        return fromRequest((MedicationRequest) resource, index, bundle, context);
    }

    private ClinicalSectionEntry fromStatement(MedicationStatement statement, int index, Bundle bundle,
            ExtractionContext context) {
        Optional<Medication> medication = referencedMedication(statement, statement.getMedication(), bundle);
        CodeableConcept code = medicationCode(statement.getMedication(), medication);
        List<ResolvedTerm> concepts = resolveAll(code, context);

        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(statement, index))
                .displayText(displayText(concepts, code, "medication"))
                .codedConcepts(concepts)
                .clinicalStatus(statement.hasStatus()
                        ? ClinicalVocabulary.eventStatusOrCode(statement.getStatus().toCode()) : null)
                .recordedDate(FhirCodings.date(statement.getDateAssertedElement()));

        if (statement.hasEffectiveDateTimeType()) {
            builder.onsetDate(FhirCodings.date(statement.getEffectiveDateTimeType()));
        } else if (statement.hasEffectivePeriod()) {
            builder.onsetDate(FhirCodings.date(statement.getEffectivePeriod().getStartElement()));
            putDetail(builder, MappingConstants.DETAIL_END_DATE,
                    FhirCodings.date(statement.getEffectivePeriod().getEndElement()));
        }
        if (statement.hasDosage()) {
            addDosage(builder, statement.getDosageFirstRep(), context);
        }
        medication.ifPresent(m -> putDetail(builder, MappingConstants.DETAIL_DOSE_FORM, displayOf(m.getForm(), context)));
        addNotes(builder, statement.getNote());
        return builder.build();
    }

    private ClinicalSectionEntry fromRequest(MedicationRequest request, int index, Bundle bundle,
            ExtractionContext context) {
        Optional<Medication> medication = referencedMedication(request, request.getMedication(), bundle);
        CodeableConcept code = medicationCode(request.getMedication(), medication);
        List<ResolvedTerm> concepts = resolveAll(code, context);

        String authoredOn = FhirCodings.date(request.getAuthoredOnElement());
        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(request, index))
                .displayText(displayText(concepts, code, "medication"))
                .codedConcepts(concepts)
                .clinicalStatus(request.hasStatus()
                        ? ClinicalVocabulary.eventStatusOrCode(request.getStatus().toCode()) : null)
                .onsetDate(authoredOn)
                .recordedDate(authoredOn);

        if (request.hasDosageInstruction()) {
            addDosage(builder, request.getDosageInstructionFirstRep(), context);
        }
        medication.ifPresent(m -> putDetail(builder, MappingConstants.DETAIL_DOSE_FORM, displayOf(m.getForm(), context)));
        addNotes(builder, request.getNote());
        return builder.build();
    }

    private void addDosage(ClinicalSectionEntry.ClinicalSectionEntryBuilder builder, Dosage dosage,
            ExtractionContext context) {
        if (dosage.hasRoute()) {
            putDetail(builder, MappingConstants.DETAIL_ROUTE, displayOf(dosage.getRoute(), context));
        }
        String dose = null;
        if (dosage.hasDoseAndRate() && dosage.getDoseAndRateFirstRep().hasDoseQuantity()) {
            dose = FhirCodings.quantity(dosage.getDoseAndRateFirstRep().getDoseQuantity());
        }
        if (dose == null && dosage.hasText()) {
            dose = DisplaySanitizer.sanitize(dosage.getText());
        } else if (dosage.hasText()) {
            builder.note(DisplaySanitizer.sanitize(dosage.getText()));
        }
        putDetail(builder, MappingConstants.DETAIL_DOSAGE, dose);
    }

    private static CodeableConcept medicationCode(Type medication, Optional<Medication> referenced) {
        if (medication instanceof CodeableConcept) {
            return (CodeableConcept) medication;
        }
        return referenced.map(Medication::getCode).orElse(null);
    }

    private static Optional<Medication> referencedMedication(DomainResource owner, Type medication, Bundle bundle) {
        if (!(medication instanceof Reference)) {
            return Optional.empty();
        }
        return referencedResource(owner, (Reference) medication, bundle, Medication.class);
    }
}
