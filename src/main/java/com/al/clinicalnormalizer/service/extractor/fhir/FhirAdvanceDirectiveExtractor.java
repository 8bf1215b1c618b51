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
import org.hl7.fhir.r4.model.Consent;
import org.hl7.fhir.r4.model.Reference;
import org.hl7.fhir.r4.model.RelatedPerson;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Advance directives recorded as Consent. The directive is the first provision code, else
 * the first category; a RelatedPerson among the performers is the healthcare proxy.
 */
@Component
public class FhirAdvanceDirectiveExtractor extends AbstractFhirSectionExtractor<Consent> {

    public FhirAdvanceDirectiveExtractor(TerminologyResolver resolver, CodeSystemRegistry codeSystemRegistry) {
        super(resolver, codeSystemRegistry, Consent.class);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.ADVANCE_DIRECTIVES;
    }

    @Override
    protected ClinicalSectionEntry toEntry(Consent consent, int index, Bundle bundle, ExtractionContext context) {
        CodeableConcept directive = directiveConcept(consent);
        List<ResolvedTerm> concepts = resolveAll(directive, context);
        String displayText = displayText(concepts, directive, "directive");

        String start = null;
        String end = null;
        if (consent.hasProvision() && consent.getProvision().hasPeriod()) {
            start = FhirCodings.date(consent.getProvision().getPeriod().getStartElement());
            end = FhirCodings.date(consent.getProvision().getPeriod().getEndElement());
        }
        if (start == null) {
            start = FhirCodings.date(consent.getDateTimeElement());
        }

        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(consent, index))
                .displayText(displayText)
                .codedConcepts(concepts)
                .category(vocabularyValue(directive, ClinicalVocabulary::directiveType).orElse(displayText))
                .clinicalStatus(consent.hasStatus()
                        ? ClinicalVocabulary.eventStatusOrCode(consent.getStatus().toCode()) : ClinicalVocabulary.ACTIVE)
                .onsetDate(start)
                .recordedDate(FhirCodings.date(consent.getDateTimeElement()));

        if (consent.hasPolicyRule()) {
            putDetail(builder, MappingConstants.DETAIL_DESCRIPTION, displayOf(consent.getPolicyRule(), context));
        }
        putDetail(builder, MappingConstants.DETAIL_END_DATE, end);
        putDetail(builder, MappingConstants.DETAIL_HEALTHCARE_PROXY, proxyName(consent, bundle));
        return builder.build();
    }

    private static CodeableConcept directiveConcept(Consent consent) {
        if (consent.hasProvision() && consent.getProvision().hasCode()) {
            return consent.getProvision().getCodeFirstRep();
        }
        return consent.hasCategory() ? consent.getCategoryFirstRep() : null;
    }

    private static String proxyName(Consent consent, Bundle bundle) {
        for (Reference performer : consent.getPerformer()) {
            Optional<RelatedPerson> person = referencedResource(consent, performer, bundle, RelatedPerson.class);
            boolean relatedPerson = person.isPresent()
                    || "RelatedPerson".equals(performer.getReferenceElement().getResourceType());
            if (!relatedPerson) {
                continue;
            }
            if (performer.hasDisplay()) {
                return DisplaySanitizer.sanitize(performer.getDisplay());
            }
            if (person.isPresent() && person.get().hasName()) {
                return DisplaySanitizer.sanitize(person.get().getNameFirstRep().getNameAsSingleString());
            }
        }
        return null;
    }
}
