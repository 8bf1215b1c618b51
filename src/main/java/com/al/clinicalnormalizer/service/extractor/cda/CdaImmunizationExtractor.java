package com.al.clinicalnormalizer.service.extractor.cda;

import com.al.clinicalnormalizer.exception.MalformedSourceElementException;
import com.al.clinicalnormalizer.model.ClinicalSectionEntry;
import com.al.clinicalnormalizer.model.ResolvedTerm;
import com.al.clinicalnormalizer.model.enums.ClinicalSectionType;
import com.al.clinicalnormalizer.service.terminology.TerminologyResolver;
import com.al.clinicalnormalizer.util.MappingConstants;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Optional;

@Component
public class CdaImmunizationExtractor extends AbstractCdaSectionExtractor {

    /** LOINC "Dose number" observation */
    private static final String CODE_DOSE_NUMBER = "30973-2";

    private static final String MATERIAL_PATH = "consumable/manufacturedProduct/manufacturedMaterial";

    public CdaImmunizationExtractor(TerminologyResolver resolver) {
        super(resolver);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.IMMUNIZATIONS;
    }

    @Override
    protected ClinicalSectionEntry toEntry(Element entry, int index, CdaSectionScope scope) {
        Element administration = clinicalStatement(entry, "substanceAdministration")
                .orElseThrow(() -> new MalformedSourceElementException("substanceAdministration",
                        "Immunization entry has no substanceAdministration"));

        Optional<Element> material = CdaElements.path(administration, MATERIAL_PATH);
        Optional<Element> vaccineCode = material.flatMap(m -> CdaElements.child(m, "code"));
        List<ResolvedTerm> concepts = resolveWithTranslations(vaccineCode.orElse(null), scope);

        String freeText = vaccineCode.map(scope::originalText).orElse(null);
        if (freeText == null) {
            freeText = CdaElements.text(material.flatMap(m -> CdaElements.child(m, "name")).orElse(null));
        }

        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(administration, index))
                .displayText(displayText(concepts, freeText, "vaccine"))
                .codedConcepts(concepts)
                .clinicalStatus(eventStatus(administration))
                .onsetDate(onsetDate(administration))
                .recordedDate(authorTime(administration))
                .sourceReference(CdaElements.attr(CdaElements.path(administration, "text/reference"), "value"));

        putDetail(builder, MappingConstants.DETAIL_DOSE_NUMBER, doseNumber(administration));
        putDetail(builder, MappingConstants.DETAIL_LOT_NUMBER,
                CdaElements.text(material.flatMap(m -> CdaElements.child(m, "lotNumberText")).orElse(null)));
        putDetail(builder, MappingConstants.DETAIL_ROUTE,
                displayOf(CdaElements.child(administration, "routeCode"), scope));
        return builder.build();
    }

    private static String doseNumber(Element administration) {
        String fromObservation = CdaElements.attr(relatedObservation(administration, CODE_DOSE_NUMBER)
                .flatMap(o -> CdaElements.child(o, "value")), "value");
        if (fromObservation != null) {
            return fromObservation;
        }
        return CdaElements.attr(CdaElements.child(administration, "repeatNumber"), "value");
    }
}
