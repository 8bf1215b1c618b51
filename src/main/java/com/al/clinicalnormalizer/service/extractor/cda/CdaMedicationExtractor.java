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

/**
 * Medication summary (10160-0): one {@code substanceAdministration} per entry, the product
 * under {@code consumable/manufacturedProduct/manufacturedMaterial}.
 */
@Component
public class CdaMedicationExtractor extends AbstractCdaSectionExtractor {

    private static final String MATERIAL_PATH = "consumable/manufacturedProduct/manufacturedMaterial";

    public CdaMedicationExtractor(TerminologyResolver resolver) {
        super(resolver);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.MEDICATIONS;
    }

    @Override
    protected ClinicalSectionEntry toEntry(Element entry, int index, CdaSectionScope scope) {
        Element administration = clinicalStatement(entry, "substanceAdministration")
                .orElseThrow(() -> new MalformedSourceElementException("substanceAdministration",
                        "Medication entry has no substanceAdministration"));

        Optional<Element> material = CdaElements.path(administration, MATERIAL_PATH);
        Optional<Element> productCode = material.flatMap(m -> CdaElements.child(m, "code"));
        List<ResolvedTerm> concepts = resolveWithTranslations(productCode.orElse(null), scope);

        String freeText = productCode.map(scope::originalText).orElse(null);
        if (freeText == null) {
            freeText = CdaElements.text(material.flatMap(m -> CdaElements.child(m, "name")).orElse(null));
        }

        String displayText = displayText(concepts, freeText, "medication");
        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(administration, index))
                .displayText(displayText)
                .codedConcepts(concepts)
                .clinicalStatus(eventStatus(administration))
                .onsetDate(onsetDate(administration))
                .recordedDate(authorTime(administration))
                .sourceReference(CdaElements.attr(CdaElements.path(administration, "text/reference"), "value"));

        putDetail(builder, MappingConstants.DETAIL_ROUTE,
                displayOf(CdaElements.child(administration, "routeCode"), scope));
        putDetail(builder, MappingConstants.DETAIL_DOSAGE, dosage(administration));
        putDetail(builder, MappingConstants.DETAIL_DOSE_FORM,
                displayOf(material.flatMap(m -> CdaElements.child(m, "formCode")), scope));
        putDetail(builder, MappingConstants.DETAIL_END_DATE, endDate(administration));

        String instructions = scope.resolveReference(
                CdaElements.attr(CdaElements.path(administration, "text/reference"), "value"));
        if (instructions != null && !instructions.equals(displayText)) {
            builder.note(instructions);
        }
        return builder.build();
    }

    private static String dosage(Element administration) {
        Optional<Element> dose = CdaElements.child(administration, "doseQuantity");
        String single = quantity(dose);
        if (single != null) {
            return single;
        }
        String low = quantity(dose.flatMap(d -> CdaElements.child(d, "low")));
        String high = quantity(dose.flatMap(d -> CdaElements.child(d, "high")));
        if (low != null && high != null) {
            return low + " - " + high;
        }
        return low != null ? low : high;
    }
}
