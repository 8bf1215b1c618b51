package com.al.clinicalnormalizer.service.extractor.cda;

import com.al.clinicalnormalizer.exception.MalformedSourceElementException;
import com.al.clinicalnormalizer.model.ClinicalSectionEntry;
import com.al.clinicalnormalizer.model.ResolvedTerm;
import com.al.clinicalnormalizer.model.enums.ClinicalSectionType;
import com.al.clinicalnormalizer.service.terminology.TerminologyResolver;
import com.al.clinicalnormalizer.util.ClinicalVocabulary;
import com.al.clinicalnormalizer.util.MappingConstants;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Functional status (47420-5, 47109-7). A quantity value is an assessment score, any
 * other value the functional level, from which the degree of independence is read.
 */
@Component
public class CdaFunctionalStatusExtractor extends AbstractCdaSectionExtractor {

    public CdaFunctionalStatusExtractor(TerminologyResolver resolver) {
        super(resolver);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.FUNCTIONAL_STATUS;
    }

    @Override
    protected ClinicalSectionEntry toEntry(Element entry, int index, CdaSectionScope scope) {
        Element observation = CdaElements.descendants(entry, "observation").stream().findFirst()
                .orElseThrow(() -> new MalformedSourceElementException("observation",
                        "Functional status entry has no observation"));

        Optional<Element> code = CdaElements.child(observation, "code");
        List<ResolvedTerm> concepts = new ArrayList<>(resolveWithTranslations(code.orElse(null), scope));
        String textReference = CdaElements.attr(CdaElements.path(observation, "text/reference"), "value");
        String freeText = code.map(scope::originalText).orElse(null);
        if (freeText == null) {
            freeText = scope.resolveReference(textReference);
        }
        String displayText = displayText(concepts, freeText, "functional assessment");

        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(observation, index))
                .displayText(displayText)
                .category(ClinicalVocabulary.functionalCategory(CdaElements.attr(code, "code")).orElse(displayText))
                .clinicalStatus(eventStatus(observation))
                .onsetDate(onsetDate(observation))
                .recordedDate(authorTime(observation))
                .sourceReference(textReference);

        Optional<Element> value = CdaElements.child(observation, "value");
        String score = quantity(value);
        if (score != null) {
            putDetail(builder, MappingConstants.DETAIL_SCORE, score);
        } else {
            String level = observationValue(observation, scope, concepts);
            putDetail(builder, MappingConstants.DETAIL_LEVEL, level);
            ClinicalVocabulary.independence(level).ifPresent(independence -> {
                builder.detail(MappingConstants.DETAIL_INDEPENDENCE, independence);
                ClinicalVocabulary.assistanceRequired(independence)
                        .ifPresent(assistance -> builder.detail(MappingConstants.DETAIL_ASSISTANCE, assistance));
            });
        }
        return builder.codedConcepts(concepts).build();
    }
}
