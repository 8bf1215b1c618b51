package com.al.clinicalnormalizer.service.extractor.cda;

import com.al.clinicalnormalizer.exception.MalformedSourceElementException;
import com.al.clinicalnormalizer.model.ClinicalSectionEntry;
import com.al.clinicalnormalizer.model.ResolvedTerm;
import com.al.clinicalnormalizer.model.enums.ClinicalSectionType;
import com.al.clinicalnormalizer.service.terminology.TerminologyResolver;
import com.al.clinicalnormalizer.util.MappingConstants;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * History of pregnancies (10162-6, 10155-0).
 *
 * <p>
 * A coded observation value is the pregnancy outcome and becomes the primary concept,
 * followed by the observation code. Otherwise the code is primary and the value is kept
 * as a detail. Gestational age and birth weight come from nested observations.
 */
@Component
public class CdaPregnancyHistoryExtractor extends AbstractCdaSectionExtractor {

    public CdaPregnancyHistoryExtractor(TerminologyResolver resolver) {
        super(resolver);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.PREGNANCY_HISTORY;
    }

    @Override
    protected ClinicalSectionEntry toEntry(Element entry, int index, CdaSectionScope scope) {
        Element observation = CdaElements.descendants(entry, "observation").stream().findFirst()
                .orElseThrow(() -> new MalformedSourceElementException("observation",
                        "Pregnancy entry has no observation"));

        Optional<Element> code = CdaElements.child(observation, "code");
        Optional<Element> value = CdaElements.child(observation, "value");
        boolean codedOutcome = CdaElements.attr(value, "code") != null;

        List<ResolvedTerm> concepts = new ArrayList<>();
        String freeText;
        if (codedOutcome) {
            concepts.addAll(resolveWithTranslations(value.get(), scope));
            freeText = scope.originalText(value.get());
        } else {
            freeText = code.map(scope::originalText).orElse(null);
        }
        concepts.addAll(resolveWithTranslations(code.orElse(null), scope));
        String textReference = CdaElements.attr(CdaElements.path(observation, "text/reference"), "value");
        if (freeText == null) {
            freeText = scope.resolveReference(textReference);
        }

        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(observation, index))
                .displayText(displayText(concepts, freeText, "pregnancy"))
                .codedConcepts(concepts)
                .clinicalStatus(eventStatus(observation))
                .onsetDate(onsetDate(observation))
                .recordedDate(authorTime(observation))
                .sourceReference(textReference);

        if (!codedOutcome) {
            putDetail(builder, MappingConstants.DETAIL_VALUE, observationValue(observation, scope, null));
        }
        putDetail(builder, MappingConstants.DETAIL_GESTATIONAL_AGE,
                relatedQuantity(observation, MappingConstants.CODES_GESTATIONAL_AGE));
        putDetail(builder, MappingConstants.DETAIL_BIRTH_WEIGHT,
                relatedQuantity(observation, MappingConstants.CODES_BIRTH_WEIGHT));
        return builder.build();
    }

    private static String relatedQuantity(Element observation, Set<String> codes) {
        for (String code : codes) {
            Optional<Element> value = relatedValue(observation, code);
            if (value.isPresent()) {
                return quantity(value);
            }
        }
        return null;
    }
}
