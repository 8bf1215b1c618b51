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
 * Social history (29762-2, 10164-2): smoking, alcohol, substance use, occupation and
 * other lifestyle observations. The observation code names what was recorded, the value
 * holds the finding.
 */
@Component
public class CdaSocialHistoryExtractor extends AbstractCdaSectionExtractor {

    public CdaSocialHistoryExtractor(TerminologyResolver resolver) {
        super(resolver);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.SOCIAL_HISTORY;
    }

    @Override
    protected ClinicalSectionEntry toEntry(Element entry, int index, CdaSectionScope scope) {
        Element observation = CdaElements.descendants(entry, "observation").stream().findFirst()
                .orElseThrow(() -> new MalformedSourceElementException("observation",
                        "Social history entry has no observation"));

        Optional<Element> code = CdaElements.child(observation, "code");
        List<ResolvedTerm> concepts = new ArrayList<>(resolveWithTranslations(code.orElse(null), scope));
        String textReference = CdaElements.attr(CdaElements.path(observation, "text/reference"), "value");
        String freeText = code.map(scope::originalText).orElse(null);
        if (freeText == null) {
            freeText = scope.resolveReference(textReference);
        }
        String displayText = displayText(concepts, freeText, "social history observation");

        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(observation, index))
                .displayText(displayText)
                .category(ClinicalVocabulary.socialHistoryCategory(CdaElements.attr(code, "code"))
                        .orElse(displayText))
                .clinicalStatus(eventStatus(observation))
                .onsetDate(onsetDate(observation))
                .recordedDate(authorTime(observation))
                .sourceReference(textReference);

        putDetail(builder, MappingConstants.DETAIL_VALUE, observationValue(observation, scope, concepts));
        putDetail(builder, MappingConstants.DETAIL_END_DATE, endDate(observation));
        return builder.codedConcepts(concepts).build();
    }
}
