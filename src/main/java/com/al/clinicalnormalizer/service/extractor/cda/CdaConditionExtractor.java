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

import java.util.List;
import java.util.Optional;

/**
 * Problem list (11450-4) and history of past illness (11348-0). The problem itself is
 * the observation {@code value}; the concern act carries the status and dates when the
 * observation does not.
 */
@Component
public class CdaConditionExtractor extends AbstractCdaSectionExtractor {

    public CdaConditionExtractor(TerminologyResolver resolver) {
        super(resolver);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.CONDITIONS;
    }

    @Override
    protected ClinicalSectionEntry toEntry(Element entry, int index, CdaSectionScope scope) {
        Element observation = clinicalStatement(entry, "observation")
                .orElseThrow(() -> new MalformedSourceElementException("observation",
                        "Problem entry has no observation"));
        Optional<Element> act = CdaElements.child(entry, "act");

        Optional<Element> value = CdaElements.child(observation, "value");
        List<ResolvedTerm> concepts = resolveWithTranslations(value.orElse(null), scope);

        String textReference = CdaElements.attr(CdaElements.path(observation, "text/reference"), "value");
        String freeText = value.map(scope::originalText).orElse(null);
        if (freeText == null) {
            freeText = scope.resolveReference(textReference);
        }

        String onset = onsetDate(observation);
        if (onset == null) {
            onset = act.map(AbstractCdaSectionExtractor::onsetDate).orElse(null);
        }
        String recorded = authorTime(observation);
        if (recorded == null) {
            recorded = act.map(AbstractCdaSectionExtractor::authorTime).orElse(null);
        }

        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(act.orElse(observation), index))
                .displayText(displayText(concepts, freeText, "problem"))
                .codedConcepts(concepts)
                .clinicalStatus(concernClinicalStatus(observation, act,
                        MappingConstants.CODE_PROBLEM_STATUS_OBSERVATION, scope))
                .verificationStatus(verificationStatus(observation, scope))
                .severity(vocabularyDisplay(relatedValue(observation, MappingConstants.CODE_SEVERITY_OBSERVATION),
                        scope, ClinicalVocabulary::severity))
                .onsetDate(onset)
                .recordedDate(recorded)
                .sourceReference(textReference);

        String abatement = endDate(observation);
        putDetail(builder, MappingConstants.DETAIL_ABATEMENT_DATE,
                abatement != null ? abatement : act.map(AbstractCdaSectionExtractor::endDate).orElse(null));
        putDetail(builder, MappingConstants.DETAIL_BODY_SITE, displayOf(CdaElements.child(observation, "targetSiteCode"), scope));
        return builder.build();
    }
}
