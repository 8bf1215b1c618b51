package com.al.clinicalnormalizer.service.extractor.cda;

import com.al.clinicalnormalizer.exception.MalformedSourceElementException;
import com.al.clinicalnormalizer.model.ClinicalSectionEntry;
import com.al.clinicalnormalizer.model.ResolvedTerm;
import com.al.clinicalnormalizer.model.enums.ClinicalSectionType;
import com.al.clinicalnormalizer.service.terminology.TerminologyResolver;
import com.al.clinicalnormalizer.util.ClinicalVocabulary;
import com.al.clinicalnormalizer.util.DisplaySanitizer;
import com.al.clinicalnormalizer.util.MappingConstants;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Advance directives (42348-3, 75320-2): living wills, healthcare proxies, resuscitation
 * orders. The directive type is derived from the observation code; the performer named on
 * the directive is reported as the healthcare proxy.
 */
@Component
public class CdaAdvanceDirectiveExtractor extends AbstractCdaSectionExtractor {

    public CdaAdvanceDirectiveExtractor(TerminologyResolver resolver) {
        super(resolver);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.ADVANCE_DIRECTIVES;
    }

    @Override
    protected ClinicalSectionEntry toEntry(Element entry, int index, CdaSectionScope scope) {
        Element observation = CdaElements.descendants(entry, "observation").stream().findFirst()
                .orElseThrow(() -> new MalformedSourceElementException("observation",
                        "Advance directive entry has no observation"));

        Optional<Element> code = CdaElements.child(observation, "code");
        List<ResolvedTerm> concepts = resolveWithTranslations(code.orElse(null), scope);
        String textReference = CdaElements.attr(CdaElements.path(observation, "text/reference"), "value");
        String freeText = code.map(scope::originalText).orElse(null);
        if (freeText == null) {
            freeText = scope.resolveReference(textReference);
        }
        String displayText = displayText(concepts, freeText, "directive");

        String status = statusCode(observation);
        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(observation, index))
                .displayText(displayText)
                .codedConcepts(concepts)
                .category(ClinicalVocabulary.directiveType(CdaElements.attr(code, "code")).orElse(displayText))
                .clinicalStatus(status != null ? ClinicalVocabulary.eventStatusOrCode(status) : ClinicalVocabulary.ACTIVE)
                .onsetDate(onsetDate(observation))
                .recordedDate(authorTime(observation))
                .sourceReference(textReference);

        putDetail(builder, MappingConstants.DETAIL_DESCRIPTION, observationValue(observation, scope, null));
        putDetail(builder, MappingConstants.DETAIL_END_DATE, endDate(observation));
        putDetail(builder, MappingConstants.DETAIL_HEALTHCARE_PROXY, proxyName(observation));
        return builder.build();
    }

    private static String proxyName(Element observation) {
        List<Element> performers = CdaElements.descendants(observation, "performer");
        if (performers.isEmpty()) {
            return null;
        }
        List<Element> names = CdaElements.descendants(performers.get(0), "name");
        if (names.isEmpty()) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        for (Element given : CdaElements.children(names.get(0), "given")) {
            addIfPresent(parts, CdaElements.text(given));
        }
        for (Element family : CdaElements.children(names.get(0), "family")) {
            addIfPresent(parts, CdaElements.text(family));
        }
        if (parts.isEmpty()) {
            return DisplaySanitizer.sanitize(CdaElements.text(names.get(0)));
        }
        return String.join(" ", parts);
    }

    private static void addIfPresent(List<String> parts, String value) {
        if (value != null) {
            parts.add(value);
        }
    }
}
