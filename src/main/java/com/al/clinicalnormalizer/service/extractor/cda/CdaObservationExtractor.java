package com.al.clinicalnormalizer.service.extractor.cda;

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

/**
 * Results (30954-2) and vital signs (8716-3). Results are often grouped in an
 * {@code organizer}; every component observation becomes its own entry.
 */
@Component
public class CdaObservationExtractor extends AbstractCdaSectionExtractor {

    public CdaObservationExtractor(TerminologyResolver resolver) {
        super(resolver);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.OBSERVATIONS;
    }

    @Override
    protected List<Element> entryElements(Element section) {
        List<Element> observations = new ArrayList<>();
        for (Element entry : CdaElements.children(section, "entry")) {
            Optional<Element> organizer = CdaElements.child(entry, "organizer");
            if (organizer.isPresent()) {
                for (Element component : CdaElements.children(organizer.get(), "component")) {
                    CdaElements.child(component, "observation").ifPresent(observations::add);
                }
            } else {
                // Keep the entry itself so that an empty entry is reported as malformed
                observations.add(CdaElements.child(entry, "observation").orElse(entry));
            }
        }
        return observations;
    }

    @Override
    protected ClinicalSectionEntry toEntry(Element observation, int index, CdaSectionScope scope) {
        Optional<Element> code = CdaElements.child(observation, "code");
        List<ResolvedTerm> concepts = resolveWithTranslations(code.orElse(null), scope);

        String textReference = CdaElements.attr(CdaElements.path(observation, "text/reference"), "value");
        String freeText = code.map(scope::originalText).orElse(null);
        if (freeText == null) {
            freeText = scope.resolveReference(textReference);
        }

        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(observation, index))
                .displayText(displayText(concepts, freeText, "observation"))
                .codedConcepts(concepts)
                .clinicalStatus(eventStatus(observation))
                .onsetDate(onsetDate(observation))
                .recordedDate(authorTime(observation))
                .sourceReference(textReference);

        putDetail(builder, MappingConstants.DETAIL_VALUE, observationValue(observation, scope, null));
        putDetail(builder, MappingConstants.DETAIL_INTERPRETATION,
                displayOf(CdaElements.child(observation, "interpretationCode"), scope));
        return builder.build();
    }
}
