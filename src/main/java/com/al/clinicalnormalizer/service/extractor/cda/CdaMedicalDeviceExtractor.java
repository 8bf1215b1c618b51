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
 * Medical devices and implants (46264-8).
 *
 * <p>
 * Structure handled:
 * <pre>
 * entry/supply
 *   effectiveTime/low, high                                   implant and removal dates
 *   participant[DEV]/participantRole/id                       device identifier
 *   participant[DEV]/participantRole/playingDevice/code       device type (primary code)
 * </pre>
 * A device without status code is active until a removal date is recorded.
 */
@Component
public class CdaMedicalDeviceExtractor extends AbstractCdaSectionExtractor {

    public CdaMedicalDeviceExtractor(TerminologyResolver resolver) {
        super(resolver);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.MEDICAL_DEVICES;
    }

    @Override
    protected ClinicalSectionEntry toEntry(Element entry, int index, CdaSectionScope scope) {
        Element supply = CdaElements.descendants(entry, "supply").stream().findFirst()
                .orElseThrow(() -> new MalformedSourceElementException("supply", "Device entry has no supply"));
        Optional<Element> role = deviceRole(supply);
        Optional<Element> deviceCode = role.flatMap(r -> CdaElements.path(r, "playingDevice/code"));

        List<ResolvedTerm> concepts = resolveWithTranslations(deviceCode.orElse(null), scope);
        String freeText = deviceCode.map(scope::originalText).orElse(null);
        if (freeText == null) {
            freeText = CdaElements.text(role.flatMap(r -> CdaElements.path(r, "playingDevice/manufacturerModelName"))
                    .orElse(null));
        }

        String removal = endDate(supply);
        String status = statusCode(supply);
        if (status == null) {
            status = removal != null ? ClinicalVocabulary.COMPLETED : ClinicalVocabulary.ACTIVE;
        } else {
            status = ClinicalVocabulary.eventStatusOrCode(status);
        }

        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(supply, index))
                .displayText(displayText(concepts, freeText, "device"))
                .codedConcepts(concepts)
                .clinicalStatus(status)
                .onsetDate(onsetDate(supply))
                .recordedDate(authorTime(supply))
                .sourceReference(CdaElements.attr(CdaElements.path(supply, "text/reference"), "value"));

        putDetail(builder, MappingConstants.DETAIL_DEVICE_ID,
                CdaElements.attr(role.flatMap(r -> CdaElements.child(r, "id")), "extension"));
        putDetail(builder, MappingConstants.DETAIL_END_DATE, removal);
        return builder.build();
    }

    private static Optional<Element> deviceRole(Element supply) {
        for (Element participant : CdaElements.children(supply, "participant")) {
            if ("DEV".equals(CdaElements.attr(participant, "typeCode"))) {
                return CdaElements.child(participant, "participantRole");
            }
        }
        return Optional.empty();
    }
}
