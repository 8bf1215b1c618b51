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
import java.util.Map;
import java.util.Optional;

/**
 * Allergies and intolerances from the CDA section 48765-2.
 *
 * <p>
 * Structure handled:
 * <pre>
 * entry/act/entryRelationship/observation
 *   value                                  allergy type
 *   participant/participantRole/playingEntity/code   allergen (primary code)
 *   entryRelationship[MFST]/observation/value        reactions
 *   entryRelationship/observation[code=SEV]          severity
 *   entryRelationship/observation[code=82606-5]      criticality
 *   entryRelationship/observation[code=33999-4]      clinical status
 *   entryRelationship/observation[code=66455-7]      certainty
 * </pre>
 */
@Component
public class CdaAllergyExtractor extends AbstractCdaSectionExtractor {

    // SNOMED CT allergy/intolerance types mapped to FHIR AllergyIntolerance categories
    private static final Map<String, String> CATEGORY_BY_TYPE = Map.of(
            "414285001", "food",
            "235719002", "food",
            "416098002", "medication",
            "59037007", "medication",
            "419511003", "medication",
            "426232007", "environment",
            "232347008", "environment");

    public CdaAllergyExtractor(TerminologyResolver resolver) {
        super(resolver);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.ALLERGIES;
    }

    @Override
    protected ClinicalSectionEntry toEntry(Element entry, int index, CdaSectionScope scope) {
        Element observation = clinicalStatement(entry, "observation")
                .orElseThrow(() -> new MalformedSourceElementException("observation",
                        "Allergy entry has no observation"));
        Optional<Element> act = CdaElements.child(entry, "act");

        Optional<Element> playingEntity = CdaElements.path(observation, "participant/participantRole/playingEntity");
        Optional<Element> allergenCode = playingEntity.flatMap(e -> CdaElements.child(e, "code"));
        List<ResolvedTerm> concepts = new ArrayList<>(
                resolveWithTranslations(allergenCode.orElse(null), scope));

        String freeText = allergenCode.map(scope::originalText)
                .orElseGet(() -> CdaElements.text(playingEntity.flatMap(e -> CdaElements.child(e, "name"))
                        .orElse(null)));
        if (freeText == null) {
            freeText = scope.resolveReference(
                    CdaElements.attr(CdaElements.path(observation, "text/reference"), "value"));
        }
        String displayText = displayText(concepts, freeText, "allergen");

        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(act.orElse(observation), index))
                .displayText(displayText)
                .onsetDate(onsetDate(observation))
                .recordedDate(authorTime(act.orElse(observation)))
                .category(category(observation, scope))
                .sourceReference(CdaElements.attr(CdaElements.path(observation, "text/reference"), "value"));

        // Reactions and their severity
        List<String> reactions = new ArrayList<>();
        String severity = null;
        for (Element reaction : relatedObservations(observation, "MFST")) {
            List<ResolvedTerm> manifestation = resolveWithTranslations(
                    CdaElements.child(reaction, "value").orElse(null), scope);
            if (!manifestation.isEmpty()) {
                concepts.add(manifestation.get(0));
                reactions.add(manifestation.get(0).getDisplay());
            }
            if (severity == null) {
                severity = severityOf(reaction, scope);
            }
        }
        if (severity == null) {
            severity = severityOf(observation, scope);
        }
        builder.severity(severity);
        putDetail(builder, MappingConstants.DETAIL_REACTION, reactions.isEmpty() ? null : String.join("; ", reactions));

        putDetail(builder, MappingConstants.DETAIL_CRITICALITY, vocabularyDisplay(
                relatedValue(observation, MappingConstants.CODE_CRITICALITY_OBSERVATION), scope,
                ClinicalVocabulary::criticality));
        builder.clinicalStatus(concernClinicalStatus(observation, act,
                MappingConstants.CODE_ALLERGY_STATUS_OBSERVATION, scope));
        builder.verificationStatus(verificationStatus(observation, scope));

        String endDate = endDate(observation);
        putDetail(builder, MappingConstants.DETAIL_END_DATE, endDate);

        return builder.codedConcepts(concepts).build();
    }

    private String category(Element observation, CdaSectionScope scope) {
        Optional<Element> type = CdaElements.child(observation, "value");
        String typeCode = CdaElements.attr(type, "code");
        if (typeCode != null && CATEGORY_BY_TYPE.containsKey(typeCode)) {
            return CATEGORY_BY_TYPE.get(typeCode);
        }
        return displayOf(type, scope);
    }

    private String severityOf(Element observation, CdaSectionScope scope) {
        return vocabularyDisplay(relatedValue(observation, MappingConstants.CODE_SEVERITY_OBSERVATION), scope,
                ClinicalVocabulary::severity);
    }
}
