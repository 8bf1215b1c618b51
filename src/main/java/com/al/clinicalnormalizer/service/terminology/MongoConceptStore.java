package com.al.clinicalnormalizer.service.terminology;

import com.al.clinicalnormalizer.exception.ConceptStoreException;
import com.al.clinicalnormalizer.model.ConceptRecord;
import com.al.clinicalnormalizer.model.catalogue.ConceptDocument;
import com.al.clinicalnormalizer.model.catalogue.ConceptTranslationDocument;
import com.al.clinicalnormalizer.model.enums.ConceptStatus;
import com.al.clinicalnormalizer.repository.ConceptRepository;
import com.al.clinicalnormalizer.repository.ConceptTranslationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.List;
import java.util.Optional;

/**
 * Concept catalogue backed by the MongoDB collections filled by the terminology import.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoConceptStore implements ConceptStore {

    private static final String STATUS_ACTIVE = "active";

    private final ConceptRepository conceptRepository;
    private final ConceptTranslationRepository translationRepository;

    @Override
    public Optional<ConceptRecord> findConcept(String code, String codeSystemOid) {
        try {
            return conceptRepository.findFirstByCodeAndCodeSystemOidAndStatus(code, codeSystemOid, STATUS_ACTIVE)
                    .map(MongoConceptStore::toRecord);
        } catch (DataAccessException e) {
            throw new ConceptStoreException("Concept lookup failed for " + code + " in " + codeSystemOid, e);
        }
    }

    @Override
    public Optional<ConceptRecord> findConceptInValueSet(String code, String valueSetOid) {
        try {
            return conceptRepository.findFirstByCodeAndValueSetOidAndStatus(code, valueSetOid, STATUS_ACTIVE)
                    .map(MongoConceptStore::toRecord);
        } catch (DataAccessException e) {
            throw new ConceptStoreException("Value set lookup failed for " + code + " in " + valueSetOid, e);
        }
    }

    @Override
    public Optional<String> findTranslation(ConceptRecord concept, String language, String country) {
        try {
            if (country != null) {
                return translationRepository
                        .findFirstByConceptIdAndLanguageCodeAndCountryCode(concept.getId(), language, country)
                        .map(ConceptTranslationDocument::getTranslatedDisplay);
            }
            List<ConceptTranslationDocument> candidates = translationRepository
                    .findByConceptIdAndLanguageCode(concept.getId(), language);
            // Language-wide rows win over country-specific ones
            return candidates.stream()
                    .filter(t -> t.getCountryCode() == null)
                    .findFirst()
                    .or(() -> candidates.stream().findFirst())
                    .map(ConceptTranslationDocument::getTranslatedDisplay);
        } catch (DataAccessException e) {
            throw new ConceptStoreException("Translation lookup failed for concept " + concept.getId(), e);
        }
    }

    private static ConceptRecord toRecord(ConceptDocument document) {
        return ConceptRecord.builder()
                .id(document.getId())
                .code(document.getCode())
                .codeSystemOid(document.getCodeSystemOid())
                .valueSetOid(document.getValueSetOid())
                .status(ConceptStatus.fromValue(document.getStatus()))
                .defaultDisplay(document.getDisplay())
                .build();
    }
}
