package com.al.clinicalnormalizer.repository;

import com.al.clinicalnormalizer.model.catalogue.ConceptTranslationDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ConceptTranslationRepository extends MongoRepository<ConceptTranslationDocument, String> {
    Optional<ConceptTranslationDocument> findFirstByConceptIdAndLanguageCodeAndCountryCode(String conceptId,
            String languageCode, String countryCode);

    List<ConceptTranslationDocument> findByConceptIdAndLanguageCode(String conceptId, String languageCode);
}
