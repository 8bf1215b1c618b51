package com.al.clinicalnormalizer.repository;

import com.al.clinicalnormalizer.model.catalogue.ConceptDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ConceptRepository extends MongoRepository<ConceptDocument, String> {
    Optional<ConceptDocument> findFirstByCodeAndCodeSystemOidAndStatus(String code, String codeSystemOid,
            String status);

    Optional<ConceptDocument> findFirstByCodeAndValueSetOidAndStatus(String code, String valueSetOid, String status);
}
