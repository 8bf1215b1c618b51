package com.al.clinicalnormalizer.service.terminology;

import com.al.clinicalnormalizer.model.ConceptRecord;

import java.util.Optional;

/**
 * Read-only view of the terminology catalogue. The catalogue is populated by an external
 * import process; this engine never writes to it.
 *
 * <p>
 * Implementations may throw {@link com.al.clinicalnormalizer.exception.ConceptStoreException}
 * when the backend cannot answer; the resolver turns that into a fallback term.
 */
public interface ConceptStore {

    /**
     * Exact dual-key match on code and code system OID.
     */
    Optional<ConceptRecord> findConcept(String code, String codeSystemOid);

    /**
     * Secondary lookup for documents that carry a value set OID where the code system OID
     * was expected.
     */
    Optional<ConceptRecord> findConceptInValueSet(String code, String valueSetOid);

    /**
     * Translated display for a concept.
     *
     * @param country optional; when null a language-only translation is preferred, but any
     *                translation in the language is acceptable
     */
    Optional<String> findTranslation(ConceptRecord concept, String language, String country);
}
