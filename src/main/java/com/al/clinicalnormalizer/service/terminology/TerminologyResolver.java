package com.al.clinicalnormalizer.service.terminology;

import com.al.clinicalnormalizer.config.NormalizerProperties;
import com.al.clinicalnormalizer.exception.CacheBackendUnavailableException;
import com.al.clinicalnormalizer.model.ClinicalCode;
import com.al.clinicalnormalizer.model.ConceptRecord;
import com.al.clinicalnormalizer.model.ResolvedTerm;
import com.al.clinicalnormalizer.model.enums.FallbackReason;
import com.al.clinicalnormalizer.model.enums.Provenance;
import com.al.clinicalnormalizer.service.extractor.ExtractionContext;
import com.al.clinicalnormalizer.util.DisplaySanitizer;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns (code, code system) pairs into display text in the requested language.
 *
 * <p>
 * Resolution order for a cache miss:
 * <ol>
 * <li>code system not registered: fallback, {@link FallbackReason#UNSUPPORTED_CODE_SYSTEM}</li>
 * <li>active concept by code and system, then by code and value set</li>
 * <li>translation for language and country, then for the language alone</li>
 * <li>the concept's default display</li>
 * <li>otherwise the fallback text {@code Code: <code> (System: <oid>)}</li>
 * </ol>
 * Every failure degrades to a fallback term; {@link #resolve} never throws.
 */
@Slf4j
@Service
public class TerminologyResolver {

    private static final String RESOLUTION_METRIC = "terminology.resolution";

    private final CodeSystemRegistry codeSystemRegistry;
    private final ConceptStore conceptStore;
    private final TerminologyCache cache;
    private final MeterRegistry meterRegistry;
    private final NormalizerProperties properties;

    public TerminologyResolver(CodeSystemRegistry codeSystemRegistry, ConceptStore conceptStore,
            TerminologyCache cache, MeterRegistry meterRegistry, NormalizerProperties properties) {
        this.codeSystemRegistry = codeSystemRegistry;
        this.conceptStore = conceptStore;
        this.cache = cache;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
    }

    /**
     * Resolve a code that carries no usable source display.
     *
     * @param language ISO 639-1 language; the configured target language when null
     * @param country  optional ISO 3166-1 country
     */
    public ResolvedTerm resolve(String code, String codeSystemOid, String language, String country) {
        String normalizedCode = trimToNull(code);
        String normalizedOid = trimToNull(codeSystemOid);
        if (normalizedCode == null || normalizedOid == null) {
            return record(fallback(normalizedCode, normalizedOid, FallbackReason.CONCEPT_NOT_FOUND));
        }

        String lang = trimToNull(language) != null ? language.trim().toLowerCase() : properties.getTargetLanguage();
        String ctry = trimToNull(country) != null ? country.trim().toUpperCase() : null;
        TerminologyCacheKey key = new TerminologyCacheKey(normalizedOid, normalizedCode, lang, ctry);

        ResolvedTerm term;
        try {
            term = cache.getOrCompute(key, () -> lookup(key));
        } catch (CacheBackendUnavailableException e) {
            log.warn("Terminology cache unavailable, resolving {} directly: {}", key.asString(), e.getMessage());
            term = lookup(key);
        } catch (RuntimeException e) {
            log.error("Unexpected failure resolving {}", key.asString(), e);
            term = fallback(normalizedCode, normalizedOid, FallbackReason.LOOKUP_FAILED);
        }
        return record(term);
    }

    /**
     * Resolve a code found in a document. A non-empty source display always wins and the
     * catalogue is not consulted.
     */
    public ResolvedTerm resolveCode(ClinicalCode clinicalCode, ExtractionContext context) {
        String sourceDisplay = DisplaySanitizer.sanitize(clinicalCode.getSourceDisplay());
        if (sourceDisplay != null) {
            return record(ResolvedTerm.builder()
                    .code(clinicalCode.getCode())
                    .codeSystemOid(clinicalCode.getCodeSystemOid())
                    .codeSystemName(codeSystemRegistry.lookup(clinicalCode.getCodeSystemOid()))
                    .display(sourceDisplay)
                    .provenance(Provenance.SOURCE_DISPLAY)
                    .build());
        }
        return resolve(clinicalCode.getCode(), clinicalCode.getCodeSystemOid(),
                context != null ? context.getLanguage() : null,
                context != null ? context.getCountry() : null);
    }

    /**
     * Drop every cached resolution, e.g. after the catalogue was re-imported.
     */
    public void invalidateCache() {
        try {
            cache.invalidateAll();
        } catch (CacheBackendUnavailableException e) {
            log.warn("Could not invalidate terminology cache: {}", e.getMessage());
        }
    }

    private ResolvedTerm lookup(TerminologyCacheKey key) {
        String code = key.getCode();
        String oid = key.getCodeSystemOid();

        if (!codeSystemRegistry.isRegistered(oid)) {
            log.debug("Code system {} is not registered, code {} left unresolved", oid, code);
            return fallback(code, oid, FallbackReason.UNSUPPORTED_CODE_SYSTEM);
        }

        try {
            Optional<ConceptRecord> concept = conceptStore.findConcept(code, oid)
                    .filter(ConceptRecord::isActive);
            if (concept.isEmpty()) {
                concept = conceptStore.findConceptInValueSet(code, oid).filter(ConceptRecord::isActive);
            }
            if (concept.isEmpty()) {
                log.debug("No active concept for {} in {}", code, oid);
                return fallback(code, oid, FallbackReason.CONCEPT_NOT_FOUND);
            }
            return fromConcept(concept.get(), key);
        } catch (RuntimeException e) {
            log.warn("Catalogue lookup failed for {} in {}: {}", code, oid, e.getMessage());
            return fallback(code, oid, FallbackReason.LOOKUP_FAILED);
        }
    }

    private ResolvedTerm fromConcept(ConceptRecord concept, TerminologyCacheKey key) {
        Optional<String> translation = Optional.empty();
        if (key.getCountry() != null) {
            translation = conceptStore.findTranslation(concept, key.getLanguage(), key.getCountry())
                    .map(DisplaySanitizer::sanitize);
        }
        if (translation.isEmpty()) {
            translation = conceptStore.findTranslation(concept, key.getLanguage(), null)
                    .map(DisplaySanitizer::sanitize);
        }
        if (translation.isPresent()) {
            return term(key, translation.get(), Provenance.TRANSLATION);
        }

        String defaultDisplay = DisplaySanitizer.sanitize(concept.getDefaultDisplay());
        if (defaultDisplay != null) {
            return term(key, defaultDisplay, Provenance.DEFAULT_DISPLAY);
        }
        log.debug("Concept {} has no usable display", concept.getId());
        return fallback(key.getCode(), key.getCodeSystemOid(), FallbackReason.CONCEPT_NOT_FOUND);
    }

    private ResolvedTerm term(TerminologyCacheKey key, String display, Provenance provenance) {
        return ResolvedTerm.builder()
                .code(key.getCode())
                .codeSystemOid(key.getCodeSystemOid())
                .codeSystemName(codeSystemRegistry.lookup(key.getCodeSystemOid()))
                .display(display)
                .provenance(provenance)
                .build();
    }

    private ResolvedTerm fallback(String code, String oid, FallbackReason reason) {
        return ResolvedTerm.builder()
                .code(code)
                .codeSystemOid(oid)
                .codeSystemName(codeSystemRegistry.lookup(oid))
                .display(fallbackDisplay(code, oid))
                .provenance(Provenance.FALLBACK)
                .fallbackReason(reason)
                .build();
    }

    static String fallbackDisplay(String code, String oid) {
        String text = "Code: " + orNone(code) + " (System: " + orNone(oid) + ")";
        String sanitized = DisplaySanitizer.sanitize(text);
        return sanitized != null ? sanitized : text;
    }

    private ResolvedTerm record(ResolvedTerm term) {
        meterRegistry.counter(RESOLUTION_METRIC, "provenance", term.getProvenance().name()).increment();
        return term;
    }

    private static String orNone(String value) {
        String trimmed = trimToNull(value);
        return trimmed != null ? trimmed : "(none)";
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
