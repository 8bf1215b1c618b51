package com.al.clinicalnormalizer.service.extractor.cda;

import com.al.clinicalnormalizer.exception.MalformedSourceElementException;
import com.al.clinicalnormalizer.model.ClinicalCode;
import com.al.clinicalnormalizer.model.ClinicalSectionEntry;
import com.al.clinicalnormalizer.model.NormalizedSection;
import com.al.clinicalnormalizer.model.ResolvedTerm;
import com.al.clinicalnormalizer.model.enums.SourceType;
import com.al.clinicalnormalizer.service.extractor.CdaSectionExtractor;
import com.al.clinicalnormalizer.service.extractor.ExtractionContext;
import com.al.clinicalnormalizer.service.extractor.SectionAssembler;
import com.al.clinicalnormalizer.service.terminology.TerminologyResolver;
import com.al.clinicalnormalizer.util.ClinicalVocabulary;
import com.al.clinicalnormalizer.util.DateTimeUtil;
import com.al.clinicalnormalizer.util.DisplaySanitizer;
import com.al.clinicalnormalizer.util.MappingConstants;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Template for CDA extractors: locate the section, map each {@code entry}, assemble.
 * Subclasses only describe how one entry becomes a {@link ClinicalSectionEntry}.
 */
@Slf4j
public abstract class AbstractCdaSectionExtractor implements CdaSectionExtractor {

    protected final TerminologyResolver resolver;

    protected AbstractCdaSectionExtractor(TerminologyResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public NormalizedSection extract(CdaDocument document, ExtractionContext context) {
        Optional<Element> section = document.findSection(getSectionType());
        if (section.isEmpty()) {
            log.debug("CDA document has no {} section", getSectionId());
            return SectionAssembler.empty(getSectionType(), SourceType.CDA);
        }

        CdaSectionScope scope = new CdaSectionScope(document, section.get(), context);
        List<Element> elements = entryElements(section.get());
        List<ClinicalSectionEntry> entries = SectionAssembler.collect(getSectionType(), elements,
                (element, index) -> toEntry(element, index, scope));
        log.debug("Extracted {} of {} {} entries from CDA", entries.size(), elements.size(), getSectionId());
        return SectionAssembler.build(getSectionType(), SourceType.CDA, entries);
    }

    /**
     * Source elements that become one entry each. Defaults to the section's {@code entry}
     * children.
     */
    protected List<Element> entryElements(Element section) {
        return CdaElements.children(section, "entry");
    }

    protected abstract ClinicalSectionEntry toEntry(Element element, int index, CdaSectionScope scope);

    // ========================================================================
    // Coded elements
    // ========================================================================

    /**
     * Read a coded element ({@code code}, {@code value}, {@code routeCode}, ...). Elements
     * carrying only a nullFlavor yield empty. The source display is the {@code displayName}
     * or, failing that, the element's original text.
     */
    protected Optional<ClinicalCode> clinicalCode(Element coded, CdaSectionScope scope) {
        if (coded == null) {
            return Optional.empty();
        }
        String code = CdaElements.attr(coded, "code");
        String codeSystem = CdaElements.attr(coded, "codeSystem");
        if (code == null || codeSystem == null) {
            return Optional.empty();
        }
        String display = CdaElements.attr(coded, "displayName");
        if (!DisplaySanitizer.hasText(display)) {
            display = scope.originalText(coded);
        }
        return Optional.of(ClinicalCode.of(code, codeSystem, display));
    }

    protected ResolvedTerm resolve(ClinicalCode code, CdaSectionScope scope) {
        return resolver.resolveCode(code, scope.getContext());
    }

    /**
     * Resolve a coded element and its {@code translation} children, primary first.
     */
    protected List<ResolvedTerm> resolveWithTranslations(Element coded, CdaSectionScope scope) {
        List<ResolvedTerm> terms = new ArrayList<>();
        if (coded == null) {
            return terms;
        }
        clinicalCode(coded, scope).ifPresent(code -> terms.add(resolve(code, scope)));
        for (Element translation : CdaElements.children(coded, "translation")) {
            clinicalCode(translation, scope).ifPresent(code -> terms.add(resolve(code, scope)));
        }
        return terms;
    }

    /**
     * Display of a secondary coded element (route, severity, status...): the resolved
     * display when coded, otherwise its original text.
     */
    protected String displayOf(Optional<Element> coded, CdaSectionScope scope) {
        if (coded.isEmpty()) {
            return null;
        }
        Optional<ClinicalCode> code = clinicalCode(coded.get(), scope);
        if (code.isPresent()) {
            return resolve(code.get(), scope).getDisplay();
        }
        return scope.originalText(coded.get());
    }

    /**
     * Display of a status-like coded element through a shared vocabulary, falling back to
     * {@link #displayOf} for codes the vocabulary does not know.
     */
    protected String vocabularyDisplay(Optional<Element> coded, CdaSectionScope scope,
            Function<String, Optional<String>> vocabulary) {
        if (coded.isEmpty()) {
            return null;
        }
        return vocabulary.apply(CdaElements.attr(coded, "code")).orElseGet(() -> displayOf(coded, scope));
    }

    /**
     * Display of an observation {@code value}: a quantity with its unit, a coded value's
     * display, else the text content. When {@code concepts} is given, a coded value's
     * primary term is appended to it.
     */
    protected String observationValue(Element observation, CdaSectionScope scope, List<ResolvedTerm> concepts) {
        Optional<Element> value = CdaElements.child(observation, "value");
        if (value.isEmpty()) {
            return null;
        }
        String quantity = quantity(value);
        if (quantity != null) {
            return quantity;
        }
        if (CdaElements.attr(value, "code") == null) {
            return CdaElements.text(value.get());
        }
        if (concepts == null) {
            return displayOf(value, scope);
        }
        List<ResolvedTerm> terms = resolveWithTranslations(value.get(), scope);
        if (terms.isEmpty()) {
            return displayOf(value, scope);
        }
        concepts.add(terms.get(0));
        return terms.get(0).getDisplay();
    }

    /**
     * Entry display text: the primary term's display, else the free text.
     *
     * @throws MalformedSourceElementException when the entry has neither
     */
    protected static String displayText(List<ResolvedTerm> concepts, String freeText, String subject) {
        if (!concepts.isEmpty()) {
            return concepts.get(0).getDisplay();
        }
        String text = DisplaySanitizer.sanitize(freeText);
        if (text == null) {
            throw new MalformedSourceElementException(subject, "Entry has no coded or textual " + subject);
        }
        return text;
    }

    // ========================================================================
    // Entry relationships
    // ========================================================================

    /**
     * Nested observation whose {@code code} equals the given code, searched through all
     * entry relationships below the act.
     */
    protected static Optional<Element> relatedObservation(Element act, String code) {
        for (Element relationship : CdaElements.descendants(act, "entryRelationship")) {
            Optional<Element> observation = CdaElements.child(relationship, "observation");
            if (observation.isPresent()
                    && code.equals(CdaElements.attr(CdaElements.child(observation.get(), "code"), "code"))) {
                return observation;
            }
        }
        return Optional.empty();
    }

    /**
     * {@code value} of the related observation with the given code.
     */
    protected static Optional<Element> relatedValue(Element act, String code) {
        return relatedObservation(act, code).flatMap(o -> CdaElements.child(o, "value"));
    }

    /**
     * Direct entry relationships of the given type (e.g. {@code MFST}) that hold an observation.
     */
    protected static List<Element> relatedObservations(Element act, String typeCode) {
        List<Element> observations = new ArrayList<>();
        for (Element relationship : CdaElements.children(act, "entryRelationship")) {
            if (typeCode.equals(CdaElements.attr(relationship, "typeCode"))) {
                CdaElements.child(relationship, "observation").ifPresent(observations::add);
            }
        }
        return observations;
    }

    /**
     * The clinical statement inside an entry, unwrapping a concern {@code act} when present.
     */
    protected static Optional<Element> clinicalStatement(Element entry, String statementName) {
        Optional<Element> direct = CdaElements.child(entry, statementName);
        if (direct.isPresent()) {
            return direct;
        }
        Optional<Element> act = CdaElements.child(entry, "act");
        if (act.isPresent()) {
            for (Element relationship : CdaElements.children(act.get(), "entryRelationship")) {
                Optional<Element> statement = CdaElements.child(relationship, statementName);
                if (statement.isPresent()) {
                    return statement;
                }
            }
        }
        return Optional.empty();
    }

    // ========================================================================
    // Dates, status and ids
    // ========================================================================

    protected static String onsetDate(Element act) {
        for (Element effectiveTime : CdaElements.children(act, "effectiveTime")) {
            String low = CdaElements.attr(CdaElements.child(effectiveTime, "low"), "value");
            if (low != null) {
                return DateTimeUtil.normalizeCdaTimestampOrNull(low);
            }
            String value = CdaElements.attr(effectiveTime, "value");
            if (value != null) {
                return DateTimeUtil.normalizeCdaTimestampOrNull(value);
            }
        }
        return null;
    }

    protected static String endDate(Element act) {
        for (Element effectiveTime : CdaElements.children(act, "effectiveTime")) {
            String high = CdaElements.attr(CdaElements.child(effectiveTime, "high"), "value");
            if (high != null) {
                return DateTimeUtil.normalizeCdaTimestampOrNull(high);
            }
        }
        return null;
    }

    protected static String authorTime(Element act) {
        return DateTimeUtil.normalizeCdaTimestampOrNull(
                CdaElements.attr(CdaElements.path(act, "author/time"), "value"));
    }

    protected static String statusCode(Element act) {
        return CdaElements.attr(CdaElements.child(act, "statusCode"), "code");
    }

    protected static String eventStatus(Element act) {
        return ClinicalVocabulary.eventStatusOrCode(statusCode(act));
    }

    /**
     * Clinical status of a problem or allergy: the status observation when present, else
     * the ActStatus of the concern act wrapping the observation.
     */
    protected String concernClinicalStatus(Element observation, Optional<Element> act, String statusObservationCode,
            CdaSectionScope scope) {
        Optional<Element> status = relatedValue(observation, statusObservationCode);
        if (status.isPresent()) {
            return vocabularyDisplay(status, scope, ClinicalVocabulary::clinicalStatus);
        }
        String actStatus = statusCode(act.orElse(observation));
        return ClinicalVocabulary.concernStatus(actStatus)
                .or(() -> ClinicalVocabulary.eventStatus(actStatus))
                .orElse(actStatus);
    }

    /**
     * Verification status: the certainty observation, else what {@code negationInd} or an
     * uncertain {@code uncertaintyCode} on the observation imply.
     */
    protected String verificationStatus(Element observation, CdaSectionScope scope) {
        Optional<Element> certainty = relatedValue(observation, MappingConstants.CODE_CERTAINTY_OBSERVATION);
        if (certainty.isPresent()) {
            return vocabularyDisplay(certainty, scope, ClinicalVocabulary::verificationStatus);
        }
        if ("true".equalsIgnoreCase(CdaElements.attr(observation, "negationInd"))) {
            return ClinicalVocabulary.REFUTED;
        }
        if ("UN".equals(CdaElements.attr(CdaElements.child(observation, "uncertaintyCode"), "code"))) {
            return ClinicalVocabulary.UNCONFIRMED;
        }
        return null;
    }

    protected String entryId(Element act, int index) {
        Optional<Element> id = CdaElements.child(act, "id");
        String root = CdaElements.attr(id, "root");
        String extension = CdaElements.attr(id, "extension");
        if (root != null) {
            return extension != null ? root + "^" + extension : root;
        }
        return getSectionId() + "-" + (index + 1);
    }

    protected static void putDetail(ClinicalSectionEntry.ClinicalSectionEntryBuilder builder, String key,
            String value) {
        if (value != null && !value.isBlank()) {
            builder.detail(key, value);
        }
    }

    protected static String quantity(Optional<Element> quantity) {
        String value = CdaElements.attr(quantity, "value");
        if (value == null) {
            return null;
        }
        String unit = CdaElements.attr(quantity, "unit");
        return unit != null && !"1".equals(unit) ? value + " " + unit : value;
    }
}
