package com.al.clinicalnormalizer.service.extractor.fhir;

import com.al.clinicalnormalizer.exception.MalformedSourceElementException;
import com.al.clinicalnormalizer.model.ClinicalCode;
import com.al.clinicalnormalizer.model.ClinicalSectionEntry;
import com.al.clinicalnormalizer.model.NormalizedSection;
import com.al.clinicalnormalizer.model.ResolvedTerm;
import com.al.clinicalnormalizer.model.enums.SourceType;
import com.al.clinicalnormalizer.service.extractor.ExtractionContext;
import com.al.clinicalnormalizer.service.extractor.FhirSectionExtractor;
import com.al.clinicalnormalizer.service.extractor.SectionAssembler;
import com.al.clinicalnormalizer.service.terminology.CodeSystemRegistry;
import com.al.clinicalnormalizer.service.terminology.TerminologyResolver;
import com.al.clinicalnormalizer.util.DisplaySanitizer;
import lombok.extern.slf4j.Slf4j;
import org.hl7.fhir.r4.model.Annotation;
import org.hl7.fhir.r4.model.BooleanType;
import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.DomainResource;
import org.hl7.fhir.r4.model.IntegerType;
import org.hl7.fhir.r4.model.Quantity;
import org.hl7.fhir.r4.model.Reference;
import org.hl7.fhir.r4.model.Resource;
import org.hl7.fhir.r4.model.StringType;
import org.hl7.fhir.r4.model.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Template for FHIR extractors: collect the Bundle resources of the section's types, map
 * each one, assemble.
 *
 * @param <R> resource class handled by the extractor
 */
@Slf4j
public abstract class AbstractFhirSectionExtractor<R extends Resource> implements FhirSectionExtractor {

    protected final TerminologyResolver resolver;
    protected final CodeSystemRegistry codeSystemRegistry;
    private final Class<R> resourceClass;

    protected AbstractFhirSectionExtractor(TerminologyResolver resolver, CodeSystemRegistry codeSystemRegistry,
            Class<R> resourceClass) {
        this.resolver = resolver;
        this.codeSystemRegistry = codeSystemRegistry;
        this.resourceClass = resourceClass;
    }

    @Override
    public NormalizedSection extract(Bundle bundle, ExtractionContext context) {
        List<R> resources = findResources(bundle);
        if (resources.isEmpty()) {
            log.debug("Bundle has no {} resources", getSectionType().getFhirResourceTypes());
            return SectionAssembler.empty(getSectionType(), SourceType.FHIR);
        }
        List<ClinicalSectionEntry> entries = SectionAssembler.collect(getSectionType(), resources,
                (resource, index) -> toEntry(resource, index, bundle, context));
        log.debug("Extracted {} of {} {} entries from FHIR", entries.size(), resources.size(), getSectionId());
        return SectionAssembler.build(getSectionType(), SourceType.FHIR, entries);
    }

    protected abstract ClinicalSectionEntry toEntry(R resource, int index, Bundle bundle, ExtractionContext context);

    /**
     * Narrows the resources of the section's types, for domains that share a resource type.
     */
    protected boolean accepts(R resource) {
        return true;
    }

    protected List<R> findResources(Bundle bundle) {
        List<R> resources = new ArrayList<>();
        if (bundle == null) {
            return resources;
        }
        for (Bundle.BundleEntryComponent entry : bundle.getEntry()) {
            Resource resource = entry.getResource();
            if (resource != null && getSectionType().getFhirResourceTypes().contains(resource.fhirType())
                    && resourceClass.isInstance(resource) && accepts(resourceClass.cast(resource))) {
                resources.add(resourceClass.cast(resource));
            }
        }
        return resources;
    }

    /**
     * Resolve every coding of the concept independently, in coding order.
     */
    protected List<ResolvedTerm> resolveAll(CodeableConcept concept, ExtractionContext context) {
        List<ResolvedTerm> terms = new ArrayList<>();
        for (ClinicalCode code : FhirCodings.codes(concept, codeSystemRegistry)) {
            terms.add(resolver.resolveCode(code, context));
        }
        return terms;
    }

    /**
     * Display of a secondary concept (route, body site, interpretation...): the first
     * resolved coding, else the concept text.
     */
    protected String displayOf(CodeableConcept concept, ExtractionContext context) {
        if (concept == null || concept.isEmpty()) {
            return null;
        }
        List<ResolvedTerm> terms = resolveAll(concept, context);
        return terms.isEmpty() ? FhirCodings.text(concept) : terms.get(0).getDisplay();
    }

    /**
     * Display of an observation or component value: a quantity with its unit, a coded
     * value's display, else its string form. When {@code concepts} is given, a coded
     * value's primary term is appended to it.
     */
    protected String observationValue(Type value, ExtractionContext context, List<ResolvedTerm> concepts) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        if (value instanceof Quantity) {
            return FhirCodings.quantity((Quantity) value);
        }
        if (value instanceof CodeableConcept) {
            CodeableConcept concept = (CodeableConcept) value;
            if (concepts == null) {
                return displayOf(concept, context);
            }
            List<ResolvedTerm> terms = resolveAll(concept, context);
            if (terms.isEmpty()) {
                return FhirCodings.text(concept);
            }
            concepts.add(terms.get(0));
            return terms.get(0).getDisplay();
        }
        if (value instanceof StringType) {
            return DisplaySanitizer.sanitize(((StringType) value).getValue());
        }
        if (value instanceof BooleanType) {
            return String.valueOf(((BooleanType) value).booleanValue());
        }
        if (value instanceof IntegerType) {
            return String.valueOf(((IntegerType) value).getValue());
        }
        return null;
    }

    /**
     * First coding of the concept known to the vocabulary, mapped.
     */
    protected static Optional<String> vocabularyValue(CodeableConcept concept,
            Function<String, Optional<String>> vocabulary) {
        if (concept == null) {
            return Optional.empty();
        }
        for (Coding coding : concept.getCoding()) {
            Optional<String> mapped = vocabulary.apply(coding.getCode());
            if (mapped.isPresent()) {
                return mapped;
            }
        }
        return Optional.empty();
    }

    /**
     * Display of a status-like concept through a shared vocabulary, else its
     * {@link FhirCodings#statusText status text}.
     */
    protected static String vocabularyDisplay(CodeableConcept concept, Function<String, Optional<String>> vocabulary) {
        return vocabularyValue(concept, vocabulary).orElseGet(() -> FhirCodings.statusText(concept));
    }

    /**
     * Entry display text: the primary term's display, else the concept text.
     *
     * @throws MalformedSourceElementException when the resource has neither
     */
    protected static String displayText(List<ResolvedTerm> concepts, CodeableConcept concept, String subject) {
        if (!concepts.isEmpty()) {
            return concepts.get(0).getDisplay();
        }
        String text = FhirCodings.text(concept);
        if (text == null) {
            throw new MalformedSourceElementException(subject, "Resource has no coded or textual " + subject);
        }
        return text;
    }

    /**
     * Follow a reference: contained resources first, then Bundle entries by full URL or
     * relative id.
     */
    protected static <T extends Resource> Optional<T> referencedResource(DomainResource owner, Reference reference,
            Bundle bundle, Class<T> type) {
        if (reference == null) {
            return Optional.empty();
        }
        if (type.isInstance(reference.getResource())) {
            return Optional.of(type.cast(reference.getResource()));
        }
        String target = reference.getReference();
        if (target == null) {
            return Optional.empty();
        }
        if (target.startsWith("#")) {
            String localId = target.substring(1);
            for (Resource contained : owner.getContained()) {
                String containedId = contained.getIdElement().getIdPart();
                if (type.isInstance(contained) && containedId != null
                        && localId.equals(containedId.startsWith("#") ? containedId.substring(1) : containedId)) {
                    return Optional.of(type.cast(contained));
                }
            }
            return Optional.empty();
        }
        if (bundle == null) {
            return Optional.empty();
        }
        for (Bundle.BundleEntryComponent entry : bundle.getEntry()) {
            Resource candidate = entry.getResource();
            if (!type.isInstance(candidate)) {
                continue;
            }
            if (target.equals(entry.getFullUrl())
                    || target.equals(candidate.getIdElement().toUnqualifiedVersionless().getValue())
                    || target.equals(candidate.fhirType() + "/" + candidate.getIdElement().getIdPart())) {
                return Optional.of(type.cast(candidate));
            }
        }
        return Optional.empty();
    }

    protected String entryId(Resource resource, int index) {
        if (resource.hasIdElement() && resource.getIdElement().hasIdPart()) {
            return resource.getIdElement().toUnqualifiedVersionless().getValue();
        }
        return getSectionId() + "-" + (index + 1);
    }

    protected static void addNotes(ClinicalSectionEntry.ClinicalSectionEntryBuilder builder, List<Annotation> notes) {
        for (Annotation note : notes) {
            String text = DisplaySanitizer.sanitize(note.getText());
            if (text != null) {
                builder.note(text);
            }
        }
    }

    protected static void putDetail(ClinicalSectionEntry.ClinicalSectionEntryBuilder builder, String key,
            String value) {
        if (value != null && !value.isBlank()) {
            builder.detail(key, value);
        }
    }
}
