package com.al.clinicalnormalizer.service.extractor.cda;

import com.al.clinicalnormalizer.model.enums.ClinicalSectionType;
import com.al.clinicalnormalizer.util.DisplaySanitizer;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of a parsed CDA document. Shared by all CDA extractors of a pipeline run.
 */
public class CdaDocument {

    // IPS and epSOS section templates, used when a section carries no recognised LOINC code
    private static final Map<ClinicalSectionType, List<String>> SECTION_TEMPLATES = Map.of(
            ClinicalSectionType.MEDICATIONS, List.of("2.16.840.1.113883.10.22.3.1"),
            ClinicalSectionType.ALLERGIES, List.of("2.16.840.1.113883.10.22.3.2", "1.3.6.1.4.1.12559.11.10.1.3.1.2.2"),
            ClinicalSectionType.CONDITIONS, List.of("2.16.840.1.113883.10.22.3.3"),
            ClinicalSectionType.PROCEDURES, List.of("2.16.840.1.113883.10.22.3.4"),
            ClinicalSectionType.IMMUNIZATIONS, List.of("2.16.840.1.113883.10.22.3.5"));

    private final Document document;

    public CdaDocument(Document document) {
        this.document = document;
    }

    public Element getRoot() {
        return document.getDocumentElement();
    }

    /**
     * Document id as {@code root^extension}, or null when the header has no id.
     */
    public String getDocumentId() {
        Optional<Element> id = CdaElements.child(getRoot(), "id");
        String root = CdaElements.attr(id, "root");
        String extension = CdaElements.attr(id, "extension");
        if (root == null) {
            return extension;
        }
        return extension != null ? root + "^" + extension : root;
    }

    /**
     * First section whose code matches one of the domain's LOINC codes, falling back to a
     * known section template id.
     */
    public Optional<Element> findSection(ClinicalSectionType type) {
        List<Element> sections = CdaElements.descendants(getRoot(), "section");
        for (Element section : sections) {
            String code = CdaElements.attr(CdaElements.child(section, "code"), "code");
            if (code != null && type.getCdaSectionCodes().contains(code)) {
                return Optional.of(section);
            }
        }
        List<String> templates = SECTION_TEMPLATES.getOrDefault(type, List.of());
        for (Element section : sections) {
            for (Element templateId : CdaElements.children(section, "templateId")) {
                if (templates.contains(CdaElements.attr(templateId, "root"))) {
                    return Optional.of(section);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Resolve a narrative pointer such as {@code #allergen-1} against the section text.
     *
     * @return the sanitized narrative text, or null when the pointer does not resolve
     */
    public String resolveReference(Element section, String reference) {
        if (section == null || reference == null || reference.isBlank()) {
            return null;
        }
        String id = reference.startsWith("#") ? reference.substring(1) : reference;
        Optional<Element> narrative = CdaElements.child(section, "text");
        if (narrative.isEmpty()) {
            return null;
        }
        if (id.equals(CdaElements.attr(narrative.get(), "ID"))) {
            return DisplaySanitizer.sanitize(narrative.get().getTextContent());
        }
        for (Element candidate : CdaElements.descendants(narrative.get(), "*")) {
            if (id.equals(CdaElements.attr(candidate, "ID"))) {
                return DisplaySanitizer.sanitize(candidate.getTextContent());
            }
        }
        return null;
    }

    /**
     * Text of a coded element's {@code originalText}: the referenced narrative when it has
     * a reference, otherwise its inline content.
     */
    public String originalText(Element section, Element codedElement) {
        Optional<Element> originalText = CdaElements.child(codedElement, "originalText");
        if (originalText.isEmpty()) {
            return null;
        }
        String reference = CdaElements.attr(CdaElements.child(originalText.get(), "reference"), "value");
        String resolved = resolveReference(section, reference);
        if (resolved != null) {
            return resolved;
        }
        return DisplaySanitizer.sanitize(CdaElements.text(originalText.get()));
    }
}
