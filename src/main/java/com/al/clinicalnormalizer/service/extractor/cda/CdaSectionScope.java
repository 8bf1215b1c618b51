package com.al.clinicalnormalizer.service.extractor.cda;

import com.al.clinicalnormalizer.service.extractor.ExtractionContext;
import lombok.Value;
import org.w3c.dom.Element;

/**
 * What an entry mapper needs besides the entry itself: the owning section (for narrative
 * references), the document and the run settings.
 */
@Value
public class CdaSectionScope {
    CdaDocument document;
    Element section;
    ExtractionContext context;

    public String resolveReference(String reference) {
        return document.resolveReference(section, reference);
    }

    public String originalText(Element codedElement) {
        return document.originalText(section, codedElement);
    }
}
