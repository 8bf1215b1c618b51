package com.al.clinicalnormalizer.service.extractor.cda;

import com.al.clinicalnormalizer.exception.DocumentParseException;
import com.al.clinicalnormalizer.model.enums.SourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;

/**
 * Parses CDA R2 XML into a {@link CdaDocument}.
 *
 * <p>
 * The builder is namespace aware and hardened against XXE: DOCTYPE declarations and
 * external entities are rejected. Node expansion is not deferred so the resulting DOM can
 * be read by several extractor threads at once.
 */
@Slf4j
@Component
public class CdaDocumentParser {

    private static final ThreadLocal<DocumentBuilder> BUILDER = ThreadLocal.withInitial(
            CdaDocumentParser::newSecureBuilder);

    public CdaDocument parse(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new DocumentParseException(SourceType.CDA, "CDA document is empty", null);
        }
        try {
            DocumentBuilder builder = BUILDER.get();
            builder.reset();
            // Fatal errors surface as SAXException instead of being printed to stderr
            builder.setErrorHandler(new DefaultHandler());
            Document document = builder.parse(new InputSource(new StringReader(xml)));
            document.getDocumentElement().normalize();
            if (!"ClinicalDocument".equals(document.getDocumentElement().getLocalName())) {
                throw new DocumentParseException(SourceType.CDA,
                        "Root element is not ClinicalDocument: " + document.getDocumentElement().getLocalName(),
                        null);
            }
            return new CdaDocument(document);
        } catch (SAXException | IOException e) {
            throw new DocumentParseException(SourceType.CDA, "Malformed CDA XML: " + e.getMessage(), e);
        }
    }

    private static DocumentBuilder newSecureBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setValidating(false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setFeature("http://apache.org/xml/features/dom/defer-node-expansion", false);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to initialise secure XML parser", e);
        }
    }
}
