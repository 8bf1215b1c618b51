package com.al.clinicalnormalizer.service.extractor.cda;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DOM navigation helpers for CDA. Elements are matched by local name so that HL7 v3 and
 * extension namespaces (e.g. {@code pharm:}) are handled alike.
 */
public final class CdaElements {

    private CdaElements() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    public static List<Element> children(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && localName.equals(localName(node))) {
                result.add((Element) node);
            }
        }
        return result;
    }

    public static Optional<Element> child(Element parent, String localName) {
        List<Element> matches = children(parent, localName);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    /**
     * Follow a path of child element names, e.g. {@code "consumable/manufacturedProduct/manufacturedMaterial"}.
     * Only the first match is followed at each step.
     */
    public static Optional<Element> path(Element start, String path) {
        Optional<Element> current = Optional.ofNullable(start);
        for (String step : path.split("/")) {
            if (current.isEmpty()) {
                break;
            }
            current = child(current.get(), step);
        }
        return current;
    }

    /**
     * All descendant elements with the given local name, in document order.
     */
    public static List<Element> descendants(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        NodeList nodes = parent.getElementsByTagNameNS("*", localName);
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    /**
     * @return the attribute value, or null when absent or blank
     */
    public static String attr(Element element, String name) {
        if (element == null || !element.hasAttribute(name)) {
            return null;
        }
        String value = element.getAttribute(name).trim();
        return value.isEmpty() ? null : value;
    }

    public static String attr(Optional<Element> element, String name) {
        return element.map(e -> attr(e, name)).orElse(null);
    }

    public static String text(Element element) {
        if (element == null) {
            return null;
        }
        String content = element.getTextContent();
        return content == null || content.isBlank() ? null : content.trim();
    }

    private static String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }
}
