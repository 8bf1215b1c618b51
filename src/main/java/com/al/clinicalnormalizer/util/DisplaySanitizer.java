package com.al.clinicalnormalizer.util;

import java.util.regex.Pattern;

/**
 * Cleans display text coming from untrusted documents or the catalogue before it reaches
 * presentation layers: markup is removed and whitespace collapsed.
 */
public final class DisplaySanitizer {

    private DisplaySanitizer() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    private static final Pattern TAGS = Pattern.compile("<[^>]*>");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");

    /**
     * @return the cleaned text, or null when nothing printable is left
     */
    public static String sanitize(String text) {
        if (text == null) {
            return null;
        }
        String cleaned = TAGS.matcher(text).replaceAll(" ");
        // Stray brackets that were not part of a complete tag
        cleaned = cleaned.replace('<', ' ').replace('>', ' ');
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    public static boolean hasText(String text) {
        return sanitize(text) != null;
    }
}
