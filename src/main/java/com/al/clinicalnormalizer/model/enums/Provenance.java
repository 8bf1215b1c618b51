package com.al.clinicalnormalizer.model.enums;

/**
 * Where the display text of a resolved term came from.
 */
public enum Provenance {
    /** Display text carried verbatim by the source document */
    SOURCE_DISPLAY,
    /** Catalogue translation for the requested language */
    TRANSLATION,
    /** Catalogue default display (no translation for the language) */
    DEFAULT_DISPLAY,
    /** Synthesized "Code: x (System: y)" text */
    FALLBACK
}
