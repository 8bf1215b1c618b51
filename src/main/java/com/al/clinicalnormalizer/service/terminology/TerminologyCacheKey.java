package com.al.clinicalnormalizer.service.terminology;

import lombok.Value;

/**
 * Cache key of a resolution: code, code system, language and optional country.
 */
@Value
public class TerminologyCacheKey {
    String codeSystemOid;
    String code;
    String language;
    String country;

    /**
     * Flat form used by shared caches, e.g. {@code terminology:2.16.840.1.113883.6.96:91936005:en:-}.
     */
    public String asString() {
        return String.join(":", "terminology", codeSystemOid, code, language, country != null ? country : "-");
    }
}
