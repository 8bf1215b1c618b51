package com.al.clinicalnormalizer.util;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static java.util.Map.entry;

/**
 * Shared display vocabulary for status-like values.
 *
 * <p>
 * CDA carries statuses as HL7 v3 ActStatus codes or SNOMED CT status observations, FHIR as
 * R4 value set codes. Both extractor families map them here so that the same fact reads
 * the same way whatever the source format. Lookups are case-insensitive on the code.
 */
public final class ClinicalVocabulary {

    public static final String ACTIVE = "Active";
    public static final String INACTIVE = "Inactive";
    public static final String RESOLVED = "Resolved";
    public static final String COMPLETED = "Completed";
    public static final String CONFIRMED = "Confirmed";
    public static final String UNCONFIRMED = "Unconfirmed";
    public static final String REFUTED = "Refuted";

    private static final Map<String, String> CLINICAL_STATUS = Map.ofEntries(
            // FHIR condition-clinical / allergyintolerance-clinical
            entry("active", ACTIVE),
            entry("inactive", INACTIVE),
            entry("resolved", RESOLVED),
            entry("recurrence", "Recurrence"),
            entry("relapse", "Relapse"),
            entry("remission", "Remission"),
            // SNOMED CT problem / allergy status values
            entry("55561003", ACTIVE),
            entry("73425007", INACTIVE),
            entry("413322009", RESOLVED),
            entry("246455001", "Recurrence"),
            entry("277022003", "Remission"),
            entry("263855007", "Relapse"));

    // HL7 v3 ActStatus of a concern act
    private static final Map<String, String> CONCERN_STATUS = Map.of(
            "active", ACTIVE,
            "completed", RESOLVED,
            "suspended", INACTIVE,
            "aborted", INACTIVE);

    // HL7 v3 ActStatus and the FHIR R4 event / request status codes
    private static final Map<String, String> EVENT_STATUS = Map.ofEntries(
            entry("completed", COMPLETED),
            entry("final", COMPLETED),
            entry("amended", COMPLETED),
            entry("corrected", COMPLETED),
            entry("active", ACTIVE),
            entry("in-progress", ACTIVE),
            entry("new", ACTIVE),
            entry("intended", "Intended"),
            entry("preparation", "Intended"),
            entry("registered", "Preliminary"),
            entry("preliminary", "Preliminary"),
            entry("draft", "Preliminary"),
            entry("held", "On Hold"),
            entry("on-hold", "On Hold"),
            entry("suspended", "On Hold"),
            entry("stopped", "Stopped"),
            entry("aborted", "Stopped"),
            entry("cancelled", "Cancelled"),
            entry("revoked", "Cancelled"),
            entry("rejected", "Cancelled"),
            entry("proposed", "Intended"),
            entry("not-done", "Not Done"),
            entry("not-taken", "Not Done"),
            entry("nullified", "Entered in Error"),
            entry("entered-in-error", "Entered in Error"),
            entry("obsolete", INACTIVE),
            entry("inactive", INACTIVE),
            entry("unknown", "Unknown"));

    private static final Map<String, String> VERIFICATION_STATUS = Map.ofEntries(
            entry("confirmed", CONFIRMED),
            entry("unconfirmed", UNCONFIRMED),
            entry("provisional", "Provisional"),
            entry("differential", "Differential"),
            entry("refuted", REFUTED),
            entry("entered-in-error", "Entered in Error"),
            // SNOMED CT certainty values
            entry("410605003", CONFIRMED),
            entry("415684004", UNCONFIRMED),
            entry("410590009", UNCONFIRMED),
            entry("410594000", REFUTED));

    private static final Map<String, String> CRITICALITY = Map.of(
            "low", "Low",
            "high", "High",
            "unable-to-assess", "Unable to Assess",
            "critl", "Low",
            "crith", "High",
            "critu", "Unable to Assess");

    private static final Map<String, String> SEVERITY = Map.of(
            "mild", "Mild",
            "moderate", "Moderate",
            "severe", "Severe",
            "255604002", "Mild",
            "6736007", "Moderate",
            "24484000", "Severe");

    // Social history observation codes (LOINC and SNOMED CT) by lifestyle category
    private static final Map<String, String> SOCIAL_HISTORY_CATEGORY = Map.of(
            "72166-2", "Smoking",
            "11341-5", "Smoking",
            "11331-6", "Alcohol use",
            "160573003", "Alcohol use",
            "364393001", "Substance use",
            "228273003", "Substance use",
            "224362002", "Occupation",
            "14679004", "Occupation");

    private static final Map<String, String> DIRECTIVE_TYPE = Map.of(
            "75320-2", "Living will",
            "371538006", "Living will",
            "75781-5", "Healthcare proxy",
            "186065004", "Healthcare proxy",
            "75776-5", "Do not resuscitate",
            "304253006", "Do not resuscitate",
            "75777-3", "POLST");

    private static final Map<String, String> FUNCTIONAL_CATEGORY = Map.of(
            "57267-9", "ADL",
            "83254-7", "ADL",
            "57266-1", "IADL",
            "83255-4", "IADL",
            "72133-2", "Mobility",
            "72134-0", "Mobility",
            "72101-9", "Cognitive",
            "72102-7", "Cognitive");

    private static final Map<String, String> ASSISTANCE_BY_INDEPENDENCE = Map.of(
            "Independent", "None",
            "Dependent", "Full assistance",
            "Partially dependent", "Partial assistance");

    private ClinicalVocabulary() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Clinical status of a problem or allergy, from a FHIR clinical status code or a SNOMED
     * CT status value.
     */
    public static Optional<String> clinicalStatus(String code) {
        return lookup(CLINICAL_STATUS, code);
    }

    /**
     * Clinical status implied by the ActStatus of a CDA concern act. A completed concern is
     * a resolved problem.
     */
    public static Optional<String> concernStatus(String actStatus) {
        return lookup(CONCERN_STATUS, actStatus);
    }

    /**
     * Status of an event (administration, procedure, result...). CDA {@code completed} and
     * FHIR {@code final} both read {@value #COMPLETED}.
     */
    public static Optional<String> eventStatus(String code) {
        return lookup(EVENT_STATUS, code);
    }

    public static Optional<String> verificationStatus(String code) {
        return lookup(VERIFICATION_STATUS, code);
    }

    public static Optional<String> criticality(String code) {
        return lookup(CRITICALITY, code);
    }

    public static Optional<String> severity(String code) {
        return lookup(SEVERITY, code);
    }

    public static Optional<String> socialHistoryCategory(String code) {
        return lookup(SOCIAL_HISTORY_CATEGORY, code);
    }

    public static Optional<String> directiveType(String code) {
        return lookup(DIRECTIVE_TYPE, code);
    }

    public static Optional<String> functionalCategory(String code) {
        return lookup(FUNCTIONAL_CATEGORY, code);
    }

    /**
     * Degree of independence read from a functional level such as "Independent" or
     * "Needs assistance".
     */
    public static Optional<String> independence(String level) {
        if (level == null) {
            return Optional.empty();
        }
        String text = level.toLowerCase(Locale.ROOT);
        if (text.contains("independent")) {
            return Optional.of("Independent");
        }
        if (text.contains("partial") || text.contains("assist")) {
            return Optional.of("Partially dependent");
        }
        if (text.contains("dependent")) {
            return Optional.of("Dependent");
        }
        return Optional.empty();
    }

    public static Optional<String> assistanceRequired(String independence) {
        return Optional.ofNullable(independence).map(ASSISTANCE_BY_INDEPENDENCE::get);
    }

    /**
     * Event status display, keeping an unmapped code as it is.
     */
    public static String eventStatusOrCode(String code) {
        return eventStatus(code).orElse(code);
    }

    private static Optional<String> lookup(Map<String, String> vocabulary, String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(vocabulary.get(code.trim().toLowerCase(Locale.ROOT)));
    }
}
