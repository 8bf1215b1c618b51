package com.al.clinicalnormalizer.model.enums;

import lombok.Getter;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Clinical domains handled by the extractors.
 *
 * <p>
 * The section metadata (title, LOINC section code, table columns and display
 * configuration) lives here rather than in the extractors so that a CDA and a
 * FHIR extractor for the same domain always emit identical section headers.
 */
@Getter
public enum ClinicalSectionType {

    ADVANCE_DIRECTIVES("advance_directives", "Advance Directives", "42348-3",
            List.of("42348-3", "75320-2"),
            List.of("Consent"),
            List.of("display_text", "category", "clinical_status", "onset_date", "healthcare_proxy"),
            displayConfig(true, false, Map.of())),

    ALLERGIES("allergies", "Allergies and Intolerances", "48765-2",
            List.of("48765-2"),
            List.of("AllergyIntolerance"),
            List.of("display_text", "category", "severity", "clinical_status", "onset_date"),
            displayConfig(true, true, Map.of("Severe", "danger", "Moderate", "warning", "Mild", "info"))),

    CONDITIONS("conditions", "Problem List", "11450-4",
            List.of("11450-4", "11348-0"),
            List.of("Condition"),
            List.of("display_text", "clinical_status", "severity", "onset_date", "recorded_date"),
            displayConfig(true, true, Map.of("Severe", "danger", "Moderate", "warning", "Mild", "info"))),

    FUNCTIONAL_STATUS("functional_status", "Functional Status", "47420-5",
            List.of("47420-5", "47109-7"),
            List.of("Observation"),
            List.of("display_text", "category", "level", "independence", "onset_date"),
            displayConfig(true, false, Map.of())),

    IMMUNIZATIONS("immunizations", "Immunizations", "11369-6",
            List.of("11369-6"),
            List.of("Immunization"),
            List.of("display_text", "clinical_status", "onset_date", "dose_number", "lot_number"),
            displayConfig(true, false, Map.of())),

    MEDICAL_DEVICES("medical_devices", "Medical Devices", "46264-8",
            List.of("46264-8"),
            List.of("DeviceUseStatement"),
            List.of("display_text", "device_id", "clinical_status", "onset_date", "end_date"),
            displayConfig(true, false, Map.of())),

    MEDICATIONS("medications", "Medication Summary", "10160-0",
            List.of("10160-0"),
            List.of("MedicationStatement", "MedicationRequest"),
            List.of("display_text", "clinical_status", "route", "dosage", "onset_date"),
            displayConfig(true, false, Map.of())),

    OBSERVATIONS("observations", "Results", "30954-2",
            List.of("30954-2", "8716-3"),
            List.of("Observation"),
            List.of("display_text", "value", "interpretation", "clinical_status", "onset_date"),
            displayConfig(true, false, Map.of())),

    PREGNANCY_HISTORY("pregnancy_history", "History of Pregnancies", "10162-6",
            List.of("10162-6", "10155-0"),
            List.of("Observation"),
            List.of("display_text", "onset_date", "gestational_age", "birth_weight", "clinical_status"),
            displayConfig(true, false, Map.of())),

    PROCEDURES("procedures", "History of Procedures", "47519-4",
            List.of("47519-4"),
            List.of("Procedure"),
            List.of("display_text", "clinical_status", "onset_date", "body_site"),
            displayConfig(true, false, Map.of())),

    SOCIAL_HISTORY("social_history", "Social History", "29762-2",
            List.of("29762-2", "10164-2"),
            List.of("Observation"),
            List.of("display_text", "category", "value", "onset_date", "clinical_status"),
            displayConfig(true, false, Map.of()));

    private final String sectionId;
    private final String title;
    private final String loincCode;
    private final List<String> cdaSectionCodes;
    private final List<String> fhirResourceTypes;
    private final List<String> columns;
    private final Map<String, Object> displayConfig;

    ClinicalSectionType(String sectionId, String title, String loincCode, List<String> cdaSectionCodes,
            List<String> fhirResourceTypes, List<String> columns, Map<String, Object> displayConfig) {
        this.sectionId = sectionId;
        this.title = title;
        this.loincCode = loincCode;
        this.cdaSectionCodes = cdaSectionCodes;
        this.fhirResourceTypes = fhirResourceTypes;
        this.columns = columns;
        this.displayConfig = displayConfig;
    }

    public static Optional<ClinicalSectionType> fromSectionId(String sectionId) {
        return Arrays.stream(values())
                .filter(type -> type.sectionId.equals(sectionId))
                .findFirst();
    }

    private static Map<String, Object> displayConfig(boolean showTimeline, boolean showSeverity,
            Map<String, String> severityColors) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("show_timeline", showTimeline);
        config.put("show_severity", showSeverity);
        config.put("show_status", true);
        config.put("enable_filtering", true);
        config.put("severity_colors", severityColors);
        return Collections.unmodifiableMap(config);
    }
}
