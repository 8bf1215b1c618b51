package com.al.clinicalnormalizer.service.terminology;

import com.al.clinicalnormalizer.util.MappingConstants;
import org.springframework.stereotype.Component;

import java.util.Map;

import static java.util.Map.entry;

/**
 * Static OID to code system name table.
 *
 * <p>
 * Lookups never fail: an unregistered OID yields {@link #UNKNOWN}, which presentation
 * layers render as an audit badge.
 */
@Component
public class CodeSystemRegistry {

    public static final String UNKNOWN = "Unknown";

    private static final Map<String, String> NAMES_BY_OID = Map.ofEntries(
            entry(MappingConstants.OID_SNOMED, "SNOMED CT"),
            entry(MappingConstants.OID_LOINC, "LOINC"),
            entry(MappingConstants.OID_ICD10, "ICD-10"),
            entry(MappingConstants.OID_ICD10_CM, "ICD-10-CM"),
            entry(MappingConstants.OID_ICD10_PCS, "ICD-10-PCS"),
            entry(MappingConstants.OID_ICD9_CM, "ICD-9-CM"),
            entry(MappingConstants.OID_RXNORM, "RxNorm"),
            entry(MappingConstants.OID_ATC, "ATC"),
            entry(MappingConstants.OID_UCUM, "UCUM"),
            entry(MappingConstants.OID_EDQM, "EDQM"),
            entry(MappingConstants.OID_CVX, "CVX"),
            entry(MappingConstants.OID_ACT_STATUS, "HL7 ActStatus"),
            entry(MappingConstants.OID_ACT_CODE, "HL7 ActCode"),
            entry(MappingConstants.OID_ADMINISTRATIVE_GENDER, "HL7 AdministrativeGender"),
            entry(MappingConstants.OID_OBSERVATION_INTERPRETATION, "HL7 ObservationInterpretation"),
            entry(MappingConstants.OID_ROUTE_OF_ADMINISTRATION, "HL7 RouteOfAdministration"),
            entry(MappingConstants.OID_ALLERGY_CLINICAL_STATUS, "AllergyIntolerance Clinical Status"),
            entry(MappingConstants.OID_ALLERGY_VERIFICATION_STATUS, "AllergyIntolerance Verification Status"),
            entry(MappingConstants.OID_CONDITION_CLINICAL_STATUS, "Condition Clinical Status"));

    private static final Map<String, String> OIDS_BY_FHIR_SYSTEM = Map.ofEntries(
            entry(MappingConstants.SYSTEM_SNOMED, MappingConstants.OID_SNOMED),
            entry(MappingConstants.SYSTEM_LOINC, MappingConstants.OID_LOINC),
            entry(MappingConstants.SYSTEM_ICD10, MappingConstants.OID_ICD10),
            entry(MappingConstants.SYSTEM_ICD10_CM, MappingConstants.OID_ICD10_CM),
            entry(MappingConstants.SYSTEM_RXNORM, MappingConstants.OID_RXNORM),
            entry(MappingConstants.SYSTEM_ATC, MappingConstants.OID_ATC),
            entry(MappingConstants.SYSTEM_UCUM, MappingConstants.OID_UCUM),
            entry(MappingConstants.SYSTEM_EDQM, MappingConstants.OID_EDQM),
            entry(MappingConstants.SYSTEM_CVX, MappingConstants.OID_CVX),
            entry(MappingConstants.SYSTEM_OBSERVATION_INTERPRETATION, MappingConstants.OID_OBSERVATION_INTERPRETATION),
            entry(MappingConstants.SYSTEM_ROUTE_OF_ADMINISTRATION, MappingConstants.OID_ROUTE_OF_ADMINISTRATION),
            entry(MappingConstants.SYSTEM_ALLERGY_CLINICAL, MappingConstants.OID_ALLERGY_CLINICAL_STATUS),
            entry(MappingConstants.SYSTEM_ALLERGY_VER_STATUS, MappingConstants.OID_ALLERGY_VERIFICATION_STATUS),
            entry(MappingConstants.SYSTEM_CONDITION_CLINICAL, MappingConstants.OID_CONDITION_CLINICAL_STATUS));

    /**
     * @return the canonical system name, or {@link #UNKNOWN}
     */
    public String lookup(String oid) {
        if (oid == null) {
            return UNKNOWN;
        }
        return NAMES_BY_OID.getOrDefault(oid.trim(), UNKNOWN);
    }

    public boolean isRegistered(String oid) {
        return oid != null && NAMES_BY_OID.containsKey(oid.trim());
    }

    /**
     * Badge helper for presentation layers.
     */
    public String codeSystemName(String oid) {
        return lookup(oid);
    }

    /**
     * Map a FHIR system URI (or {@code urn:oid:} URI, or bare OID) onto the OID used as the
     * resolver's key. Unknown URIs are returned unchanged.
     */
    public String normalizeSystem(String system) {
        if (system == null || system.isBlank()) {
            return null;
        }
        String trimmed = system.trim();
        if (trimmed.startsWith(MappingConstants.URN_OID_PREFIX)) {
            return trimmed.substring(MappingConstants.URN_OID_PREFIX.length());
        }
        String withoutSlash = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        return OIDS_BY_FHIR_SYSTEM.getOrDefault(withoutSlash, trimmed);
    }
}
