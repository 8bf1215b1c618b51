package com.al.clinicalnormalizer.util;

import java.util.Set;

/**
 * Centralized constants for CDA and FHIR R4 section normalization.
 *
 * <p>
 * Code system OIDs are the resolver's dual-key identifiers; FHIR system URIs are
 * mapped onto them by the code system registry.
 */
public final class MappingConstants {

    private MappingConstants() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    // ========================================================================
    // Code System OIDs
    // ========================================================================

    /** SNOMED CT */
    public static final String OID_SNOMED = "2.16.840.1.113883.6.96";

    /** LOINC */
    public static final String OID_LOINC = "2.16.840.1.113883.6.1";

    /** ICD-10 (WHO) */
    public static final String OID_ICD10 = "2.16.840.1.113883.6.3";

    /** ICD-10-CM */
    public static final String OID_ICD10_CM = "2.16.840.1.113883.6.90";

    /** ICD-10-PCS */
    public static final String OID_ICD10_PCS = "2.16.840.1.113883.6.4";

    /** ICD-9-CM */
    public static final String OID_ICD9_CM = "2.16.840.1.113883.6.103";

    /** RxNorm */
    public static final String OID_RXNORM = "2.16.840.1.113883.6.88";

    /** ATC (Anatomical Therapeutic Chemical classification) */
    public static final String OID_ATC = "2.16.840.1.113883.6.73";

    /** UCUM (Unified Code for Units of Measure) */
    public static final String OID_UCUM = "2.16.840.1.113883.6.8";

    /** EDQM Standard Terms (dose forms, routes) */
    public static final String OID_EDQM = "0.4.0.127.0.16.1.1.2.1";

    /** CVX vaccine codes */
    public static final String OID_CVX = "2.16.840.1.113883.12.292";

    /** HL7 v3 ActStatus */
    public static final String OID_ACT_STATUS = "2.16.840.1.113883.5.14";

    /** HL7 v3 ObservationInterpretation */
    public static final String OID_OBSERVATION_INTERPRETATION = "2.16.840.1.113883.5.83";

    /** HL7 v3 AdministrativeGender */
    public static final String OID_ADMINISTRATIVE_GENDER = "2.16.840.1.113883.5.1";

    /** HL7 v3 ActCode */
    public static final String OID_ACT_CODE = "2.16.840.1.113883.5.4";

    /** HL7 v3 RouteOfAdministration */
    public static final String OID_ROUTE_OF_ADMINISTRATION = "2.16.840.1.113883.5.112";

    /** FHIR AllergyIntolerance clinical status value set */
    public static final String OID_ALLERGY_CLINICAL_STATUS = "2.16.840.1.113883.4.642.3.1372";

    /** FHIR AllergyIntolerance verification status value set */
    public static final String OID_ALLERGY_VERIFICATION_STATUS = "2.16.840.1.113883.4.642.3.1371";

    /** FHIR Condition clinical status value set */
    public static final String OID_CONDITION_CLINICAL_STATUS = "2.16.840.1.113883.4.642.3.164";

    // ========================================================================
    // FHIR System URIs
    // ========================================================================

    public static final String SYSTEM_SNOMED = "http://snomed.info/sct";
    public static final String SYSTEM_LOINC = "http://loinc.org";
    public static final String SYSTEM_ICD10 = "http://hl7.org/fhir/sid/icd-10";
    public static final String SYSTEM_ICD10_CM = "http://hl7.org/fhir/sid/icd-10-cm";
    public static final String SYSTEM_RXNORM = "http://www.nlm.nih.gov/research/umls/rxnorm";
    public static final String SYSTEM_ATC = "http://www.whocc.no/atc";
    public static final String SYSTEM_UCUM = "http://unitsofmeasure.org";
    public static final String SYSTEM_EDQM = "http://standardterms.edqm.eu";
    public static final String SYSTEM_CVX = "http://hl7.org/fhir/sid/cvx";
    public static final String SYSTEM_OBSERVATION_INTERPRETATION = "http://terminology.hl7.org/CodeSystem/v3-ObservationInterpretation";
    public static final String SYSTEM_ROUTE_OF_ADMINISTRATION = "http://terminology.hl7.org/CodeSystem/v3-RouteOfAdministration";
    public static final String SYSTEM_ALLERGY_CLINICAL = "http://terminology.hl7.org/CodeSystem/allergyintolerance-clinical";
    public static final String SYSTEM_ALLERGY_VER_STATUS = "http://terminology.hl7.org/CodeSystem/allergyintolerance-verification";
    public static final String SYSTEM_CONDITION_CLINICAL = "http://terminology.hl7.org/CodeSystem/condition-clinical";

    /** Prefix used by FHIR to carry an OID as a system URI */
    public static final String URN_OID_PREFIX = "urn:oid:";

    // ========================================================================
    // CDA
    // ========================================================================

    /** LOINC code of the allergy/intolerance status observation */
    public static final String CODE_ALLERGY_STATUS_OBSERVATION = "33999-4";

    /** LOINC code of the criticality observation */
    public static final String CODE_CRITICALITY_OBSERVATION = "82606-5";

    /** LOINC code of the certainty (verification status) observation */
    public static final String CODE_CERTAINTY_OBSERVATION = "66455-7";

    /** ActCode severity observation */
    public static final String CODE_SEVERITY_OBSERVATION = "SEV";

    /** Problem status observation (LOINC) */
    public static final String CODE_PROBLEM_STATUS_OBSERVATION = "33999-4";

    /** Gestational age at birth (LOINC, reported and estimated) */
    public static final Set<String> CODES_GESTATIONAL_AGE = Set.of("11884-4", "18185-9");

    /** Birth weight (LOINC, measured and reported) */
    public static final Set<String> CODES_BIRTH_WEIGHT = Set.of("8339-4", "3141-9");

    // ========================================================================
    // FHIR Observation routing
    // ========================================================================

    public static final String CATEGORY_SOCIAL_HISTORY = "social-history";
    public static final String CATEGORY_FUNCTIONAL_STATUS = "functional-status";

    /** LOINC codes of pregnancy status, outcome and delivery observations */
    public static final Set<String> CODES_PREGNANCY = Set.of(
            "82810-3", "11778-8", "93857-1", "11636-8", "11637-6", "11638-4",
            "11639-2", "11640-0", "11612-9", "11613-7", "11614-5");

    // ========================================================================
    // Entry detail keys (shared by both extractor families)
    // ========================================================================

    public static final String DETAIL_REACTION = "reaction";
    public static final String DETAIL_CRITICALITY = "criticality";
    public static final String DETAIL_ROUTE = "route";
    public static final String DETAIL_DOSAGE = "dosage";
    public static final String DETAIL_DOSE_FORM = "dose_form";
    public static final String DETAIL_END_DATE = "end_date";
    public static final String DETAIL_VALUE = "value";
    public static final String DETAIL_INTERPRETATION = "interpretation";
    public static final String DETAIL_BODY_SITE = "body_site";
    public static final String DETAIL_LOT_NUMBER = "lot_number";
    public static final String DETAIL_DOSE_NUMBER = "dose_number";
    public static final String DETAIL_ABATEMENT_DATE = "abatement_date";
    public static final String DETAIL_DEVICE_ID = "device_id";
    public static final String DETAIL_GESTATIONAL_AGE = "gestational_age";
    public static final String DETAIL_BIRTH_WEIGHT = "birth_weight";
    public static final String DETAIL_DESCRIPTION = "description";
    public static final String DETAIL_HEALTHCARE_PROXY = "healthcare_proxy";
    public static final String DETAIL_SCORE = "score";
    public static final String DETAIL_LEVEL = "level";
    public static final String DETAIL_INDEPENDENCE = "independence";
    public static final String DETAIL_ASSISTANCE = "assistance_required";
}
