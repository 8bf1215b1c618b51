package com.al.clinicalnormalizer.util;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ClinicalVocabularyTest {

    @Test
    public void testEventStatus_CdaAndFhirCodesReadAlike() {
        assertEquals(Optional.of("Completed"), ClinicalVocabulary.eventStatus("completed"));
        assertEquals(Optional.of("Completed"), ClinicalVocabulary.eventStatus("final"));
        assertEquals(Optional.of("Active"), ClinicalVocabulary.eventStatus("active"));
        assertEquals(Optional.of("Active"), ClinicalVocabulary.eventStatus("in-progress"));
    }

    @Test
    public void testEventStatusOrCode_UnmappedCodeKept() {
        assertEquals("Completed", ClinicalVocabulary.eventStatusOrCode("FINAL"));
        assertEquals("xyz", ClinicalVocabulary.eventStatusOrCode("xyz"));
        assertNull(ClinicalVocabulary.eventStatusOrCode(null));
    }

    @Test
    public void testClinicalStatus_FhirCodeAndSnomedValue() {
        assertEquals(Optional.of("Active"), ClinicalVocabulary.clinicalStatus("active"));
        assertEquals(Optional.of("Active"), ClinicalVocabulary.clinicalStatus("55561003"));
        assertEquals(Optional.of("Resolved"), ClinicalVocabulary.clinicalStatus("413322009"));
        assertEquals(Optional.of("Resolved"), ClinicalVocabulary.concernStatus("completed"));
    }

    @Test
    public void testCriticality_V3AndFhirCodes() {
        assertEquals(Optional.of("High"), ClinicalVocabulary.criticality("CRITH"));
        assertEquals(Optional.of("High"), ClinicalVocabulary.criticality("high"));
        assertEquals(Optional.of("Unable to Assess"), ClinicalVocabulary.criticality("unable-to-assess"));
    }

    @Test
    public void testVerificationAndSeverity() {
        assertEquals(Optional.of("Confirmed"), ClinicalVocabulary.verificationStatus("410605003"));
        assertEquals(Optional.of("Confirmed"), ClinicalVocabulary.verificationStatus("confirmed"));
        assertEquals(Optional.of("Severe"), ClinicalVocabulary.severity("24484000"));
        assertEquals(Optional.of("Severe"), ClinicalVocabulary.severity("severe"));
    }

    @Test
    public void testSectionCategories() {
        assertEquals(Optional.of("Smoking"), ClinicalVocabulary.socialHistoryCategory("72166-2"));
        assertEquals(Optional.of("Do not resuscitate"), ClinicalVocabulary.directiveType("304253006"));
        assertEquals(Optional.of("ADL"), ClinicalVocabulary.functionalCategory("83254-7"));
        assertEquals(Optional.empty(), ClinicalVocabulary.functionalCategory("2345-7"));
    }

    @Test
    public void testIndependence_ReadFromLevelText() {
        assertEquals(Optional.of("Independent"), ClinicalVocabulary.independence("Independent"));
        assertEquals(Optional.of("Partially dependent"), ClinicalVocabulary.independence("Needs assistance"));
        assertEquals(Optional.of("Dependent"), ClinicalVocabulary.independence("Totally dependent"));
        assertEquals(Optional.empty(), ClinicalVocabulary.independence("Unknown"));
        assertEquals(Optional.of("Full assistance"), ClinicalVocabulary.assistanceRequired("Dependent"));
    }

    @Test
    public void testLookup_BlankOrNull() {
        assertEquals(Optional.empty(), ClinicalVocabulary.severity(null));
        assertEquals(Optional.empty(), ClinicalVocabulary.severity("  "));
    }
}
