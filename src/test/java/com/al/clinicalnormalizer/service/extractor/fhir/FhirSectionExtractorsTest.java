package com.al.clinicalnormalizer.service.extractor.fhir;

import ca.uhn.fhir.context.FhirContext;
import com.al.clinicalnormalizer.config.PerformanceConfig;
import com.al.clinicalnormalizer.exception.DocumentParseException;
import com.al.clinicalnormalizer.model.ClinicalSectionEntry;
import com.al.clinicalnormalizer.model.NormalizedSection;
import com.al.clinicalnormalizer.model.enums.Provenance;
import com.al.clinicalnormalizer.service.extractor.ExtractionContext;
import com.al.clinicalnormalizer.service.terminology.CodeSystemRegistry;
import com.al.clinicalnormalizer.service.terminology.TerminologyResolver;
import com.al.clinicalnormalizer.support.InMemoryConceptStore;
import com.al.clinicalnormalizer.support.TestTerminology;
import com.al.clinicalnormalizer.util.MappingConstants;
import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.Condition;
import org.hl7.fhir.r4.model.DateTimeType;
import org.hl7.fhir.r4.model.Device;
import org.hl7.fhir.r4.model.DeviceUseStatement;
import org.hl7.fhir.r4.model.Medication;
import org.hl7.fhir.r4.model.MedicationRequest;
import org.hl7.fhir.r4.model.Observation;
import org.hl7.fhir.r4.model.Period;
import org.hl7.fhir.r4.model.Quantity;
import org.hl7.fhir.r4.model.Reference;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FhirSectionExtractorsTest {

    private static FhirDocumentParser parser;

    private final ExtractionContext context = ExtractionContext.builder().documentId("ps-0001").language("en").build();
    private final CodeSystemRegistry registry = new CodeSystemRegistry();

    private Bundle bundle;
    private TerminologyResolver resolver;

    @BeforeAll
    public static void setUpParser() {
        FhirContext fhirContext = new PerformanceConfig().fhirContext();
        parser = new FhirDocumentParser(fhirContext);
    }

    @BeforeEach
    public void setUp() {
        InMemoryConceptStore store = new InMemoryConceptStore();
        store.addConcept("I10", MappingConstants.OID_ICD10, "Essential (primary) hypertension");
        resolver = TestTerminology.resolver(store);
        bundle = parser.parse(TestTerminology.fixture("fhir/patient-summary-bundle.json"));
    }

    @Test
    public void testAllergies() {
        NormalizedSection section = new FhirAllergyExtractor(resolver, registry).extract(bundle, context);

        assertEquals(2, section.getEntryCount());
        ClinicalSectionEntry kiwi = section.getEntries().get(0);
        assertEquals("Kiwi fruit", kiwi.getDisplayText());
        assertEquals(Provenance.SOURCE_DISPLAY, kiwi.getCodedConcepts().get(0).getProvenance());
        assertEquals("Active", kiwi.getClinicalStatus());
        assertEquals("Confirmed", kiwi.getVerificationStatus());
        assertEquals("food", kiwi.getCategory());
        assertEquals("Severe", kiwi.getSeverity());
        assertEquals("2019-03-15", kiwi.getOnsetDate());
        assertEquals("2019-03-20", kiwi.getRecordedDate());
        assertEquals("Anaphylaxis", kiwi.getDetails().get(MappingConstants.DETAIL_REACTION));
        assertTrue(kiwi.getEntryId().contains("allergy-1"));
    }

    @Test
    public void testConditions() {
        NormalizedSection section = new FhirConditionExtractor(resolver, registry).extract(bundle, context);

        assertEquals(2, section.getEntryCount());
        assertEquals("Hypertensive disorder", section.getEntries().get(0).getDisplayText());
        assertEquals("Active", section.getEntries().get(0).getClinicalStatus());

        ClinicalSectionEntry resolved = section.getEntries().get(1);
        assertEquals("Essential (primary) hypertension", resolved.getDisplayText());
        assertEquals(MappingConstants.OID_ICD10, resolved.getCodedConcepts().get(0).getCodeSystemOid());
        assertEquals("2016-03-01", resolved.getDetails().get(MappingConstants.DETAIL_ABATEMENT_DATE));
        assertEquals("Resolved after lifestyle changes", resolved.getNotes().get(0));
    }

    @Test
    public void testMedications_ReferenceResolvedInBundle() {
        NormalizedSection section = new FhirMedicationExtractor(resolver, registry).extract(bundle, context);

        assertEquals(1, section.getEntryCount());
        ClinicalSectionEntry paracetamol = section.getEntries().get(0);
        assertEquals("paracetamol", paracetamol.getDisplayText());
        assertEquals(MappingConstants.OID_ATC, paracetamol.getCodedConcepts().get(0).getCodeSystemOid());
        assertEquals("Active", paracetamol.getClinicalStatus());
        assertEquals("2020-01-01", paracetamol.getOnsetDate());
        assertEquals("Oral use", paracetamol.getDetails().get(MappingConstants.DETAIL_ROUTE));
        assertEquals("500 mg", paracetamol.getDetails().get(MappingConstants.DETAIL_DOSAGE));
        assertEquals("Tablet", paracetamol.getDetails().get(MappingConstants.DETAIL_DOSE_FORM));
        assertEquals("Take one tablet every 8 hours", paracetamol.getNotes().get(0));
    }

    @Test
    public void testMedications_ContainedMedication() {
        Medication contained = new Medication();
        contained.setId("#m1");
        contained.setCode(new CodeableConcept().addCoding(
                new Coding(MappingConstants.SYSTEM_RXNORM, "197361", "Amlodipine 5 MG Oral Tablet")));
        MedicationRequest request = new MedicationRequest();
        request.setStatus(MedicationRequest.MedicationRequestStatus.ACTIVE);
        request.addContained(contained);
        request.setMedication(new Reference("#m1"));

        NormalizedSection section = new FhirMedicationExtractor(resolver, registry)
                .extract(FhirAllergyExtractorTest.bundleOf(request), context);

        assertEquals("Amlodipine 5 MG Oral Tablet", section.getEntries().get(0).getDisplayText());
        assertEquals(MappingConstants.OID_RXNORM, section.getEntries().get(0).getCodedConcepts().get(0)
                .getCodeSystemOid());
    }

    @Test
    public void testProcedures() {
        ClinicalSectionEntry appendectomy = new FhirProcedureExtractor(resolver, registry)
                .extract(bundle, context).getEntries().get(0);

        assertEquals("Appendectomy", appendectomy.getDisplayText());
        assertEquals("Completed", appendectomy.getClinicalStatus());
        assertEquals("2015-06-10", appendectomy.getOnsetDate());
        assertEquals("Appendix structure", appendectomy.getDetails().get(MappingConstants.DETAIL_BODY_SITE));
    }

    @Test
    public void testObservations() {
        NormalizedSection section = new FhirObservationExtractor(resolver, registry).extract(bundle, context);

        assertEquals(2, section.getEntryCount());
        ClinicalSectionEntry hemoglobin = section.getEntries().get(0);
        assertEquals("Hemoglobin", hemoglobin.getDisplayText());
        assertEquals("13.5 g/dL", hemoglobin.getDetails().get(MappingConstants.DETAIL_VALUE));
        assertEquals("Normal", hemoglobin.getDetails().get(MappingConstants.DETAIL_INTERPRETATION));
        assertEquals("Completed", hemoglobin.getClinicalStatus());

        ClinicalSectionEntry glucose = section.getEntries().get(1);
        assertEquals("Code: 2345-7 (System: 2.16.840.1.113883.6.1)", glucose.getDisplayText());
        assertEquals(Provenance.FALLBACK, glucose.getCodedConcepts().get(0).getProvenance());
    }

    @Test
    public void testImmunizations() {
        ClinicalSectionEntry vaccine = new FhirImmunizationExtractor(resolver, registry)
                .extract(bundle, context).getEntries().get(0);

        assertEquals("COVID-19 mRNA vaccine", vaccine.getDisplayText());
        assertEquals("2021-04-15", vaccine.getOnsetDate());
        assertEquals("2", vaccine.getDetails().get(MappingConstants.DETAIL_DOSE_NUMBER));
        assertEquals("EW0182", vaccine.getDetails().get(MappingConstants.DETAIL_LOT_NUMBER));
        assertEquals("Intramuscular use", vaccine.getDetails().get(MappingConstants.DETAIL_ROUTE));
    }

    @Test
    public void testConditions_AbatementWithoutStatusIsResolved() {
        Condition condition = new Condition();
        condition.setId("condition-9");
        condition.setCode(new CodeableConcept().addCoding(
                new Coding(MappingConstants.SYSTEM_SNOMED, "195967001", "Asthma")));
        condition.setAbatement(new DateTimeType("2012-05-01"));

        ClinicalSectionEntry asthma = new FhirConditionExtractor(resolver, registry)
                .extract(FhirAllergyExtractorTest.bundleOf(condition), context).getEntries().get(0);

        assertEquals("Resolved", asthma.getClinicalStatus());
        assertEquals("2012-05-01", asthma.getDetails().get(MappingConstants.DETAIL_ABATEMENT_DATE));
    }

    @Test
    public void testObservations_SupplementedSectionsRoutedAway() {
        NormalizedSection section = new FhirObservationExtractor(resolver, registry).extract(bundle, context);

        for (ClinicalSectionEntry entry : section.getEntries()) {
            assertFalse(entry.getEntryId().contains("social-1"));
            assertFalse(entry.getEntryId().contains("pregnancy-1"));
            assertFalse(entry.getEntryId().contains("functional-1"));
        }
        assertEquals(1, new FhirSocialHistoryExtractor(resolver, registry).extract(bundle, context).getEntryCount());
        assertEquals(1, new FhirPregnancyHistoryExtractor(resolver, registry).extract(bundle, context)
                .getEntryCount());
        assertEquals(1, new FhirFunctionalStatusExtractor(resolver, registry).extract(bundle, context)
                .getEntryCount());
    }

    @Test
    public void testMedicalDevices_DeviceResolvedInBundle() {
        NormalizedSection section = new FhirMedicalDeviceExtractor(resolver, registry).extract(bundle, context);

        assertEquals(1, section.getEntryCount());
        ClinicalSectionEntry device = section.getEntries().get(0);
        assertEquals("Implantable defibrillator", device.getDisplayText());
        assertEquals("Active", device.getClinicalStatus());
        assertEquals("2014-10-20", device.getOnsetDate());
        assertEquals("ICD-SN-4471", device.getDetails().get(MappingConstants.DETAIL_DEVICE_ID));
    }

    @Test
    public void testMedicalDevices_RemovedDeviceNamedFromDeviceName() {
        Device device = new Device();
        device.setId("device-7");
        device.addDeviceName().setName("Cardiac pacemaker model X");
        device.addUdiCarrier().setDeviceIdentifier("00844588003288");
        DeviceUseStatement statement = new DeviceUseStatement();
        statement.setId("use-7");
        statement.setDevice(new Reference("Device/device-7"));
        statement.setTiming(new Period().setStartElement(new DateTimeType("2010-01-01"))
                .setEndElement(new DateTimeType("2018-03-02")));

        ClinicalSectionEntry entry = new FhirMedicalDeviceExtractor(resolver, registry)
                .extract(FhirAllergyExtractorTest.bundleOf(device, statement), context).getEntries().get(0);

        assertEquals("Cardiac pacemaker model X", entry.getDisplayText());
        assertEquals("Completed", entry.getClinicalStatus());
        assertEquals("2018-03-02", entry.getDetails().get(MappingConstants.DETAIL_END_DATE));
        assertEquals("00844588003288", entry.getDetails().get(MappingConstants.DETAIL_DEVICE_ID));
    }

    @Test
    public void testSocialHistory() {
        ClinicalSectionEntry smoking = new FhirSocialHistoryExtractor(resolver, registry)
                .extract(bundle, context).getEntries().get(0);

        assertEquals("Tobacco smoking status", smoking.getDisplayText());
        assertEquals("Smoking", smoking.getCategory());
        assertEquals("Completed", smoking.getClinicalStatus());
        assertEquals("Ex-smoker", smoking.getDetails().get(MappingConstants.DETAIL_VALUE));
    }

    @Test
    public void testPregnancyHistory_ComponentsReadAsDetails() {
        ClinicalSectionEntry pregnancy = new FhirPregnancyHistoryExtractor(resolver, registry)
                .extract(bundle, context).getEntries().get(0);

        assertEquals("Livebirth", pregnancy.getDisplayText());
        assertEquals("2016-08-12", pregnancy.getOnsetDate());
        assertEquals("39 wk", pregnancy.getDetails().get(MappingConstants.DETAIL_GESTATIONAL_AGE));
        assertEquals("3400 g", pregnancy.getDetails().get(MappingConstants.DETAIL_BIRTH_WEIGHT));
    }

    @Test
    public void testAdvanceDirectives_RelatedPersonIsProxy() {
        ClinicalSectionEntry directive = new FhirAdvanceDirectiveExtractor(resolver, registry)
                .extract(bundle, context).getEntries().get(0);

        assertEquals("Not for resuscitation", directive.getDisplayText());
        assertEquals("Do not resuscitate", directive.getCategory());
        assertEquals("Active", directive.getClinicalStatus());
        assertEquals("2022-01-05", directive.getOnsetDate());
        assertEquals("Maria Silva", directive.getDetails().get(MappingConstants.DETAIL_HEALTHCARE_PROXY));
    }

    @Test
    public void testFunctionalStatus_QuantityIsScore() {
        Observation observation = new Observation();
        observation.setId("functional-9");
        observation.setStatus(Observation.ObservationStatus.FINAL);
        observation.setCode(new CodeableConcept().addCoding(
                new Coding(MappingConstants.SYSTEM_LOINC, "72133-2", "Mobility score")));
        observation.setValue(new Quantity().setValue(8).setUnit("{score}"));

        ClinicalSectionEntry mobility = new FhirFunctionalStatusExtractor(resolver, registry)
                .extract(FhirAllergyExtractorTest.bundleOf(observation), context).getEntries().get(0);

        assertEquals("Mobility", mobility.getCategory());
        assertEquals("Completed", mobility.getClinicalStatus());
        assertEquals("8 {score}", mobility.getDetails().get(MappingConstants.DETAIL_SCORE));
        assertNull(mobility.getDetails().get(MappingConstants.DETAIL_ASSISTANCE));
    }

    @Test
    public void testFunctionalStatus_IndependenceAndAssistance() {
        ClinicalSectionEntry adl = new FhirFunctionalStatusExtractor(resolver, registry)
                .extract(bundle, context).getEntries().get(0);

        assertEquals("ADL", adl.getCategory());
        assertEquals("Independent", adl.getDetails().get(MappingConstants.DETAIL_INDEPENDENCE));
        assertEquals("None", adl.getDetails().get(MappingConstants.DETAIL_ASSISTANCE));
    }

    @Test
    public void testParser_RejectsNonBundle() {
        assertThrows(DocumentParseException.class,
                () -> parser.parse("{\"resourceType\":\"Patient\",\"id\":\"p1\"}"));
        assertThrows(DocumentParseException.class, () -> parser.parse("{not json"));
        assertThrows(DocumentParseException.class, () -> parser.parse(""));
    }
}
