package com.al.clinicalnormalizer.service.extractor.cda;

import com.al.clinicalnormalizer.model.ClinicalSectionEntry;
import com.al.clinicalnormalizer.model.NormalizedSection;
import com.al.clinicalnormalizer.model.enums.FallbackReason;
import com.al.clinicalnormalizer.model.enums.Provenance;
import com.al.clinicalnormalizer.service.extractor.ExtractionContext;
import com.al.clinicalnormalizer.service.terminology.TerminologyResolver;
import com.al.clinicalnormalizer.support.InMemoryConceptStore;
import com.al.clinicalnormalizer.support.TestTerminology;
import com.al.clinicalnormalizer.util.MappingConstants;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CdaSectionExtractorsTest {

    private final ExtractionContext context = ExtractionContext.builder().documentId("PS-0001").language("en").build();

    private CdaDocument document;
    private TerminologyResolver resolver;

    @BeforeEach
    public void setUp() {
        InMemoryConceptStore store = new InMemoryConceptStore();
        store.addConcept("I10", MappingConstants.OID_ICD10, "Essential (primary) hypertension");
        resolver = TestTerminology.resolver(store);
        document = new CdaDocumentParser().parse(TestTerminology.fixture("cda/patient-summary.xml"));
    }

    @Test
    public void testDocumentId() {
        assertEquals("2.16.470.1.100.1.1.1000.990.1^PS-0001", document.getDocumentId());
    }

    @Test
    public void testConditions_StatusOnsetAndCatalogueDisplay() {
        NormalizedSection section = new CdaConditionExtractor(resolver).extract(document, context);

        assertEquals(2, section.getEntryCount());
        ClinicalSectionEntry hypertension = section.getEntries().get(0);
        assertEquals("Hypertensive disorder", hypertension.getDisplayText());
        assertEquals("Active", hypertension.getClinicalStatus());
        assertEquals("2018-01-01", hypertension.getOnsetDate());

        ClinicalSectionEntry resolved = section.getEntries().get(1);
        assertEquals("Essential (primary) hypertension", resolved.getDisplayText());
        assertEquals(Provenance.DEFAULT_DISPLAY, resolved.getCodedConcepts().get(0).getProvenance());
        assertEquals("ICD-10", resolved.getCodedConcepts().get(0).getCodeSystemName());
        assertEquals("Resolved", resolved.getClinicalStatus());
        assertEquals("2015-03-01", resolved.getOnsetDate());
        assertEquals("2016-03-01", resolved.getDetails().get(MappingConstants.DETAIL_ABATEMENT_DATE));
    }

    @Test
    public void testMedications_RouteDosageFormAndInstructions() {
        NormalizedSection section = new CdaMedicationExtractor(resolver).extract(document, context);

        assertEquals(1, section.getEntryCount());
        ClinicalSectionEntry paracetamol = section.getEntries().get(0);
        assertEquals("paracetamol", paracetamol.getDisplayText());
        assertEquals("Active", paracetamol.getClinicalStatus());
        assertEquals("2020-01-01", paracetamol.getOnsetDate());
        assertEquals("Oral use", paracetamol.getDetails().get(MappingConstants.DETAIL_ROUTE));
        assertEquals("500 mg", paracetamol.getDetails().get(MappingConstants.DETAIL_DOSAGE));
        assertEquals("Tablet", paracetamol.getDetails().get(MappingConstants.DETAIL_DOSE_FORM));
        assertEquals("Take one tablet every 8 hours", paracetamol.getNotes().get(0));
        assertEquals(MappingConstants.OID_ATC, paracetamol.getCodedConcepts().get(0).getCodeSystemOid());
    }

    @Test
    public void testProcedures() {
        NormalizedSection section = new CdaProcedureExtractor(resolver).extract(document, context);

        ClinicalSectionEntry appendectomy = section.getEntries().get(0);
        assertEquals("Appendectomy", appendectomy.getDisplayText());
        assertEquals("Completed", appendectomy.getClinicalStatus());
        assertEquals("2015-06-10", appendectomy.getOnsetDate());
        assertEquals("Appendix structure", appendectomy.getDetails().get(MappingConstants.DETAIL_BODY_SITE));
        assertEquals("1.2.3.999^proc-1", appendectomy.getEntryId());
    }

    @Test
    public void testObservations_OrganizerComponentsFlattened() {
        NormalizedSection section = new CdaObservationExtractor(resolver).extract(document, context);

        // Two organizer components; the empty entry is skipped
        assertEquals(2, section.getEntryCount());
        ClinicalSectionEntry hemoglobin = section.getEntries().get(0);
        assertEquals("Hemoglobin", hemoglobin.getDisplayText());
        assertEquals("13.5 g/dL", hemoglobin.getDetails().get(MappingConstants.DETAIL_VALUE));
        assertEquals("Normal", hemoglobin.getDetails().get(MappingConstants.DETAIL_INTERPRETATION));
        assertEquals("2023-12-01", hemoglobin.getOnsetDate());

        ClinicalSectionEntry glucose = section.getEntries().get(1);
        assertEquals("Code: 2345-7 (System: 2.16.840.1.113883.6.1)", glucose.getDisplayText());
        assertEquals(FallbackReason.CONCEPT_NOT_FOUND, glucose.getCodedConcepts().get(0).getFallbackReason());
        assertEquals("5.4 mmol/L", glucose.getDetails().get(MappingConstants.DETAIL_VALUE));
    }

    @Test
    public void testImmunizations_DoseLotAndRoute() {
        NormalizedSection section = new CdaImmunizationExtractor(resolver).extract(document, context);

        ClinicalSectionEntry vaccine = section.getEntries().get(0);
        assertEquals("COVID-19 mRNA vaccine", vaccine.getDisplayText());
        assertEquals("2021-04-15", vaccine.getOnsetDate());
        assertEquals("2", vaccine.getDetails().get(MappingConstants.DETAIL_DOSE_NUMBER));
        assertEquals("EW0182", vaccine.getDetails().get(MappingConstants.DETAIL_LOT_NUMBER));
        assertEquals("Intramuscular use", vaccine.getDetails().get(MappingConstants.DETAIL_ROUTE));
        assertEquals(MappingConstants.OID_CVX, vaccine.getCodedConcepts().get(0).getCodeSystemOid());
    }

    @Test
    public void testMedicalDevices_ImplantedDevice() {
        NormalizedSection section = new CdaMedicalDeviceExtractor(resolver).extract(document, context);

        assertEquals(1, section.getEntryCount());
        ClinicalSectionEntry device = section.getEntries().get(0);
        assertEquals("Implantable defibrillator", device.getDisplayText());
        assertEquals("2014-10-20", device.getOnsetDate());
        assertEquals("Active", device.getClinicalStatus());
        assertEquals("ICD-SN-4471", device.getDetails().get(MappingConstants.DETAIL_DEVICE_ID));
        assertEquals(MappingConstants.OID_SNOMED, device.getCodedConcepts().get(0).getCodeSystemOid());
    }

    @Test
    public void testMedicalDevices_RemovalDateMeansCompleted() {
        CdaDocument removed = inlineSection("46264-8", "<supply classCode=\"SPLY\" moodCode=\"EVN\">"
                + "<effectiveTime><low value=\"20100101\"/><high value=\"20180302\"/></effectiveTime>"
                + "<participant typeCode=\"DEV\"><participantRole><playingDevice>"
                + "<manufacturerModelName>Cardiac pacemaker model X</manufacturerModelName>"
                + "</playingDevice></participantRole></participant></supply>");

        ClinicalSectionEntry device = new CdaMedicalDeviceExtractor(resolver).extract(removed, context)
                .getEntries().get(0);

        assertEquals("Cardiac pacemaker model X", device.getDisplayText());
        assertEquals("Completed", device.getClinicalStatus());
        assertEquals("2018-03-02", device.getDetails().get(MappingConstants.DETAIL_END_DATE));
    }

    @Test
    public void testSocialHistory_CategoryAndValue() {
        ClinicalSectionEntry smoking = new CdaSocialHistoryExtractor(resolver).extract(document, context)
                .getEntries().get(0);

        assertEquals("Tobacco smoking status", smoking.getDisplayText());
        assertEquals("Smoking", smoking.getCategory());
        assertEquals("Completed", smoking.getClinicalStatus());
        assertEquals("2017-04-15", smoking.getOnsetDate());
        assertEquals("Ex-smoker", smoking.getDetails().get(MappingConstants.DETAIL_VALUE));
        assertEquals(2, smoking.getCodedConcepts().size());
        assertEquals("8517006", smoking.getCodedConcepts().get(1).getCode());
    }

    @Test
    public void testPregnancyHistory_OutcomeGestationAndWeight() {
        ClinicalSectionEntry pregnancy = new CdaPregnancyHistoryExtractor(resolver).extract(document, context)
                .getEntries().get(0);

        assertEquals("Livebirth", pregnancy.getDisplayText());
        assertEquals("281050002", pregnancy.getCodedConcepts().get(0).getCode());
        assertEquals("93857-1", pregnancy.getCodedConcepts().get(1).getCode());
        assertEquals("2016-08-12", pregnancy.getOnsetDate());
        assertEquals("39 wk", pregnancy.getDetails().get(MappingConstants.DETAIL_GESTATIONAL_AGE));
        assertEquals("3400 g", pregnancy.getDetails().get(MappingConstants.DETAIL_BIRTH_WEIGHT));
        assertNull(pregnancy.getDetails().get(MappingConstants.DETAIL_VALUE));
    }

    @Test
    public void testAdvanceDirectives_TypeAndProxy() {
        ClinicalSectionEntry directive = new CdaAdvanceDirectiveExtractor(resolver).extract(document, context)
                .getEntries().get(0);

        assertEquals("Not for resuscitation", directive.getDisplayText());
        assertEquals("Do not resuscitate", directive.getCategory());
        assertEquals("Active", directive.getClinicalStatus());
        assertEquals("2022-01-05", directive.getOnsetDate());
        assertEquals("Maria Silva", directive.getDetails().get(MappingConstants.DETAIL_HEALTHCARE_PROXY));
    }

    @Test
    public void testFunctionalStatus_LevelIndependenceAndAssistance() {
        ClinicalSectionEntry adl = new CdaFunctionalStatusExtractor(resolver).extract(document, context)
                .getEntries().get(0);

        assertEquals("Activities of daily living", adl.getDisplayText());
        assertEquals("ADL", adl.getCategory());
        assertEquals("Independent", adl.getDetails().get(MappingConstants.DETAIL_LEVEL));
        assertEquals("Independent", adl.getDetails().get(MappingConstants.DETAIL_INDEPENDENCE));
        assertEquals("None", adl.getDetails().get(MappingConstants.DETAIL_ASSISTANCE));
    }

    @Test
    public void testFunctionalStatus_QuantityIsScore() {
        CdaDocument scored = inlineSection("47420-5", "<observation classCode=\"OBS\" moodCode=\"EVN\">"
                + "<code code=\"72133-2\" codeSystem=\"2.16.840.1.113883.6.1\" displayName=\"Mobility score\"/>"
                + "<value xsi:type=\"PQ\" value=\"8\" unit=\"{score}\"/></observation>");

        ClinicalSectionEntry mobility = new CdaFunctionalStatusExtractor(resolver).extract(scored, context)
                .getEntries().get(0);

        assertEquals("Mobility", mobility.getCategory());
        assertEquals("8 {score}", mobility.getDetails().get(MappingConstants.DETAIL_SCORE));
        assertNull(mobility.getDetails().get(MappingConstants.DETAIL_LEVEL));
        assertNull(mobility.getDetails().get(MappingConstants.DETAIL_ASSISTANCE));
    }

    @Test
    public void testEveryEntryHasDisplayText() {
        for (AbstractCdaSectionExtractor extractor : new AbstractCdaSectionExtractor[] {
                new CdaAllergyExtractor(resolver), new CdaConditionExtractor(resolver),
                new CdaMedicationExtractor(resolver), new CdaProcedureExtractor(resolver),
                new CdaObservationExtractor(resolver), new CdaImmunizationExtractor(resolver),
                new CdaMedicalDeviceExtractor(resolver), new CdaSocialHistoryExtractor(resolver),
                new CdaPregnancyHistoryExtractor(resolver), new CdaAdvanceDirectiveExtractor(resolver),
                new CdaFunctionalStatusExtractor(resolver) }) {
            NormalizedSection section = extractor.extract(document, context);
            assertTrue(section.isHasEntries(), section.getSectionId());
            for (ClinicalSectionEntry entry : section.getEntries()) {
                assertNotNull(entry.getDisplayText());
                assertFalse(entry.getDisplayText().isBlank());
                assertNotNull(entry.getEntryId());
            }
        }
    }

    private static CdaDocument inlineSection(String sectionCode, String entryXml) {
        return new CdaDocumentParser().parse("<ClinicalDocument xmlns=\"urn:hl7-org:v3\" "
                + "xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\"><component><structuredBody><component>"
                + "<section><code code=\"" + sectionCode + "\" codeSystem=\"2.16.840.1.113883.6.1\"/>"
                + "<entry>" + entryXml + "</entry>"
                + "</section></component></structuredBody></component></ClinicalDocument>");
    }
}
