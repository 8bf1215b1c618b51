package com.al.clinicalnormalizer.service.extractor.cda;

import com.al.clinicalnormalizer.model.ClinicalSectionEntry;
import com.al.clinicalnormalizer.model.NormalizedSection;
import com.al.clinicalnormalizer.model.ResolvedTerm;
import com.al.clinicalnormalizer.model.enums.Provenance;
import com.al.clinicalnormalizer.model.enums.SourceType;
import com.al.clinicalnormalizer.service.extractor.ExtractionContext;
import com.al.clinicalnormalizer.support.InMemoryConceptStore;
import com.al.clinicalnormalizer.support.TestTerminology;
import com.al.clinicalnormalizer.util.MappingConstants;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CdaAllergyExtractorTest {

    private final CdaDocumentParser parser = new CdaDocumentParser();
    private final ExtractionContext context = ExtractionContext.builder()
            .documentId("PS-0001")
            .language("en")
            .build();

    private InMemoryConceptStore store;
    private CdaAllergyExtractor extractor;

    @BeforeEach
    public void setUp() {
        store = new InMemoryConceptStore();
        store.addConcept("260176001", MappingConstants.OID_SNOMED, "Kiwi fruit");
        extractor = new CdaAllergyExtractor(TestTerminology.resolver(store));
    }

    @Test
    public void testExtract_SourceDisplayUsedWithoutCatalogue() {
        NormalizedSection section = extractor.extract(fixture(), context);

        ClinicalSectionEntry kiwi = section.getEntries().get(0);
        assertEquals("Kiwi fruit", kiwi.getDisplayText());
        ResolvedTerm primary = kiwi.getCodedConcepts().get(0);
        assertEquals("260176001", primary.getCode());
        assertEquals(MappingConstants.OID_SNOMED, primary.getCodeSystemOid());
        assertEquals(Provenance.SOURCE_DISPLAY, primary.getProvenance());
        assertEquals(0, store.getTotalLookups());
    }

    @Test
    public void testExtract_SectionHeader() {
        NormalizedSection section = extractor.extract(fixture(), context);

        assertEquals("allergies", section.getSectionId());
        assertEquals("Allergies and Intolerances", section.getTitle());
        assertEquals("48765-2", section.getSectionCode());
        assertEquals(SourceType.CDA, section.getDataSource());
        assertTrue(section.isHasEntries());
        assertTrue(section.isCodedSection());
        assertEquals(section.getEntries().size(), section.getEntryCount());
    }

    @Test
    public void testExtract_ReactionSeverityStatusAndDates() {
        ClinicalSectionEntry kiwi = extractor.extract(fixture(), context).getEntries().get(0);

        assertEquals("1.2.3.999^allergy-1", kiwi.getEntryId());
        assertEquals("food", kiwi.getCategory());
        assertEquals("Severe", kiwi.getSeverity());
        assertEquals("Active", kiwi.getClinicalStatus());
        assertEquals("Confirmed", kiwi.getVerificationStatus());
        assertEquals("2019-03-15", kiwi.getOnsetDate());
        assertEquals("2019-03-20", kiwi.getRecordedDate());
        assertEquals("Anaphylaxis", kiwi.getDetails().get(MappingConstants.DETAIL_REACTION));
        assertEquals("High", kiwi.getDetails().get(MappingConstants.DETAIL_CRITICALITY));
        assertEquals("#allergen-1", kiwi.getSourceReference());
        assertEquals(2, kiwi.getCodedConcepts().size());
        assertEquals("39579001", kiwi.getCodedConcepts().get(1).getCode());
    }

    @Test
    public void testExtract_OriginalTextReferenceResolvedFromNarrative() {
        ClinicalSectionEntry penicillin = extractor.extract(fixture(), context).getEntries().get(1);

        assertEquals("Penicillin", penicillin.getDisplayText());
        assertEquals(Provenance.SOURCE_DISPLAY, penicillin.getCodedConcepts().get(0).getProvenance());
        assertEquals("medication", penicillin.getCategory());
        assertEquals("Active", penicillin.getClinicalStatus());
        assertNull(penicillin.getVerificationStatus());
        assertNull(penicillin.getSeverity());
    }

    @Test
    public void testExtract_MalformedEntrySkipped() {
        NormalizedSection section = extractor.extract(fixture(), context);

        assertEquals(2, section.getEntryCount());
    }

    @Test
    public void testExtract_CatalogueUsedWhenNoSourceDisplay() {
        String xml = "<ClinicalDocument xmlns=\"urn:hl7-org:v3\"><component><structuredBody><component>"
                + "<section><code code=\"48765-2\" codeSystem=\"2.16.840.1.113883.6.1\"/>"
                + "<entry><observation classCode=\"OBS\" moodCode=\"EVN\">"
                + "<participant typeCode=\"CSM\"><participantRole><playingEntity>"
                + "<code code=\"260176001\" codeSystem=\"2.16.840.1.113883.6.96\"/>"
                + "</playingEntity></participantRole></participant>"
                + "</observation></entry></section></component></structuredBody></component></ClinicalDocument>";

        NormalizedSection section = extractor.extract(parser.parse(xml), context);

        ClinicalSectionEntry entry = section.getEntries().get(0);
        assertEquals("Kiwi fruit", entry.getDisplayText());
        assertEquals(Provenance.DEFAULT_DISPLAY, entry.getCodedConcepts().get(0).getProvenance());
        assertEquals("allergies-1", entry.getEntryId());
    }

    @Test
    public void testExtract_StatusesReadThroughSharedVocabulary() {
        String xml = "<ClinicalDocument xmlns=\"urn:hl7-org:v3\"><component><structuredBody><component>"
                + "<section><code code=\"48765-2\" codeSystem=\"2.16.840.1.113883.6.1\"/>"
                + "<entry><act classCode=\"ACT\" moodCode=\"EVN\"><statusCode code=\"completed\"/>"
                + "<entryRelationship typeCode=\"SUBJ\">"
                + "<observation classCode=\"OBS\" moodCode=\"EVN\" negationInd=\"true\">"
                + "<participant typeCode=\"CSM\"><participantRole><playingEntity>"
                + "<code code=\"260176001\" codeSystem=\"2.16.840.1.113883.6.96\" displayName=\"Kiwi\"/>"
                + "</playingEntity></participantRole></participant>"
                + "<entryRelationship typeCode=\"SUBJ\"><observation classCode=\"OBS\" moodCode=\"EVN\">"
                + "<code code=\"82606-5\" codeSystem=\"2.16.840.1.113883.6.1\"/>"
                + "<value code=\"CRITL\" codeSystem=\"2.16.840.1.113883.5.1063\"/>"
                + "</observation></entryRelationship>"
                + "<entryRelationship typeCode=\"SUBJ\"><observation classCode=\"OBS\" moodCode=\"EVN\">"
                + "<code code=\"SEV\" codeSystem=\"2.16.840.1.113883.5.4\"/>"
                + "<value code=\"6736007\" codeSystem=\"2.16.840.1.113883.6.96\"/>"
                + "</observation></entryRelationship>"
                + "</observation></entryRelationship></act></entry>"
                + "</section></component></structuredBody></component></ClinicalDocument>";

        ClinicalSectionEntry entry = extractor.extract(parser.parse(xml), context).getEntries().get(0);

        assertEquals("Resolved", entry.getClinicalStatus());
        assertEquals("Refuted", entry.getVerificationStatus());
        assertEquals("Moderate", entry.getSeverity());
        assertEquals("Low", entry.getDetails().get(MappingConstants.DETAIL_CRITICALITY));
        assertEquals(0, store.getTotalLookups());
    }

    @Test
    public void testExtract_SectionFoundByTemplateId() {
        String xml = "<ClinicalDocument xmlns=\"urn:hl7-org:v3\"><component><structuredBody><component>"
                + "<section><templateId root=\"1.3.6.1.4.1.12559.11.10.1.3.1.2.2\"/>"
                + "<code code=\"00000-0\" codeSystem=\"2.16.840.1.113883.6.1\"/>"
                + "<entry><observation><participant><participantRole><playingEntity>"
                + "<name>House dust</name>"
                + "</playingEntity></participantRole></participant></observation></entry>"
                + "</section></component></structuredBody></component></ClinicalDocument>";

        NormalizedSection section = extractor.extract(parser.parse(xml), context);

        assertEquals(1, section.getEntryCount());
        assertEquals("House dust", section.getEntries().get(0).getDisplayText());
        assertTrue(section.getEntries().get(0).getCodedConcepts().isEmpty());
        assertFalse(section.isCodedSection());
    }

    @Test
    public void testExtract_AbsentSectionIsEmpty() {
        String xml = "<ClinicalDocument xmlns=\"urn:hl7-org:v3\"><component><structuredBody/></component>"
                + "</ClinicalDocument>";

        NormalizedSection section = extractor.extract(parser.parse(xml), context);

        assertFalse(section.isHasEntries());
        assertEquals(0, section.getEntryCount());
        assertEquals(List.of(), section.getEntries());
        assertEquals("Allergies and Intolerances", section.getTitle());
    }

    private CdaDocument fixture() {
        return parser.parse(TestTerminology.fixture("cda/patient-summary.xml"));
    }
}
