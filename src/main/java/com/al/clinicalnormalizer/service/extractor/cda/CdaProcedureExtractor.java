package com.al.clinicalnormalizer.service.extractor.cda;

import com.al.clinicalnormalizer.exception.MalformedSourceElementException;
import com.al.clinicalnormalizer.model.ClinicalSectionEntry;
import com.al.clinicalnormalizer.model.ResolvedTerm;
import com.al.clinicalnormalizer.model.enums.ClinicalSectionType;
import com.al.clinicalnormalizer.service.terminology.TerminologyResolver;
import com.al.clinicalnormalizer.util.MappingConstants;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Optional;

@Component
public class CdaProcedureExtractor extends AbstractCdaSectionExtractor {

    public CdaProcedureExtractor(TerminologyResolver resolver) {
        super(resolver);
    }

    @Override
    public ClinicalSectionType getSectionType() {
        return ClinicalSectionType.PROCEDURES;
    }

    @Override
    protected ClinicalSectionEntry toEntry(Element entry, int index, CdaSectionScope scope) {
        Element procedure = clinicalStatement(entry, "procedure")
                .or(() -> clinicalStatement(entry, "act"))
                .orElseThrow(() -> new MalformedSourceElementException("procedure",
                        "Procedure entry has no procedure element"));

        Optional<Element> code = CdaElements.child(procedure, "code");
        List<ResolvedTerm> concepts = resolveWithTranslations(code.orElse(null), scope);

        String textReference = CdaElements.attr(CdaElements.path(procedure, "text/reference"), "value");
        String freeText = code.map(scope::originalText).orElse(null);
        if (freeText == null) {
            freeText = scope.resolveReference(textReference);
        }

        ClinicalSectionEntry.ClinicalSectionEntryBuilder builder = ClinicalSectionEntry.builder()
                .entryId(entryId(procedure, index))
                .displayText(displayText(concepts, freeText, "procedure"))
                .codedConcepts(concepts)
                .clinicalStatus(eventStatus(procedure))
                .onsetDate(onsetDate(procedure))
                .recordedDate(authorTime(procedure))
                .sourceReference(textReference);

        putDetail(builder, MappingConstants.DETAIL_BODY_SITE,
                displayOf(CdaElements.child(procedure, "targetSiteCode"), scope));
        putDetail(builder, MappingConstants.DETAIL_END_DATE, endDate(procedure));
        return builder.build();
    }
}
