package com.al.clinicalnormalizer.service.quality;

import com.al.clinicalnormalizer.model.ClinicalSectionEntry;
import com.al.clinicalnormalizer.model.NormalizedSection;
import com.al.clinicalnormalizer.model.PipelineResult;
import com.al.clinicalnormalizer.model.QualityScore;
import com.al.clinicalnormalizer.model.ResolvedTerm;
import com.al.clinicalnormalizer.model.enums.QualityLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

/**
 * Scores how much of a document's coded content was resolved to catalogue or source text.
 *
 * <p>
 * Only entry level concepts are counted; the section aggregate repeats them. A term counts
 * as resolved unless its provenance is FALLBACK.
 */
@Slf4j
@Service
public class TranslationQualityAssessor {

    public QualityScore score(PipelineResult result) {
        if (result == null) {
            return score(List.of());
        }
        return score(result.getSections());
    }

    public QualityScore scoreSection(NormalizedSection section) {
        if (section == null) {
            return score(List.of());
        }
        return score(List.of(section));
    }

    private QualityScore score(Collection<NormalizedSection> sections) {
        int total = 0;
        int resolved = 0;
        for (NormalizedSection section : sections) {
            for (ClinicalSectionEntry entry : section.getEntries()) {
                for (ResolvedTerm term : entry.getCodedConcepts()) {
                    total++;
                    if (term.isResolved()) {
                        resolved++;
                    }
                }
            }
        }

        if (total == 0) {
            return new QualityScore(QualityLevel.NO_CODES, null, 0, 0);
        }
        double percentage = resolved * 100.0 / total;
        QualityScore score = new QualityScore(QualityLevel.fromPercentage(percentage), percentage, resolved, total);
        log.debug("Translation quality {} ({}/{} concepts resolved)", score.getLabel(), resolved, total);
        return score;
    }
}
