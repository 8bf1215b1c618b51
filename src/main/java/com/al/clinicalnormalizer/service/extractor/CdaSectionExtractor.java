package com.al.clinicalnormalizer.service.extractor;

import com.al.clinicalnormalizer.model.enums.SourceType;
import com.al.clinicalnormalizer.service.extractor.cda.CdaDocument;

public interface CdaSectionExtractor extends SectionExtractor<CdaDocument> {

    @Override
    default SourceType getSourceType() {
        return SourceType.CDA;
    }
}
