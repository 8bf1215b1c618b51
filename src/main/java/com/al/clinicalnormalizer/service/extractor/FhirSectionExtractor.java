package com.al.clinicalnormalizer.service.extractor;

import com.al.clinicalnormalizer.model.enums.SourceType;
import org.hl7.fhir.r4.model.Bundle;

public interface FhirSectionExtractor extends SectionExtractor<Bundle> {

    @Override
    default SourceType getSourceType() {
        return SourceType.FHIR;
    }
}
