package com.al.clinicalnormalizer.model;

import com.al.clinicalnormalizer.model.enums.QualityLevel;
import lombok.Value;

@Value
public class QualityScore {
    QualityLevel level;
    /** Coverage 0-100, null when no codes were encountered */
    Double percentage;
    int resolvedConcepts;
    int totalConcepts;

    public String getLabel() {
        return level.getLabel();
    }
}
