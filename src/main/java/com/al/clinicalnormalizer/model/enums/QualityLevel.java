package com.al.clinicalnormalizer.model.enums;

import lombok.Getter;

@Getter
public enum QualityLevel {
    EXCELLENT("Excellent"),
    GOOD("Good"),
    FAIR("Fair"),
    POOR("Poor"),
    NO_CODES("No codes");

    private final String label;

    QualityLevel(String label) {
        this.label = label;
    }

    /**
     * Map a coverage percentage (0-100) to a level.
     */
    public static QualityLevel fromPercentage(double percentage) {
        if (percentage >= 90.0) {
            return EXCELLENT;
        } else if (percentage >= 70.0) {
            return GOOD;
        } else if (percentage >= 50.0) {
            return FAIR;
        }
        return POOR;
    }
}
