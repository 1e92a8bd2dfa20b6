package com.patternsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Qualitative strength of a correlation coefficient, by absolute value.
 *
 * @since 1.0.0
 */
public enum CorrelationStrength {

    VERY_STRONG(0.9),
    STRONG(0.7),
    MODERATE(0.5),
    WEAK(0.3),
    NEGLIGIBLE(0.0);

    private final double lowerBound;

    CorrelationStrength(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param correlation Pearson coefficient in [-1, 1]
     * @return the strongest class whose lower bound {@code |correlation|} reaches
     */
    public static CorrelationStrength of(double correlation) {
        double abs = Math.abs(correlation);
        for (CorrelationStrength s : values()) {
            if (abs >= s.lowerBound) {
                return s;
            }
        }
        return NEGLIGIBLE;
    }
}
