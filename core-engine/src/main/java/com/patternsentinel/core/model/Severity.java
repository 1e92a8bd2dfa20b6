package com.patternsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity class of an {@link Anomaly}, ordered from least to most severe.
 *
 * @since 1.0.0
 */
public enum Severity {

    INFO(1),
    WARNING(2),
    CRITICAL(3);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    /**
     * @return 1 for info, 2 for warning, 3 for critical
     */
    public int rank() {
        return rank;
    }

    /**
     * @return lowercase identifier used in JSON and description templates
     */
    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a severity from its identifier, ignoring case.
     *
     * @param id identifier such as {@code "warning"}
     * @return the matching severity
     * @throws IllegalArgumentException if {@code id} is unknown
     */
    @JsonCreator
    public static Severity fromId(String id) {
        if (id != null) {
            for (Severity s : values()) {
                if (s.id().equalsIgnoreCase(id.trim())) {
                    return s;
                }
            }
        }
        throw new IllegalArgumentException("Unknown severity: '" + id
                + "'. Supported: info, warning, critical");
    }
}
