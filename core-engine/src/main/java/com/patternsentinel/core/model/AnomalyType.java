package com.patternsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Signal type of an {@link Anomaly}.
 *
 * <p>
 * Declaration order is the order in which the detection pipeline runs its
 * detectors.
 * </p>
 *
 * @since 1.0.0
 */
public enum AnomalyType {

    /** Sudden jump or drop of a reading against its baseline. */
    SPIKE,
    /** Sustained shift of the recent mean away from the historical mean. */
    DRIFT,
    /** Run of bit-identical readings (stuck sensor). */
    FLATLINE,
    /** Violation of the hour-of-day or weekday pattern. */
    SEASONAL,
    /** Change of the reporting interval. */
    FREQUENCY,
    /** Break of a learned cross-entity correlation. */
    CORRELATION;

    /**
     * @return lowercase identifier, e.g. {@code "spike"}
     */
    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a type from its identifier, ignoring case.
     *
     * @param id identifier such as {@code "flatline"}
     * @return the matching type
     * @throws IllegalArgumentException if {@code id} is unknown
     */
    @JsonCreator
    public static AnomalyType fromId(String id) {
        if (id != null) {
            for (AnomalyType t : values()) {
                if (t.id().equalsIgnoreCase(id.trim())) {
                    return t;
                }
            }
        }
        throw new IllegalArgumentException("Unknown anomaly type: '" + id
                + "'. Supported: spike, drift, flatline, seasonal, frequency, correlation");
    }
}
