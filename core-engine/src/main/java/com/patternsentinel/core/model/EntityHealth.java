package com.patternsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Worst severity seen for an entity, with {@link #OK} for entities that have
 * no logged anomaly.
 *
 * @since 1.0.0
 */
public enum EntityHealth {

    OK(0),
    INFO(1),
    WARNING(2),
    CRITICAL(3);

    private final int rank;

    EntityHealth(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Map a severity onto the health scale.
     *
     * @param severity anomaly severity; must not be {@code null}
     * @return the health status of the same rank
     */
    public static EntityHealth of(Severity severity) {
        return switch (severity) {
            case INFO -> INFO;
            case WARNING -> WARNING;
            case CRITICAL -> CRITICAL;
        };
    }

    /**
     * @param other status to compare with
     * @return the more severe of {@code this} and {@code other}
     */
    public EntityHealth worst(EntityHealth other) {
        return other.rank > rank ? other : this;
    }
}
