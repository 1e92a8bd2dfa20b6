package com.patternsentinel.core.model;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single numeric reading of one entity.
 *
 * <p>
 * Instances are immutable. The timestamp keeps the offset it was supplied
 * with, so hour-of-day and weekday bucketing follow the source's local time.
 * </p>
 *
 * @since 1.0.0
 */
public final class DataPoint {

    private final String entityId;
    private final double value;
    private final OffsetDateTime timestamp;
    private final Map<String, Object> attributes;

    /**
     * @param entityId   entity the reading belongs to; must not be {@code null}
     * @param value      the reading
     * @param timestamp  when the reading was taken; must not be {@code null}
     * @param attributes free-form source attributes, may be {@code null}
     */
    public DataPoint(String entityId, double value, OffsetDateTime timestamp,
            Map<String, Object> attributes) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.value = value;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.attributes = attributes == null || attributes.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public String getEntityId() {
        return entityId;
    }

    public double getValue() {
        return value;
    }

    public OffsetDateTime getTimestamp() {
        return timestamp;
    }

    /**
     * @return unmodifiable attribute map, never {@code null}
     */
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DataPoint that))
            return false;
        return Double.compare(value, that.value) == 0
                && entityId.equals(that.entityId)
                && timestamp.equals(that.timestamp)
                && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, value, timestamp, attributes);
    }

    @Override
    public String toString() {
        return "DataPoint{" +
                "entityId='" + entityId + '\'' +
                ", value=" + value +
                ", timestamp=" + timestamp +
                '}';
    }
}
