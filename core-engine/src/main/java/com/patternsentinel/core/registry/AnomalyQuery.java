package com.patternsentinel.core.registry;

import com.patternsentinel.core.model.Anomaly;
import com.patternsentinel.core.model.AnomalyType;
import com.patternsentinel.core.model.Severity;

import java.util.Objects;
import java.util.Optional;

/**
 * Filter for {@link AnomalyRegistry#query(AnomalyQuery)}.
 *
 * <p>
 * Every criterion is optional; unset criteria match everything. Results are
 * limited to the most recent {@code limit} matches, {@value #DEFAULT_LIMIT}
 * by default.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyQuery {

    public static final int DEFAULT_LIMIT = 50;

    private static final AnomalyQuery ALL = builder().build();

    private final String entityId;
    private final Severity severity;
    private final AnomalyType type;
    private final int limit;

    private AnomalyQuery(Builder b) {
        if (b.limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + b.limit);
        }
        this.entityId = b.entityId;
        this.severity = b.severity;
        this.type = b.type;
        this.limit = b.limit;
    }

    /**
     * @return a query matching everything with the default limit
     */
    public static AnomalyQuery all() {
        return ALL;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyQuery}.
     */
    public static class Builder {
        private String entityId;
        private Severity severity;
        private AnomalyType type;
        private int limit = DEFAULT_LIMIT;

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder type(AnomalyType type) {
            this.type = type;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        /**
         * @return a new query
         * @throws IllegalArgumentException if {@code limit} is not positive
         */
        public AnomalyQuery build() {
            return new AnomalyQuery(this);
        }
    }

    /**
     * @param anomaly candidate
     * @return {@code true} if every set criterion matches
     */
    public boolean matches(Anomaly anomaly) {
        return (entityId == null || entityId.equals(anomaly.getEntityId()))
                && (severity == null || severity == anomaly.getSeverity())
                && (type == null || type == anomaly.getType());
    }

    public Optional<String> getEntityId() {
        return Optional.ofNullable(entityId);
    }

    public Optional<Severity> getSeverity() {
        return Optional.ofNullable(severity);
    }

    public Optional<AnomalyType> getType() {
        return Optional.ofNullable(type);
    }

    public int getLimit() {
        return limit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyQuery that))
            return false;
        return limit == that.limit
                && Objects.equals(entityId, that.entityId)
                && severity == that.severity
                && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, severity, type, limit);
    }

    @Override
    public String toString() {
        return "AnomalyQuery{entityId=" + entityId + ", severity=" + severity
                + ", type=" + type + ", limit=" + limit + '}';
    }
}
