package com.patternsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.patternsentinel.core.model.context.AnomalyContext;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Scored, classified anomaly emitted by the detection pipeline.
 *
 * <p>
 * An anomaly references its source entity by id only (for correlation
 * anomalies the synthetic id {@code "A <-> B"}), so it outlives later changes
 * to the source series.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code anomalyId}, {@code entityId}, {@code type},
 * {@code severity}, {@code detectedAt} and {@code context} are required;
 * omitting any of them throws {@link NullPointerException} at build time.
 * The score and deviation are rounded to one decimal, value and expected
 * value to two.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "anomalyId", "entityId", "type", "severity", "score", "detectedAt",
        "value", "expectedValue", "deviationPct", "descriptionKey", "context" })
public final class Anomaly {

    private final String anomalyId;
    private final String entityId;
    private final AnomalyType type;
    private final Severity severity;
    private final double score;
    private final OffsetDateTime detectedAt;
    private final double value;
    private final double expectedValue;
    private final double deviationPct;
    private final String descriptionKey;
    private final AnomalyContext context;

    private Anomaly(Builder b) {
        this.anomalyId = Objects.requireNonNull(b.anomalyId, "anomalyId must not be null");
        this.entityId = Objects.requireNonNull(b.entityId, "entityId must not be null");
        this.type = Objects.requireNonNull(b.type, "type must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.detectedAt = Objects.requireNonNull(b.detectedAt, "detectedAt must not be null");
        this.context = Objects.requireNonNull(b.context, "context must not be null");
        this.score = round(b.score, 1);
        this.value = round(b.value, 2);
        this.expectedValue = round(b.expectedValue, 2);
        this.deviationPct = round(b.deviationPct, 1);
        this.descriptionKey = b.descriptionKey != null ? b.descriptionKey : b.type.id();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Anomaly} instances. When no description key is
     * given the type id is used.
     */
    public static class Builder {
        private String anomalyId;
        private String entityId;
        private AnomalyType type;
        private Severity severity;
        private double score;
        private OffsetDateTime detectedAt;
        private double value;
        private double expectedValue;
        private double deviationPct;
        private String descriptionKey;
        private AnomalyContext context;

        public Builder anomalyId(String anomalyId) {
            this.anomalyId = anomalyId;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder type(AnomalyType type) {
            this.type = type;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder detectedAt(OffsetDateTime detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder expectedValue(double expectedValue) {
            this.expectedValue = expectedValue;
            return this;
        }

        public Builder deviationPct(double deviationPct) {
            this.deviationPct = deviationPct;
            return this;
        }

        public Builder descriptionKey(String descriptionKey) {
            this.descriptionKey = descriptionKey;
            return this;
        }

        public Builder context(AnomalyContext context) {
            this.context = context;
            return this;
        }

        /**
         * @return a new {@link Anomaly}
         * @throws NullPointerException if a required field is missing
         */
        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getAnomalyId() {
        return anomalyId;
    }

    public String getEntityId() {
        return entityId;
    }

    public AnomalyType getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    /**
     * @return score in [0, 100], 100 being the most anomalous
     */
    public double getScore() {
        return score;
    }

    public OffsetDateTime getDetectedAt() {
        return detectedAt;
    }

    public double getValue() {
        return value;
    }

    public double getExpectedValue() {
        return expectedValue;
    }

    public double getDeviationPct() {
        return deviationPct;
    }

    /**
     * @return key of the description template, e.g. {@code "spike.up"}
     */
    public String getDescriptionKey() {
        return descriptionKey;
    }

    public AnomalyContext getContext() {
        return context;
    }

    /**
     * Typed access to the context.
     *
     * @param contextType expected context class
     * @param <T>         context type
     * @return the context cast to {@code contextType}
     * @throws ClassCastException if the context is of another type
     */
    public <T extends AnomalyContext> T getContext(Class<T> contextType) {
        return contextType.cast(context);
    }

    private static double round(double v, int places) {
        if (!Double.isFinite(v)) {
            return v;
        }
        return BigDecimal.valueOf(v).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return anomalyId.equals(that.anomalyId);
    }

    @Override
    public int hashCode() {
        return anomalyId.hashCode();
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "id='" + anomalyId + '\'' +
                ", entityId='" + entityId + '\'' +
                ", type=" + type.id() +
                ", severity=" + severity.id() +
                ", score=" + score +
                ", value=" + value +
                ", expected=" + expectedValue +
                ", detectedAt=" + detectedAt +
                '}';
    }
}
