package com.patternsentinel.core.model;

import java.util.Objects;

/**
 * Learned correlation between two entities.
 *
 * <p>
 * Entities are referenced by id only; a pair does not keep either history
 * alive.
 * </p>
 *
 * @since 1.0.0
 */
public final class CorrelationPair {

    private final String entityA;
    private final String entityB;
    private final double correlation;
    private final int sampleCount;

    public CorrelationPair(String entityA, String entityB, double correlation, int sampleCount) {
        this.entityA = Objects.requireNonNull(entityA, "entityA must not be null");
        this.entityB = Objects.requireNonNull(entityB, "entityB must not be null");
        this.correlation = correlation;
        this.sampleCount = sampleCount;
    }

    public String getEntityA() {
        return entityA;
    }

    public String getEntityB() {
        return entityB;
    }

    public double getCorrelation() {
        return correlation;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public CorrelationStrength getStrength() {
        return CorrelationStrength.of(correlation);
    }

    /**
     * @param entityId entity to test
     * @return {@code true} if the pair references {@code entityId}
     */
    public boolean involves(String entityId) {
        return entityA.equals(entityId) || entityB.equals(entityId);
    }

    /**
     * @return synthetic entity id used for anomalies raised on this pair
     */
    public String compositeId() {
        return entityA + " <-> " + entityB;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CorrelationPair that))
            return false;
        return Double.compare(correlation, that.correlation) == 0
                && sampleCount == that.sampleCount
                && entityA.equals(that.entityA)
                && entityB.equals(that.entityB);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityA, entityB, correlation, sampleCount);
    }

    @Override
    public String toString() {
        return "CorrelationPair{" + entityA + " <-> " + entityB
                + ", r=" + correlation + ", n=" + sampleCount + '}';
    }
}
