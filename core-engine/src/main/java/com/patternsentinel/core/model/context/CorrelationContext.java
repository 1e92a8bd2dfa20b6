package com.patternsentinel.core.model.context;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.util.Collections.unmodifiableMap;

/**
 * Details of a broken correlation: the pair and its historical and recent
 * coefficients.
 */
public final class CorrelationContext extends AnomalyContext {

    private final String entityA;
    private final String entityB;
    private final double historicalCorrelation;
    private final double recentCorrelation;

    public CorrelationContext(String entityA, String entityB, double historicalCorrelation,
            double recentCorrelation) {
        this.entityA = Objects.requireNonNull(entityA, "entityA must not be null");
        this.entityB = Objects.requireNonNull(entityB, "entityB must not be null");
        this.historicalCorrelation = historicalCorrelation;
        this.recentCorrelation = recentCorrelation;
    }

    @Override
    public String getKind() {
        return "correlation";
    }

    public String getEntityA() {
        return entityA;
    }

    public String getEntityB() {
        return entityB;
    }

    public double getHistoricalCorrelation() {
        return historicalCorrelation;
    }

    public double getRecentCorrelation() {
        return recentCorrelation;
    }

    @Override
    public Map<String, Object> toTemplateValues() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("entity_a", entityA);
        m.put("entity_b", entityB);
        m.put("historical_correlation", historicalCorrelation);
        m.put("recent_correlation", recentCorrelation);
        return unmodifiableMap(m);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CorrelationContext that))
            return false;
        return entityA.equals(that.entityA)
                && entityB.equals(that.entityB)
                && Double.compare(historicalCorrelation, that.historicalCorrelation) == 0
                && Double.compare(recentCorrelation, that.recentCorrelation) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityA, entityB, historicalCorrelation, recentCorrelation);
    }
}
