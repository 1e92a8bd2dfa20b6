package com.patternsentinel.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated view over the anomaly registry.
 *
 * <p>
 * Severity and type counts contain every constant, with zero for those that
 * never occurred. {@code entityHealth} lists every tracked entity with the
 * worst severity logged for it, or {@link EntityHealth#OK}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalySummary {

    private final int totalEntities;
    private final int totalAnomalies;
    private final Map<Severity, Integer> severityCounts;
    private final Map<AnomalyType, Integer> typeCounts;
    private final Map<String, EntityHealth> entityHealth;
    private final List<Anomaly> topAnomalies;

    public AnomalySummary(int totalEntities, int totalAnomalies,
            Map<Severity, Integer> severityCounts,
            Map<AnomalyType, Integer> typeCounts,
            Map<String, EntityHealth> entityHealth,
            List<Anomaly> topAnomalies) {
        this.totalEntities = totalEntities;
        this.totalAnomalies = totalAnomalies;
        this.severityCounts = Collections.unmodifiableMap(new EnumMap<>(severityCounts));
        this.typeCounts = Collections.unmodifiableMap(new EnumMap<>(typeCounts));
        this.entityHealth = Collections.unmodifiableMap(new LinkedHashMap<>(entityHealth));
        this.topAnomalies = List.copyOf(topAnomalies);
    }

    public int getTotalEntities() {
        return totalEntities;
    }

    public int getTotalAnomalies() {
        return totalAnomalies;
    }

    public Map<Severity, Integer> getSeverityCounts() {
        return severityCounts;
    }

    public Map<AnomalyType, Integer> getTypeCounts() {
        return typeCounts;
    }

    public int count(Severity severity) {
        return severityCounts.getOrDefault(severity, 0);
    }

    public int count(AnomalyType type) {
        return typeCounts.getOrDefault(type, 0);
    }

    public Map<String, EntityHealth> getEntityHealth() {
        return entityHealth;
    }

    /**
     * @return up to ten anomalies, highest score first
     */
    public List<Anomaly> getTopAnomalies() {
        return topAnomalies;
    }

    @Override
    public String toString() {
        return "AnomalySummary{" +
                "totalEntities=" + totalEntities +
                ", totalAnomalies=" + totalAnomalies +
                ", severities=" + severityCounts +
                ", types=" + typeCounts +
                '}';
    }
}
