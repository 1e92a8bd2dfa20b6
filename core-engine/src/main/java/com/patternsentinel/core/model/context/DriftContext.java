package com.patternsentinel.core.model.context;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.util.Collections.unmodifiableMap;

/**
 * Details of a drift between the recent window and the older history.
 */
public final class DriftContext extends AnomalyContext {

    private final double driftZ;
    private final DriftDirection direction;
    private final double recentMean;
    private final double historicalMean;

    public DriftContext(double driftZ, DriftDirection direction, double recentMean,
            double historicalMean) {
        this.driftZ = driftZ;
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.recentMean = recentMean;
        this.historicalMean = historicalMean;
    }

    @Override
    public String getKind() {
        return "drift";
    }

    public double getDriftZ() {
        return driftZ;
    }

    public DriftDirection getDirection() {
        return direction;
    }

    public double getRecentMean() {
        return recentMean;
    }

    public double getHistoricalMean() {
        return historicalMean;
    }

    @Override
    public Map<String, Object> toTemplateValues() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("drift_z", driftZ);
        m.put("direction", direction.id());
        m.put("recent_mean", recentMean);
        m.put("historical_mean", historicalMean);
        return unmodifiableMap(m);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DriftContext that))
            return false;
        return Double.compare(driftZ, that.driftZ) == 0
                && direction == that.direction
                && Double.compare(recentMean, that.recentMean) == 0
                && Double.compare(historicalMean, that.historicalMean) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(driftZ, direction, recentMean, historicalMean);
    }
}
