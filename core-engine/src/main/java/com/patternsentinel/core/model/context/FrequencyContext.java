package com.patternsentinel.core.model.context;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.util.Collections.unmodifiableMap;

/**
 * Details of a change in reporting interval between the older and the newer
 * half of the history. Intervals are in seconds.
 */
public final class FrequencyContext extends AnomalyContext {

    private final double recentIntervalS;
    private final double historicalIntervalS;
    private final double changeRatio;
    private final FrequencyDirection direction;

    public FrequencyContext(double recentIntervalS, double historicalIntervalS, double changeRatio,
            FrequencyDirection direction) {
        this.recentIntervalS = recentIntervalS;
        this.historicalIntervalS = historicalIntervalS;
        this.changeRatio = changeRatio;
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
    }

    @Override
    public String getKind() {
        return "frequency";
    }

    public double getRecentIntervalS() {
        return recentIntervalS;
    }

    public double getHistoricalIntervalS() {
        return historicalIntervalS;
    }

    public double getChangeRatio() {
        return changeRatio;
    }

    public FrequencyDirection getDirection() {
        return direction;
    }

    @Override
    public Map<String, Object> toTemplateValues() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("recent_interval_s", recentIntervalS);
        m.put("historical_interval_s", historicalIntervalS);
        m.put("change_ratio", changeRatio);
        m.put("change_pct", changeRatio * 100);
        m.put("direction", direction.id());
        return unmodifiableMap(m);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FrequencyContext that))
            return false;
        return Double.compare(recentIntervalS, that.recentIntervalS) == 0
                && Double.compare(historicalIntervalS, that.historicalIntervalS) == 0
                && Double.compare(changeRatio, that.changeRatio) == 0
                && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(recentIntervalS, historicalIntervalS, changeRatio, direction);
    }
}
