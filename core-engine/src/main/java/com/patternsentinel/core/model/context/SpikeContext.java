package com.patternsentinel.core.model.context;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.util.Collections.unmodifiableMap;

/**
 * Details of a spike: the effective z-score, the hour-of-day z-score (0 when
 * the hour has no baseline) and the hour of the offending reading.
 */
public final class SpikeContext extends AnomalyContext {

    private final double zScore;
    private final double hourlyZ;
    private final int hour;

    public SpikeContext(double zScore, double hourlyZ, int hour) {
        this.zScore = zScore;
        this.hourlyZ = hourlyZ;
        this.hour = hour;
    }

    @Override
    public String getKind() {
        return "spike";
    }

    public double getZScore() {
        return zScore;
    }

    public double getHourlyZ() {
        return hourlyZ;
    }

    public int getHour() {
        return hour;
    }

    @Override
    public Map<String, Object> toTemplateValues() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("z_score", zScore);
        m.put("hourly_z", hourlyZ);
        m.put("hour", hour);
        return unmodifiableMap(m);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SpikeContext that))
            return false;
        return Double.compare(zScore, that.zScore) == 0
                && Double.compare(hourlyZ, that.hourlyZ) == 0
                && hour == that.hour;
    }

    @Override
    public int hashCode() {
        return Objects.hash(zScore, hourlyZ, hour);
    }
}
