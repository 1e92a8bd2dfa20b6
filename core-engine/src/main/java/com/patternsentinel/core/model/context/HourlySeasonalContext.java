package com.patternsentinel.core.model.context;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.util.Collections.unmodifiableMap;

/**
 * Details of a reading that violates its hour-of-day baseline.
 */
public final class HourlySeasonalContext extends AnomalyContext {

    private final int hour;
    private final double expectedMean;
    private final double expectedStd;
    private final double zScore;

    public HourlySeasonalContext(int hour, double expectedMean, double expectedStd, double zScore) {
        this.hour = hour;
        this.expectedMean = expectedMean;
        this.expectedStd = expectedStd;
        this.zScore = zScore;
    }

    @Override
    public String getKind() {
        return "seasonal_hourly";
    }

    public int getHour() {
        return hour;
    }

    /**
     * @return the hour formatted as {@code HH:00}
     */
    public String getHourStr() {
        return String.format("%02d:00", hour);
    }

    public double getExpectedMean() {
        return expectedMean;
    }

    public double getExpectedStd() {
        return expectedStd;
    }

    public double getZScore() {
        return zScore;
    }

    @Override
    public Map<String, Object> toTemplateValues() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("hour", hour);
        m.put("hour_str", getHourStr());
        m.put("expected_mean", expectedMean);
        m.put("expected_std", expectedStd);
        m.put("z_score", zScore);
        return unmodifiableMap(m);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof HourlySeasonalContext that))
            return false;
        return hour == that.hour
                && Double.compare(expectedMean, that.expectedMean) == 0
                && Double.compare(expectedStd, that.expectedStd) == 0
                && Double.compare(zScore, that.zScore) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(hour, expectedMean, expectedStd, zScore);
    }
}
