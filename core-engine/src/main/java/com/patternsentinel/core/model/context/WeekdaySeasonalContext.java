package com.patternsentinel.core.model.context;

import java.time.DayOfWeek;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.util.Collections.unmodifiableMap;

/**
 * Details of a reading that violates its weekday baseline.
 *
 * <p>
 * {@code weekday_name} is exposed as a {@link DayOfWeek} so that the
 * describer can render it in its own locale.
 * </p>
 */
public final class WeekdaySeasonalContext extends AnomalyContext {

    private final DayOfWeek weekdayName;
    private final double expectedDailyMean;
    private final double zScore;

    public WeekdaySeasonalContext(DayOfWeek weekdayName, double expectedDailyMean, double zScore) {
        this.weekdayName = Objects.requireNonNull(weekdayName, "weekdayName must not be null");
        this.expectedDailyMean = expectedDailyMean;
        this.zScore = zScore;
    }

    @Override
    public String getKind() {
        return "seasonal_weekday";
    }

    /**
     * @return weekday index, Monday = 0 .. Sunday = 6
     */
    public int getWeekday() {
        return weekdayName.getValue() - 1;
    }

    public DayOfWeek getWeekdayName() {
        return weekdayName;
    }

    public double getExpectedDailyMean() {
        return expectedDailyMean;
    }

    public double getZScore() {
        return zScore;
    }

    @Override
    public Map<String, Object> toTemplateValues() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("weekday", getWeekday());
        m.put("weekday_name", weekdayName);
        m.put("expected_daily_mean", expectedDailyMean);
        m.put("z_score", zScore);
        return unmodifiableMap(m);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WeekdaySeasonalContext that))
            return false;
        return weekdayName == that.weekdayName
                && Double.compare(expectedDailyMean, that.expectedDailyMean) == 0
                && Double.compare(zScore, that.zScore) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(weekdayName, expectedDailyMean, zScore);
    }
}
