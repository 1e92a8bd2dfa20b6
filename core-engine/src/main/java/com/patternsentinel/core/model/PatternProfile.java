package com.patternsentinel.core.model;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Learned statistical baseline of one entity.
 *
 * <p>
 * Holds global statistics over the retained window plus 24 hour-of-day and 7
 * weekday buckets (Monday = 0). Buckets without samples are
 * {@link BucketStats#EMPTY}.
 * </p>
 *
 * <p>
 * A profile is a pure function of the history it was computed from:
 * {@link #getLastUpdated()} is the timestamp of the newest point in that
 * history, so recomputing over unchanged history yields an equal profile.
 * </p>
 *
 * @since 1.0.0
 */
public final class PatternProfile {

    public static final int HOURS = 24;
    public static final int WEEKDAYS = 7;

    private final String entityId;
    private final double globalMean;
    private final double globalStd;
    private final double minValue;
    private final double maxValue;
    private final int totalPoints;
    private final OffsetDateTime lastUpdated;
    private final BucketStats[] hourly;
    private final BucketStats[] daily;

    private PatternProfile(Builder b) {
        this.entityId = Objects.requireNonNull(b.entityId, "entityId must not be null");
        this.globalMean = b.globalMean;
        this.globalStd = b.globalStd;
        this.minValue = b.minValue;
        this.maxValue = b.maxValue;
        this.totalPoints = b.totalPoints;
        this.lastUpdated = b.lastUpdated;
        this.hourly = b.hourly.clone();
        this.daily = b.daily.clone();
    }

    public static Builder builder(String entityId) {
        return new Builder(entityId);
    }

    // ---------------------------------------------------------------
    // Global statistics
    // ---------------------------------------------------------------

    public String getEntityId() {
        return entityId;
    }

    public double getGlobalMean() {
        return globalMean;
    }

    public double getGlobalStd() {
        return globalStd;
    }

    public double getMinValue() {
        return minValue;
    }

    public double getMaxValue() {
        return maxValue;
    }

    public int getTotalPoints() {
        return totalPoints;
    }

    public OffsetDateTime getLastUpdated() {
        return lastUpdated;
    }

    // ---------------------------------------------------------------
    // Buckets
    // ---------------------------------------------------------------

    /**
     * @param hour hour of day, 0-23
     * @return bucket statistics, {@link BucketStats#EMPTY} if no sample fell in
     *         that hour
     */
    public BucketStats hourBucket(int hour) {
        return hourly[checkIndex(hour, HOURS, "hour")];
    }

    /**
     * @param weekday day of week, Monday = 0 .. Sunday = 6
     * @return bucket statistics, {@link BucketStats#EMPTY} if no sample fell on
     *         that day
     */
    public BucketStats dayBucket(int weekday) {
        return daily[checkIndex(weekday, WEEKDAYS, "weekday")];
    }

    public OptionalDouble hourlyMean(int hour) {
        BucketStats b = hourBucket(hour);
        return b.hasData() ? OptionalDouble.of(b.getMean()) : OptionalDouble.empty();
    }

    public OptionalDouble hourlyStd(int hour) {
        BucketStats b = hourBucket(hour);
        return b.hasData() ? OptionalDouble.of(b.getStd()) : OptionalDouble.empty();
    }

    public OptionalDouble dailyMean(int weekday) {
        BucketStats b = dayBucket(weekday);
        return b.hasData() ? OptionalDouble.of(b.getMean()) : OptionalDouble.empty();
    }

    public OptionalDouble dailyStd(int weekday) {
        BucketStats b = dayBucket(weekday);
        return b.hasData() ? OptionalDouble.of(b.getStd()) : OptionalDouble.empty();
    }

    /**
     * @return hourly buckets that hold data, keyed by hour, in ascending order
     */
    public Map<Integer, BucketStats> getHourlyBuckets() {
        return sparse(hourly);
    }

    /**
     * @return weekday buckets that hold data, keyed by weekday (Monday = 0)
     */
    public Map<Integer, BucketStats> getDailyBuckets() {
        return sparse(daily);
    }

    private static Map<Integer, BucketStats> sparse(BucketStats[] buckets) {
        Map<Integer, BucketStats> out = new LinkedHashMap<>();
        for (int i = 0; i < buckets.length; i++) {
            if (buckets[i].hasData()) {
                out.put(i, buckets[i]);
            }
        }
        return Collections.unmodifiableMap(out);
    }

    private static int checkIndex(int index, int size, String name) {
        if (index < 0 || index >= size) {
            throw new IllegalArgumentException(
                    name + " must be in [0, " + (size - 1) + "], got: " + index);
        }
        return index;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link PatternProfile}. Unset buckets are empty.
     */
    public static class Builder {
        private final String entityId;
        private double globalMean;
        private double globalStd;
        private double minValue;
        private double maxValue;
        private int totalPoints;
        private OffsetDateTime lastUpdated;
        private final BucketStats[] hourly = filled(HOURS);
        private final BucketStats[] daily = filled(WEEKDAYS);

        private Builder(String entityId) {
            this.entityId = entityId;
        }

        public Builder globalMean(double v) {
            this.globalMean = v;
            return this;
        }

        public Builder globalStd(double v) {
            this.globalStd = v;
            return this;
        }

        public Builder minValue(double v) {
            this.minValue = v;
            return this;
        }

        public Builder maxValue(double v) {
            this.maxValue = v;
            return this;
        }

        public Builder totalPoints(int v) {
            this.totalPoints = v;
            return this;
        }

        public Builder lastUpdated(OffsetDateTime v) {
            this.lastUpdated = v;
            return this;
        }

        public Builder hourBucket(int hour, BucketStats stats) {
            hourly[checkIndex(hour, HOURS, "hour")] = Objects.requireNonNull(stats);
            return this;
        }

        public Builder dayBucket(int weekday, BucketStats stats) {
            daily[checkIndex(weekday, WEEKDAYS, "weekday")] = Objects.requireNonNull(stats);
            return this;
        }

        public PatternProfile build() {
            return new PatternProfile(this);
        }

        private static BucketStats[] filled(int size) {
            BucketStats[] arr = new BucketStats[size];
            Arrays.fill(arr, BucketStats.EMPTY);
            return arr;
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PatternProfile that))
            return false;
        return Double.compare(globalMean, that.globalMean) == 0
                && Double.compare(globalStd, that.globalStd) == 0
                && Double.compare(minValue, that.minValue) == 0
                && Double.compare(maxValue, that.maxValue) == 0
                && totalPoints == that.totalPoints
                && entityId.equals(that.entityId)
                && Objects.equals(lastUpdated, that.lastUpdated)
                && Arrays.equals(hourly, that.hourly)
                && Arrays.equals(daily, that.daily);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(entityId, globalMean, globalStd, minValue, maxValue,
                totalPoints, lastUpdated);
        result = 31 * result + Arrays.hashCode(hourly);
        result = 31 * result + Arrays.hashCode(daily);
        return result;
    }

    @Override
    public String toString() {
        return "PatternProfile{" +
                "entityId='" + entityId + '\'' +
                ", globalMean=" + globalMean +
                ", globalStd=" + globalStd +
                ", min=" + minValue +
                ", max=" + maxValue +
                ", totalPoints=" + totalPoints +
                ", lastUpdated=" + lastUpdated +
                '}';
    }
}
