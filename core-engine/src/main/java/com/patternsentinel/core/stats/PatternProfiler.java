package com.patternsentinel.core.stats;

import com.patternsentinel.core.model.BucketStats;
import com.patternsentinel.core.model.DataPoint;
import com.patternsentinel.core.model.PatternProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Learns a {@link PatternProfile} from one entity's history.
 *
 * <p>
 * Global statistics span the whole retained window. Readings are bucketed by
 * the hour of their timestamp (0-23, in the offset they were supplied with)
 * and by weekday (Monday = 0). Histories shorter than {@code minPoints}
 * produce no profile.
 * </p>
 *
 * <p>
 * The result depends only on the history passed in, so profiling the same
 * history twice yields equal profiles.
 * </p>
 *
 * @since 1.0.0
 */
public class PatternProfiler {

    private static final Logger LOG = LoggerFactory.getLogger(PatternProfiler.class);

    private final int minPoints;

    /**
     * @param minPoints minimum history length for a profile, {@code >= 2}
     */
    public PatternProfiler(int minPoints) {
        if (minPoints < 2) {
            throw new IllegalArgumentException("minPoints must be >= 2, got: " + minPoints);
        }
        this.minPoints = minPoints;
    }

    /**
     * @param entityId entity the history belongs to
     * @param history  readings, oldest first
     * @return the learned profile, or empty if the history is too short
     */
    public Optional<PatternProfile> profile(String entityId, List<DataPoint> history) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        if (history == null || history.size() < minPoints) {
            LOG.trace("Not profiling '{}': {} point(s) < {}", entityId,
                    history == null ? 0 : history.size(), minPoints);
            return Optional.empty();
        }

        double[] values = Statistics.values(history);
        double mean = Statistics.mean(values);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }

        PatternProfile.Builder builder = PatternProfile.builder(entityId)
                .globalMean(mean)
                .globalStd(Statistics.sampleStdDev(values, mean))
                .minValue(min)
                .maxValue(max)
                .totalPoints(values.length)
                .lastUpdated(history.get(history.size() - 1).getTimestamp());

        List<List<Double>> hourly = buckets(PatternProfile.HOURS);
        List<List<Double>> daily = buckets(PatternProfile.WEEKDAYS);
        for (DataPoint dp : history) {
            hourly.get(dp.getTimestamp().getHour()).add(dp.getValue());
            daily.get(dp.getTimestamp().getDayOfWeek().getValue() - 1).add(dp.getValue());
        }
        for (int h = 0; h < PatternProfile.HOURS; h++) {
            builder.hourBucket(h, stats(hourly.get(h)));
        }
        for (int d = 0; d < PatternProfile.WEEKDAYS; d++) {
            builder.dayBucket(d, stats(daily.get(d)));
        }

        PatternProfile profile = builder.build();
        LOG.debug("Learned profile for '{}': mean={} std={} points={}", entityId,
                profile.getGlobalMean(), profile.getGlobalStd(), profile.getTotalPoints());
        return Optional.of(profile);
    }

    public int getMinPoints() {
        return minPoints;
    }

    private static List<List<Double>> buckets(int size) {
        List<List<Double>> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            out.add(new ArrayList<>());
        }
        return out;
    }

    private static BucketStats stats(List<Double> bucket) {
        if (bucket.isEmpty()) {
            return BucketStats.EMPTY;
        }
        double[] values = bucket.stream().mapToDouble(Double::doubleValue).toArray();
        double mean = Statistics.mean(values);
        return new BucketStats(values.length, mean, Statistics.sampleStdDev(values, mean));
    }
}
