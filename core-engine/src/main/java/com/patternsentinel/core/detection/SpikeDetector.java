package com.patternsentinel.core.detection;

import com.patternsentinel.core.model.Anomaly;
import com.patternsentinel.core.model.AnomalyType;
import com.patternsentinel.core.model.BucketStats;
import com.patternsentinel.core.model.DataPoint;
import com.patternsentinel.core.model.PatternProfile;
import com.patternsentinel.core.model.context.SpikeContext;
import com.patternsentinel.core.scoring.SeverityScorer;
import com.patternsentinel.core.stats.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Flags sudden outliers among the most recent readings.
 *
 * <p>
 * Each of the last {@code lookback} points is scored against the global
 * baseline and, where the point's hour-of-day bucket has a baseline, against
 * that bucket too. The larger of both z-scores decides; it must reach the info
 * threshold. The expected value is the hourly mean when the hour has data,
 * otherwise the global mean.
 * </p>
 *
 * <p>
 * Requires a profile with a positive global standard deviation.
 * </p>
 *
 * @since 1.0.0
 */
public class SpikeDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SpikeDetector.class);

    private final int lookback;
    private final SeverityScorer scorer;
    private final AnomalyFactory anomalies;

    /**
     * @param lookback  number of most recent points to examine
     * @param scorer    z-score classification
     * @param anomalies anomaly id source
     */
    public SpikeDetector(int lookback, SeverityScorer scorer, AnomalyFactory anomalies) {
        if (lookback <= 0) {
            throw new IllegalArgumentException("lookback must be > 0, got: " + lookback);
        }
        this.lookback = lookback;
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.anomalies = Objects.requireNonNull(anomalies, "anomalies must not be null");
    }

    @Override
    public List<Anomaly> evaluate(SeriesSnapshot snapshot) {
        PatternProfile profile = snapshot.getProfile();
        if (!(profile.getGlobalStd() > 0)) {
            return List.of();
        }

        List<Anomaly> found = new ArrayList<>();
        for (DataPoint dp : snapshot.tail(lookback)) {
            double value = dp.getValue();
            double z = Math.abs(value - profile.getGlobalMean()) / profile.getGlobalStd();

            int hour = dp.getTimestamp().getHour();
            BucketStats bucket = profile.hourBucket(hour);
            double hourlyZ = bucket.hasBaseline()
                    ? Math.abs(value - bucket.getMean()) / bucket.getStd()
                    : 0.0;

            double effectiveZ = Math.max(z, hourlyZ);
            if (!scorer.isReportable(effectiveZ)) {
                continue;
            }

            double expected = bucket.hasData() ? bucket.getMean() : profile.getGlobalMean();
            LOG.debug("Spike on '{}' at {}: value={} expected={} z={} hourlyZ={}",
                    snapshot.getEntityId(), dp.getTimestamp(), value, expected, z, hourlyZ);

            found.add(anomalies.newAnomaly(snapshot.getEntityId(), AnomalyType.SPIKE)
                    .severity(scorer.severityFor(effectiveZ))
                    .score(scorer.scoreFor(effectiveZ))
                    .detectedAt(dp.getTimestamp())
                    .value(value)
                    .expectedValue(expected)
                    .deviationPct(Statistics.deviationPct(value, expected))
                    .descriptionKey(value > expected ? "spike.up" : "spike.down")
                    .context(new SpikeContext(
                            Statistics.round(effectiveZ, 2),
                            Statistics.round(hourlyZ, 2),
                            hour))
                    .build());
        }
        return found;
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.SPIKE;
    }
}
