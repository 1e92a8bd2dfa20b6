package com.patternsentinel.core.detection;

import com.patternsentinel.core.model.Anomaly;
import com.patternsentinel.core.model.AnomalyType;
import com.patternsentinel.core.model.DataPoint;
import com.patternsentinel.core.model.Severity;
import com.patternsentinel.core.model.context.FrequencyContext;
import com.patternsentinel.core.model.context.FrequencyDirection;
import com.patternsentinel.core.scoring.SeverityScorer;
import com.patternsentinel.core.stats.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Flags a change in how often an entity reports.
 *
 * <p>
 * The history is split at its midpoint and the mean positive gap between
 * consecutive timestamps is computed for each half. Gaps of zero or less
 * (duplicate or out-of-order timestamps) are ignored. With
 * {@code ratio = |recent - older| / older}:
 * </p>
 * <ul>
 * <li>{@code ratio < changeThreshold}: nothing</li>
 * <li>{@code ratio < criticalRatio}: warning</li>
 * <li>otherwise: critical</li>
 * </ul>
 * <p>
 * The score is {@code min(100, ratio * 50)}.
 * </p>
 *
 * @since 1.0.0
 */
public class FrequencyDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(FrequencyDetector.class);

    static final double SCORE_PER_RATIO = 50.0;

    private final int minPoints;
    private final double changeThreshold;
    private final double criticalRatio;
    private final AnomalyFactory anomalies;

    /**
     * @param minPoints       history length required before the check runs
     * @param changeThreshold ratio at which the detector fires
     * @param criticalRatio   ratio from which the anomaly is critical
     * @param anomalies       anomaly id source
     */
    public FrequencyDetector(int minPoints, double changeThreshold, double criticalRatio,
            AnomalyFactory anomalies) {
        this.minPoints = Math.max(4, minPoints);
        this.changeThreshold = changeThreshold;
        this.criticalRatio = criticalRatio;
        this.anomalies = Objects.requireNonNull(anomalies, "anomalies must not be null");
    }

    @Override
    public List<Anomaly> evaluate(SeriesSnapshot snapshot) {
        List<DataPoint> history = snapshot.getHistory();
        if (history.size() < minPoints) {
            return List.of();
        }

        int mid = history.size() / 2;
        OptionalDouble older = meanInterval(history.subList(0, mid));
        OptionalDouble recent = meanInterval(history.subList(mid, history.size()));
        if (older.isEmpty() || recent.isEmpty()) {
            return List.of();
        }
        double olderS = older.getAsDouble();
        double recentS = recent.getAsDouble();

        double ratio = Math.abs(recentS - olderS) / olderS;
        if (ratio < changeThreshold) {
            return List.of();
        }

        FrequencyDirection direction = recentS > olderS ? FrequencyDirection.SLOWER : FrequencyDirection.FASTER;
        LOG.debug("Reporting frequency change on '{}': {}s -> {}s (ratio={}, {})",
                snapshot.getEntityId(), olderS, recentS, ratio, direction.id());

        return List.of(anomalies.newAnomaly(snapshot.getEntityId(), AnomalyType.FREQUENCY)
                .severity(ratio < criticalRatio ? Severity.WARNING : Severity.CRITICAL)
                .score(SeverityScorer.cap(ratio * SCORE_PER_RATIO))
                .detectedAt(snapshot.latest().getTimestamp())
                .value(recentS)
                .expectedValue(olderS)
                .deviationPct(ratio * 100)
                .descriptionKey(direction == FrequencyDirection.SLOWER ? "frequency.slower" : "frequency.faster")
                .context(new FrequencyContext(
                        Statistics.round(recentS, 1),
                        Statistics.round(olderS, 1),
                        Statistics.round(ratio, 2),
                        direction))
                .build());
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.FREQUENCY;
    }

    /**
     * @param points consecutive readings
     * @return mean positive gap in seconds, or empty if there is none
     */
    static OptionalDouble meanInterval(List<DataPoint> points) {
        double sum = 0;
        int count = 0;
        for (int i = 1; i < points.size(); i++) {
            Duration gap = Duration.between(points.get(i - 1).getTimestamp(), points.get(i).getTimestamp());
            if (!gap.isNegative() && !gap.isZero()) {
                sum += gap.getSeconds() + gap.getNano() / 1_000_000_000.0;
                count++;
            }
        }
        return count == 0 ? OptionalDouble.empty() : OptionalDouble.of(sum / count);
    }
}
