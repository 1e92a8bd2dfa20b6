package com.patternsentinel.core.detection;

import com.patternsentinel.core.model.Anomaly;
import com.patternsentinel.core.model.AnomalyType;
import com.patternsentinel.core.model.DataPoint;
import com.patternsentinel.core.model.context.DriftContext;
import com.patternsentinel.core.model.context.DriftDirection;
import com.patternsentinel.core.scoring.SeverityScorer;
import com.patternsentinel.core.stats.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Flags a gradual shift of the level of a series.
 *
 * <p>
 * The newest {@code window} points are compared with everything before them:
 * {@code z = |recentMean - olderMean| / olderStd}. Needs at least
 * {@code 2 * window} points and a non-constant older segment.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DriftDetector.class);

    private final int window;
    private final SeverityScorer scorer;
    private final AnomalyFactory anomalies;

    public DriftDetector(int window, SeverityScorer scorer, AnomalyFactory anomalies) {
        if (window <= 0) {
            throw new IllegalArgumentException("window must be > 0, got: " + window);
        }
        this.window = window;
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.anomalies = Objects.requireNonNull(anomalies, "anomalies must not be null");
    }

    @Override
    public List<Anomaly> evaluate(SeriesSnapshot snapshot) {
        List<DataPoint> history = snapshot.getHistory();
        if (history.size() < 2 * window) {
            return List.of();
        }

        int split = history.size() - window;
        double[] older = Statistics.values(history.subList(0, split));
        double[] recent = Statistics.values(history.subList(split, history.size()));

        double olderMean = Statistics.mean(older);
        double olderStd = Statistics.sampleStdDev(older, olderMean);
        if (olderStd == 0) {
            return List.of();
        }
        double recentMean = Statistics.mean(recent);

        double driftZ = Math.abs(recentMean - olderMean) / olderStd;
        if (!scorer.isReportable(driftZ)) {
            return List.of();
        }

        DriftDirection direction = recentMean > olderMean ? DriftDirection.RISING : DriftDirection.FALLING;
        LOG.debug("Drift on '{}': recentMean={} olderMean={} z={} ({})",
                snapshot.getEntityId(), recentMean, olderMean, driftZ, direction.id());

        return List.of(anomalies.newAnomaly(snapshot.getEntityId(), AnomalyType.DRIFT)
                .severity(scorer.severityFor(driftZ))
                .score(scorer.scoreFor(driftZ))
                .detectedAt(snapshot.latest().getTimestamp())
                .value(recentMean)
                .expectedValue(olderMean)
                .deviationPct(Statistics.deviationPct(recentMean, olderMean))
                .descriptionKey(direction == DriftDirection.RISING ? "drift.rising" : "drift.falling")
                .context(new DriftContext(
                        Statistics.round(driftZ, 2),
                        direction,
                        Statistics.round(recentMean, 2),
                        Statistics.round(olderMean, 2)))
                .build());
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.DRIFT;
    }
}
