package com.patternsentinel.core.detection;

import com.patternsentinel.core.model.Anomaly;
import com.patternsentinel.core.model.AnomalyType;
import com.patternsentinel.core.model.CorrelationPair;
import com.patternsentinel.core.model.DataPoint;
import com.patternsentinel.core.model.Severity;
import com.patternsentinel.core.model.context.CorrelationContext;
import com.patternsentinel.core.scoring.SeverityScorer;
import com.patternsentinel.core.stats.CorrelationAnalyzer;
import com.patternsentinel.core.stats.CorrelationTable;
import com.patternsentinel.core.stats.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.Function;

/**
 * Cross-entity detector: flags learned correlations that no longer hold.
 *
 * <p>
 * For every learned pair with {@code |r| >= strongCorrelation} whose series
 * both hold at least {@code window} points, the coefficient is recomputed
 * over the newest {@code window} points. A difference above
 * {@code breakThreshold} is reported on the synthetic entity id
 * {@code "A <-> B"}, stamped with the current time of the supplied clock.
 * </p>
 *
 * <p>
 * Unlike the {@link AnomalyDetector}s this runs once per full detection pass,
 * not once per entity.
 * </p>
 *
 * @since 1.0.0
 */
public class CorrelationBreakDetector {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationBreakDetector.class);

    static final double SCORE_PER_DIFF = 100.0;

    private final double strongCorrelation;
    private final int window;
    private final double breakThreshold;
    private final double criticalBreak;
    private final CorrelationAnalyzer analyzer;
    private final AnomalyFactory anomalies;
    private final Clock clock;

    public CorrelationBreakDetector(double strongCorrelation, int window, double breakThreshold,
            double criticalBreak, CorrelationAnalyzer analyzer, AnomalyFactory anomalies, Clock clock) {
        this.strongCorrelation = strongCorrelation;
        this.window = window;
        this.breakThreshold = breakThreshold;
        this.criticalBreak = criticalBreak;
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.anomalies = Objects.requireNonNull(anomalies, "anomalies must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param table     learned correlations
     * @param histories lookup of current entity histories; an unknown entity
     *                  yields an empty list
     * @return one anomaly per broken pair
     */
    public List<Anomaly> evaluate(CorrelationTable table, Function<String, List<DataPoint>> histories) {
        List<Anomaly> found = new ArrayList<>();
        for (CorrelationPair pair : table.pairs()) {
            if (Math.abs(pair.getCorrelation()) < strongCorrelation) {
                continue;
            }
            List<DataPoint> histA = histories.apply(pair.getEntityA());
            List<DataPoint> histB = histories.apply(pair.getEntityB());
            if (histA.size() < window || histB.size() < window) {
                continue;
            }
            OptionalDouble recent = analyzer.correlation(histA, histB, window);
            if (recent.isEmpty()) {
                continue;
            }

            double historical = pair.getCorrelation();
            double recentR = recent.getAsDouble();
            double diff = Math.abs(recentR - historical);
            if (diff <= breakThreshold) {
                continue;
            }

            LOG.debug("Correlation break {}: historical={} recent={} diff={}",
                    pair.compositeId(), historical, recentR, diff);
            found.add(anomalies.newAnomaly(pair.compositeId(), AnomalyType.CORRELATION)
                    .severity(diff < criticalBreak ? Severity.WARNING : Severity.CRITICAL)
                    .score(SeverityScorer.cap(diff * SCORE_PER_DIFF))
                    .detectedAt(OffsetDateTime.now(clock))
                    .value(recentR)
                    .expectedValue(historical)
                    .deviationPct(diff * 100)
                    .descriptionKey("correlation")
                    .context(new CorrelationContext(
                            pair.getEntityA(),
                            pair.getEntityB(),
                            Statistics.round(historical, 3),
                            Statistics.round(recentR, 3)))
                    .build());
        }
        return found;
    }

    public AnomalyType getType() {
        return AnomalyType.CORRELATION;
    }
}
