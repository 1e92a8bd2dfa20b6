package com.patternsentinel.core.detection;

import com.patternsentinel.core.model.Anomaly;
import com.patternsentinel.core.model.AnomalyType;
import com.patternsentinel.core.model.DataPoint;
import com.patternsentinel.core.model.Severity;
import com.patternsentinel.core.model.context.FlatlineContext;

import java.util.List;
import java.util.Objects;

/**
 * Flags a stuck sensor: the last {@code threshold} readings are identical.
 *
 * <p>
 * Values are compared bit for bit, so {@code 0.0} and {@code -0.0} differ.
 * Always {@link Severity#WARNING} with score {@value #SCORE}.
 * </p>
 *
 * @since 1.0.0
 */
public class FlatlineDetector implements AnomalyDetector {

    static final double SCORE = 60.0;

    private final int threshold;
    private final AnomalyFactory anomalies;

    public FlatlineDetector(int threshold, AnomalyFactory anomalies) {
        if (threshold < 2) {
            throw new IllegalArgumentException("threshold must be >= 2, got: " + threshold);
        }
        this.threshold = threshold;
        this.anomalies = Objects.requireNonNull(anomalies, "anomalies must not be null");
    }

    @Override
    public List<Anomaly> evaluate(SeriesSnapshot snapshot) {
        if (snapshot.size() < threshold) {
            return List.of();
        }
        List<DataPoint> recent = snapshot.tail(threshold);
        long bits = Double.doubleToLongBits(recent.get(0).getValue());
        for (DataPoint dp : recent) {
            if (Double.doubleToLongBits(dp.getValue()) != bits) {
                return List.of();
            }
        }

        double stuck = recent.get(0).getValue();
        return List.of(anomalies.newAnomaly(snapshot.getEntityId(), AnomalyType.FLATLINE)
                .severity(Severity.WARNING)
                .score(SCORE)
                .detectedAt(snapshot.latest().getTimestamp())
                .value(stuck)
                .expectedValue(stuck)
                .deviationPct(0.0)
                .descriptionKey("flatline")
                .context(new FlatlineContext(threshold, stuck))
                .build());
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.FLATLINE;
    }
}
