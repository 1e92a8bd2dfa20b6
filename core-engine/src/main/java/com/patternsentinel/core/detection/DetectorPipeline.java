package com.patternsentinel.core.detection;

import com.patternsentinel.core.model.Anomaly;
import com.patternsentinel.core.model.AnomalyType;
import com.patternsentinel.core.model.DataPoint;
import com.patternsentinel.core.stats.CorrelationTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Runs the enabled detectors in their fixed order.
 *
 * <p>
 * Per-entity detectors always execute in {@link AnomalyType} declaration
 * order (spike, drift, flatline, seasonal, frequency) regardless of the order
 * they were supplied in. Each detector is wrapped in a try/catch: a failing
 * detector is logged and counted, and the remaining detectors still run.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorPipeline.class);

    private final List<AnomalyDetector> detectors;
    private final CorrelationBreakDetector correlationDetector;
    private final AtomicLong failures = new AtomicLong();

    /**
     * @param detectors           per-entity detectors, one per type
     * @param correlationDetector cross-entity detector, or {@code null} when
     *                            correlation checks are disabled
     * @throws IllegalArgumentException if two detectors report the same type
     */
    public DetectorPipeline(List<? extends AnomalyDetector> detectors,
            CorrelationBreakDetector correlationDetector) {
        Objects.requireNonNull(detectors, "detectors must not be null");
        List<AnomalyDetector> ordered = new ArrayList<>(detectors);
        ordered.sort(Comparator.comparing(AnomalyDetector::getType));
        for (int i = 1; i < ordered.size(); i++) {
            if (ordered.get(i).getType() == ordered.get(i - 1).getType()) {
                throw new IllegalArgumentException(
                        "Duplicate detector type: " + ordered.get(i).getType().id());
            }
        }
        this.detectors = List.copyOf(ordered);
        this.correlationDetector = correlationDetector;
    }

    /**
     * Run every per-entity detector against one entity.
     *
     * @param snapshot the entity's history and profile
     * @return anomalies in detector order
     */
    public List<Anomaly> evaluate(SeriesSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        List<Anomaly> found = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            try {
                found.addAll(detector.evaluate(snapshot));
            } catch (Exception e) {
                failures.incrementAndGet();
                LOG.error("Detector [{}] failed for entity '{}' ({} points)",
                        detector.getType().id(), snapshot.getEntityId(), snapshot.size(), e);
            }
        }
        return found;
    }

    /**
     * Run the correlation-break check, if enabled.
     *
     * @param table     learned correlations
     * @param histories entity history lookup
     * @return broken correlations, empty when the check is disabled or fails
     */
    public List<Anomaly> evaluateCorrelations(CorrelationTable table,
            Function<String, List<DataPoint>> histories) {
        if (correlationDetector == null || table.isEmpty()) {
            return List.of();
        }
        try {
            return correlationDetector.evaluate(table, histories);
        } catch (Exception e) {
            failures.incrementAndGet();
            LOG.error("Detector [{}] failed over {} learned pair(s)",
                    correlationDetector.getType().id(), table.size(), e);
            return List.of();
        }
    }

    /**
     * @return enabled detector types in execution order
     */
    public List<AnomalyType> enabledTypes() {
        List<AnomalyType> types = new ArrayList<>(detectors.stream().map(AnomalyDetector::getType).toList());
        if (correlationDetector != null) {
            types.add(correlationDetector.getType());
        }
        return List.copyOf(types);
    }

    public List<AnomalyDetector> getDetectors() {
        return detectors;
    }

    public Optional<CorrelationBreakDetector> getCorrelationDetector() {
        return Optional.ofNullable(correlationDetector);
    }

    /**
     * @return number of detector invocations that threw
     */
    public long failures() {
        return failures.get();
    }
}
