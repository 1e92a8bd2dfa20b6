package com.patternsentinel.core.detection;

import com.patternsentinel.core.model.Anomaly;
import com.patternsentinel.core.model.AnomalyType;

import java.util.List;

/**
 * Contract for the per-entity anomaly detectors.
 * <p>
 * Implementations are <strong>stateless</strong>: everything they need is in
 * the {@link SeriesSnapshot}, so one instance serves every entity and may be
 * called from any thread. A detector whose preconditions are not met (too
 * little history, degenerate baseline) returns an empty list.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Evaluate one entity.
     *
     * @param snapshot the entity's history and profile
     * @return anomalies found, possibly empty, never {@code null}
     */
    List<Anomaly> evaluate(SeriesSnapshot snapshot);

    /**
     * @return the type of anomaly this detector reports
     */
    AnomalyType getType();
}
