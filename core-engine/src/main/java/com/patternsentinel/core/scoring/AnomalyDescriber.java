package com.patternsentinel.core.scoring;

import com.patternsentinel.core.model.Anomaly;

/**
 * Renders a human-readable description of an anomaly.
 *
 * <p>
 * Implementations work only from the anomaly's fields and its structured
 * context; they never look at the source series.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnomalyDescriber {

    /**
     * @param anomaly anomaly to describe
     * @return description text, never {@code null}
     */
    String describe(Anomaly anomaly);
}
