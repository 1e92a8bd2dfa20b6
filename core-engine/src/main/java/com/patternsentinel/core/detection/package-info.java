/**
 * Anomaly detectors and the pipeline that runs them.
 *
 * <p>
 * Per-entity detectors implement
 * {@link com.patternsentinel.core.detection.AnomalyDetector} and see one
 * {@link com.patternsentinel.core.detection.SeriesSnapshot} at a time. The
 * correlation-break check works across entities and is run once per full
 * pass by {@link com.patternsentinel.core.detection.DetectorPipeline}.
 * </p>
 *
 * @since 1.0.0
 */
package com.patternsentinel.core.detection;
