/**
 * The engine facade and its optional scheduler.
 *
 * <p>
 * {@link com.patternsentinel.core.engine.AnomalyDetectionEngine} is the only
 * entry point most callers need. It never self-schedules;
 * {@link com.patternsentinel.core.engine.DetectionScheduler} is one way to
 * drive it periodically.
 * </p>
 *
 * @since 1.0.0
 */
package com.patternsentinel.core.engine;
