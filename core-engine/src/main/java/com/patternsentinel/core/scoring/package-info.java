/**
 * Severity scoring and description rendering.
 *
 * <p>
 * {@link com.patternsentinel.core.scoring.SeverityScorer} classifies z-scores.
 * Descriptions are locale-specific and therefore come from external
 * {@link com.patternsentinel.core.scoring.DescriptionTemplates}; the engine
 * only guarantees that every anomaly carries the description key and the
 * structured context the templates refer to.
 * </p>
 *
 * @since 1.0.0
 */
package com.patternsentinel.core.scoring;
