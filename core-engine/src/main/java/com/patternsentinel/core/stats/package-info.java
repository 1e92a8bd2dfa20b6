/**
 * Statistical baselines: descriptive statistics, per-entity pattern profiles
 * and pairwise correlations.
 *
 * <ul>
 * <li>{@link com.patternsentinel.core.stats.PatternProfiler} — global,
 * hour-of-day and weekday baselines</li>
 * <li>{@link com.patternsentinel.core.stats.CorrelationAnalyzer} — Pearson
 * correlation and the learned
 * {@link com.patternsentinel.core.stats.CorrelationTable}</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.patternsentinel.core.stats;
