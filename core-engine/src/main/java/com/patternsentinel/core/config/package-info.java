/**
 * Configuration of the anomaly detection engine.
 *
 * <p>
 * {@link com.patternsentinel.core.config.EngineConfigLoader} reads YAML into
 * an {@link com.patternsentinel.core.config.EngineConfig} and validates it,
 * so that invalid thresholds fail at startup.
 * </p>
 *
 * @since 1.0.0
 */
package com.patternsentinel.core.config;
