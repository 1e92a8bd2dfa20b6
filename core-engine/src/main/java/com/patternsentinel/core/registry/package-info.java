/**
 * Bounded, queryable log of detected anomalies.
 *
 * @since 1.0.0
 */
package com.patternsentinel.core.registry;
