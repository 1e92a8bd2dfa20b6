/**
 * Bounded in-memory storage of per-entity readings.
 *
 * @since 1.0.0
 */
package com.patternsentinel.core.store;
