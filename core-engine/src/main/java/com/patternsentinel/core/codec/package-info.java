/**
 * JSON encoding at the engine boundary, based on Jackson.
 *
 * @since 1.0.0
 */
package com.patternsentinel.core.codec;
