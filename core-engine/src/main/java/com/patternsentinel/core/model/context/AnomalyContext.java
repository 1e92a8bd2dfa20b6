package com.patternsentinel.core.model.context;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured, type-specific details attached to an anomaly.
 *
 * <p>
 * Each anomaly type has its own subclass with a closed set of typed fields.
 * {@link #toTemplateValues()} exposes those fields under stable snake_case
 * names so a description can be rendered in any language without
 * re-deriving numbers. The same names, preceded by {@code kind}, are
 * the JSON form of a context.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class AnomalyContext {

    /**
     * @return short discriminator written to JSON, e.g. {@code "spike"} or
     *         {@code "seasonal_hourly"}
     */
    public abstract String getKind();

    /**
     * @return template placeholder name to value; the map is unmodifiable and
     *         iterates in a stable order
     */
    public abstract Map<String, Object> toTemplateValues();

    /**
     * @return {@code kind} followed by the template values
     */
    @JsonValue
    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("kind", getKind());
        json.putAll(toTemplateValues());
        return json;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + toTemplateValues();
    }
}
