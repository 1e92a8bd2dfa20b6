package com.patternsentinel.core.model.context;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Direction of a drift between the historical and the recent mean. */
public enum DriftDirection {
    RISING,
    FALLING;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
