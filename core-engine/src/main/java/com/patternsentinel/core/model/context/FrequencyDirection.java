package com.patternsentinel.core.model.context;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Whether an entity now reports less often (SLOWER) or more often (FASTER). */
public enum FrequencyDirection {
    SLOWER,
    FASTER;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
