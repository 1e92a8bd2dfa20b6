package com.patternsentinel.core.model.context;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.util.Collections.unmodifiableMap;

/**
 * Details of a flatline: how many trailing readings were identical, and the
 * value they were stuck at.
 */
public final class FlatlineContext extends AnomalyContext {

    private final int consecutiveIdentical;
    private final double stuckValue;

    public FlatlineContext(int consecutiveIdentical, double stuckValue) {
        this.consecutiveIdentical = consecutiveIdentical;
        this.stuckValue = stuckValue;
    }

    @Override
    public String getKind() {
        return "flatline";
    }

    public int getConsecutiveIdentical() {
        return consecutiveIdentical;
    }

    public double getStuckValue() {
        return stuckValue;
    }

    @Override
    public Map<String, Object> toTemplateValues() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("consecutive_identical", consecutiveIdentical);
        m.put("stuck_value", stuckValue);
        return unmodifiableMap(m);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FlatlineContext that))
            return false;
        return consecutiveIdentical == that.consecutiveIdentical
                && Double.compare(stuckValue, that.stuckValue) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(consecutiveIdentical, stuckValue);
    }
}
