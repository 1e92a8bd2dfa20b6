package com.patternsentinel.core.detection;

import com.patternsentinel.core.model.DataPoint;
import com.patternsentinel.core.model.PatternProfile;

import java.util.List;
import java.util.Objects;

/**
 * One entity's history together with its learned profile, as seen by the
 * per-entity detectors during a single detection pass.
 *
 * @since 1.0.0
 */
public final class SeriesSnapshot {

    private final String entityId;
    private final List<DataPoint> history;
    private final PatternProfile profile;

    /**
     * @param entityId entity the snapshot belongs to
     * @param history  immutable history, oldest first
     * @param profile  profile learned for the entity
     */
    public SeriesSnapshot(String entityId, List<DataPoint> history, PatternProfile profile) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.history = List.copyOf(Objects.requireNonNull(history, "history must not be null"));
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
    }

    public String getEntityId() {
        return entityId;
    }

    public List<DataPoint> getHistory() {
        return history;
    }

    public PatternProfile getProfile() {
        return profile;
    }

    public int size() {
        return history.size();
    }

    /**
     * @return the newest point
     * @throws IllegalStateException if the history is empty
     */
    public DataPoint latest() {
        if (history.isEmpty()) {
            throw new IllegalStateException("History of '" + entityId + "' is empty");
        }
        return history.get(history.size() - 1);
    }

    /**
     * @param n maximum number of points
     * @return the newest {@code n} points, oldest first
     */
    public List<DataPoint> tail(int n) {
        return history.size() <= n ? history : history.subList(history.size() - n, history.size());
    }

    @Override
    public String toString() {
        return "SeriesSnapshot{entityId='" + entityId + "', points=" + history.size() + '}';
    }
}
