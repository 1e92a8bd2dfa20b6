package com.patternsentinel.core.store;

import com.patternsentinel.core.model.DataPoint;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, append-only buffer of one entity's readings.
 *
 * <p>
 * When the buffer is full the oldest reading is evicted (sliding window, no
 * downsampling). All methods synchronize on the instance, so ingestion for one
 * entity never contends with another entity's series.
 * </p>
 */
final class EntitySeries {

    private final int capacity;

    /** Oldest first. */
    private final Deque<DataPoint> points = new ArrayDeque<>();

    EntitySeries(int capacity) {
        this.capacity = capacity;
    }

    /**
     * @return number of points evicted to make room (0 or 1)
     */
    synchronized int append(DataPoint point) {
        points.addLast(point);
        int evicted = 0;
        while (points.size() > capacity) {
            points.pollFirst();
            evicted++;
        }
        return evicted;
    }

    synchronized List<DataPoint> snapshot() {
        return List.copyOf(points);
    }

    synchronized int size() {
        return points.size();
    }
}
