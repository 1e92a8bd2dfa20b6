package com.patternsentinel.core.registry;

import com.patternsentinel.core.model.Anomaly;
import com.patternsentinel.core.model.AnomalySummary;
import com.patternsentinel.core.model.AnomalyType;
import com.patternsentinel.core.model.EntityHealth;
import com.patternsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded log of detected anomalies.
 *
 * <p>
 * Holds at most {@code capacity} anomalies in insertion order; adding beyond
 * that silently evicts the oldest (FIFO). All operations are thread-safe;
 * queries take the read lock and therefore never wait for one another.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyRegistry.class);

    /** Number of anomalies in {@link AnomalySummary#getTopAnomalies()}. */
    public static final int TOP_ANOMALIES = 10;

    private final int capacity;
    private final Deque<Anomaly> anomalies = new ArrayDeque<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private long evicted;

    public AnomalyRegistry(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
    }

    // ---------------------------------------------------------------
    // Mutation
    // ---------------------------------------------------------------

    /**
     * Append anomalies in the given order, evicting the oldest beyond
     * capacity.
     *
     * @param batch anomalies to log
     */
    public void addAll(Collection<Anomaly> batch) {
        Objects.requireNonNull(batch, "batch must not be null");
        if (batch.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            int dropped = 0;
            for (Anomaly a : batch) {
                anomalies.addLast(Objects.requireNonNull(a, "anomaly must not be null"));
                if (anomalies.size() > capacity) {
                    anomalies.removeFirst();
                    dropped++;
                }
            }
            evicted += dropped;
            if (dropped > 0) {
                LOG.debug("Registry full ({}): evicted {} oldest anomaly(ies)", capacity, dropped);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @param entityId entity whose anomalies are removed, or {@code null} for
     *                 all
     * @return number of removed anomalies
     */
    public int clear(String entityId) {
        lock.writeLock().lock();
        try {
            if (entityId == null) {
                int count = anomalies.size();
                anomalies.clear();
                return count;
            }
            int removed = 0;
            for (Iterator<Anomaly> it = anomalies.iterator(); it.hasNext();) {
                if (entityId.equals(it.next().getEntityId())) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @param query filter and limit
     * @return the most recent {@code query.limit} matches, oldest first
     */
    public List<Anomaly> query(AnomalyQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        lock.readLock().lock();
        try {
            List<Anomaly> matches = new ArrayList<>();
            for (Anomaly a : anomalies) {
                if (query.matches(a)) {
                    matches.add(a);
                }
            }
            int from = Math.max(0, matches.size() - query.getLimit());
            return List.copyOf(matches.subList(from, matches.size()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Build an aggregate view.
     *
     * @param trackedEntities entities with history; each appears in the health
     *                        map, {@link EntityHealth#OK} if it has no anomaly.
     *                        Entities with anomalies but no history (such as
     *                        correlation pairs) are counted but get no health
     *                        entry.
     * @return the summary
     */
    public AnomalySummary summary(Collection<String> trackedEntities) {
        Objects.requireNonNull(trackedEntities, "trackedEntities must not be null");
        lock.readLock().lock();
        try {
            Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
            for (Severity s : Severity.values()) {
                bySeverity.put(s, 0);
            }
            Map<AnomalyType, Integer> byType = new EnumMap<>(AnomalyType.class);
            for (AnomalyType t : AnomalyType.values()) {
                byType.put(t, 0);
            }
            Map<String, EntityHealth> worst = new HashMap<>();

            for (Anomaly a : anomalies) {
                bySeverity.merge(a.getSeverity(), 1, Integer::sum);
                byType.merge(a.getType(), 1, Integer::sum);
                worst.merge(a.getEntityId(), EntityHealth.of(a.getSeverity()), EntityHealth::worst);
            }

            Map<String, EntityHealth> health = new LinkedHashMap<>();
            for (String entityId : trackedEntities) {
                health.put(entityId, worst.getOrDefault(entityId, EntityHealth.OK));
            }

            // List.sort is stable: equal scores keep chronological order
            List<Anomaly> top = new ArrayList<>(anomalies);
            top.sort(Comparator.comparingDouble(Anomaly::getScore).reversed());
            if (top.size() > TOP_ANOMALIES) {
                top = top.subList(0, TOP_ANOMALIES);
            }

            return new AnomalySummary(trackedEntities.size(), anomalies.size(),
                    bySeverity, byType, health, top);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return anomalies.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * @return anomalies dropped by FIFO eviction since creation
     */
    public long evicted() {
        lock.readLock().lock();
        try {
            return evicted;
        } finally {
            lock.readLock().unlock();
        }
    }
}
