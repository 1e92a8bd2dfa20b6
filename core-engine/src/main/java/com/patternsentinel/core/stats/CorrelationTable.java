package com.patternsentinel.core.stats;

import com.patternsentinel.core.model.CorrelationPair;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable table of learned correlations keyed by unordered entity pair.
 *
 * <p>
 * A new table replaces the previous one wholesale on every learning pass.
 * </p>
 *
 * @since 1.0.0
 */
public final class CorrelationTable {

    public static final CorrelationTable EMPTY = new CorrelationTable(List.of());

    private final Map<List<String>, CorrelationPair> pairs;

    public CorrelationTable(Collection<CorrelationPair> pairs) {
        Map<List<String>, CorrelationPair> m = new LinkedHashMap<>();
        for (CorrelationPair p : pairs) {
            m.put(key(p.getEntityA(), p.getEntityB()), p);
        }
        this.pairs = Collections.unmodifiableMap(m);
    }

    /**
     * Look up a pair regardless of argument order.
     *
     * @param entityA one entity
     * @param entityB the other entity
     * @return the learned pair, if any
     */
    public Optional<CorrelationPair> get(String entityA, String entityB) {
        return Optional.ofNullable(pairs.get(key(entityA, entityB)));
    }

    /**
     * @return all pairs in learning order
     */
    public List<CorrelationPair> pairs() {
        return List.copyOf(pairs.values());
    }

    public int size() {
        return pairs.size();
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }

    /**
     * @param entityId entity to drop
     * @return a table without the pairs that involve {@code entityId}
     */
    public CorrelationTable without(String entityId) {
        List<CorrelationPair> kept = new ArrayList<>();
        for (CorrelationPair p : pairs.values()) {
            if (!p.involves(entityId)) {
                kept.add(p);
            }
        }
        return kept.size() == pairs.size() ? this : new CorrelationTable(kept);
    }

    /** Unordered key: the lexicographically smaller id comes first. */
    static List<String> key(String a, String b) {
        return a.compareTo(b) <= 0 ? List.of(a, b) : List.of(b, a);
    }

    @Override
    public String toString() {
        return "CorrelationTable" + pairs.values();
    }
}
