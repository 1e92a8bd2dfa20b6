package com.patternsentinel.core.detection;

import com.patternsentinel.core.model.Anomaly;
import com.patternsentinel.core.model.AnomalyType;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues anomaly ids and pre-fills anomaly builders.
 *
 * <p>
 * Ids are {@code anomaly_000001}, {@code anomaly_000002}, ... and strictly
 * increasing for the lifetime of the factory, including across clears of
 * the registry. One factory is shared by all detectors of an engine.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyFactory {

    static final String ID_FORMAT = "anomaly_%06d";

    private final AtomicLong sequence = new AtomicLong();

    /**
     * @param entityId source entity, or the synthetic pair id
     * @param type     anomaly type
     * @return a builder with id, entity and type already set
     */
    public Anomaly.Builder newAnomaly(String entityId, AnomalyType type) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        return Anomaly.builder()
                .anomalyId(nextId())
                .entityId(entityId)
                .type(type);
    }

    /**
     * @return number of ids issued so far
     */
    public long issued() {
        return sequence.get();
    }

    private String nextId() {
        return String.format(ID_FORMAT, sequence.incrementAndGet());
    }
}
