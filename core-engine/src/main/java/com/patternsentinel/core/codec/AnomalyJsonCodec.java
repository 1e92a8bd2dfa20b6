package com.patternsentinel.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.patternsentinel.core.model.Anomaly;
import com.patternsentinel.core.model.AnomalySummary;
import com.patternsentinel.core.model.AnomalyType;
import com.patternsentinel.core.model.Severity;
import com.patternsentinel.core.scoring.AnomalyDescriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON mapping for the engine's ingestion and notification boundaries.
 *
 * <h3>Ingestion</h3>
 * <p>
 * {@link #readBatch(byte[])} accepts a JSON array of reading objects in the
 * shape {@link com.patternsentinel.core.store.TimeSeriesStore#ingestBatch(List)}
 * expects. Malformed input is logged and yields an empty list; individual
 * non-object elements are dropped.
 * </p>
 *
 * <h3>Notification</h3>
 * <p>
 * Anomalies and summaries are written with ISO-8601 timestamps, lowercase
 * enum ids and the context as {@code kind} plus its typed fields. A codec
 * built with an {@link AnomalyDescriber} also adds the rendered
 * {@code description} to every anomaly it writes.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyJsonCodec {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyJsonCodec.class);

    private static final TypeReference<Map<String, Object>> READING = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final AnomalyDescriber describer;

    public AnomalyJsonCodec() {
        this(null);
    }

    /**
     * @param describer renders the {@code description} field; {@code null} omits it
     */
    public AnomalyJsonCodec(AnomalyDescriber describer) {
        this.describer = describer;
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * @param json UTF-8 JSON array of reading objects
     * @return one map per object element; empty for malformed input
     */
    public List<Map<String, Object>> readBatch(byte[] json) {
        if (json == null || json.length == 0) {
            return List.of();
        }
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (IOException e) {
            LOG.warn("Failed to parse reading batch – skipping: {}", e.getMessage());
            return List.of();
        }
        if (root == null || !root.isArray()) {
            LOG.warn("Reading batch is not a JSON array (got {}) – skipping",
                    root == null ? "nothing" : root.getNodeType());
            return List.of();
        }

        List<Map<String, Object>> readings = new ArrayList<>(root.size());
        int dropped = 0;
        for (JsonNode element : root) {
            if (element.isObject()) {
                readings.add(mapper.convertValue(element, READING));
            } else {
                dropped++;
            }
        }
        if (dropped > 0) {
            LOG.debug("Dropped {} non-object element(s) from reading batch", dropped);
        }
        return readings;
    }

    // ---------------------------------------------------------------
    // Notification
    // ---------------------------------------------------------------

    /**
     * @param anomaly anomaly to encode
     * @return UTF-8 JSON
     * @throws IllegalStateException if encoding fails
     */
    public byte[] write(Anomaly anomaly) {
        Objects.requireNonNull(anomaly, "anomaly must not be null");
        try {
            return mapper.writeValueAsBytes(toNode(anomaly));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize anomaly " + anomaly.getAnomalyId(), e);
        }
    }

    /**
     * @param summary summary to encode
     * @return UTF-8 JSON object with {@code totalEntities},
     *         {@code totalAnomalies}, {@code severityCounts},
     *         {@code typeCounts}, {@code entityHealth} and
     *         {@code topAnomalies}
     * @throws IllegalStateException if encoding fails
     */
    public byte[] writeSummary(AnomalySummary summary) {
        Objects.requireNonNull(summary, "summary must not be null");
        ObjectNode root = mapper.createObjectNode();
        root.put("totalEntities", summary.getTotalEntities());
        root.put("totalAnomalies", summary.getTotalAnomalies());

        ObjectNode severities = root.putObject("severityCounts");
        for (Severity s : Severity.values()) {
            severities.put(s.id(), summary.count(s));
        }
        ObjectNode types = root.putObject("typeCounts");
        for (AnomalyType t : AnomalyType.values()) {
            types.put(t.id(), summary.count(t));
        }
        ObjectNode health = root.putObject("entityHealth");
        summary.getEntityHealth().forEach((entity, h) -> health.put(entity, h.id()));

        ArrayNode top = root.putArray("topAnomalies");
        summary.getTopAnomalies().forEach(a -> top.add(toNode(a)));

        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize anomaly summary", e);
        }
    }

    private ObjectNode toNode(Anomaly anomaly) {
        ObjectNode node = mapper.valueToTree(anomaly);
        if (describer != null) {
            node.put("description", describer.describe(anomaly));
        }
        return node;
    }

    /**
     * @return the configured mapper, for callers that need to read the output
     */
    public ObjectMapper getMapper() {
        return mapper;
    }
}
