package com.patternsentinel.core.store;

import com.patternsentinel.core.model.DataPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-entity bounded history of numeric readings.
 *
 * <h3>Eviction</h3>
 * <p>
 * Each entity keeps at most {@code maxHistory} points; older points are
 * dropped first.
 * </p>
 *
 * <h3>Batch ingestion</h3>
 * <p>
 * {@link #ingestBatch(List)} accepts loosely typed entries as they arrive
 * from the ingestion boundary:
 * </p>
 *
 * <pre>
 * {"entity_id": "sensor.temp", "value": 21.5,
 *  "timestamp": "2025-06-15T10:30:00+02:00", "attributes": {...}}
 * </pre>
 * <p>
 * Entries without an {@code entity_id} or without a finite numeric
 * {@code value} are skipped. Timestamps are ISO dates with an optional
 * time, separated by {@code T} or a space, and an optional offset; an
 * unparsable {@code timestamp} falls back to the current time. Both cases are logged at DEBUG and counted, and never
 * abort the batch.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Safe for concurrent use. Ingestion only locks the target entity's series.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeSeriesStore {

    private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesStore.class);

    public static final String FIELD_ENTITY_ID = "entity_id";
    public static final String FIELD_VALUE = "value";
    public static final String FIELD_TIMESTAMP = "timestamp";
    public static final String FIELD_ATTRIBUTES = "attributes";

    /**
     * ISO date with optional time ({@code T} or space separator) and optional
     * offset. A missing time is midnight, a missing offset is UTC.
     */
    static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffsetId().optionalEnd()
            .optionalEnd()
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
            .parseDefaulting(ChronoField.OFFSET_SECONDS, 0)
            .toFormatter(Locale.ROOT);

    private final int maxHistory;
    private final Clock clock;
    private final Map<String, EntitySeries> series = new ConcurrentHashMap<>();

    private final AtomicLong skippedPoints = new AtomicLong();
    private final AtomicLong timestampFallbacks = new AtomicLong();
    private final AtomicLong evictedPoints = new AtomicLong();

    /**
     * @param maxHistory maximum points retained per entity, {@code > 0}
     * @param clock      source of "now" for readings without a timestamp
     * @throws IllegalArgumentException if {@code maxHistory <= 0}
     */
    public TimeSeriesStore(int maxHistory, Clock clock) {
        if (maxHistory <= 0) {
            throw new IllegalArgumentException("maxHistory must be > 0, got: " + maxHistory);
        }
        this.maxHistory = maxHistory;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * Append a reading.
     *
     * @param entityId   entity id; must not be {@code null} or blank
     * @param value      finite reading
     * @param timestamp  reading time, or {@code null} for now (UTC)
     * @param attributes optional source attributes
     * @return the stored point
     * @throws IllegalArgumentException if {@code entityId} is blank or
     *                                  {@code value} is not finite
     */
    public DataPoint ingest(String entityId, double value, OffsetDateTime timestamp,
            Map<String, Object> attributes) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        if (entityId.isBlank()) {
            throw new IllegalArgumentException("entityId must not be blank");
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(
                    "value must be finite for entity '" + entityId + "', got: " + value);
        }
        OffsetDateTime ts = timestamp != null ? timestamp : now();
        DataPoint point = new DataPoint(entityId, value, ts, attributes);
        int evicted = series.computeIfAbsent(entityId, id -> new EntitySeries(maxHistory))
                .append(point);
        if (evicted > 0) {
            evictedPoints.addAndGet(evicted);
        }
        return point;
    }

    /**
     * Append a reading time-stamped now.
     *
     * @see #ingest(String, double, OffsetDateTime, Map)
     */
    public DataPoint ingest(String entityId, double value) {
        return ingest(entityId, value, null, null);
    }

    /**
     * Ingest every well-formed entry of a batch.
     *
     * @param points entries keyed by {@value #FIELD_ENTITY_ID},
     *               {@value #FIELD_VALUE} and optionally
     *               {@value #FIELD_TIMESTAMP} and {@value #FIELD_ATTRIBUTES}
     * @return number of entries actually ingested
     */
    public int ingestBatch(List<? extends Map<String, ?>> points) {
        if (points == null || points.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (Map<String, ?> entry : points) {
            if (entry == null) {
                skip("null entry");
                continue;
            }
            Object rawId = entry.get(FIELD_ENTITY_ID);
            String entityId = rawId == null ? "" : rawId.toString().trim();
            if (entityId.isEmpty()) {
                skip("missing entity_id");
                continue;
            }
            Double value = toDouble(entry.get(FIELD_VALUE));
            if (value == null) {
                skip("missing or non-numeric value for '" + entityId + "'");
                continue;
            }
            OffsetDateTime ts = entry.containsKey(FIELD_TIMESTAMP)
                    ? parseTimestamp(entityId, entry.get(FIELD_TIMESTAMP))
                    : null;
            ingest(entityId, value, ts, toAttributes(entry.get(FIELD_ATTRIBUTES)));
            count++;
        }
        LOG.debug("Batch ingested {} of {} point(s)", count, points.size());
        return count;
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @param entityId entity id
     * @return immutable snapshot of the entity's history, oldest first; empty
     *         for unknown entities
     */
    public List<DataPoint> history(String entityId) {
        EntitySeries s = series.get(entityId);
        return s == null ? List.of() : s.snapshot();
    }

    /**
     * @param entityId entity id
     * @return number of retained points for the entity
     */
    public int size(String entityId) {
        EntitySeries s = series.get(entityId);
        return s == null ? 0 : s.size();
    }

    /**
     * @return ids of all entities with a history, sorted
     */
    public Set<String> entityIds() {
        return Collections.unmodifiableSet(new TreeSet<>(series.keySet()));
    }

    public boolean contains(String entityId) {
        return series.containsKey(entityId);
    }

    public int getMaxHistory() {
        return maxHistory;
    }

    // ---------------------------------------------------------------
    // Removal
    // ---------------------------------------------------------------

    /**
     * Drop an entity's whole history.
     *
     * @param entityId entity id
     * @return {@code true} if the entity had a history
     */
    public boolean clear(String entityId) {
        return series.remove(entityId) != null;
    }

    public void clearAll() {
        series.clear();
    }

    // ---------------------------------------------------------------
    // Counters
    // ---------------------------------------------------------------

    /**
     * @return batch entries skipped as malformed since creation
     */
    public long skippedPoints() {
        return skippedPoints.get();
    }

    /**
     * @return batch entries whose timestamp could not be parsed and was
     *         replaced by the current time
     */
    public long timestampFallbacks() {
        return timestampFallbacks.get();
    }

    /**
     * @return points dropped by the sliding window since creation
     */
    public long evictedPoints() {
        return evictedPoints.get();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
    }

    private void skip(String reason) {
        skippedPoints.incrementAndGet();
        LOG.debug("Skipping batch entry: {}", reason);
    }

    private static Double toDouble(Object raw) {
        double v;
        if (raw instanceof Number n) {
            v = n.doubleValue();
        } else if (raw instanceof String s) {
            try {
                v = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(v) ? v : null;
    }

    /**
     * @return parsed timestamp, or {@code null} (meaning "now") when absent or
     *         unparsable
     */
    private OffsetDateTime parseTimestamp(String entityId, Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof OffsetDateTime odt) {
            return odt;
        }
        if (raw instanceof ZonedDateTime zdt) {
            return zdt.toOffsetDateTime();
        }
        if (raw instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC);
        }
        String text = raw.toString().trim();
        try {
            return OffsetDateTime.parse(text, TIMESTAMP_FORMAT);
        } catch (DateTimeParseException e) {
            timestampFallbacks.incrementAndGet();
            LOG.debug("Unparsable timestamp '{}' for '{}' – using current time", text, entityId);
            return null;
        }
    }

    private static Map<String, Object> toAttributes(Object raw) {
        if (!(raw instanceof Map<?, ?> m)) {
            return null;
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : m.entrySet()) {
            if (!(e.getKey() instanceof String key)) {
                return null;
            }
            attributes.put(key, e.getValue());
        }
        return attributes;
    }
}
