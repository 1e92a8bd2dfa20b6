package com.patternsentinel.core.store;

import com.patternsentinel.core.model.DataPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TimeSeriesStore}.
 */
class TimeSeriesStoreTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final OffsetDateTime T0 = OffsetDateTime.parse("2025-01-06T00:00:00Z");

    private TimeSeriesStore store;

    @BeforeEach
    void setUp() {
        store = new TimeSeriesStore(5, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should keep at most maxHistory points, dropping the oldest")
    void shouldEvictOldestBeyondCapacity() {
        for (int i = 0; i < 8; i++) {
            store.ingest("sensor.a", i, T0.plusHours(i), null);
        }

        List<DataPoint> history = store.history("sensor.a");
        assertThat(history).hasSize(5);
        assertThat(history).extracting(DataPoint::getValue).containsExactly(3.0, 4.0, 5.0, 6.0, 7.0);
        assertThat(store.evictedPoints()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should stamp readings without timestamp with the clock's time in UTC")
    void shouldDefaultTimestampToNow() {
        DataPoint p = store.ingest("sensor.a", 1.0);

        assertThat(p.getTimestamp()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should reject null, blank ids and non-finite values on direct ingest")
    void shouldRejectInvalidDirectIngest() {
        assertThatThrownBy(() -> store.ingest(null, 1.0)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> store.ingest("  ", 1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.ingest("sensor.a", Double.NaN))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("finite");
        assertThat(store.entityIds()).isEmpty();
    }

    @Test
    @DisplayName("History snapshot should not change when more points arrive")
    void historyShouldBeSnapshot() {
        store.ingest("sensor.a", 1.0, T0, null);
        List<DataPoint> snapshot = store.history("sensor.a");

        store.ingest("sensor.a", 2.0, T0.plusHours(1), null);

        assertThat(snapshot).hasSize(1);
        assertThatThrownBy(() -> snapshot.add(snapshot.get(0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Unknown entity should have an empty history")
    void unknownEntityShouldHaveEmptyHistory() {
        assertThat(store.history("nope")).isEmpty();
        assertThat(store.size("nope")).isZero();
        assertThat(store.contains("nope")).isFalse();
    }

    @Test
    @DisplayName("Batch should ingest well-formed entries and skip malformed ones")
    void batchShouldSkipMalformedEntries() {
        List<Map<String, Object>> batch = new ArrayList<>();
        batch.add(reading("sensor.a", 1.5, "2025-01-06T00:00:00Z"));
        batch.add(reading("sensor.a", "2.5", "2025-01-06T01:00:00+01:00"));
        batch.add(reading(null, 3.0, null));
        batch.add(reading("  ", 3.0, null));
        batch.add(reading("sensor.b", "warm", null));
        batch.add(reading("sensor.b", null, null));
        batch.add(reading("sensor.b", Double.POSITIVE_INFINITY, null));
        batch.add(null);

        int ingested = store.ingestBatch(batch);

        assertThat(ingested).isEqualTo(2);
        assertThat(store.skippedPoints()).isEqualTo(6);
        assertThat(store.entityIds()).containsExactly("sensor.a");
        assertThat(store.history("sensor.a")).extracting(DataPoint::getValue).containsExactly(1.5, 2.5);
    }

    @Test
    @DisplayName("Batch should fall back to now for unparsable timestamps and count it")
    void batchShouldFallBackForBadTimestamp() {
        int ingested = store.ingestBatch(List.of(reading("sensor.a", 1.0, "yesterday-ish")));

        assertThat(ingested).isEqualTo(1);
        assertThat(store.timestampFallbacks()).isEqualTo(1);
        assertThat(store.history("sensor.a").get(0).getTimestamp().toInstant()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Batch should read a timestamp without offset as UTC")
    void batchShouldReadNaiveTimestampAsUtc() {
        store.ingestBatch(List.of(reading("sensor.a", 1.0, "2025-01-06T07:30:00")));

        OffsetDateTime ts = store.history("sensor.a").get(0).getTimestamp();
        assertThat(ts).isEqualTo(OffsetDateTime.parse("2025-01-06T07:30:00Z"));
        assertThat(store.timestampFallbacks()).isZero();
    }

    @Test
    @DisplayName("Batch should accept a space between date and time")
    void batchShouldAcceptSpaceSeparator() {
        store.ingestBatch(List.of(
                reading("sensor.a", 1.0, "2025-06-15 10:30:00+02:00"),
                reading("sensor.b", 1.0, "2025-06-15 10:30:00.250")));

        assertThat(store.history("sensor.a").get(0).getTimestamp())
                .isEqualTo(OffsetDateTime.parse("2025-06-15T10:30:00+02:00"));
        assertThat(store.history("sensor.b").get(0).getTimestamp())
                .isEqualTo(OffsetDateTime.parse("2025-06-15T10:30:00.250Z"));
        assertThat(store.timestampFallbacks()).isZero();
    }

    @Test
    @DisplayName("Batch should read a date without time as midnight UTC")
    void batchShouldReadDateOnlyAsMidnightUtc() {
        store.ingestBatch(List.of(reading("sensor.a", 1.0, "2025-06-15")));

        assertThat(store.history("sensor.a").get(0).getTimestamp())
                .isEqualTo(OffsetDateTime.parse("2025-06-15T00:00:00Z"));
        assertThat(store.timestampFallbacks()).isZero();
    }

    @Test
    @DisplayName("Batch should drop attributes with non-string keys")
    void batchShouldDropAttributesWithNonStringKeys() {
        Map<String, Object> entry = reading("sensor.a", 1.0, "2025-06-15");
        entry.put(TimeSeriesStore.FIELD_ATTRIBUTES, Map.of(1, "one"));

        store.ingestBatch(List.of(entry));

        assertThat(store.history("sensor.a").get(0).getAttributes()).isEmpty();
    }

    @Test
    @DisplayName("Batch should keep the supplied offset and attributes")
    void batchShouldKeepOffsetAndAttributes() {
        Map<String, Object> entry = reading("sensor.a", 1.0, "2025-01-06T07:30:00+02:00");
        entry.put(TimeSeriesStore.FIELD_ATTRIBUTES, Map.of("unit", "°C"));

        store.ingestBatch(List.of(entry));

        DataPoint p = store.history("sensor.a").get(0);
        assertThat(p.getTimestamp().getHour()).isEqualTo(7);
        assertThat(p.getTimestamp().getOffset()).isEqualTo(ZoneOffset.ofHours(2));
        assertThat(p.getAttributes()).containsEntry("unit", "°C");
    }

    @Test
    @DisplayName("Clearing an entity should remove only that entity")
    void clearShouldRemoveOneEntity() {
        store.ingest("sensor.a", 1.0);
        store.ingest("sensor.b", 2.0);

        assertThat(store.clear("sensor.a")).isTrue();
        assertThat(store.clear("sensor.a")).isFalse();
        assertThat(store.entityIds()).containsExactly("sensor.b");
    }

    @Test
    @DisplayName("Concurrent writers on different entities should not lose points")
    void concurrentIngestionShouldNotLosePoints() throws InterruptedException {
        TimeSeriesStore big = new TimeSeriesStore(10_000, Clock.systemUTC());
        int writers = 8;
        int perWriter = 1_000;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        for (int w = 0; w < writers; w++) {
            String id = "sensor." + w;
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < perWriter; i++) {
                    big.ingest(id, i);
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        assertThat(big.entityIds()).hasSize(writers);
        for (String id : big.entityIds()) {
            assertThat(big.size(id)).isEqualTo(perWriter);
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Map<String, Object> reading(String entityId, Object value, String timestamp) {
        Map<String, Object> m = new HashMap<>();
        m.put(TimeSeriesStore.FIELD_ENTITY_ID, entityId);
        m.put(TimeSeriesStore.FIELD_VALUE, value);
        if (timestamp != null) {
            m.put(TimeSeriesStore.FIELD_TIMESTAMP, timestamp);
        }
        return m;
    }
}
