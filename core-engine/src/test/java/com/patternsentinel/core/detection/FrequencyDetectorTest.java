package com.patternsentinel.core.detection;

import com.patternsentinel.core.model.Anomaly;
import com.patternsentinel.core.model.DataPoint;
import com.patternsentinel.core.model.PatternProfile;
import com.patternsentinel.core.model.Severity;
import com.patternsentinel.core.model.context.FrequencyContext;
import com.patternsentinel.core.model.context.FrequencyDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FrequencyDetector}.
 */
class FrequencyDetectorTest {

    private static final OffsetDateTime T0 = OffsetDateTime.parse("2025-01-06T00:00:00Z");
    private static final PatternProfile PROFILE =
            PatternProfile.builder("sensor.a").globalMean(20).globalStd(1).build();

    private final FrequencyDetector detector = new FrequencyDetector(48, 0.5, 1.0, new AnomalyFactory());

    @Test
    @DisplayName("Should NOT fire for a steady reporting interval")
    void shouldIgnoreSteadyInterval() {
        assertThat(detector.evaluate(snapshot(24, Duration.ofHours(1), 24, Duration.ofHours(1)))).isEmpty();
    }

    @Test
    @DisplayName("Should NOT run with fewer than 48 points")
    void shouldSkipShortHistory() {
        assertThat(detector.evaluate(snapshot(24, Duration.ofHours(1), 23, Duration.ofHours(5)))).isEmpty();
    }

    @Test
    @DisplayName("A doubled interval should be a critical slowdown")
    void doubledIntervalShouldBeCritical() {
        List<Anomaly> found = detector.evaluate(snapshot(24, Duration.ofHours(1), 24, Duration.ofHours(2)));

        assertThat(found).hasSize(1);
        Anomaly a = found.get(0);
        assertThat(a.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(a.getScore()).isEqualTo(50.0);
        assertThat(a.getValue()).isEqualTo(7200.0);
        assertThat(a.getExpectedValue()).isEqualTo(3600.0);
        assertThat(a.getDeviationPct()).isEqualTo(100.0);
        assertThat(a.getDescriptionKey()).isEqualTo("frequency.slower");

        FrequencyContext ctx = a.getContext(FrequencyContext.class);
        assertThat(ctx.getDirection()).isEqualTo(FrequencyDirection.SLOWER);
        assertThat(ctx.getChangeRatio()).isEqualTo(1.0);
        assertThat(ctx.getRecentIntervalS()).isEqualTo(7200.0);
        assertThat(ctx.getHistoricalIntervalS()).isEqualTo(3600.0);
    }

    @Test
    @DisplayName("A halved interval should be a warning speed-up")
    void halvedIntervalShouldBeWarning() {
        Anomaly a = detector.evaluate(snapshot(24, Duration.ofHours(1), 24, Duration.ofMinutes(30))).get(0);

        assertThat(a.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(a.getScore()).isEqualTo(25.0);
        assertThat(a.getDescriptionKey()).isEqualTo("frequency.faster");
        assertThat(a.getContext(FrequencyContext.class).getDirection()).isEqualTo(FrequencyDirection.FASTER);
    }

    @Test
    @DisplayName("A change below the threshold should be ignored")
    void smallChangeShouldBeIgnored() {
        assertThat(detector.evaluate(snapshot(24, Duration.ofHours(1), 24, Duration.ofMinutes(40)))).isEmpty();
    }

    @Test
    @DisplayName("A half without positive gaps should suppress the check")
    void halfWithoutPositiveGapsShouldSuppress() {
        assertThat(detector.evaluate(snapshot(24, Duration.ofHours(1), 24, Duration.ZERO))).isEmpty();
    }

    @Test
    @DisplayName("Mean interval should ignore zero and negative gaps")
    void meanIntervalShouldIgnoreNonPositiveGaps() {
        List<DataPoint> points = List.of(
                point(0, T0),
                point(1, T0.plusSeconds(10)),
                point(2, T0.plusSeconds(10)),
                point(3, T0.plusSeconds(5)),
                point(4, T0.plusSeconds(35)));

        assertThat(FrequencyDetector.meanInterval(points)).hasValue(20.0);
        assertThat(FrequencyDetector.meanInterval(points.subList(0, 1))).isEmpty();
    }

    @Test
    @DisplayName("Mean interval should handle gaps of several centuries")
    void meanIntervalShouldHandleVeryLongGaps() {
        OffsetDateTime from = OffsetDateTime.parse("1700-01-01T00:00:00Z");
        OffsetDateTime to = OffsetDateTime.parse("2100-01-01T00:00:00.5Z");

        assertThat(FrequencyDetector.meanInterval(List.of(point(0, from), point(1, to))))
                .hasValue(Duration.between(from, to).getSeconds() + 0.5);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static DataPoint point(double value, OffsetDateTime ts) {
        return new DataPoint("sensor.a", value, ts, null);
    }

    /**
     * {@code olderCount} points spaced by {@code olderGap}, then
     * {@code recentCount} points spaced by {@code recentGap}.
     */
    private static SeriesSnapshot snapshot(int olderCount, Duration olderGap, int recentCount, Duration recentGap) {
        List<DataPoint> history = new ArrayList<>();
        OffsetDateTime ts = T0;
        for (int i = 0; i < olderCount; i++) {
            history.add(point(20.0, ts));
            ts = ts.plus(olderGap);
        }
        for (int i = 0; i < recentCount; i++) {
            history.add(point(20.0, ts));
            ts = ts.plus(recentGap);
        }
        return new SeriesSnapshot("sensor.a", history, PROFILE);
    }
}
