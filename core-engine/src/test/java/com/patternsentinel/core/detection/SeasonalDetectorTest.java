package com.patternsentinel.core.detection;

import com.patternsentinel.core.model.Anomaly;
import com.patternsentinel.core.model.BucketStats;
import com.patternsentinel.core.model.DataPoint;
import com.patternsentinel.core.model.PatternProfile;
import com.patternsentinel.core.model.Severity;
import com.patternsentinel.core.model.context.HourlySeasonalContext;
import com.patternsentinel.core.model.context.WeekdaySeasonalContext;
import com.patternsentinel.core.scoring.SeverityScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SeasonalDetector}.
 *
 * <p>
 * Histories start on Monday 00:00, so the 168th point lands on Sunday at
 * 23:00 (hour 23, weekday 6).
 * </p>
 */
class SeasonalDetectorTest {

    private static final OffsetDateTime T0 = OffsetDateTime.parse("2025-01-06T00:00:00Z");
    private static final int HOUR = 23;
    private static final int SUNDAY = 6;

    private SeasonalDetector detector;

    @BeforeEach
    void setUp() {
        detector = new SeasonalDetector(168, new SeverityScorer(2.0, 3.0, 4.0), new AnomalyFactory());
    }

    @Test
    @DisplayName("Should NOT run with less than one week of history")
    void shouldSkipShortHistory() {
        PatternProfile p = profile().hourBucket(HOUR, new BucketStats(7, 20.0, 1.0)).build();

        assertThat(detector.evaluate(snapshot(p, 167, 40.0))).isEmpty();
    }

    @Test
    @DisplayName("Should flag an hourly violation at the warning threshold")
    void shouldFlagHourlyViolation() {
        PatternProfile p = profile().hourBucket(HOUR, new BucketStats(7, 20.0, 2.0)).build();

        List<Anomaly> found = detector.evaluate(snapshot(p, 168, 27.0));

        assertThat(found).hasSize(1);
        Anomaly a = found.get(0);
        assertThat(a.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(a.getScore()).isEqualTo(70.0);
        assertThat(a.getExpectedValue()).isEqualTo(20.0);
        assertThat(a.getDeviationPct()).isEqualTo(35.0);
        assertThat(a.getDescriptionKey()).isEqualTo("seasonal.hourly");

        HourlySeasonalContext ctx = a.getContext(HourlySeasonalContext.class);
        assertThat(ctx.getHour()).isEqualTo(HOUR);
        assertThat(ctx.getHourStr()).isEqualTo("23:00");
        assertThat(ctx.getExpectedMean()).isEqualTo(20.0);
        assertThat(ctx.getExpectedStd()).isEqualTo(2.0);
        assertThat(ctx.getZScore()).isEqualTo(3.5);
    }

    @Test
    @DisplayName("An hourly deviation below the warning threshold should be ignored")
    void shouldIgnoreHourlyBelowWarning() {
        PatternProfile p = profile().hourBucket(HOUR, new BucketStats(7, 20.0, 1.0)).build();

        assertThat(detector.evaluate(snapshot(p, 168, 22.9))).isEmpty();
    }

    @Test
    @DisplayName("A weekday violation should be critical and need the critical threshold")
    void shouldFlagWeekdayViolationAsCritical() {
        PatternProfile p = profile().dayBucket(SUNDAY, new BucketStats(24, 20.0, 1.0)).build();

        assertThat(detector.evaluate(snapshot(p, 168, 23.9))).isEmpty();

        Anomaly a = detector.evaluate(snapshot(p, 168, 25.0)).get(0);
        assertThat(a.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(a.getDescriptionKey()).isEqualTo("seasonal.weekday");

        WeekdaySeasonalContext ctx = a.getContext(WeekdaySeasonalContext.class);
        assertThat(ctx.getWeekday()).isEqualTo(SUNDAY);
        assertThat(ctx.getWeekdayName()).isEqualTo(DayOfWeek.SUNDAY);
        assertThat(ctx.getExpectedDailyMean()).isEqualTo(20.0);
        assertThat(ctx.getZScore()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Both checks may fire for the same reading, hourly first")
    void bothChecksMayFire() {
        PatternProfile p = profile()
                .hourBucket(HOUR, new BucketStats(7, 20.0, 1.0))
                .dayBucket(SUNDAY, new BucketStats(24, 20.0, 1.0))
                .build();

        List<Anomaly> found = detector.evaluate(snapshot(p, 168, 25.0));

        assertThat(found).extracting(Anomaly::getDescriptionKey)
                .containsExactly("seasonal.hourly", "seasonal.weekday");
    }

    @Test
    @DisplayName("Buckets without a baseline should never fire")
    void shouldSkipBucketsWithoutBaseline() {
        PatternProfile p = profile()
                .hourBucket(HOUR, new BucketStats(1, 20.0, 0.0))
                .dayBucket(SUNDAY, new BucketStats(5, 20.0, 0.0))
                .build();

        assertThat(detector.evaluate(snapshot(p, 168, 1000.0))).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static PatternProfile.Builder profile() {
        return PatternProfile.builder("sensor.a").globalMean(20).globalStd(1).totalPoints(168);
    }

    private static SeriesSnapshot snapshot(PatternProfile profile, int n, double latest) {
        List<DataPoint> history = new ArrayList<>();
        for (int i = 0; i < n - 1; i++) {
            history.add(new DataPoint("sensor.a", 20.0, T0.plusHours(i), null));
        }
        history.add(new DataPoint("sensor.a", latest, T0.plusHours(n - 1), null));
        return new SeriesSnapshot("sensor.a", history, profile);
    }
}
