package com.patternsentinel.core.detection;

import com.patternsentinel.core.model.Anomaly;
import com.patternsentinel.core.model.AnomalyType;
import com.patternsentinel.core.model.BucketStats;
import com.patternsentinel.core.model.DataPoint;
import com.patternsentinel.core.model.PatternProfile;
import com.patternsentinel.core.model.Severity;
import com.patternsentinel.core.model.context.HourlySeasonalContext;
import com.patternsentinel.core.model.context.WeekdaySeasonalContext;
import com.patternsentinel.core.scoring.SeverityScorer;
import com.patternsentinel.core.stats.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks the newest reading against its time-of-day and day-of-week
 * baselines.
 *
 * <ul>
 * <li>Hourly: fires at the warning threshold, severity from the z-score.</li>
 * <li>Weekday: fires at the critical threshold and is always critical.</li>
 * </ul>
 * <p>
 * Both checks may fire for the same reading. Only buckets with a baseline
 * (two or more samples, non-zero spread) are used, and the detector needs at
 * least {@code minPoints} points of history.
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalDetector.class);

    private final int minPoints;
    private final SeverityScorer scorer;
    private final AnomalyFactory anomalies;

    public SeasonalDetector(int minPoints, SeverityScorer scorer, AnomalyFactory anomalies) {
        this.minPoints = minPoints;
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.anomalies = Objects.requireNonNull(anomalies, "anomalies must not be null");
    }

    @Override
    public List<Anomaly> evaluate(SeriesSnapshot snapshot) {
        if (snapshot.size() < minPoints) {
            return List.of();
        }
        PatternProfile profile = snapshot.getProfile();
        DataPoint latest = snapshot.latest();
        double value = latest.getValue();
        List<Anomaly> found = new ArrayList<>(2);

        int hour = latest.getTimestamp().getHour();
        BucketStats hourly = profile.hourBucket(hour);
        if (hourly.hasBaseline()) {
            double z = Math.abs(value - hourly.getMean()) / hourly.getStd();
            if (z >= scorer.getWarningZ()) {
                LOG.debug("Hourly pattern violation on '{}' at hour {}: value={} mean={} z={}",
                        snapshot.getEntityId(), hour, value, hourly.getMean(), z);
                found.add(anomalies.newAnomaly(snapshot.getEntityId(), AnomalyType.SEASONAL)
                        .severity(scorer.severityFor(z))
                        .score(scorer.scoreFor(z))
                        .detectedAt(latest.getTimestamp())
                        .value(value)
                        .expectedValue(hourly.getMean())
                        .deviationPct(Statistics.deviationPct(value, hourly.getMean()))
                        .descriptionKey("seasonal.hourly")
                        .context(new HourlySeasonalContext(
                                hour,
                                Statistics.round(hourly.getMean(), 2),
                                Statistics.round(hourly.getStd(), 2),
                                Statistics.round(z, 2)))
                        .build());
            }
        }

        DayOfWeek day = latest.getTimestamp().getDayOfWeek();
        BucketStats daily = profile.dayBucket(day.getValue() - 1);
        if (daily.hasBaseline()) {
            double z = Math.abs(value - daily.getMean()) / daily.getStd();
            if (z >= scorer.getCriticalZ()) {
                LOG.debug("Weekday pattern violation on '{}' on {}: value={} mean={} z={}",
                        snapshot.getEntityId(), day, value, daily.getMean(), z);
                found.add(anomalies.newAnomaly(snapshot.getEntityId(), AnomalyType.SEASONAL)
                        .severity(Severity.CRITICAL)
                        .score(scorer.scoreFor(z))
                        .detectedAt(latest.getTimestamp())
                        .value(value)
                        .expectedValue(daily.getMean())
                        .deviationPct(Statistics.deviationPct(value, daily.getMean()))
                        .descriptionKey("seasonal.weekday")
                        .context(new WeekdaySeasonalContext(
                                day,
                                Statistics.round(daily.getMean(), 2),
                                Statistics.round(z, 2)))
                        .build());
            }
        }
        return found;
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.SEASONAL;
    }
}
