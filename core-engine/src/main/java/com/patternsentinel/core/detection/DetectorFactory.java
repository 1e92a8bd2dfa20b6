package com.patternsentinel.core.detection;

import com.patternsentinel.core.config.EngineConfig;
import com.patternsentinel.core.model.AnomalyType;
import com.patternsentinel.core.scoring.SeverityScorer;
import com.patternsentinel.core.stats.CorrelationAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates detectors from an {@link EngineConfig}.
 *
 * <p>
 * This is the single point of extension when adding new detector types:
 * add the {@link AnomalyType} constant and create the corresponding detector
 * here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class — not instantiable
    }

    /**
     * Create the per-entity detector for the given type.
     *
     * @param type      detector type; must not be {@link AnomalyType#CORRELATION}
     * @param config    thresholds
     * @param scorer    z-score classification
     * @param anomalies anomaly id source
     * @return a new detector
     * @throws NullPointerException     if an argument is {@code null}
     * @throws IllegalArgumentException for {@link AnomalyType#CORRELATION},
     *                                  which is not a per-entity detector
     */
    public static AnomalyDetector create(AnomalyType type, EngineConfig config,
            SeverityScorer scorer, AnomalyFactory anomalies) {
        Objects.requireNonNull(type, "Detector type must not be null");
        Objects.requireNonNull(config, "EngineConfig must not be null");
        return switch (type) {
            case SPIKE -> new SpikeDetector(config.getSpikeLookback(), scorer, anomalies);
            case DRIFT -> new DriftDetector(config.getDriftWindow(), scorer, anomalies);
            case FLATLINE -> new FlatlineDetector(config.getFlatlineThreshold(), anomalies);
            case SEASONAL -> new SeasonalDetector(config.getMinPointsSeasonal(), scorer, anomalies);
            case FREQUENCY -> new FrequencyDetector(2 * config.getMinPointsBasic(),
                    config.getFrequencyChangeThreshold(), config.getFrequencyCriticalRatio(), anomalies);
            case CORRELATION -> throw new IllegalArgumentException(
                    "'correlation' is a cross-entity detector; use createCorrelationDetector");
        };
    }

    /**
     * @param config    thresholds
     * @param analyzer  correlation computation shared with the learning pass
     * @param anomalies anomaly id source
     * @param clock     time source for the detection timestamp
     * @return a new correlation-break detector
     */
    public static CorrelationBreakDetector createCorrelationDetector(EngineConfig config,
            CorrelationAnalyzer analyzer, AnomalyFactory anomalies, Clock clock) {
        Objects.requireNonNull(config, "EngineConfig must not be null");
        return new CorrelationBreakDetector(
                config.getStrongCorrelation(),
                config.getRecentCorrelationWindow(),
                config.getCorrelationBreakThreshold(),
                config.getCorrelationCriticalBreak(),
                analyzer, anomalies, clock);
    }

    /**
     * Create a pipeline holding every detector enabled in the configuration.
     *
     * @param config    validated configuration
     * @param analyzer  correlation computation
     * @param anomalies anomaly id source
     * @param clock     time source
     * @return the pipeline
     */
    public static DetectorPipeline createPipeline(EngineConfig config, CorrelationAnalyzer analyzer,
            AnomalyFactory anomalies, Clock clock) {
        Objects.requireNonNull(config, "EngineConfig must not be null");
        SeverityScorer scorer = SeverityScorer.from(config);

        List<AnomalyDetector> detectors = new ArrayList<>();
        CorrelationBreakDetector correlation = null;
        for (AnomalyType type : AnomalyType.values()) {
            if (!config.isDetectorEnabled(type)) {
                continue;
            }
            if (type == AnomalyType.CORRELATION) {
                correlation = createCorrelationDetector(config, analyzer, anomalies, clock);
            } else {
                detectors.add(create(type, config, scorer, anomalies));
            }
        }
        LOG.info("Created detector pipeline: {} per-entity detector(s), correlation check {}",
                detectors.size(), correlation != null ? "enabled" : "disabled");
        return new DetectorPipeline(detectors, correlation);
    }
}
