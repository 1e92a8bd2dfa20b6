package com.patternsentinel.core.config;

import com.patternsentinel.core.model.AnomalyType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Tunable limits and thresholds of the anomaly detection engine.
 *
 * <p>
 * Every field has a default, so an empty YAML document yields a usable
 * configuration. Expected YAML structure (all keys optional):
 * </p>
 *
 * <pre>
 * maxHistory: 2016
 * registryCapacity: 500
 * minPointsBasic: 24
 * infoZ: 2.0
 * warningZ: 3.0
 * criticalZ: 4.0
 * detectors: [spike, drift, flatline, seasonal, frequency, correlation]
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig {

    // --- Capacity ---
    /** Maximum retained points per entity (12 weeks of hourly data). */
    private int maxHistory = 2016;

    /** Maximum retained anomalies in the registry. */
    private int registryCapacity = 500;

    // --- Minimum sample sizes ---
    /** Points required before a profile is learned or any detector runs. */
    private int minPointsBasic = 24;

    /** Points required per entity before it takes part in correlation learning. */
    private int minPointsCorrelation = 48;

    /** Points required for the seasonal detector (one week of hourly data). */
    private int minPointsSeasonal = 168;

    /** Overlapping samples below which a correlation is undefined. */
    private int minCorrelationOverlap = 5;

    // --- Severity ---
    private double infoZ = 2.0;
    private double warningZ = 3.0;
    private double criticalZ = 4.0;

    // --- Detector parameters ---
    /** Number of most recent points examined by the spike detector. */
    private int spikeLookback = 3;

    /** Size of the recent segment compared by the drift detector. */
    private int driftWindow = 24;

    /** Consecutive identical values that make a flatline. */
    private int flatlineThreshold = 12;

    /** Relative interval change at which the frequency detector fires. */
    private double frequencyChangeThreshold = 0.5;

    /** Relative interval change from which a frequency anomaly is critical. */
    private double frequencyCriticalRatio = 1.0;

    /** Minimum |r| of a learned pair for the correlation-break check. */
    private double strongCorrelation = 0.7;

    /** Number of recent points used to recompute a pair's correlation. */
    private int recentCorrelationWindow = 24;

    /** |r_recent - r_historical| above which a correlation counts as broken. */
    private double correlationBreakThreshold = 0.5;

    /** Correlation difference from which a break is critical. */
    private double correlationCriticalBreak = 0.8;

    /** Entity count above which all-pairs correlation learning logs a warning. */
    private int correlationEntityWarnLimit = 500;

    // --- Scheduling ---
    /** Delay between two scheduled detection passes. */
    private long detectionIntervalSeconds = 300;

    /** Enabled detectors; order here does not change execution order. */
    private List<String> detectors = new ArrayList<>(Arrays.asList(
            "spike", "drift", "flatline", "seasonal", "frequency", "correlation"));

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all values are within legal ranges.
     *
     * @throws IllegalStateException listing every violation, if any
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        requirePositive(errors, "maxHistory", maxHistory);
        requirePositive(errors, "registryCapacity", registryCapacity);
        requirePositive(errors, "spikeLookback", spikeLookback);
        requirePositive(errors, "driftWindow", driftWindow);
        requirePositive(errors, "recentCorrelationWindow", recentCorrelationWindow);
        requirePositive(errors, "correlationEntityWarnLimit", correlationEntityWarnLimit);

        if (minPointsBasic < 2) {
            errors.add("'minPointsBasic' must be >= 2, got: " + minPointsBasic);
        }
        if (minPointsCorrelation < minPointsBasic) {
            errors.add("'minPointsCorrelation' must be >= minPointsBasic (" + minPointsBasic
                    + "), got: " + minPointsCorrelation);
        }
        if (minPointsSeasonal < minPointsBasic) {
            errors.add("'minPointsSeasonal' must be >= minPointsBasic (" + minPointsBasic
                    + "), got: " + minPointsSeasonal);
        }
        if (minCorrelationOverlap < 2) {
            errors.add("'minCorrelationOverlap' must be >= 2, got: " + minCorrelationOverlap);
        }
        if (flatlineThreshold < 2) {
            errors.add("'flatlineThreshold' must be >= 2, got: " + flatlineThreshold);
        }
        if (!(infoZ > 0 && infoZ <= warningZ && warningZ <= criticalZ)) {
            errors.add("z thresholds must satisfy 0 < infoZ <= warningZ <= criticalZ, got: "
                    + infoZ + ", " + warningZ + ", " + criticalZ);
        }
        if (frequencyChangeThreshold <= 0 || frequencyCriticalRatio < frequencyChangeThreshold) {
            errors.add("frequency thresholds must satisfy 0 < frequencyChangeThreshold"
                    + " <= frequencyCriticalRatio, got: " + frequencyChangeThreshold
                    + ", " + frequencyCriticalRatio);
        }
        if (strongCorrelation <= 0 || strongCorrelation > 1) {
            errors.add("'strongCorrelation' must be in (0, 1], got: " + strongCorrelation);
        }
        if (correlationBreakThreshold <= 0 || correlationCriticalBreak < correlationBreakThreshold) {
            errors.add("correlation break thresholds must satisfy 0 < correlationBreakThreshold"
                    + " <= correlationCriticalBreak, got: " + correlationBreakThreshold
                    + ", " + correlationCriticalBreak);
        }
        if (detectionIntervalSeconds < 1) {
            errors.add("'detectionIntervalSeconds' must be >= 1, got: " + detectionIntervalSeconds);
        }
        for (String d : detectors) {
            try {
                AnomalyType.fromId(d);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid EngineConfig: " + String.join("; ", errors));
        }
    }

    private static void requirePositive(List<String> errors, String name, long value) {
        if (value <= 0) {
            errors.add("'" + name + "' must be > 0, got: " + value);
        }
    }

    /**
     * @param type detector type
     * @return {@code true} if the detector for {@code type} is enabled
     */
    public boolean isDetectorEnabled(AnomalyType type) {
        return detectors.stream().anyMatch(d -> d.trim().equalsIgnoreCase(type.id()));
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getMaxHistory() {
        return maxHistory;
    }

    public void setMaxHistory(int maxHistory) {
        this.maxHistory = maxHistory;
    }

    public int getRegistryCapacity() {
        return registryCapacity;
    }

    public void setRegistryCapacity(int registryCapacity) {
        this.registryCapacity = registryCapacity;
    }

    public int getMinPointsBasic() {
        return minPointsBasic;
    }

    public void setMinPointsBasic(int minPointsBasic) {
        this.minPointsBasic = minPointsBasic;
    }

    public int getMinPointsCorrelation() {
        return minPointsCorrelation;
    }

    public void setMinPointsCorrelation(int minPointsCorrelation) {
        this.minPointsCorrelation = minPointsCorrelation;
    }

    public int getMinPointsSeasonal() {
        return minPointsSeasonal;
    }

    public void setMinPointsSeasonal(int minPointsSeasonal) {
        this.minPointsSeasonal = minPointsSeasonal;
    }

    public int getMinCorrelationOverlap() {
        return minCorrelationOverlap;
    }

    public void setMinCorrelationOverlap(int minCorrelationOverlap) {
        this.minCorrelationOverlap = minCorrelationOverlap;
    }

    public double getInfoZ() {
        return infoZ;
    }

    public void setInfoZ(double infoZ) {
        this.infoZ = infoZ;
    }

    public double getWarningZ() {
        return warningZ;
    }

    public void setWarningZ(double warningZ) {
        this.warningZ = warningZ;
    }

    public double getCriticalZ() {
        return criticalZ;
    }

    public void setCriticalZ(double criticalZ) {
        this.criticalZ = criticalZ;
    }

    public int getSpikeLookback() {
        return spikeLookback;
    }

    public void setSpikeLookback(int spikeLookback) {
        this.spikeLookback = spikeLookback;
    }

    public int getDriftWindow() {
        return driftWindow;
    }

    public void setDriftWindow(int driftWindow) {
        this.driftWindow = driftWindow;
    }

    public int getFlatlineThreshold() {
        return flatlineThreshold;
    }

    public void setFlatlineThreshold(int flatlineThreshold) {
        this.flatlineThreshold = flatlineThreshold;
    }

    public double getFrequencyChangeThreshold() {
        return frequencyChangeThreshold;
    }

    public void setFrequencyChangeThreshold(double frequencyChangeThreshold) {
        this.frequencyChangeThreshold = frequencyChangeThreshold;
    }

    public double getFrequencyCriticalRatio() {
        return frequencyCriticalRatio;
    }

    public void setFrequencyCriticalRatio(double frequencyCriticalRatio) {
        this.frequencyCriticalRatio = frequencyCriticalRatio;
    }

    public double getStrongCorrelation() {
        return strongCorrelation;
    }

    public void setStrongCorrelation(double strongCorrelation) {
        this.strongCorrelation = strongCorrelation;
    }

    public int getRecentCorrelationWindow() {
        return recentCorrelationWindow;
    }

    public void setRecentCorrelationWindow(int recentCorrelationWindow) {
        this.recentCorrelationWindow = recentCorrelationWindow;
    }

    public double getCorrelationBreakThreshold() {
        return correlationBreakThreshold;
    }

    public void setCorrelationBreakThreshold(double correlationBreakThreshold) {
        this.correlationBreakThreshold = correlationBreakThreshold;
    }

    public double getCorrelationCriticalBreak() {
        return correlationCriticalBreak;
    }

    public void setCorrelationCriticalBreak(double correlationCriticalBreak) {
        this.correlationCriticalBreak = correlationCriticalBreak;
    }

    public int getCorrelationEntityWarnLimit() {
        return correlationEntityWarnLimit;
    }

    public void setCorrelationEntityWarnLimit(int correlationEntityWarnLimit) {
        this.correlationEntityWarnLimit = correlationEntityWarnLimit;
    }

    public long getDetectionIntervalSeconds() {
        return detectionIntervalSeconds;
    }

    public void setDetectionIntervalSeconds(long detectionIntervalSeconds) {
        this.detectionIntervalSeconds = detectionIntervalSeconds;
    }

    /**
     * @return unmodifiable list of enabled detector ids
     */
    public List<String> getDetectors() {
        return Collections.unmodifiableList(detectors);
    }

    /**
     * Set the enabled detectors (ids normalised to lowercase).
     *
     * @param detectors detector ids; {@code null} disables all detectors
     */
    public void setDetectors(List<String> detectors) {
        this.detectors = new ArrayList<>();
        if (detectors != null) {
            for (String d : detectors) {
                if (d != null) {
                    this.detectors.add(d.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "maxHistory=" + maxHistory +
                ", registryCapacity=" + registryCapacity +
                ", minPointsBasic=" + minPointsBasic +
                ", minPointsCorrelation=" + minPointsCorrelation +
                ", minPointsSeasonal=" + minPointsSeasonal +
                ", z=" + infoZ + "/" + warningZ + "/" + criticalZ +
                ", detectors=" + detectors +
                ", detectionIntervalSeconds=" + detectionIntervalSeconds +
                '}';
    }
}
