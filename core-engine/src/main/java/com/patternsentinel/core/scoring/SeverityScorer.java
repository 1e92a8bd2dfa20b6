package com.patternsentinel.core.scoring;

import com.patternsentinel.core.config.EngineConfig;
import com.patternsentinel.core.model.Severity;

/**
 * Maps z-scores onto severities and 0-100 scores.
 *
 * <p>
 * With the default thresholds: z &ge; 2 is info, z &ge; 3 warning, z &ge; 4
 * critical, and the score is {@code min(100, z * 20)}. Values below the info
 * threshold still map to {@link Severity#INFO}; detectors decide whether such
 * a value is reported at all via {@link #isReportable(double)}.
 * </p>
 *
 * @since 1.0.0
 */
public class SeverityScorer {

    /** Score points per standard deviation. */
    public static final double SCORE_PER_Z = 20.0;

    public static final double MAX_SCORE = 100.0;

    private final double infoZ;
    private final double warningZ;
    private final double criticalZ;

    public SeverityScorer(double infoZ, double warningZ, double criticalZ) {
        if (!(infoZ > 0 && infoZ <= warningZ && warningZ <= criticalZ)) {
            throw new IllegalArgumentException(
                    "z thresholds must satisfy 0 < info <= warning <= critical, got: "
                            + infoZ + ", " + warningZ + ", " + criticalZ);
        }
        this.infoZ = infoZ;
        this.warningZ = warningZ;
        this.criticalZ = criticalZ;
    }

    public static SeverityScorer from(EngineConfig config) {
        return new SeverityScorer(config.getInfoZ(), config.getWarningZ(), config.getCriticalZ());
    }

    /**
     * @param z absolute z-score
     * @return critical, warning, or info for everything below warning
     */
    public Severity severityFor(double z) {
        if (z >= criticalZ) {
            return Severity.CRITICAL;
        }
        if (z >= warningZ) {
            return Severity.WARNING;
        }
        return Severity.INFO;
    }

    /**
     * @param z absolute z-score
     * @return {@code true} if {@code z} reaches the info threshold
     */
    public boolean isReportable(double z) {
        return z >= infoZ;
    }

    /**
     * @param z absolute z-score
     * @return {@code min(100, z * 20)}
     */
    public double scoreFor(double z) {
        return cap(z * SCORE_PER_Z);
    }

    /**
     * @param rawScore unbounded score
     * @return {@code rawScore} limited to [0, 100]
     */
    public static double cap(double rawScore) {
        return Math.max(0.0, Math.min(MAX_SCORE, rawScore));
    }

    public double getInfoZ() {
        return infoZ;
    }

    public double getWarningZ() {
        return warningZ;
    }

    public double getCriticalZ() {
        return criticalZ;
    }
}
