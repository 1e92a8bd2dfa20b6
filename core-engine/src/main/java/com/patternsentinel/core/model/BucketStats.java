package com.patternsentinel.core.model;

import java.util.Objects;

/**
 * Sample statistics of one hour-of-day or weekday bucket.
 *
 * <p>
 * A bucket distinguishes three states:
 * </p>
 * <ul>
 * <li>no data: {@code count == 0} ({@link #EMPTY})</li>
 * <li>data without a baseline: one sample, or several identical samples
 * ({@code std == 0})</li>
 * <li>baseline: at least two samples with a positive standard deviation</li>
 * </ul>
 * <p>
 * Detectors only compute z-scores against buckets for which
 * {@link #hasBaseline()} is {@code true}.
 * </p>
 *
 * @since 1.0.0
 */
public final class BucketStats {

    /** Bucket without any sample. */
    public static final BucketStats EMPTY = new BucketStats(0, 0.0, 0.0);

    private final int count;
    private final double mean;
    private final double std;

    /**
     * @param count number of samples, {@code >= 0}
     * @param mean  sample mean
     * @param std   sample (n-1) standard deviation, 0 for fewer than two samples
     */
    public BucketStats(int count, double mean, double std) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got: " + count);
        }
        this.count = count;
        this.mean = mean;
        this.std = count > 1 ? std : 0.0;
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getStd() {
        return std;
    }

    /**
     * @return {@code true} if the bucket holds at least one sample
     */
    public boolean hasData() {
        return count > 0;
    }

    /**
     * @return {@code true} if a z-score against this bucket is meaningful
     */
    public boolean hasBaseline() {
        return count > 1 && std > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BucketStats that))
            return false;
        return count == that.count
                && Double.compare(mean, that.mean) == 0
                && Double.compare(std, that.std) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, mean, std);
    }

    @Override
    public String toString() {
        return "BucketStats{count=" + count + ", mean=" + mean + ", std=" + std + '}';
    }
}
