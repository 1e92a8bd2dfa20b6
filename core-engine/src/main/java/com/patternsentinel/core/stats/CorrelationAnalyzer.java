package com.patternsentinel.core.stats;

import com.patternsentinel.core.model.CorrelationPair;
import com.patternsentinel.core.model.DataPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.CancellationException;

/**
 * Pearson correlation between entity histories.
 *
 * <h3>Alignment</h3>
 * <p>
 * Series are aligned by position from the newest end: with {@code n} the
 * shorter length, the last {@code n} readings of each series are paired.
 * </p>
 *
 * <h3>Degenerate input</h3>
 * <ul>
 * <li>fewer than {@code minOverlap} paired samples: undefined (empty
 * result), which callers must not confuse with 0</li>
 * <li>a series with zero variance: 0.0</li>
 * </ul>
 *
 * <h3>Learning</h3>
 * <p>
 * {@link #learn(Map)} evaluates every unordered pair of eligible entities,
 * which is quadratic in the entity count. It is meant for a periodic batch
 * pass and logs a warning above {@code entityWarnLimit} entities.
 * </p>
 *
 * @since 1.0.0
 */
public class CorrelationAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationAnalyzer.class);

    private final int minPoints;
    private final int minOverlap;
    private final int entityWarnLimit;

    /**
     * @param minPoints       minimum history length for an entity to take part
     *                        in learning
     * @param minOverlap      minimum paired samples for a defined coefficient
     * @param entityWarnLimit eligible-entity count above which learning warns
     */
    public CorrelationAnalyzer(int minPoints, int minOverlap, int entityWarnLimit) {
        if (minOverlap < 2) {
            throw new IllegalArgumentException("minOverlap must be >= 2, got: " + minOverlap);
        }
        this.minPoints = minPoints;
        this.minOverlap = minOverlap;
        this.entityWarnLimit = entityWarnLimit;
    }

    /**
     * Correlation over the full histories.
     *
     * @see #correlation(List, List, int)
     */
    public OptionalDouble correlation(List<DataPoint> seriesA, List<DataPoint> seriesB) {
        return correlation(seriesA, seriesB, 0);
    }

    /**
     * @param seriesA first history, oldest first
     * @param seriesB second history, oldest first
     * @param window  if positive, only the most recent {@code window} points of
     *                each series are used
     * @return the coefficient, or empty if fewer than {@code minOverlap}
     *         samples overlap
     */
    public OptionalDouble correlation(List<DataPoint> seriesA, List<DataPoint> seriesB, int window) {
        Objects.requireNonNull(seriesA, "seriesA must not be null");
        Objects.requireNonNull(seriesB, "seriesB must not be null");
        List<DataPoint> a = window > 0 ? tail(seriesA, window) : seriesA;
        List<DataPoint> b = window > 0 ? tail(seriesB, window) : seriesB;

        int n = Math.min(a.size(), b.size());
        if (n < minOverlap) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(pearson(
                Statistics.values(tail(a, n)),
                Statistics.values(tail(b, n))));
    }

    /**
     * Learn all pairwise correlations.
     *
     * <p>
     * Checks the calling thread's interrupt flag between entities.
     * </p>
     *
     * @param histories entity id to history, iterated in map order
     * @return a new table holding every pair with a defined coefficient
     * @throws CancellationException if the calling thread is interrupted
     */
    public CorrelationTable learn(Map<String, List<DataPoint>> histories) {
        List<String> eligible = new ArrayList<>();
        for (Map.Entry<String, List<DataPoint>> e : histories.entrySet()) {
            if (e.getValue().size() >= minPoints) {
                eligible.add(e.getKey());
            }
        }
        if (eligible.size() > entityWarnLimit) {
            LOG.warn("Learning correlations for {} entities ({} pairs); all-pairs learning"
                    + " is quadratic and may dominate the detection pass",
                    eligible.size(), (long) eligible.size() * (eligible.size() - 1) / 2);
        }

        List<CorrelationPair> learned = new ArrayList<>();
        for (int i = 0; i < eligible.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Correlation learning interrupted after "
                        + i + " of " + eligible.size() + " entities");
            }
            String idA = eligible.get(i);
            List<DataPoint> histA = histories.get(idA);
            for (int j = i + 1; j < eligible.size(); j++) {
                String idB = eligible.get(j);
                List<DataPoint> histB = histories.get(idB);
                OptionalDouble r = correlation(histA, histB);
                if (r.isPresent()) {
                    learned.add(new CorrelationPair(idA, idB, r.getAsDouble(),
                            Math.min(histA.size(), histB.size())));
                }
            }
        }
        LOG.debug("Learned {} correlation pair(s) from {} eligible entities",
                learned.size(), eligible.size());
        return new CorrelationTable(learned);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static double pearson(double[] a, double[] b) {
        int n = a.length;
        double meanA = Statistics.mean(a);
        double meanB = Statistics.mean(b);
        double stdA = Statistics.sampleStdDev(a, meanA);
        double stdB = Statistics.sampleStdDev(b, meanB);
        if (stdA == 0 || stdB == 0) {
            return 0.0;
        }
        double cov = 0;
        for (int i = 0; i < n; i++) {
            cov += (a[i] - meanA) * (b[i] - meanB);
        }
        cov /= (n - 1);
        // Clamp rounding noise so the coefficient stays in [-1, 1]
        return Math.max(-1.0, Math.min(1.0, cov / (stdA * stdB)));
    }

    private static List<DataPoint> tail(List<DataPoint> list, int n) {
        return list.size() <= n ? list : list.subList(list.size() - n, list.size());
    }
}
