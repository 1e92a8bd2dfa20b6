package com.patternsentinel.core.engine;

import com.patternsentinel.core.config.EngineConfig;
import com.patternsentinel.core.detection.AnomalyFactory;
import com.patternsentinel.core.detection.DetectorFactory;
import com.patternsentinel.core.detection.DetectorPipeline;
import com.patternsentinel.core.detection.SeriesSnapshot;
import com.patternsentinel.core.model.Anomaly;
import com.patternsentinel.core.model.AnomalySummary;
import com.patternsentinel.core.model.CorrelationPair;
import com.patternsentinel.core.model.DataPoint;
import com.patternsentinel.core.model.PatternProfile;
import com.patternsentinel.core.registry.AnomalyQuery;
import com.patternsentinel.core.registry.AnomalyRegistry;
import com.patternsentinel.core.stats.CorrelationAnalyzer;
import com.patternsentinel.core.stats.CorrelationTable;
import com.patternsentinel.core.stats.PatternProfiler;
import com.patternsentinel.core.store.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Multi-dimensional anomaly detection engine.
 *
 * <p>
 * Owns the per-entity histories, the learned profiles, the correlation table
 * and the anomaly registry. The engine does not schedule itself; callers (or a
 * {@link DetectionScheduler}) decide when to run:
 * </p>
 *
 * <pre>
 * ingest(...)  →  learnPatterns()  →  learnCorrelations()  →  detect()  →  queries
 * </pre>
 *
 * <h3>Thread safety</h3>
 * <ul>
 * <li>Ingestion only locks the target entity's series, so many writers can
 * feed different entities while a pass runs.</li>
 * <li>{@link #learnPatterns(String)}, {@link #learnCorrelations()} and
 * {@link #detect(String)} are serialized by one pass lock; a detector never
 * sees a profile that is being rebuilt.</li>
 * <li>Queries take read locks only.</li>
 * </ul>
 *
 * <h3>Cancellation</h3>
 * <p>
 * Passes check the calling thread's interrupt flag between entities and
 * throw {@link CancellationException} when it is set. Work completed before
 * that point is kept.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetectionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetectionEngine.class);

    private final EngineConfig config;
    private final TimeSeriesStore store;
    private final PatternProfiler profiler;
    private final CorrelationAnalyzer analyzer;
    private final DetectorPipeline pipeline;
    private final AnomalyRegistry registry;

    private final Map<String, PatternProfile> profiles = new HashMap<>();
    private CorrelationTable correlations = CorrelationTable.EMPTY;

    /** Guards {@link #profiles} and {@link #correlations}. */
    private final ReadWriteLock stateLock = new ReentrantReadWriteLock();

    /** Serializes learning and detection passes. */
    private final ReentrantLock passLock = new ReentrantLock();

    /**
     * Create an engine that reads the system UTC clock.
     *
     * @param config engine configuration; validated here
     */
    public AnomalyDetectionEngine(EngineConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * @param config engine configuration; validated here
     * @param clock  source of "now" for readings without timestamp and for
     *               correlation anomalies
     * @throws IllegalStateException if the configuration is invalid
     */
    public AnomalyDetectionEngine(EngineConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "EngineConfig must not be null");
        Objects.requireNonNull(clock, "Clock must not be null");
        config.validate();

        this.store = new TimeSeriesStore(config.getMaxHistory(), clock);
        this.profiler = new PatternProfiler(config.getMinPointsBasic());
        this.analyzer = new CorrelationAnalyzer(config.getMinPointsCorrelation(),
                config.getMinCorrelationOverlap(), config.getCorrelationEntityWarnLimit());
        this.pipeline = DetectorFactory.createPipeline(config, analyzer, new AnomalyFactory(), clock);
        this.registry = new AnomalyRegistry(config.getRegistryCapacity());

        LOG.info("Anomaly detection engine created: maxHistory={}, registryCapacity={}, detectors={}",
                config.getMaxHistory(), config.getRegistryCapacity(), pipeline.enabledTypes());
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * @see TimeSeriesStore#ingest(String, double, OffsetDateTime, Map)
     */
    public DataPoint ingest(String entityId, double value, OffsetDateTime timestamp,
            Map<String, Object> attributes) {
        return store.ingest(entityId, value, timestamp, attributes);
    }

    /**
     * Ingest a reading stamped with the current time.
     */
    public DataPoint ingest(String entityId, double value) {
        return store.ingest(entityId, value);
    }

    /**
     * @see TimeSeriesStore#ingestBatch(List)
     */
    public int ingestBatch(List<? extends Map<String, ?>> points) {
        return store.ingestBatch(points);
    }

    // ---------------------------------------------------------------
    // Learning
    // ---------------------------------------------------------------

    /**
     * Rebuild the profile of one entity, or of every entity with history.
     * Entities with fewer than {@code minPointsBasic} points are skipped.
     *
     * @param entityId entity to profile, or {@code null} for all
     * @return number of profiles (re)built
     * @throws CancellationException if the calling thread is interrupted
     */
    public int learnPatterns(String entityId) {
        passLock.lock();
        try {
            List<String> ids = entityId != null ? List.of(entityId) : List.copyOf(store.entityIds());
            int learned = 0;
            for (int i = 0; i < ids.size(); i++) {
                checkInterrupted("Pattern learning", i, ids.size());
                if (learn(ids.get(i)).isPresent()) {
                    learned++;
                }
            }
            LOG.debug("Learned {} profile(s) out of {} entity(ies)", learned, ids.size());
            return learned;
        } finally {
            passLock.unlock();
        }
    }

    /**
     * Rebuild the profiles of all entities.
     */
    public int learnPatterns() {
        return learnPatterns(null);
    }

    /**
     * Relearn all pairwise correlations. The new table replaces the previous
     * one wholesale; on cancellation the previous table is kept.
     *
     * @return number of learned pairs
     * @throws CancellationException if the calling thread is interrupted
     */
    public int learnCorrelations() {
        passLock.lock();
        try {
            Map<String, List<DataPoint>> histories = new LinkedHashMap<>();
            for (String id : store.entityIds()) {
                histories.put(id, store.history(id));
            }
            CorrelationTable table = analyzer.learn(histories);

            stateLock.writeLock().lock();
            try {
                correlations = table;
            } finally {
                stateLock.writeLock().unlock();
            }
            LOG.debug("Learned {} correlation pair(s) across {} entity(ies)", table.size(), histories.size());
            return table.size();
        } finally {
            passLock.unlock();
        }
    }

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------

    /**
     * Run the detector pipeline and log the results in the registry.
     *
     * <p>
     * An entity without a profile gets one learned first. Entities with fewer
     * than {@code minPointsBasic} points are skipped. The correlation-break
     * check only runs in a full pass ({@code entityId == null}).
     * </p>
     *
     * @param entityId entity to check, or {@code null} for all
     * @return anomalies found by this call, in detection order
     * @throws CancellationException if the calling thread is interrupted;
     *                               anomalies found until then are logged
     */
    public List<Anomaly> detect(String entityId) {
        passLock.lock();
        try {
            List<String> ids = entityId != null ? List.of(entityId) : List.copyOf(store.entityIds());
            List<Anomaly> found = new ArrayList<>();
            try {
                for (int i = 0; i < ids.size(); i++) {
                    checkInterrupted("Detection", i, ids.size());
                    String id = ids.get(i);
                    List<DataPoint> history = store.history(id);
                    if (history.size() < config.getMinPointsBasic()) {
                        continue;
                    }
                    Optional<PatternProfile> profile = getProfile(id).or(() -> learn(id));
                    if (profile.isEmpty()) {
                        continue;
                    }
                    found.addAll(pipeline.evaluate(new SeriesSnapshot(id, history, profile.get())));
                }

                if (entityId == null) {
                    CorrelationTable table = currentCorrelations();
                    found.addAll(pipeline.evaluateCorrelations(table, store::history));
                }
            } finally {
                registry.addAll(found);
            }

            if (!found.isEmpty()) {
                LOG.info("Detection pass over {} entity(ies) found {} anomaly(ies)", ids.size(), found.size());
            }
            return found;
        } finally {
            passLock.unlock();
        }
    }

    /**
     * Run a full detection pass over all entities.
     */
    public List<Anomaly> detect() {
        return detect(null);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public List<Anomaly> getAnomalies(AnomalyQuery query) {
        return registry.query(query);
    }

    /**
     * @return the 50 most recent anomalies
     */
    public List<Anomaly> getAnomalies() {
        return registry.query(AnomalyQuery.all());
    }

    public Optional<PatternProfile> getProfile(String entityId) {
        stateLock.readLock().lock();
        try {
            return Optional.ofNullable(profiles.get(entityId));
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public AnomalySummary getSummary() {
        return registry.summary(store.entityIds());
    }

    /**
     * @return the currently learned correlation pairs
     */
    public List<CorrelationPair> getCorrelations() {
        return currentCorrelations().pairs();
    }

    /**
     * @param entityId entity whose history is returned
     * @return immutable snapshot, oldest first; empty for unknown entities
     */
    public List<DataPoint> getHistory(String entityId) {
        return store.history(entityId);
    }

    // ---------------------------------------------------------------
    // Maintenance
    // ---------------------------------------------------------------

    /**
     * @param entityId entity whose anomalies are removed, or {@code null} for all
     * @return number of removed anomalies
     */
    public int clearAnomalies(String entityId) {
        int removed = registry.clear(entityId);
        LOG.info("Cleared {} anomaly(ies){}", removed, entityId != null ? " for '" + entityId + "'" : "");
        return removed;
    }

    /**
     * Forget an entity: its history, its profile and every learned pair it is
     * part of. Logged anomalies are kept. Waits for a running pass.
     *
     * @param entityId entity to forget
     * @return {@code true} if the entity had history
     */
    public boolean clearHistory(String entityId) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        passLock.lock();
        stateLock.writeLock().lock();
        try {
            boolean existed = store.clear(entityId);
            profiles.remove(entityId);
            correlations = correlations.without(entityId);
            if (existed) {
                LOG.info("Cleared history, profile and correlations of '{}'", entityId);
            }
            return existed;
        } finally {
            stateLock.writeLock().unlock();
            passLock.unlock();
        }
    }

    public EngineConfig getConfig() {
        return config;
    }

    public TimeSeriesStore getStore() {
        return store;
    }

    public DetectorPipeline getPipeline() {
        return pipeline;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Optional<PatternProfile> learn(String entityId) {
        Optional<PatternProfile> profile = profiler.profile(entityId, store.history(entityId));
        profile.ifPresent(p -> {
            stateLock.writeLock().lock();
            try {
                profiles.put(entityId, p);
            } finally {
                stateLock.writeLock().unlock();
            }
        });
        return profile;
    }

    private CorrelationTable currentCorrelations() {
        stateLock.readLock().lock();
        try {
            return correlations;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    private static void checkInterrupted(String pass, int done, int total) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException(pass + " interrupted after " + done + " of " + total + " entities");
        }
    }
}
