package com.perfwatch.core.engine;

import com.perfwatch.core.aggregation.AggregationScheduler;
import com.perfwatch.core.alert.AlertEngine;
import com.perfwatch.core.alert.AlertListener;
import com.perfwatch.core.baseline.BaselineManager;
import com.perfwatch.core.config.EngineConfig;
import com.perfwatch.core.config.EntityDefinition;
import com.perfwatch.core.config.MetricCatalog;
import com.perfwatch.core.error.InvalidEntityException;
import com.perfwatch.core.event.EventDispatcher;
import com.perfwatch.core.event.Subscription;
import com.perfwatch.core.metrics.PerfWatchMetrics;
import com.perfwatch.core.model.AggregatedBucket;
import com.perfwatch.core.model.Alert;
import com.perfwatch.core.model.Baseline;
import com.perfwatch.core.model.EntityKind;
import com.perfwatch.core.model.MetricDirection;
import com.perfwatch.core.model.MetricSample;
import com.perfwatch.core.model.MetricTrend;
import com.perfwatch.core.model.MonitoredEntity;
import com.perfwatch.core.model.ScoreSnapshot;
import com.perfwatch.core.model.Tier;
import com.perfwatch.core.model.TrendDirection;
import com.perfwatch.core.model.TrendEvent;
import com.perfwatch.core.model.TrendResult;
import com.perfwatch.core.scoring.ScoringEngine;
import com.perfwatch.core.store.MetricStore;
import com.perfwatch.core.trend.MetricTrendTracker;
import com.perfwatch.core.trend.TrendAnalyzer;
import com.perfwatch.core.trend.TrendListener;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point of the metrics and alerting engine.
 *
 * <p>
 * Owns the store, baselines, scoring, alerting, trend analysis, tier
 * aggregation and event dispatch, and exposes them as one API:
 * </p>
 * <ul>
 * <li>entity registration: {@link #registerEntity(MonitoredEntity)},
 * {@link #updateEntity(MonitoredEntity)}, {@link #deregisterEntity(String)}</li>
 * <li>ingestion: {@link #recordSample(String, String, double, Instant)}</li>
 * <li>queries, baselines, scores, trends and reports</li>
 * <li>alert and trend subscriptions</li>
 * </ul>
 *
 * <h3>Periodic work</h3>
 * <p>
 * {@link #start()} schedules the monitoring cycle (score plus alert
 * evaluation), the trend cycle, the maintenance cycle (retention purge) and
 * the tier aggregation timers on one scheduled executor. Each cycle can also
 * be run directly, which is how tests drive the engine.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * Every entity has its own {@link ReentrantLock} serializing ingestion and
 * cycle work on that entity. Different entities never contend. Events are
 * delivered asynchronously, so listeners never run on an engine thread.
 * </p>
 *
 * <h3>Instrumentation</h3>
 * <p>
 * Samples, alerts, trend events, dropped events and cycle durations are
 * recorded on a {@link PerfWatchMetrics} bound to the registry given at
 * construction; see {@link #metrics()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricsEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsEngine.class);

    /** Accepted distance of a weight sum from 1 before a warning is logged. */
    private static final double WEIGHT_SUM_TOLERANCE = 1e-6;

    private final EngineConfig config;
    private final Clock clock;
    private final MetricCatalog catalog;

    private final MetricStore store = new MetricStore();
    private final BaselineManager baselines;
    private final ScoringEngine scoring;
    private final TrendAnalyzer trends;
    private final MetricTrendTracker metricTrends;
    private final AlertEngine alerts;
    private final AggregationScheduler aggregation;
    private final EventDispatcher<Alert> alertDispatcher;
    private final EventDispatcher<TrendEvent> trendDispatcher;
    private final PerfWatchMetrics metrics;

    private final ConcurrentMap<String, EntityState> entities = new ConcurrentHashMap<>();

    private final AtomicBoolean running = new AtomicBoolean();
    private volatile boolean closed;
    private volatile ScheduledExecutorService scheduler;

    public MetricsEngine(EngineConfig config) {
        this(config, Clock.systemUTC());
    }

    public MetricsEngine(EngineConfig config, Clock clock) {
        this(config, clock, new SimpleMeterRegistry());
    }

    /**
     * @param config   validated configuration; entities it defines are registered
     * @param clock    time source for every timestamp the engine produces
     * @param registry where the engine's meters are registered
     * @throws IllegalStateException if the configuration is invalid
     */
    public MetricsEngine(EngineConfig config, Clock clock, MeterRegistry registry) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        config.validate();

        this.metrics = new PerfWatchMetrics(registry);
        this.catalog = config.metricCatalog();
        this.baselines = new BaselineManager(clock);
        this.scoring = new ScoringEngine(catalog);
        this.trends = new TrendAnalyzer(config.getTrendWindowSize(), config.getTrendEmitEpsilon(), clock);
        this.metricTrends = new MetricTrendTracker(catalog);
        this.alertDispatcher = new EventDispatcher<>("alerts", config.getSubscriberQueueCapacity(),
                config.getShutdownTimeoutMs(), metrics.droppedCounter("alerts"));
        this.trendDispatcher = new EventDispatcher<>("trends", config.getSubscriberQueueCapacity(),
                config.getShutdownTimeoutMs(), metrics.droppedCounter("trends"));
        this.alerts = new AlertEngine(baselines, catalog, config.getAlertThresholds(),
                Duration.ofMillis(config.getAlertRetentionMs()), clock, this::publishAlert);
        this.aggregation = new AggregationScheduler(store, config.getRetention(), clock, metrics);

        for (EntityDefinition definition : config.getEntities()) {
            registerEntity(definition.toEntity());
        }
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start the periodic cycles and the aggregation timers.
     *
     * @throws IllegalStateException if the engine was closed
     */
    public void start() {
        if (closed) {
            throw new IllegalStateException("Engine is closed");
        }
        if (!running.compareAndSet(false, true)) {
            LOG.debug("Engine already running");
            return;
        }
        AtomicInteger threadSeq = new AtomicInteger();
        ScheduledExecutorService exec = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "perfwatch-scheduler-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        scheduler = exec;

        exec.scheduleAtFixedRate(guarded("monitoring", this::runMonitoringCycle),
                config.getUpdateIntervalMs(), config.getUpdateIntervalMs(), TimeUnit.MILLISECONDS);
        exec.scheduleAtFixedRate(guarded("trend", this::runTrendCycle),
                config.getTrendAnalysisIntervalMs(), config.getTrendAnalysisIntervalMs(), TimeUnit.MILLISECONDS);
        exec.scheduleAtFixedRate(guarded("maintenance", this::runMaintenance),
                config.getCleanupIntervalMs(), config.getCleanupIntervalMs(), TimeUnit.MILLISECONDS);
        aggregation.start(exec);

        LOG.info("Metrics engine started: {} entit(y/ies), monitoring every {} ms, trends every {} ms",
                entities.size(), config.getUpdateIntervalMs(), config.getTrendAnalysisIntervalMs());
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stop all timers, wait for in-flight cycles, then drain subscriber
     * queues. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (running.getAndSet(false)) {
            aggregation.stop();
            ScheduledExecutorService exec = scheduler;
            exec.shutdown();
            try {
                if (!exec.awaitTermination(config.getShutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                    LOG.warn("Engine cycles did not finish within {} ms, interrupting", config.getShutdownTimeoutMs());
                    exec.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                exec.shutdownNow();
            }
        }
        alertDispatcher.close();
        trendDispatcher.close();
        LOG.info("Metrics engine stopped");
    }

    public PerfWatchMetrics metrics() {
        return metrics;
    }

    private Runnable guarded(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.error("{} cycle failed: {}", name, e.getMessage(), e);
            }
        };
    }

    // ---------------------------------------------------------------
    // Entity management
    // ---------------------------------------------------------------

    public MonitoredEntity registerEntity(String id, EntityKind kind, Map<String, Double> weights,
                                          Map<String, Double> targets) {
        return registerEntity(new MonitoredEntity(id, kind, weights, targets));
    }

    /**
     * Register a new entity.
     *
     * @return the registered entity
     * @throws IllegalArgumentException if the id is already registered
     */
    public MonitoredEntity registerEntity(MonitoredEntity entity) {
        Objects.requireNonNull(entity, "entity must not be null");
        warnOnWeightSum(entity);
        if (entities.putIfAbsent(entity.getId(), new EntityState(entity)) != null) {
            throw new IllegalArgumentException("Entity already registered: '" + entity.getId() + "'");
        }
        LOG.info("Registered {} '{}' with weights {}", entity.getKind(), entity.getId(), entity.getWeights());
        return entity;
    }

    /**
     * Replace the definition of a registered entity, keeping its data,
     * baselines and score history.
     *
     * @throws InvalidEntityException if the entity is not registered
     */
    public MonitoredEntity updateEntity(MonitoredEntity entity) {
        Objects.requireNonNull(entity, "entity must not be null");
        EntityState state = requireEntity(entity.getId());
        warnOnWeightSum(entity);
        state.lock.lock();
        try {
            state.entity = entity;
        } finally {
            state.lock.unlock();
        }
        LOG.info("Updated {} '{}' with weights {}", entity.getKind(), entity.getId(), entity.getWeights());
        return entity;
    }

    /**
     * Remove an entity together with its stored data, baselines and score
     * history. Alerts already raised stay in the alert index until they
     * expire.
     *
     * @throws InvalidEntityException if the entity is not registered
     */
    public void deregisterEntity(String entityId) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        EntityState state = entities.remove(entityId);
        if (state == null) {
            throw new InvalidEntityException(entityId);
        }
        state.lock.lock();
        try {
            state.removed = true;
            store.removeEntity(entityId);
            baselines.removeEntity(entityId);
            trends.removeEntity(entityId);
            metricTrends.removeEntity(entityId);
        } finally {
            state.lock.unlock();
        }
        LOG.info("Deregistered entity '{}'", entityId);
    }

    public Optional<MonitoredEntity> entity(String entityId) {
        EntityState state = entities.get(entityId);
        return state != null ? Optional.of(state.entity) : Optional.empty();
    }

    public List<MonitoredEntity> entities() {
        return new TreeMap<>(entities).values().stream()
                .map(s -> s.entity)
                .toList();
    }

    private static void warnOnWeightSum(MonitoredEntity entity) {
        if (!entity.getWeights().isEmpty() && Math.abs(entity.weightSum() - 1.0) > WEIGHT_SUM_TOLERANCE) {
            LOG.warn("Weights of '{}' sum to {}, scores are not rescaled", entity.getId(), entity.weightSum());
        }
    }

    private EntityState requireEntity(String entityId) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        EntityState state = entities.get(entityId);
        if (state == null) {
            throw new InvalidEntityException(entityId);
        }
        return state;
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * Record one measurement.
     *
     * <p>
     * The sample is stored in the realtime tier, becomes the metric's current
     * value unless a newer sample is already known, and establishes the
     * metric's baseline if it has none yet. Re-recording the same timestamp
     * overwrites the stored sample.
     * </p>
     *
     * @throws InvalidEntityException   if the entity is not registered
     * @throws IllegalArgumentException if the value is not finite
     * @throws IllegalStateException    if the engine is closed
     */
    public void recordSample(String entityId, String metricName, double value, Instant timestamp) {
        if (closed) {
            throw new IllegalStateException("Engine is closed");
        }
        EntityState state = requireEntity(entityId);
        MetricSample sample = new MetricSample(entityId, metricName, value, timestamp);

        state.lock.lock();
        try {
            if (state.removed) {
                throw new InvalidEntityException(entityId);
            }
            store.record(sample);
            Instant latestAt = state.latestAt.get(metricName);
            if (latestAt == null || !timestamp.isBefore(latestAt)) {
                state.latest.put(metricName, value);
                state.latestAt.put(metricName, timestamp);
            }
            baselines.establish(entityId, metricName, value, false);
        } finally {
            state.lock.unlock();
        }
        metrics.recordSampleRecorded();
        LOG.trace("Recorded {}", sample);
    }

    // ---------------------------------------------------------------
    // Subscriptions
    // ---------------------------------------------------------------

    public Subscription subscribeAlerts(AlertListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        return alertDispatcher.subscribe(listener::onAlert);
    }

    public Subscription subscribeTrends(TrendListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        return trendDispatcher.subscribe(listener::onTrend);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @see MetricStore#query(String, String, Tier, Instant, Instant)
     * @throws InvalidEntityException if the entity is not registered
     */
    public List<AggregatedBucket> query(String entityId, String metricName, Tier tier, Instant from, Instant to) {
        requireEntity(entityId);
        return store.query(entityId, metricName, tier, from, to);
    }

    public List<MetricSample> querySamples(String entityId, String metricName, Instant from, Instant to) {
        requireEntity(entityId);
        return store.querySamples(entityId, metricName, from, to);
    }

    /**
     * @return current value of every metric the entity has reported
     */
    public Map<String, Double> currentValues(String entityId) {
        EntityState state = requireEntity(entityId);
        state.lock.lock();
        try {
            return new TreeMap<>(state.latest);
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Composite score of the entity's current values. Metrics without a
     * weight are left out.
     *
     * @return score in [0, 1]; 0 before any sample was recorded
     */
    public double currentScore(String entityId) {
        EntityState state = requireEntity(entityId);
        state.lock.lock();
        try {
            return scoring.scoreLenient(state.entity, state.latest);
        } finally {
            state.lock.unlock();
        }
    }

    public Optional<Baseline> baseline(String entityId, String metricName) {
        requireEntity(entityId);
        return baselines.get(entityId, metricName);
    }

    /**
     * Replace a metric's baseline with its current value.
     *
     * @return the new baseline, or empty if the metric has no current value
     */
    public Optional<Baseline> rebaseline(String entityId, String metricName) {
        EntityState state = requireEntity(entityId);
        state.lock.lock();
        try {
            Double current = state.latest.get(metricName);
            if (current == null) {
                LOG.warn("Cannot rebaseline {}/{}: no value recorded", entityId, metricName);
                return Optional.empty();
            }
            return Optional.of(baselines.establish(entityId, metricName, current, true));
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * @return the last evaluated trend, or a fresh analysis if the trend
     *         cycle has not covered the entity yet
     */
    public TrendResult trend(String entityId) {
        requireEntity(entityId);
        return trends.latest(entityId).orElseGet(() -> trends.analyze(entityId));
    }

    public List<ScoreSnapshot> scoreHistory(String entityId) {
        requireEntity(entityId);
        return trends.history(entityId);
    }

    /**
     * Short-term trend of each metric, fed by the monitoring cycle.
     *
     * @return trends by metric name; empty before the first cycle
     * @throws InvalidEntityException if the entity is not registered
     */
    public Map<String, MetricTrend> metricTrends(String entityId) {
        requireEntity(entityId);
        return metricTrends.trends(entityId);
    }

    /**
     * @return entity direction derived from the per-metric trends
     * @see MetricTrendTracker#summary(String)
     */
    public TrendDirection metricTrendSummary(String entityId) {
        requireEntity(entityId);
        return metricTrends.summary(entityId);
    }

    // ---------------------------------------------------------------
    // Alerts
    // ---------------------------------------------------------------

    public Optional<Alert> acknowledgeAlert(String alertId) {
        return alerts.acknowledge(alertId);
    }

    public List<Alert> alerts() {
        return alerts.alerts();
    }

    public List<Alert> alerts(String entityId) {
        return alerts.alerts(entityId);
    }

    public List<Alert> activeAlerts() {
        return alerts.activeAlerts();
    }

    // ---------------------------------------------------------------
    // Cycles
    // ---------------------------------------------------------------

    /**
     * Score every entity, append the score to its trend window, append each
     * current value to its metric trend and evaluate it against its baseline.
     *
     * @return number of entities scored
     */
    public int runMonitoringCycle() {
        Timer.Sample sample = metrics.startTimer();
        Instant now = clock.instant();
        int scored = 0;
        for (EntityState state : entities.values()) {
            state.lock.lock();
            try {
                if (state.removed || state.latest.isEmpty()) {
                    continue;
                }
                String entityId = state.entity.getId();
                double score = scoring.scoreLenient(state.entity, state.latest);
                trends.recordScore(entityId, score, now);
                for (Map.Entry<String, Double> entry : state.latest.entrySet()) {
                    metricTrends.record(entityId, entry.getKey(), entry.getValue());
                    alerts.evaluate(entityId, entry.getKey(), entry.getValue());
                }
                scored++;
            } catch (RuntimeException e) {
                LOG.error("Monitoring cycle failed for entity '{}': {}", state.entity.getId(), e.getMessage(), e);
            } finally {
                state.lock.unlock();
            }
        }
        sample.stop(metrics.cycleTimer(PerfWatchMetrics.CYCLE_MONITORING));
        LOG.debug("Monitoring cycle scored {} entit(y/ies)", scored);
        return scored;
    }

    /**
     * Analyze every entity's score window and publish trend changes.
     *
     * @return number of trend events published
     */
    public int runTrendCycle() {
        Timer.Sample sample = metrics.startTimer();
        int published = 0;
        for (EntityState state : entities.values()) {
            String entityId = state.entity.getId();
            try {
                Optional<TrendEvent> event = trends.evaluate(entityId);
                if (event.isPresent()) {
                    trendDispatcher.publish(event.get());
                    metrics.recordTrendEvent();
                    published++;
                }
            } catch (RuntimeException e) {
                LOG.error("Trend analysis failed for entity '{}': {}", entityId, e.getMessage(), e);
            }
        }
        sample.stop(metrics.cycleTimer(PerfWatchMetrics.CYCLE_TREND));
        LOG.debug("Trend cycle published {} event(s)", published);
        return published;
    }

    /**
     * Purge expired records from every tier and expired alerts.
     *
     * @return number of records and alerts removed
     */
    public int runMaintenance() {
        Timer.Sample sample = metrics.startTimer();
        Instant now = clock.instant();
        int removed = aggregation.purgeExpired(now) + alerts.purgeExpired(now);
        sample.stop(metrics.cycleTimer(PerfWatchMetrics.CYCLE_MAINTENANCE));
        LOG.debug("Maintenance removed {} expired record(s)", removed);
        return removed;
    }

    /**
     * Roll closed windows of {@code tier} up from its source tier. Coarser
     * tiers are not run.
     *
     * @see AggregationScheduler#runTier(Tier, Instant)
     */
    public int runAggregation(Tier tier) {
        return aggregation.runTier(tier, clock.instant());
    }

    // ---------------------------------------------------------------
    // Reporting
    // ---------------------------------------------------------------

    public GlobalMetrics globalMetrics() {
        Map<String, double[]> sums = new TreeMap<>();
        double scoreSum = 0.0;
        int scoredEntities = 0;
        for (EntityState state : entities.values()) {
            Map<String, Double> values;
            MonitoredEntity entity;
            state.lock.lock();
            try {
                values = new HashMap<>(state.latest);
                entity = state.entity;
            } finally {
                state.lock.unlock();
            }
            if (values.isEmpty()) {
                continue;
            }
            values.forEach((metric, value) -> {
                double[] acc = sums.computeIfAbsent(metric, m -> new double[2]);
                acc[0] += value;
                acc[1]++;
            });
            scoreSum += scoring.scoreLenient(entity, values);
            scoredEntities++;
        }
        Map<String, Double> averages = new LinkedHashMap<>();
        sums.forEach((metric, acc) -> averages.put(metric, acc[0] / acc[1]));
        return new GlobalMetrics(clock.instant(), entities.size(),
                scoredEntities > 0 ? scoreSum / scoredEntities : 0.0,
                alerts.activeAlerts().size(), averages);
    }

    public SystemStats systemStats() {
        Map<EntityKind, Integer> byKind = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            byKind.put(kind, 0);
        }
        for (EntityState state : entities.values()) {
            byKind.merge(state.entity.getKind(), 1, Integer::sum);
        }
        Map<Tier, Long> perTier = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            perTier.put(tier, store.size(tier));
        }
        return new SystemStats(running.get(), byKind, alerts.size(), alerts.activeAlerts().size(),
                baselines.size(), perTier, metrics.droppedEvents());
    }

    /**
     * Compare the entity's current values with its baselines and targets.
     *
     * @throws InvalidEntityException if the entity is not registered
     */
    public PerformanceReport report(String entityId) {
        EntityState state = requireEntity(entityId);
        MonitoredEntity entity;
        Map<String, Double> values;
        state.lock.lock();
        try {
            entity = state.entity;
            values = new HashMap<>(state.latest);
        } finally {
            state.lock.unlock();
        }

        Set<String> metricNames = new TreeSet<>(entity.getWeights().keySet());
        metricNames.addAll(entity.getTargets().keySet());
        metricNames.addAll(values.keySet());

        Map<String, MetricTrend> trendByMetric = metricTrends.trends(entityId);
        List<MetricReport> rows = new ArrayList<>();
        double overall = 0.0;
        for (String metric : metricNames) {
            MetricDirection direction = catalog.direction(metric);
            Double current = values.get(metric);
            Double reference = baselines.get(entityId, metric).map(Baseline::getValue).orElse(null);
            OptionalDouble targetOpt = entity.targetOf(metric);
            Double target = targetOpt.isPresent() ? targetOpt.getAsDouble() : null;

            Double improvement = null;
            if (current != null && reference != null && reference != 0.0) {
                improvement = -direction.deviation(reference, current) * 100.0;
                OptionalDouble weight = entity.weightOf(metric);
                if (weight.isPresent()) {
                    overall += weight.getAsDouble() * improvement;
                }
            }
            MetricTrend trend = trendByMetric.get(metric);
            rows.add(new MetricReport(metric, direction, reference, current, target, improvement,
                    attainment(direction, current, target), trend != null ? trend.getDirection() : null));
        }
        return new PerformanceReport(entityId, clock.instant(), scoring.scoreLenient(entity, values), overall,
                metricTrends.summary(entityId), rows);
    }

    private void publishAlert(Alert alert) {
        metrics.recordAlert(alert.getSeverity());
        alertDispatcher.publish(alert);
    }

    private static Double attainment(MetricDirection direction, Double current, Double target) {
        if (current == null || target == null) {
            return null;
        }
        return switch (direction) {
            case HIGHER_IS_BETTER -> target == 0.0 ? null : current / target;
            case LOWER_IS_BETTER -> current == 0.0 ? null : target / current;
        };
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /** Mutable per-entity state, guarded by {@link #lock}. */
    private static final class EntityState {
        final ReentrantLock lock = new ReentrantLock();
        final Map<String, Double> latest = new LinkedHashMap<>();
        final Map<String, Instant> latestAt = new HashMap<>();
        volatile MonitoredEntity entity;
        volatile boolean removed;

        EntityState(MonitoredEntity entity) {
            this.entity = entity;
        }
    }
}
