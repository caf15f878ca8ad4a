package com.perfwatch.core.aggregation;

import com.perfwatch.core.config.RetentionConfig;
import com.perfwatch.core.error.AggregationException;
import com.perfwatch.core.metrics.PerfWatchMetrics;
import com.perfwatch.core.model.AggregatedBucket;
import com.perfwatch.core.model.Tier;
import com.perfwatch.core.store.MetricStore;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Rolls each tier into the next coarser one and enforces retention.
 *
 * <h3>Cascade</h3>
 * <p>
 * HOURLY buckets are built from raw samples, DAILY from HOURLY and WEEKLY
 * from DAILY. A bucket's mean is the sample-count-weighted mean of its
 * source records, which equals the plain mean of the raw samples it covers.
 * </p>
 *
 * <h3>Catch-up</h3>
 * <p>
 * Each tier remembers the end of its last committed window. A run
 * aggregates every closed window after it, oldest first, and stops at the
 * first failing window; that window stays uncommitted and is retried on the
 * next run. Samples arriving after their window was committed are not
 * rolled up.
 * </p>
 * <p>
 * DAILY and WEEKLY never run ahead of their source tier: a window is only
 * aggregated once the source tier has committed up to its end. A source
 * with no commit yet holds the tier back entirely.
 * </p>
 *
 * <h3>Timers</h3>
 * <p>
 * {@link #start(ScheduledExecutorService)} arms one timer per aggregated
 * tier at the next UTC boundary (hour, day, Monday). A firing runs its
 * tier and then every coarser tier, so the hourly firing at midnight also
 * closes the day once the last hour is in. Every firing reschedules itself,
 * whatever the outcome of the run.
 * </p>
 *
 * @since 1.0.0
 */
public final class AggregationScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationScheduler.class);

    private static final List<Tier> AGGREGATED_TIERS = List.of(Tier.HOURLY, Tier.DAILY, Tier.WEEKLY);

    private final MetricStore store;
    private final RetentionConfig retention;
    private final Clock clock;
    private final Consumer<AggregatedBucket> bucketWriter;
    private final PerfWatchMetrics metrics;

    private final Map<Tier, TierJob> jobs = new EnumMap<>(Tier.class);
    private volatile ScheduledExecutorService executor;
    private volatile boolean stopped;

    public AggregationScheduler(MetricStore store, RetentionConfig retention, Clock clock) {
        this(store, retention, clock, new PerfWatchMetrics(new SimpleMeterRegistry()));
    }

    /**
     * @param metrics timer firings are recorded on its aggregation cycle timer
     */
    public AggregationScheduler(MetricStore store, RetentionConfig retention, Clock clock, PerfWatchMetrics metrics) {
        this(store, retention, clock, store::writeBucket, metrics);
    }

    AggregationScheduler(MetricStore store, RetentionConfig retention, Clock clock,
                         Consumer<AggregatedBucket> bucketWriter) {
        this(store, retention, clock, bucketWriter, new PerfWatchMetrics(new SimpleMeterRegistry()));
    }

    private AggregationScheduler(MetricStore store, RetentionConfig retention, Clock clock,
                                 Consumer<AggregatedBucket> bucketWriter, PerfWatchMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.retention = Objects.requireNonNull(retention, "retention must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.bucketWriter = Objects.requireNonNull(bucketWriter, "bucketWriter must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        for (Tier tier : AGGREGATED_TIERS) {
            jobs.put(tier, new TierJob(tier));
        }
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Arm the boundary timers on {@code executor}. The executor is not owned
     * and is not shut down by {@link #stop()}.
     */
    public void start(ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        stopped = false;
        for (TierJob job : jobs.values()) {
            scheduleNext(job);
        }
        LOG.info("Aggregation timers armed for tiers {}", AGGREGATED_TIERS);
    }

    /**
     * Cancel the timers. A run in progress finishes its current window but
     * does not commit it.
     */
    public void stop() {
        stopped = true;
        for (TierJob job : jobs.values()) {
            ScheduledFuture<?> future = job.timer;
            if (future != null) {
                future.cancel(false);
            }
        }
        LOG.info("Aggregation timers stopped");
    }

    private void scheduleNext(TierJob job) {
        ScheduledExecutorService exec = executor;
        if (stopped || exec == null || exec.isShutdown()) {
            return;
        }
        Instant now = clock.instant();
        long delayMs = Math.max(1L, Duration.between(now, job.tier.nextBoundary(now)).toMillis());
        job.timer = exec.schedule(() -> tick(job), delayMs, TimeUnit.MILLISECONDS);
        LOG.debug("{} aggregation scheduled in {} ms", job.tier, delayMs);
    }

    private void tick(TierJob job) {
        Timer.Sample sample = metrics.startTimer();
        try {
            runCascade(job.tier, clock.instant());
        } catch (AggregationException e) {
            LOG.error("{}; will retry on next tick", e.getMessage(), e);
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure in {} aggregation: {}", job.tier, e.getMessage(), e);
        } finally {
            sample.stop(metrics.cycleTimer(PerfWatchMetrics.CYCLE_AGGREGATION));
            scheduleNext(job);
        }
    }

    /**
     * Run {@code tier} and then each coarser aggregated tier. A failure stops
     * the cascade; the coarser tiers catch up on a later run.
     *
     * @return number of windows committed across all tiers run
     */
    public int runCascade(Tier tier, Instant now) {
        int index = AGGREGATED_TIERS.indexOf(Objects.requireNonNull(tier, "tier must not be null"));
        if (index < 0) {
            throw new IllegalArgumentException("Tier " + tier + " is not aggregated");
        }
        int committed = 0;
        for (Tier next : AGGREGATED_TIERS.subList(index, AGGREGATED_TIERS.size())) {
            committed += runTier(next, now);
        }
        return committed;
    }

    // ---------------------------------------------------------------
    // Aggregation
    // ---------------------------------------------------------------

    /**
     * Aggregate every closed window of {@code tier} not yet committed, then
     * purge the tier and its source tier. For DAILY and WEEKLY a window also
     * has to be covered by the source tier's last commit.
     *
     * @param tier an aggregated tier
     * @param now  current time; windows ending after it are left open
     * @return number of windows committed
     * @throws AggregationException if a window fails; earlier windows stay committed
     */
    public int runTier(Tier tier, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        TierJob job = jobs.get(Objects.requireNonNull(tier, "tier must not be null"));
        if (job == null) {
            throw new IllegalArgumentException("Tier " + tier + " is not aggregated");
        }
        TierState previous = job.state.get();
        if (previous == TierState.AGGREGATING || !job.state.compareAndSet(previous, TierState.AGGREGATING)) {
            LOG.debug("{} aggregation already running, skipping", tier);
            return 0;
        }

        int committed = 0;
        try {
            Optional<Instant> first = firstPendingWindow(job);
            Optional<Instant> limit = closedUpTo(tier, now);
            if (first.isPresent() && limit.isPresent()) {
                Instant windowStart = first.get();
                Instant windowEnd = windowStart.plus(tier.window());
                while (!windowEnd.isAfter(limit.get())) {
                    if (stopped) {
                        LOG.info("{} aggregation interrupted by shutdown before window {}", tier, windowStart);
                        break;
                    }
                    aggregateWindow(tier, windowStart, windowEnd);
                    job.lastCommittedWindowEnd = windowEnd;
                    committed++;
                    windowStart = windowEnd;
                    windowEnd = windowStart.plus(tier.window());
                }
            }
            job.state.set(committed > 0 ? TierState.COMMITTED : previous);
            if (committed > 0) {
                LOG.info("{} aggregation committed {} window(s) up to {}", tier, committed,
                        job.lastCommittedWindowEnd);
            }
            return committed;
        } catch (AggregationException e) {
            job.state.set(TierState.IDLE);
            throw e;
        } finally {
            purgeTier(tier.source(), now);
            purgeTier(tier, now);
        }
    }

    private Optional<Instant> closedUpTo(Tier tier, Instant now) {
        if (!tier.source().isAggregated()) {
            return Optional.of(now);
        }
        Instant sourceEnd = jobs.get(tier.source()).lastCommittedWindowEnd;
        if (sourceEnd == null) {
            LOG.debug("{} aggregation waits for the first {} commit", tier, tier.source());
            return Optional.empty();
        }
        return Optional.of(sourceEnd.isBefore(now) ? sourceEnd : now);
    }

    private Optional<Instant> firstPendingWindow(TierJob job) {
        if (job.lastCommittedWindowEnd != null) {
            return Optional.of(job.lastCommittedWindowEnd);
        }
        return store.earliest(job.tier.source()).map(job.tier::windowStart);
    }

    private void aggregateWindow(Tier tier, Instant windowStart, Instant windowEnd) {
        try {
            List<AggregatedBucket> buckets = new ArrayList<>();
            for (String entityId : store.entityIds()) {
                for (String metric : store.metricNames(entityId)) {
                    List<AggregatedBucket> source = store.query(entityId, metric, tier.source(), windowStart, windowEnd);
                    if (source.isEmpty()) {
                        continue;
                    }
                    double weightedSum = 0.0;
                    long count = 0;
                    for (AggregatedBucket b : source) {
                        weightedSum += b.getMean() * b.getSampleCount();
                        count += b.getSampleCount();
                    }
                    buckets.add(new AggregatedBucket(entityId, metric, tier, windowStart, windowEnd,
                            weightedSum / count, count));
                }
            }
            if (stopped) {
                throw new IllegalStateException("scheduler stopped before commit");
            }
            buckets.forEach(bucketWriter);
            LOG.debug("{} window {} rolled up into {} bucket(s)", tier, windowStart, buckets.size());
        } catch (RuntimeException e) {
            throw new AggregationException(tier, windowStart, e);
        }
    }

    // ---------------------------------------------------------------
    // Retention
    // ---------------------------------------------------------------

    /**
     * Purge every tier against its retention horizon.
     *
     * @return total number of records removed
     */
    public int purgeExpired(Instant now) {
        int removed = 0;
        for (Tier tier : Tier.values()) {
            removed += purgeTier(tier, now);
        }
        return removed;
    }

    private int purgeTier(Tier tier, Instant now) {
        return store.purge(tier, now.minus(retention.horizon(tier)));
    }

    // ---------------------------------------------------------------
    // Introspection
    // ---------------------------------------------------------------

    public TierState state(Tier tier) {
        TierJob job = jobs.get(tier);
        if (job == null) {
            throw new IllegalArgumentException("Tier " + tier + " is not aggregated");
        }
        return job.state.get();
    }

    /**
     * @return end of the newest committed window of {@code tier}, if any
     */
    public Optional<Instant> lastCommittedWindowEnd(Tier tier) {
        TierJob job = jobs.get(tier);
        return job != null ? Optional.ofNullable(job.lastCommittedWindowEnd) : Optional.empty();
    }

    private static final class TierJob {
        final Tier tier;
        final AtomicReference<TierState> state = new AtomicReference<>(TierState.IDLE);
        volatile Instant lastCommittedWindowEnd;
        volatile ScheduledFuture<?> timer;

        TierJob(Tier tier) {
            this.tier = tier;
        }
    }
}
