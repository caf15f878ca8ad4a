package com.perfwatch.core.store;

import com.perfwatch.core.model.AggregatedBucket;
import com.perfwatch.core.model.MetricSample;
import com.perfwatch.core.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Multi-tier, in-memory time-series storage.
 *
 * <h3>Layout</h3>
 * <p>
 * Every {@code (entityId, metricName)} pair owns one series holding raw
 * samples keyed by timestamp plus one bucket map per aggregated tier keyed
 * by window start. Writes to a series are serialized on the series; reads
 * go through the skip lists and return copies, so a caller never holds a
 * lock while iterating a result.
 * </p>
 *
 * <h3>Idempotency</h3>
 * <ul>
 * <li>A sample with an already stored timestamp replaces the old one.</li>
 * <li>A bucket with an already stored window start replaces the old one.</li>
 * </ul>
 *
 * <p>
 * The store does not know about retention; {@link #purge(Tier, Instant)} is
 * driven by the aggregation scheduler with a per-tier cutoff.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricStore {

    private static final Logger LOG = LoggerFactory.getLogger(MetricStore.class);

    private final ConcurrentMap<String, ConcurrentMap<String, Series>> entities = new ConcurrentHashMap<>();

    /**
     * Store a raw sample in the realtime tier.
     *
     * @param sample the sample; must not be {@code null}
     */
    public void record(MetricSample sample) {
        Objects.requireNonNull(sample, "sample must not be null");
        Series series = seriesFor(sample.getEntityId(), sample.getMetricName());
        synchronized (series) {
            MetricSample previous = series.samples.put(sample.getTimestamp(), sample);
            if (previous != null) {
                LOG.debug("Overwrote sample {}/{} at {}", sample.getEntityId(),
                        sample.getMetricName(), sample.getTimestamp());
            }
        }
    }

    /**
     * Store an aggregated bucket, replacing any bucket with the same window.
     *
     * <p>
     * Only {@link #record(MetricSample)} brings an entity into the store. A
     * bucket for an entity that is not held (never recorded, or removed
     * while its window was being aggregated) is dropped.
     * </p>
     *
     * @param bucket the bucket; its tier must be aggregated
     * @return {@code false} if the bucket was dropped
     * @throws IllegalArgumentException if the bucket is a realtime bucket
     */
    public boolean writeBucket(AggregatedBucket bucket) {
        Objects.requireNonNull(bucket, "bucket must not be null");
        if (!bucket.getTier().isAggregated()) {
            throw new IllegalArgumentException("Realtime data must be recorded as samples, not buckets");
        }
        ConcurrentMap<String, Series> metrics = entities.get(bucket.getEntityId());
        if (metrics == null) {
            LOG.debug("Dropped {} bucket of unknown entity '{}'", bucket.getTier(), bucket.getEntityId());
            return false;
        }
        Series series = metrics.computeIfAbsent(bucket.getMetricName(), m -> new Series());
        synchronized (series) {
            series.buckets.get(bucket.getTier()).put(bucket.getWindowStart(), bucket);
        }
        return true;
    }

    /**
     * Range query over one tier, half-open {@code [from, to)}.
     *
     * <p>
     * Realtime samples are returned as single-sample buckets; aggregated
     * buckets are selected by window start.
     * </p>
     *
     * @return time-ascending snapshot; empty if the series is unknown
     * @throws IllegalArgumentException if {@code from} is after {@code to}
     */
    public List<AggregatedBucket> query(String entityId, String metricName, Tier tier, Instant from, Instant to) {
        Objects.requireNonNull(tier, "tier must not be null");
        checkRange(from, to);
        Series series = existingSeries(entityId, metricName);
        if (series == null) {
            return List.of();
        }
        if (tier == Tier.REALTIME) {
            return series.samples.subMap(from, true, to, false).values().stream()
                    .map(AggregatedBucket::ofSample)
                    .toList();
        }
        return List.copyOf(series.buckets.get(tier).subMap(from, true, to, false).values());
    }

    /**
     * Raw samples of one series in {@code [from, to)}.
     *
     * @return time-ascending snapshot; empty if the series is unknown
     */
    public List<MetricSample> querySamples(String entityId, String metricName, Instant from, Instant to) {
        checkRange(from, to);
        Series series = existingSeries(entityId, metricName);
        if (series == null) {
            return List.of();
        }
        return List.copyOf(series.samples.subMap(from, true, to, false).values());
    }

    /**
     * @return the most recent raw sample of the series, if any
     */
    public Optional<MetricSample> latestSample(String entityId, String metricName) {
        Series series = existingSeries(entityId, metricName);
        if (series == null) {
            return Optional.empty();
        }
        Map.Entry<Instant, MetricSample> last = series.samples.lastEntry();
        return last != null ? Optional.of(last.getValue()) : Optional.empty();
    }

    /**
     * @return timestamp of the oldest sample, or window start of the oldest
     *         bucket, held in {@code tier}
     */
    public Optional<Instant> earliest(Tier tier) {
        Objects.requireNonNull(tier, "tier must not be null");
        Instant earliest = null;
        for (ConcurrentMap<String, Series> metrics : entities.values()) {
            for (Series series : metrics.values()) {
                Map.Entry<Instant, ?> first = tier == Tier.REALTIME
                        ? series.samples.firstEntry()
                        : series.buckets.get(tier).firstEntry();
                if (first != null && (earliest == null || first.getKey().isBefore(earliest))) {
                    earliest = first.getKey();
                }
            }
        }
        return Optional.ofNullable(earliest);
    }

    /**
     * Remove records of {@code tier} that are older than {@code cutoff}.
     * Raw samples are compared by timestamp, buckets by window end.
     *
     * @return number of records removed
     */
    public int purge(Tier tier, Instant cutoff) {
        Objects.requireNonNull(tier, "tier must not be null");
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        int removed = 0;
        for (ConcurrentMap<String, Series> metrics : entities.values()) {
            for (Series series : metrics.values()) {
                synchronized (series) {
                    removed += tier == Tier.REALTIME
                            ? purgeSamples(series.samples, cutoff)
                            : purgeBuckets(series.buckets.get(tier), cutoff);
                }
            }
        }
        if (removed > 0) {
            LOG.debug("Purged {} {} record(s) older than {}", removed, tier, cutoff);
        }
        return removed;
    }

    private static int purgeSamples(ConcurrentSkipListMap<Instant, MetricSample> samples, Instant cutoff) {
        NavigableMap<Instant, MetricSample> expired = samples.headMap(cutoff, false);
        int count = expired.size();
        expired.clear();
        return count;
    }

    private static int purgeBuckets(ConcurrentSkipListMap<Instant, AggregatedBucket> buckets, Instant cutoff) {
        int count = 0;
        Iterator<AggregatedBucket> it = buckets.values().iterator();
        while (it.hasNext()) {
            AggregatedBucket bucket = it.next();
            if (!bucket.getWindowEnd().isBefore(cutoff)) {
                break;
            }
            it.remove();
            count++;
        }
        return count;
    }

    /**
     * Drop every series of an entity.
     *
     * @return {@code true} if the entity had data
     */
    public boolean removeEntity(String entityId) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        return entities.remove(entityId) != null;
    }

    /**
     * @return number of records currently held in {@code tier}
     */
    public long size(Tier tier) {
        Objects.requireNonNull(tier, "tier must not be null");
        long total = 0;
        for (ConcurrentMap<String, Series> metrics : entities.values()) {
            for (Series series : metrics.values()) {
                total += tier == Tier.REALTIME ? series.samples.size() : series.buckets.get(tier).size();
            }
        }
        return total;
    }

    public Set<String> entityIds() {
        return new TreeSet<>(entities.keySet());
    }

    public Set<String> metricNames(String entityId) {
        ConcurrentMap<String, Series> metrics = entities.get(entityId);
        return metrics != null ? new TreeSet<>(metrics.keySet()) : Set.of();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Series seriesFor(String entityId, String metricName) {
        return entities.computeIfAbsent(entityId, id -> new ConcurrentHashMap<>())
                .computeIfAbsent(metricName, m -> new Series());
    }

    private Series existingSeries(String entityId, String metricName) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(metricName, "metricName must not be null");
        ConcurrentMap<String, Series> metrics = entities.get(entityId);
        return metrics != null ? metrics.get(metricName) : null;
    }

    private static void checkRange(Instant from, Instant to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Query range start " + from + " is after end " + to);
        }
    }

    private static final class Series {

        final ConcurrentSkipListMap<Instant, MetricSample> samples = new ConcurrentSkipListMap<>();
        final Map<Tier, ConcurrentSkipListMap<Instant, AggregatedBucket>> buckets = new EnumMap<>(Tier.class);

        Series() {
            for (Tier tier : Tier.values()) {
                if (tier.isAggregated()) {
                    buckets.put(tier, new ConcurrentSkipListMap<>());
                }
            }
        }
    }
}
