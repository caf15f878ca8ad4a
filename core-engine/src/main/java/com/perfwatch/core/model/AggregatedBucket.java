package com.perfwatch.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Mean of one metric of one entity over the half-open window
 * {@code [windowStart, windowEnd)}.
 *
 * <p>
 * Buckets are immutable once written. Raw samples returned from a
 * {@link Tier#REALTIME} query are represented as single-sample buckets whose
 * window is one millisecond wide.
 * </p>
 *
 * @since 1.0.0
 */
public final class AggregatedBucket implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final String metricName;
    private final Tier tier;
    private final Instant windowStart;
    private final Instant windowEnd;
    private final double mean;
    private final long sampleCount;

    public AggregatedBucket(String entityId, String metricName, Tier tier,
            Instant windowStart, Instant windowEnd, double mean, long sampleCount) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.tier = Objects.requireNonNull(tier, "tier must not be null");
        this.windowStart = Objects.requireNonNull(windowStart, "windowStart must not be null");
        this.windowEnd = Objects.requireNonNull(windowEnd, "windowEnd must not be null");
        if (!windowEnd.isAfter(windowStart)) {
            throw new IllegalArgumentException(
                    "windowEnd must be after windowStart, got: [" + windowStart + ", " + windowEnd + ")");
        }
        if (sampleCount < 1) {
            throw new IllegalArgumentException("sampleCount must be >= 1, got: " + sampleCount);
        }
        this.mean = mean;
        this.sampleCount = sampleCount;
    }

    /**
     * Wrap a raw sample as a one-millisecond bucket.
     *
     * @param sample the raw sample
     * @return a realtime bucket holding exactly that sample
     */
    public static AggregatedBucket ofSample(MetricSample sample) {
        return new AggregatedBucket(sample.getEntityId(), sample.getMetricName(), Tier.REALTIME,
                sample.getTimestamp(), sample.getTimestamp().plusMillis(1), sample.getValue(), 1);
    }

    public String getEntityId() {
        return entityId;
    }

    public String getMetricName() {
        return metricName;
    }

    public Tier getTier() {
        return tier;
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    public double getMean() {
        return mean;
    }

    public long getSampleCount() {
        return sampleCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AggregatedBucket that))
            return false;
        return Double.compare(mean, that.mean) == 0
                && sampleCount == that.sampleCount
                && entityId.equals(that.entityId)
                && metricName.equals(that.metricName)
                && tier == that.tier
                && windowStart.equals(that.windowStart)
                && windowEnd.equals(that.windowEnd);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, metricName, tier, windowStart, windowEnd, mean, sampleCount);
    }

    @Override
    public String toString() {
        return "AggregatedBucket{" +
                "entityId='" + entityId + '\'' +
                ", metricName='" + metricName + '\'' +
                ", tier=" + tier +
                ", window=[" + windowStart + ", " + windowEnd + ')' +
                ", mean=" + mean +
                ", sampleCount=" + sampleCount +
                '}';
    }
}
