package com.perfwatch.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single measurement reported by a monitored entity.
 *
 * <p>
 * Samples are immutable once recorded. The store keys them by
 * {@code (entityId, metricName, timestamp)}, so recording a second sample
 * with the same key replaces the first.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final String metricName;
    private final double value;
    private final Instant timestamp;

    /**
     * @param entityId   owning entity; must not be {@code null}
     * @param metricName metric name; must not be {@code null}
     * @param value      measured value; must be finite
     * @param timestamp  measurement time; must not be {@code null}
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     */
    public MetricSample(String entityId, String metricName, double value, Instant timestamp) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(
                    "Sample value must be finite for " + entityId + "/" + metricName + ", got: " + value);
        }
        this.value = value;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getValue() {
        return value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSample that))
            return false;
        return Double.compare(value, that.value) == 0
                && entityId.equals(that.entityId)
                && metricName.equals(that.metricName)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, metricName, value, timestamp);
    }

    @Override
    public String toString() {
        return "MetricSample{" +
                "entityId='" + entityId + '\'' +
                ", metricName='" + metricName + '\'' +
                ", value=" + value +
                ", timestamp=" + timestamp +
                '}';
    }
}
