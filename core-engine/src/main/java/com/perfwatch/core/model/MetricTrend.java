package com.perfwatch.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;

/**
 * Short-term direction of one metric of one entity.
 *
 * <p>
 * {@code changePct} is directional like a report's improvement: positive
 * means the metric moved the good way, whatever its raw sign.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"entityId", "metricName", "direction", "changePct", "sampleCount"})
public final class MetricTrend implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final String metricName;
    private final TrendDirection direction;
    private final double changePct;
    private final int sampleCount;

    public MetricTrend(String entityId, String metricName, TrendDirection direction, double changePct,
            int sampleCount) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.changePct = changePct;
        this.sampleCount = sampleCount;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getMetricName() {
        return metricName;
    }

    public TrendDirection getDirection() {
        return direction;
    }

    public double getChangePct() {
        return changePct;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricTrend that))
            return false;
        return Double.compare(changePct, that.changePct) == 0
                && sampleCount == that.sampleCount
                && entityId.equals(that.entityId)
                && metricName.equals(that.metricName)
                && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, metricName, direction, changePct, sampleCount);
    }

    @Override
    public String toString() {
        return "MetricTrend{" +
                "entityId='" + entityId + '\'' +
                ", metricName='" + metricName + '\'' +
                ", direction=" + direction +
                ", changePct=" + changePct +
                ", sampleCount=" + sampleCount +
                '}';
    }
}
