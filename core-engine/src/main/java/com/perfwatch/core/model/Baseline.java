package com.perfwatch.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Reference value against which deviations of one metric of one entity are
 * measured.
 *
 * @since 1.0.0
 */
public final class Baseline implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final String metricName;
    private final double value;
    private final Instant establishedAt;

    public Baseline(String entityId, String metricName, double value, Instant establishedAt) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.value = value;
        this.establishedAt = Objects.requireNonNull(establishedAt, "establishedAt must not be null");
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

    public Instant getEstablishedAt() {
        return establishedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Baseline that))
            return false;
        return Double.compare(value, that.value) == 0
                && entityId.equals(that.entityId)
                && metricName.equals(that.metricName)
                && establishedAt.equals(that.establishedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, metricName, value, establishedAt);
    }

    @Override
    public String toString() {
        return "Baseline{" +
                "entityId='" + entityId + '\'' +
                ", metricName='" + metricName + '\'' +
                ", value=" + value +
                ", establishedAt=" + establishedAt +
                '}';
    }
}
