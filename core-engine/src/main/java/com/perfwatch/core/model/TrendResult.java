package com.perfwatch.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Least-squares trend of an entity's score window.
 *
 * @since 1.0.0
 */
public final class TrendResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final double slope;
    private final TrendDirection direction;
    private final double confidence;
    private final int sampleCount;
    private final Instant computedAt;

    public TrendResult(String entityId, double slope, TrendDirection direction,
            double confidence, int sampleCount, Instant computedAt) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.computedAt = Objects.requireNonNull(computedAt, "computedAt must not be null");
        this.slope = slope;
        this.confidence = confidence;
        this.sampleCount = sampleCount;
    }

    /**
     * Result used while the window holds too few points to fit a line.
     */
    public static TrendResult insufficientData(String entityId, int sampleCount, Instant computedAt) {
        return new TrendResult(entityId, 0.0, TrendDirection.STABLE, 0.0, sampleCount, computedAt);
    }

    public String getEntityId() {
        return entityId;
    }

    public double getSlope() {
        return slope;
    }

    public TrendDirection getDirection() {
        return direction;
    }

    public double getConfidence() {
        return confidence;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public Instant getComputedAt() {
        return computedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrendResult that))
            return false;
        return Double.compare(slope, that.slope) == 0
                && Double.compare(confidence, that.confidence) == 0
                && sampleCount == that.sampleCount
                && entityId.equals(that.entityId)
                && direction == that.direction
                && computedAt.equals(that.computedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, slope, direction, confidence, sampleCount, computedAt);
    }

    @Override
    public String toString() {
        return "TrendResult{" +
                "entityId='" + entityId + '\'' +
                ", slope=" + slope +
                ", direction=" + direction +
                ", confidence=" + confidence +
                ", sampleCount=" + sampleCount +
                '}';
    }
}
