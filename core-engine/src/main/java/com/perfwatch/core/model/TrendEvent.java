package com.perfwatch.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Published when an entity's trend direction changes, or when its trend
 * confidence crosses the emit threshold.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"entityId", "previousDirection", "direction", "slope", "confidence", "timestamp"})
public final class TrendEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final TrendDirection previousDirection;
    private final TrendResult result;
    private final Instant timestamp;

    public TrendEvent(String entityId, TrendDirection previousDirection, TrendResult result, Instant timestamp) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.previousDirection = Objects.requireNonNull(previousDirection, "previousDirection must not be null");
        this.result = Objects.requireNonNull(result, "result must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public String getEntityId() {
        return entityId;
    }

    public TrendDirection getPreviousDirection() {
        return previousDirection;
    }

    public TrendDirection getDirection() {
        return result.getDirection();
    }

    public double getSlope() {
        return result.getSlope();
    }

    public double getConfidence() {
        return result.getConfidence();
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return the full trend result; not part of the JSON form
     */
    public TrendResult result() {
        return result;
    }

    /**
     * @return {@code true} if the direction differs from the previously
     *         emitted one
     */
    public boolean isDirectionChange() {
        return previousDirection != result.getDirection();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrendEvent that))
            return false;
        return entityId.equals(that.entityId)
                && previousDirection == that.previousDirection
                && result.equals(that.result)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, previousDirection, result, timestamp);
    }

    @Override
    public String toString() {
        return "TrendEvent{" +
                "entityId='" + entityId + '\'' +
                ", " + previousDirection + " -> " + result.getDirection() +
                ", slope=" + result.getSlope() +
                ", confidence=" + result.getConfidence() +
                '}';
    }
}
