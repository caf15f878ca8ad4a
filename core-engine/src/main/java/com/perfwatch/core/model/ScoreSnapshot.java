package com.perfwatch.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Composite score of one entity at one point in time.
 *
 * @since 1.0.0
 */
public final class ScoreSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final Instant timestamp;
    private final double score;

    /**
     * @throws IllegalArgumentException if {@code score} is outside {@code [0, 1]}
     */
    public ScoreSnapshot(String entityId, Instant timestamp, double score) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (!(score >= 0.0 && score <= 1.0)) {
            throw new IllegalArgumentException("score must be in [0, 1], got: " + score);
        }
        this.score = score;
    }

    public String getEntityId() {
        return entityId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getScore() {
        return score;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScoreSnapshot that))
            return false;
        return Double.compare(score, that.score) == 0
                && entityId.equals(that.entityId)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, timestamp, score);
    }

    @Override
    public String toString() {
        return "ScoreSnapshot{entityId='" + entityId + "', timestamp=" + timestamp + ", score=" + score + '}';
    }
}
