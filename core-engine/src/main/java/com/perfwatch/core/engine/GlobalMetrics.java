package com.perfwatch.core.engine;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Roll-up across all registered entities.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"timestamp", "entityCount", "averageScore", "activeAlerts", "averageMetricValues"})
public final class GlobalMetrics implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final int entityCount;
    private final double averageScore;
    private final int activeAlerts;
    private final Map<String, Double> averageMetricValues;

    public GlobalMetrics(Instant timestamp, int entityCount, double averageScore, int activeAlerts,
            Map<String, Double> averageMetricValues) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.entityCount = entityCount;
        this.averageScore = averageScore;
        this.activeAlerts = activeAlerts;
        this.averageMetricValues = Collections.unmodifiableMap(new TreeMap<>(averageMetricValues));
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public int getEntityCount() {
        return entityCount;
    }

    /**
     * @return mean composite score of entities that have reported values, 0 if none
     */
    public double getAverageScore() {
        return averageScore;
    }

    public int getActiveAlerts() {
        return activeAlerts;
    }

    /**
     * @return mean current value per metric over the entities reporting it
     */
    public Map<String, Double> getAverageMetricValues() {
        return averageMetricValues;
    }

    @Override
    public String toString() {
        return "GlobalMetrics{" +
                "entityCount=" + entityCount +
                ", averageScore=" + averageScore +
                ", activeAlerts=" + activeAlerts +
                ", averageMetricValues=" + averageMetricValues +
                '}';
    }
}
