package com.perfwatch.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional):
 * </p>
 *
 * <pre>
 * updateIntervalMs: 5000
 * trendAnalysisIntervalMs: 300000
 * cleanupIntervalMs: 300000
 * retention:
 *   realtimeMs: 3600000
 * alertThresholds:
 *   critical: 0.15
 * metrics:
 *   - name: responseTime
 *     direction: lower
 *     cap: 2000
 * entities:
 *   - id: marketing
 *     kind: team
 *     weights: {efficiency: 0.5, quality: 0.5}
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading; {@link EngineConfigLoader} does so.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private long updateIntervalMs = 5_000L;
    private long trendAnalysisIntervalMs = 300_000L;
    private long cleanupIntervalMs = 300_000L;
    private long alertRetentionMs = 86_400_000L;
    private long shutdownTimeoutMs = 10_000L;
    private int trendWindowSize = 10;
    private double trendEmitEpsilon = 0.01;
    private int subscriberQueueCapacity = 1024;
    private RetentionConfig retention = new RetentionConfig();
    private AlertThresholds alertThresholds = new AlertThresholds();
    private List<MetricDefinition> metrics = new ArrayList<>();
    private List<EntityDefinition> entities = new ArrayList<>();

    /**
     * @return the metric catalog built from the defaults and {@link #getMetrics()}
     */
    public MetricCatalog metricCatalog() {
        return MetricCatalog.of(metrics);
    }

    /**
     * Validate every setting and nested definition.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is invalid.
     * </p>
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        requirePositive(errors, "updateIntervalMs", updateIntervalMs);
        requirePositive(errors, "trendAnalysisIntervalMs", trendAnalysisIntervalMs);
        requirePositive(errors, "cleanupIntervalMs", cleanupIntervalMs);
        requirePositive(errors, "alertRetentionMs", alertRetentionMs);
        requirePositive(errors, "shutdownTimeoutMs", shutdownTimeoutMs);
        if (trendWindowSize < 3) {
            errors.add("trendWindowSize must be >= 3, got: " + trendWindowSize);
        }
        if (!(trendEmitEpsilon >= 0) || Double.isInfinite(trendEmitEpsilon)) {
            errors.add("trendEmitEpsilon must be >= 0, got: " + trendEmitEpsilon);
        }
        if (subscriberQueueCapacity <= 0) {
            errors.add("subscriberQueueCapacity must be > 0, got: " + subscriberQueueCapacity);
        }

        retention.validate(errors);
        alertThresholds.validate(errors);

        for (int i = 0; i < metrics.size(); i++) {
            Objects.requireNonNull(metrics.get(i), "Metric at index " + i + " is null").validate(errors);
        }

        Set<String> ids = new HashSet<>();
        for (int i = 0; i < entities.size(); i++) {
            EntityDefinition entity = Objects.requireNonNull(entities.get(i),
                    "Entity at index " + i + " is null");
            entity.validate(errors);
            if (entity.getId() != null && !ids.add(entity.getId())) {
                errors.add("Duplicate entity id: '" + entity.getId() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static void requirePositive(List<String> errors, String key, long value) {
        if (value <= 0) {
            errors.add(key + " must be > 0, got: " + value);
        }
    }

    // ---------------------------------------------------------------
    // Getters / setters (SnakeYAML)
    // ---------------------------------------------------------------

    public long getUpdateIntervalMs() {
        return updateIntervalMs;
    }

    public void setUpdateIntervalMs(long updateIntervalMs) {
        this.updateIntervalMs = updateIntervalMs;
    }

    public long getTrendAnalysisIntervalMs() {
        return trendAnalysisIntervalMs;
    }

    public void setTrendAnalysisIntervalMs(long trendAnalysisIntervalMs) {
        this.trendAnalysisIntervalMs = trendAnalysisIntervalMs;
    }

    public long getCleanupIntervalMs() {
        return cleanupIntervalMs;
    }

    public void setCleanupIntervalMs(long cleanupIntervalMs) {
        this.cleanupIntervalMs = cleanupIntervalMs;
    }

    public long getAlertRetentionMs() {
        return alertRetentionMs;
    }

    public void setAlertRetentionMs(long alertRetentionMs) {
        this.alertRetentionMs = alertRetentionMs;
    }

    public long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    public int getTrendWindowSize() {
        return trendWindowSize;
    }

    public void setTrendWindowSize(int trendWindowSize) {
        this.trendWindowSize = trendWindowSize;
    }

    public double getTrendEmitEpsilon() {
        return trendEmitEpsilon;
    }

    public void setTrendEmitEpsilon(double trendEmitEpsilon) {
        this.trendEmitEpsilon = trendEmitEpsilon;
    }

    public int getSubscriberQueueCapacity() {
        return subscriberQueueCapacity;
    }

    public void setSubscriberQueueCapacity(int subscriberQueueCapacity) {
        this.subscriberQueueCapacity = subscriberQueueCapacity;
    }

    public RetentionConfig getRetention() {
        return retention;
    }

    public void setRetention(RetentionConfig retention) {
        this.retention = retention != null ? retention : new RetentionConfig();
    }

    public AlertThresholds getAlertThresholds() {
        return alertThresholds;
    }

    public void setAlertThresholds(AlertThresholds alertThresholds) {
        this.alertThresholds = alertThresholds != null ? alertThresholds : new AlertThresholds();
    }

    /**
     * @return unmodifiable list of metric definitions
     */
    public List<MetricDefinition> getMetrics() {
        return Collections.unmodifiableList(metrics);
    }

    public void setMetrics(List<MetricDefinition> metrics) {
        this.metrics = metrics != null ? new ArrayList<>(metrics) : new ArrayList<>();
    }

    /**
     * @return unmodifiable list of entity definitions
     */
    public List<EntityDefinition> getEntities() {
        return Collections.unmodifiableList(entities);
    }

    public void setEntities(List<EntityDefinition> entities) {
        this.entities = entities != null ? new ArrayList<>(entities) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "updateIntervalMs=" + updateIntervalMs +
                ", trendAnalysisIntervalMs=" + trendAnalysisIntervalMs +
                ", cleanupIntervalMs=" + cleanupIntervalMs +
                ", alertRetentionMs=" + alertRetentionMs +
                ", trendWindowSize=" + trendWindowSize +
                ", retention=" + retention +
                ", alertThresholds=" + alertThresholds +
                ", metrics=" + metrics.size() +
                ", entities=" + entities.size() +
                '}';
    }
}
