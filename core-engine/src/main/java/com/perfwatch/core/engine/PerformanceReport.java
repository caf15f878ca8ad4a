package com.perfwatch.core.engine;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.perfwatch.core.model.TrendDirection;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Baseline and target comparison of one entity.
 *
 * <p>
 * {@code overallImprovementPct} is the weight-weighted sum of the per-metric
 * improvements that could be computed; weights are not rescaled when some
 * metrics are missing.
 * </p>
 * <p>
 * {@code metricTrend} summarizes the per-metric trends of the rows.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"entityId", "timestamp", "score", "overallImprovementPct", "metricTrend", "metrics"})
public final class PerformanceReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final Instant timestamp;
    private final double score;
    private final double overallImprovementPct;
    private final TrendDirection metricTrend;
    private final List<MetricReport> metrics;

    public PerformanceReport(String entityId, Instant timestamp, double score, double overallImprovementPct,
            TrendDirection metricTrend, List<MetricReport> metrics) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.score = score;
        this.overallImprovementPct = overallImprovementPct;
        this.metricTrend = Objects.requireNonNull(metricTrend, "metricTrend must not be null");
        this.metrics = List.copyOf(Objects.requireNonNull(metrics, "metrics must not be null"));
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

    public double getOverallImprovementPct() {
        return overallImprovementPct;
    }

    public TrendDirection getMetricTrend() {
        return metricTrend;
    }

    public List<MetricReport> getMetrics() {
        return metrics;
    }

    /**
     * @return the row of {@code metricName}, or {@code null}
     */
    public MetricReport metric(String metricName) {
        return metrics.stream()
                .filter(m -> m.getMetricName().equals(metricName))
                .findFirst()
                .orElse(null);
    }

    @Override
    public String toString() {
        return "PerformanceReport{" +
                "entityId='" + entityId + '\'' +
                ", score=" + score +
                ", overallImprovementPct=" + overallImprovementPct +
                ", metricTrend=" + metricTrend +
                ", metrics=" + metrics +
                '}';
    }
}
