package com.perfwatch.core.engine;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.perfwatch.core.model.MetricDirection;
import com.perfwatch.core.model.TrendDirection;

import java.io.Serializable;
import java.util.Objects;

/**
 * One row of a {@link PerformanceReport}.
 *
 * <p>
 * {@code improvementPct} is directional: positive means the metric moved
 * the good way since the baseline. Values that cannot be computed (no
 * baseline, no target, zero reference) are {@code null}. {@code trend} is
 * {@code null} until the monitoring cycle has seen the metric.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"metricName", "direction", "baseline", "current", "target", "improvementPct", "targetAttainment",
        "trend"})
public final class MetricReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final MetricDirection direction;
    private final Double baseline;
    private final Double current;
    private final Double target;
    private final Double improvementPct;
    private final Double targetAttainment;
    private final TrendDirection trend;

    public MetricReport(String metricName, MetricDirection direction, Double baseline, Double current,
            Double target, Double improvementPct, Double targetAttainment, TrendDirection trend) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.baseline = baseline;
        this.current = current;
        this.target = target;
        this.improvementPct = improvementPct;
        this.targetAttainment = targetAttainment;
        this.trend = trend;
    }

    public String getMetricName() {
        return metricName;
    }

    public MetricDirection getDirection() {
        return direction;
    }

    public Double getBaseline() {
        return baseline;
    }

    public Double getCurrent() {
        return current;
    }

    public Double getTarget() {
        return target;
    }

    public Double getImprovementPct() {
        return improvementPct;
    }

    /**
     * @return share of the target reached; 1.0 means the target is met
     */
    public Double getTargetAttainment() {
        return targetAttainment;
    }

    public TrendDirection getTrend() {
        return trend;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricReport that))
            return false;
        return metricName.equals(that.metricName)
                && direction == that.direction
                && Objects.equals(baseline, that.baseline)
                && Objects.equals(current, that.current)
                && Objects.equals(target, that.target)
                && Objects.equals(improvementPct, that.improvementPct)
                && Objects.equals(targetAttainment, that.targetAttainment)
                && trend == that.trend;
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, direction, baseline, current, target, improvementPct, targetAttainment, trend);
    }

    @Override
    public String toString() {
        return "MetricReport{" +
                "metricName='" + metricName + '\'' +
                ", baseline=" + baseline +
                ", current=" + current +
                ", target=" + target +
                ", improvementPct=" + improvementPct +
                ", targetAttainment=" + targetAttainment +
                ", trend=" + trend +
                '}';
    }
}
