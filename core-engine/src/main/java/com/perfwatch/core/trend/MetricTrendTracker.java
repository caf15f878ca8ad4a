package com.perfwatch.core.trend;

import com.perfwatch.core.config.MetricCatalog;
import com.perfwatch.core.model.MetricDirection;
import com.perfwatch.core.model.MetricTrend;
import com.perfwatch.core.model.TrendDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-metric trend from a short history of values.
 *
 * <h3>Classification</h3>
 * <p>
 * Each {@code (entity, metric)} keeps its last {@value #HISTORY_SIZE} values.
 * The mean of the newest {@value #EDGE_SIZE} values is compared with the mean
 * of the oldest {@value #EDGE_SIZE}; a relative change beyond
 * {@value #CHANGE_THRESHOLD} in the good direction of the metric is
 * {@code IMPROVING}, beyond it in the bad direction {@code DECLINING}. Fewer
 * than {@value #EDGE_SIZE} values, or an oldest mean of zero, is
 * {@code STABLE}.
 * </p>
 *
 * <h3>Entity summary</h3>
 * <p>
 * An entity is {@code IMPROVING} when its improving metrics outnumber the
 * declining ones by more than one, {@code DECLINING} in the opposite case and
 * {@code STABLE} otherwise.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricTrendTracker {

    private static final Logger LOG = LoggerFactory.getLogger(MetricTrendTracker.class);

    static final int HISTORY_SIZE = 10;
    static final int EDGE_SIZE = 3;
    static final double CHANGE_THRESHOLD = 0.02;

    private final MetricCatalog catalog;
    private final ConcurrentMap<String, Map<String, Deque<Double>>> histories = new ConcurrentHashMap<>();

    public MetricTrendTracker(MetricCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    /**
     * Append a value to the metric's history, evicting the oldest when full.
     */
    public void record(String entityId, String metricName, double value) {
        Objects.requireNonNull(metricName, "metricName must not be null");
        Map<String, Deque<Double>> metrics = histories.computeIfAbsent(
                Objects.requireNonNull(entityId, "entityId must not be null"), id -> new TreeMap<>());
        synchronized (metrics) {
            Deque<Double> history = metrics.computeIfAbsent(metricName, m -> new ArrayDeque<>());
            history.addLast(value);
            if (history.size() > HISTORY_SIZE) {
                history.pollFirst();
            }
        }
    }

    /**
     * @return trend of every metric the entity has a history for, by name
     */
    public Map<String, MetricTrend> trends(String entityId) {
        Map<String, MetricTrend> result = new TreeMap<>();
        Map<String, Deque<Double>> metrics = histories.get(entityId);
        if (metrics == null) {
            return result;
        }
        synchronized (metrics) {
            metrics.forEach((metric, history) -> result.put(metric,
                    classify(entityId, metric, catalog.direction(metric),
                            history.stream().mapToDouble(Double::doubleValue).toArray())));
        }
        return result;
    }

    /**
     * @return the entity-level direction derived from its metric trends
     */
    public TrendDirection summary(String entityId) {
        int improving = 0;
        int declining = 0;
        for (MetricTrend trend : trends(entityId).values()) {
            switch (trend.getDirection()) {
                case IMPROVING -> improving++;
                case DECLINING -> declining++;
                default -> {
                }
            }
        }
        TrendDirection direction = improving > declining + 1
                ? TrendDirection.IMPROVING
                : declining > improving + 1 ? TrendDirection.DECLINING : TrendDirection.STABLE;
        LOG.debug("Metric trends of '{}': {} improving, {} declining -> {}", entityId, improving, declining, direction);
        return direction;
    }

    public void removeEntity(String entityId) {
        histories.remove(entityId);
    }

    static MetricTrend classify(String entityId, String metricName, MetricDirection direction, double[] values) {
        int n = values.length;
        if (n < EDGE_SIZE) {
            return new MetricTrend(entityId, metricName, TrendDirection.STABLE, 0.0, n);
        }
        double older = mean(values, 0);
        double recent = mean(values, n - EDGE_SIZE);
        if (older == 0.0) {
            return new MetricTrend(entityId, metricName, TrendDirection.STABLE, 0.0, n);
        }
        double change = (recent - older) / Math.abs(older);
        if (direction == MetricDirection.LOWER_IS_BETTER) {
            change = -change;
        }
        TrendDirection trend = change > CHANGE_THRESHOLD
                ? TrendDirection.IMPROVING
                : change < -CHANGE_THRESHOLD ? TrendDirection.DECLINING : TrendDirection.STABLE;
        return new MetricTrend(entityId, metricName, trend, change * 100.0, n);
    }

    private static double mean(double[] values, int from) {
        double sum = 0.0;
        for (int i = from; i < from + EDGE_SIZE; i++) {
            sum += values[i];
        }
        return sum / EDGE_SIZE;
    }
}
