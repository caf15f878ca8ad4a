package com.perfwatch.core.scoring;

import com.perfwatch.core.config.MetricCatalog;
import com.perfwatch.core.error.MissingWeightException;
import com.perfwatch.core.model.MetricDirection;
import com.perfwatch.core.model.MonitoredEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Composite performance score of an entity.
 *
 * <p>
 * {@code score = clamp01(sum(weight[m] * normalize(m, value[m])))} over the
 * supplied metrics. Weights are used as registered; a weighted metric with
 * no current value simply contributes nothing.
 * </p>
 *
 * <h3>Normalization</h3>
 * <ul>
 * <li>higher-is-better without a cap: the value is a ratio, clamped to [0, 1]</li>
 * <li>higher-is-better with a cap: {@code min(value, cap) / cap}</li>
 * <li>lower-is-better: {@code (cap - min(value, cap)) / cap}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ScoringEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ScoringEngine.class);

    private final MetricCatalog catalog;

    /** Entity and unweighted-set pairs already reported at WARN. */
    private final Set<String> warnedUnweighted = ConcurrentHashMap.newKeySet();

    public ScoringEngine(MetricCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    /**
     * Strict scoring.
     *
     * @param entity registered entity
     * @param values current value per metric
     * @return score in [0, 1]
     * @throws MissingWeightException if any supplied metric has no weight
     */
    public double score(MonitoredEntity entity, Map<String, Double> values) {
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(values, "values must not be null");
        Set<String> unweighted = unweighted(entity, values);
        if (!unweighted.isEmpty()) {
            throw new MissingWeightException(entity.getId(), unweighted);
        }
        return weightedSum(entity, values);
    }

    /**
     * Scoring that leaves unweighted metrics out instead of failing. The
     * first time an entity shows a given set of unweighted metrics it is
     * logged at WARN, repeats at DEBUG.
     *
     * @param entity registered entity
     * @param values current value per metric
     * @return score in [0, 1]
     */
    public double scoreLenient(MonitoredEntity entity, Map<String, Double> values) {
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(values, "values must not be null");
        Set<String> unweighted = unweighted(entity, values);
        if (!unweighted.isEmpty()) {
            if (warnedUnweighted.add(entity.getId() + '|' + unweighted)) {
                LOG.warn("Entity '{}' has no weight for {}; left out of the score", entity.getId(), unweighted);
            } else {
                LOG.debug("Entity '{}' has no weight for {}; left out of the score", entity.getId(), unweighted);
            }
        }
        return weightedSum(entity, values);
    }

    /**
     * Map a raw metric value onto [0, 1], where 1 is best.
     */
    public double normalize(String metricName, double value) {
        MetricDirection direction = catalog.direction(metricName);
        OptionalDouble cap = catalog.cap(metricName);
        if (direction == MetricDirection.LOWER_IS_BETTER) {
            if (cap.isEmpty()) {
                // no scale to invert against
                return clamp01(1.0 - value);
            }
            double c = cap.getAsDouble();
            return clamp01((c - Math.min(value, c)) / c);
        }
        if (cap.isPresent()) {
            double c = cap.getAsDouble();
            return clamp01(Math.min(value, c) / c);
        }
        return clamp01(value);
    }

    private double weightedSum(MonitoredEntity entity, Map<String, Double> values) {
        double sum = 0.0;
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            OptionalDouble weight = entity.weightOf(entry.getKey());
            if (weight.isPresent()) {
                sum += weight.getAsDouble() * normalize(entry.getKey(), entry.getValue());
            }
        }
        return clamp01(sum);
    }

    private static Set<String> unweighted(MonitoredEntity entity, Map<String, Double> values) {
        Set<String> missing = new TreeSet<>();
        for (String metric : values.keySet()) {
            if (entity.weightOf(metric).isEmpty()) {
                missing.add(metric);
            }
        }
        return missing;
    }

    static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
