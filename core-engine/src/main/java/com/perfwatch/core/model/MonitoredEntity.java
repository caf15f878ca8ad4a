package com.perfwatch.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A team or workflow whose metrics are tracked by the engine.
 *
 * <p>
 * {@code weights} drive the composite score and are expected to sum to 1;
 * the registrar owns that guarantee, the engine never rescales them.
 * {@code targets} are optional per-metric goals used by performance reports.
 * Instances are immutable: a configuration reload replaces the whole entity.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitoredEntity implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final EntityKind kind;
    private final Map<String, Double> weights;
    private final Map<String, Double> targets;

    /**
     * @param id      unique entity id; must not be blank
     * @param kind    entity kind; must not be {@code null}
     * @param weights metric weights; {@code null} is treated as empty
     * @param targets metric targets; {@code null} is treated as empty
     * @throws IllegalArgumentException if the id is blank or a weight is
     *                                  negative or not finite
     */
    public MonitoredEntity(String id, EntityKind kind, Map<String, Double> weights, Map<String, Double> targets) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Entity id must not be null or blank");
        }
        this.id = id;
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.weights = copy(weights);
        this.targets = copy(targets);

        this.weights.forEach((metric, weight) -> {
            if (!Double.isFinite(weight) || weight < 0) {
                throw new IllegalArgumentException(
                        "Weight for metric '" + metric + "' of entity '" + id + "' must be >= 0, got: " + weight);
            }
        });
    }

    private static Map<String, Double> copy(Map<String, Double> source) {
        Map<String, Double> result = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((k, v) -> result.put(
                    Objects.requireNonNull(k, "Metric name must not be null"),
                    Objects.requireNonNull(v, "Value for metric '" + k + "' must not be null")));
        }
        return result;
    }

    public String getId() {
        return id;
    }

    public EntityKind getKind() {
        return kind;
    }

    /**
     * @return unmodifiable view of the metric weights
     */
    public Map<String, Double> getWeights() {
        return Collections.unmodifiableMap(weights);
    }

    /**
     * @return unmodifiable view of the metric targets
     */
    public Map<String, Double> getTargets() {
        return Collections.unmodifiableMap(targets);
    }

    public OptionalDouble weightOf(String metricName) {
        Double w = weights.get(metricName);
        return w == null ? OptionalDouble.empty() : OptionalDouble.of(w);
    }

    public OptionalDouble targetOf(String metricName) {
        Double t = targets.get(metricName);
        return t == null ? OptionalDouble.empty() : OptionalDouble.of(t);
    }

    /**
     * @return the sum of all configured weights
     */
    public double weightSum() {
        double sum = 0;
        for (double w : weights.values()) {
            sum += w;
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MonitoredEntity that))
            return false;
        return id.equals(that.id) && kind == that.kind
                && weights.equals(that.weights) && targets.equals(that.targets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, weights, targets);
    }

    @Override
    public String toString() {
        return "MonitoredEntity{" +
                "id='" + id + '\'' +
                ", kind=" + kind +
                ", weights=" + weights +
                ", targets=" + targets +
                '}';
    }
}
