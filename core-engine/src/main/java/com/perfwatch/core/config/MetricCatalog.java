package com.perfwatch.core.config;

import com.perfwatch.core.model.MetricDirection;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Immutable lookup of metric direction and normalization cap by name.
 *
 * <p>
 * Metrics without an entry are treated as higher-is-better ratios.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricCatalog implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final List<MetricDefinition> DEFAULTS = List.of(
            new MetricDefinition("efficiency", "higher", null),
            new MetricDefinition("quality", "higher", null),
            new MetricDefinition("customerSatisfaction", "higher", null),
            new MetricDefinition("availability", "higher", null),
            new MetricDefinition("responseTime", "lower", 2000.0),
            new MetricDefinition("errorRate", "lower", 0.1));

    private final Map<String, MetricDirection> directions;
    private final Map<String, Double> caps;

    private MetricCatalog(Map<String, MetricDirection> directions, Map<String, Double> caps) {
        this.directions = Collections.unmodifiableMap(directions);
        this.caps = Collections.unmodifiableMap(caps);
    }

    /**
     * @return the built-in metric definitions
     */
    public static MetricCatalog defaults() {
        return of(List.of());
    }

    /**
     * Build a catalog from the built-in definitions overlaid with
     * {@code overrides}; an override replaces the built-in entry of the same
     * name.
     *
     * @param overrides validated metric definitions; must not be {@code null}
     * @return the catalog
     * @throws IllegalArgumentException if a definition has an unknown direction
     */
    public static MetricCatalog of(List<MetricDefinition> overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        Map<String, MetricDirection> directions = new LinkedHashMap<>();
        Map<String, Double> caps = new LinkedHashMap<>();
        for (MetricDefinition def : DEFAULTS) {
            put(def, directions, caps);
        }
        for (MetricDefinition def : overrides) {
            put(def, directions, caps);
        }
        return new MetricCatalog(directions, caps);
    }

    private static void put(MetricDefinition def, Map<String, MetricDirection> directions, Map<String, Double> caps) {
        directions.put(def.getName(), MetricDirection.parse(def.getDirection()));
        if (def.getCap() != null) {
            caps.put(def.getName(), def.getCap());
        } else {
            caps.remove(def.getName());
        }
    }

    public MetricDirection direction(String metricName) {
        return directions.getOrDefault(metricName, MetricDirection.HIGHER_IS_BETTER);
    }

    public OptionalDouble cap(String metricName) {
        Double cap = caps.get(metricName);
        return cap != null ? OptionalDouble.of(cap) : OptionalDouble.empty();
    }

    /**
     * @return names of every metric with an explicit definition
     */
    public Set<String> metricNames() {
        return directions.keySet();
    }

    @Override
    public String toString() {
        return "MetricCatalog{directions=" + directions + ", caps=" + caps + '}';
    }
}
