package com.perfwatch.core.error;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Thrown by strict scoring when one or more metrics have no configured
 * weight. Register an explicit zero weight to exclude a metric on purpose.
 *
 * @since 1.0.0
 */
public class MissingWeightException extends MetricsException {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final Set<String> metrics;

    public MissingWeightException(String entityId, Set<String> metrics) {
        super("No weight configured for metric(s) " + new TreeSet<>(metrics) + " of entity '" + entityId + "'");
        this.entityId = entityId;
        this.metrics = Collections.unmodifiableSet(new TreeSet<>(metrics));
    }

    public String getEntityId() {
        return entityId;
    }

    /**
     * @return the unweighted metric names, sorted
     */
    public Set<String> getMetrics() {
        return metrics;
    }
}
