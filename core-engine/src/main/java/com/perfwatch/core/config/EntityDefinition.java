package com.perfwatch.core.config;

import com.perfwatch.core.model.EntityKind;
import com.perfwatch.core.model.MonitoredEntity;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entity registration read from configuration.
 *
 * <pre>
 * entities:
 *   - id: marketing
 *     kind: team
 *     weights: {efficiency: 0.25, quality: 0.30, responseTime: 0.20, customerSatisfaction: 0.25}
 *     targets: {efficiency: 0.85, quality: 0.90}
 * </pre>
 *
 * @since 1.0.0
 */
public class EntityDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Accepted distance of the weight sum from 1. */
    static final double WEIGHT_SUM_TOLERANCE = 1e-6;

    private String id;
    private String kind = "team";
    private Map<String, Double> weights = new LinkedHashMap<>();
    private Map<String, Double> targets = new LinkedHashMap<>();

    /**
     * @return the immutable entity described by this definition
     * @throws IllegalArgumentException if the definition is invalid
     */
    public MonitoredEntity toEntity() {
        return new MonitoredEntity(id, EntityKind.parse(kind), weights, targets);
    }

    void validate(List<String> errors) {
        if (id == null || id.isBlank()) {
            errors.add("Entity 'id' is required");
            return;
        }
        try {
            MonitoredEntity entity = toEntity();
            if (!entity.getWeights().isEmpty()
                    && Math.abs(entity.weightSum() - 1.0) > WEIGHT_SUM_TOLERANCE) {
                errors.add("Weights of entity '" + id + "' must sum to 1, got: " + entity.weightSum());
            }
        } catch (IllegalArgumentException | NullPointerException e) {
            errors.add("Entity '" + id + "': " + e.getMessage());
        }
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public Map<String, Double> getWeights() {
        return weights;
    }

    public void setWeights(Map<String, Double> weights) {
        this.weights = weights != null ? new LinkedHashMap<>(weights) : new LinkedHashMap<>();
    }

    public Map<String, Double> getTargets() {
        return targets;
    }

    public void setTargets(Map<String, Double> targets) {
        this.targets = targets != null ? new LinkedHashMap<>(targets) : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "EntityDefinition{id='" + id + "', kind='" + kind + "', weights=" + weights + '}';
    }
}
