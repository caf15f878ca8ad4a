package com.perfwatch.core.config;

import com.perfwatch.core.model.MetricDirection;

import java.io.Serializable;
import java.util.List;

/**
 * How one metric is interpreted for alerting and scoring.
 *
 * <ul>
 * <li>{@code direction: higher}: a drop is a degradation; without a
 * {@code cap} the value is read as a ratio in [0, 1]</li>
 * <li>{@code direction: lower}: a rise is a degradation; {@code cap} is the
 * value at which the metric scores zero and is required</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class MetricDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    private String name;
    private String direction = "higher";
    private Double cap;

    public MetricDefinition() {
    }

    public MetricDefinition(String name, String direction, Double cap) {
        this.name = name;
        this.direction = direction;
        this.cap = cap;
    }

    void validate(List<String> errors) {
        if (name == null || name.isBlank()) {
            errors.add("Metric 'name' is required");
            return;
        }
        MetricDirection parsed;
        try {
            parsed = MetricDirection.parse(direction);
        } catch (IllegalArgumentException e) {
            errors.add("Metric '" + name + "': " + e.getMessage());
            return;
        }
        if (cap != null && !(cap > 0)) {
            errors.add("Metric '" + name + "' requires 'cap' > 0, got: " + cap);
        }
        if (parsed == MetricDirection.LOWER_IS_BETTER && cap == null) {
            errors.add("Lower-is-better metric '" + name + "' requires 'cap'");
        }
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDirection() {
        return direction;
    }

    public void setDirection(String direction) {
        this.direction = direction;
    }

    public Double getCap() {
        return cap;
    }

    public void setCap(Double cap) {
        this.cap = cap;
    }

    @Override
    public String toString() {
        return "MetricDefinition{name='" + name + "', direction='" + direction + "', cap=" + cap + '}';
    }
}
