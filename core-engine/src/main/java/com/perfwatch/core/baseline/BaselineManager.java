package com.perfwatch.core.baseline;

import com.perfwatch.core.model.Baseline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Holds the reference ("normal") value of every {@code (entity, metric)}.
 *
 * <p>
 * A baseline is set once, from the first observation, and only changes when
 * it is explicitly forced or reset. Absence of a baseline is reported as an
 * empty {@link Optional}, never as an exception.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineManager {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineManager.class);

    private final ConcurrentMap<String, ConcurrentMap<String, Baseline>> baselines = new ConcurrentHashMap<>();
    private final Clock clock;

    public BaselineManager(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Establish the baseline of a metric.
     *
     * @param entityId   entity id
     * @param metricName metric name
     * @param value      reference value
     * @param force      replace an existing baseline
     * @return the baseline in effect after the call
     */
    public Baseline establish(String entityId, String metricName, double value, boolean force) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(metricName, "metricName must not be null");
        ConcurrentMap<String, Baseline> metrics = baselines.computeIfAbsent(entityId, id -> new ConcurrentHashMap<>());
        Baseline candidate = new Baseline(entityId, metricName, value, clock.instant());

        if (force) {
            Baseline previous = metrics.put(metricName, candidate);
            LOG.info("Baseline for {}/{} set to {} (was {})", entityId, metricName, value,
                    previous != null ? previous.getValue() : "unset");
            return candidate;
        }
        Baseline existing = metrics.putIfAbsent(metricName, candidate);
        if (existing != null) {
            return existing;
        }
        LOG.info("Baseline for {}/{} established at {}", entityId, metricName, value);
        return candidate;
    }

    public Optional<Baseline> get(String entityId, String metricName) {
        Map<String, Baseline> metrics = baselines.get(entityId);
        return metrics != null ? Optional.ofNullable(metrics.get(metricName)) : Optional.empty();
    }

    /**
     * Clear one baseline; the next observation establishes a new one.
     *
     * @return {@code true} if a baseline was removed
     */
    public boolean reset(String entityId, String metricName) {
        Map<String, Baseline> metrics = baselines.get(entityId);
        return metrics != null && metrics.remove(metricName) != null;
    }

    public void removeEntity(String entityId) {
        baselines.remove(entityId);
    }

    /**
     * @return snapshot of the entity's baselines keyed by metric name
     */
    public Map<String, Baseline> baselines(String entityId) {
        Map<String, Baseline> metrics = baselines.get(entityId);
        return metrics != null ? new TreeMap<>(metrics) : Map.of();
    }

    public int size() {
        return baselines.values().stream().mapToInt(Map::size).sum();
    }
}
