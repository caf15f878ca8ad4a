package com.perfwatch.core.alert;

import com.perfwatch.core.baseline.BaselineManager;
import com.perfwatch.core.config.AlertThresholds;
import com.perfwatch.core.config.MetricCatalog;
import com.perfwatch.core.model.Alert;
import com.perfwatch.core.model.Baseline;
import com.perfwatch.core.model.MetricDirection;
import com.perfwatch.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * Baseline deviation detector.
 *
 * <p>
 * Compares a current value with the metric's baseline and raises an
 * {@link Alert} of the most severe tier whose threshold the deviation
 * reaches. Deviation is directional: a drop of a higher-is-better metric and
 * a rise of a lower-is-better metric count as degradation, the opposite
 * movement never alerts.
 * </p>
 *
 * <h3>Skipped evaluations</h3>
 * <ul>
 * <li>no baseline yet for the metric</li>
 * <li>baseline value of zero (the relative deviation is undefined)</li>
 * </ul>
 *
 * <p>
 * A persisting deviation raises a new alert on every evaluation; consumers
 * deduplicate if they need to. Raised alerts are handed to the sink and kept
 * in an index for acknowledgement until they expire.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AlertEngine.class);

    /** Absorbs representation error of ratios such as (0.80 - 0.68) / 0.80. */
    static final double THRESHOLD_TOLERANCE = 1e-9;

    private static final List<Severity> MOST_SEVERE_FIRST =
            List.of(Severity.CRITICAL, Severity.WARNING, Severity.INFO);

    private final BaselineManager baselines;
    private final MetricCatalog catalog;
    private final AlertThresholds thresholds;
    private final Duration retention;
    private final Clock clock;
    private final Consumer<Alert> sink;

    private final ConcurrentMap<String, Alert> index = new ConcurrentHashMap<>();

    /**
     * @param baselines  baseline source
     * @param catalog    metric directions
     * @param thresholds severity thresholds
     * @param retention  how long raised alerts stay in the index
     * @param clock      time source for alert timestamps
     * @param sink       receives every raised alert
     */
    public AlertEngine(BaselineManager baselines, MetricCatalog catalog, AlertThresholds thresholds,
                       Duration retention, Clock clock, Consumer<Alert> sink) {
        this.baselines = Objects.requireNonNull(baselines, "baselines must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
        this.retention = Objects.requireNonNull(retention, "retention must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    /**
     * Evaluate one metric value against its baseline.
     *
     * @return the raised alert, or empty if the value is within thresholds or
     *         the evaluation was skipped
     */
    public Optional<Alert> evaluate(String entityId, String metricName, double currentValue) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(metricName, "metricName must not be null");

        Optional<Baseline> baseline = baselines.get(entityId, metricName);
        if (baseline.isEmpty()) {
            LOG.debug("No baseline for {}/{}, skipping evaluation", entityId, metricName);
            return Optional.empty();
        }
        double reference = baseline.get().getValue();
        if (reference == 0.0) {
            LOG.warn("Baseline of {}/{} is zero, deviation undefined; skipping evaluation", entityId, metricName);
            return Optional.empty();
        }

        MetricDirection direction = catalog.direction(metricName);
        double deviation = direction.deviation(reference, currentValue);
        Optional<Severity> severity = classify(thresholds, deviation);
        if (severity.isEmpty()) {
            LOG.trace("{}/{} deviation {} within thresholds", entityId, metricName, deviation);
            return Optional.empty();
        }

        Alert alert = Alert.builder()
                .id(UUID.randomUUID().toString())
                .entityId(entityId)
                .metricName(metricName)
                .severity(severity.get())
                .deviationPct(deviation * 100.0)
                .baselineValue(reference)
                .currentValue(currentValue)
                .timestamp(clock.instant())
                .details(String.format(Locale.ROOT,
                        "%s of %s degraded %.1f%% from baseline (baseline: %.4f, current: %.4f)",
                        metricName, entityId, deviation * 100.0, reference, currentValue))
                .build();

        index.put(alert.getId(), alert);
        LOG.info("{} alert for {}/{}: deviation {}%", alert.getSeverity(), entityId, metricName,
                String.format(Locale.ROOT, "%.1f", alert.getDeviationPct()));
        publish(alert);
        return Optional.of(alert);
    }

    /**
     * Most severe tier whose threshold {@code deviation} reaches, thresholds
     * inclusive.
     *
     * @param thresholds severity thresholds
     * @param deviation  directional deviation ratio
     * @return the severity, or empty below the lowest threshold
     */
    public static Optional<Severity> classify(AlertThresholds thresholds, double deviation) {
        for (Severity severity : MOST_SEVERE_FIRST) {
            if (deviation + THRESHOLD_TOLERANCE >= thresholds.thresholdFor(severity)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }

    private void publish(Alert alert) {
        try {
            sink.accept(alert);
        } catch (RuntimeException e) {
            LOG.error("Alert sink failed for alert {}: {}", alert.getId(), e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Alert index
    // ---------------------------------------------------------------

    /**
     * Mark an alert as acknowledged.
     *
     * @return the acknowledged alert, or empty if the id is unknown or expired
     */
    public Optional<Alert> acknowledge(String alertId) {
        Objects.requireNonNull(alertId, "alertId must not be null");
        Alert acknowledged = index.computeIfPresent(alertId, (id, alert) -> alert.acknowledge());
        if (acknowledged != null) {
            LOG.info("Alert {} acknowledged", alertId);
        }
        return Optional.ofNullable(acknowledged);
    }

    public Optional<Alert> find(String alertId) {
        return Optional.ofNullable(index.get(alertId));
    }

    /**
     * @return every retained alert, oldest first
     */
    public List<Alert> alerts() {
        return index.values().stream()
                .sorted(Comparator.comparing(Alert::getTimestamp))
                .toList();
    }

    public List<Alert> alerts(String entityId) {
        return alerts().stream()
                .filter(a -> a.getEntityId().equals(entityId))
                .toList();
    }

    /**
     * @return retained alerts that have not been acknowledged, oldest first
     */
    public List<Alert> activeAlerts() {
        return alerts().stream()
                .filter(a -> !a.isAcknowledged())
                .toList();
    }

    /**
     * Drop alerts raised before {@code now - retention}.
     *
     * @return number of alerts removed
     */
    public int purgeExpired(Instant now) {
        Instant cutoff = now.minus(retention);
        int before = index.size();
        index.values().removeIf(a -> a.getTimestamp().isBefore(cutoff));
        int removed = before - index.size();
        if (removed > 0) {
            LOG.debug("Purged {} alert(s) raised before {}", removed, cutoff);
        }
        return removed;
    }

    public void removeEntity(String entityId) {
        index.values().removeIf(a -> a.getEntityId().equals(entityId));
    }

    public int size() {
        return index.size();
    }
}
