package com.perfwatch.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Alert raised when a metric deviates from its baseline by at least one of
 * the configured thresholds.
 *
 * <p>
 * Serialized to JSON and published to the configured Kafka alerts topic.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder} to construct instances. The builder enforces that
 * {@code id}, {@code entityId}, {@code metricName}, {@code severity} and
 * {@code timestamp} are present; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * <h3>Acknowledgement</h3>
 * <p>
 * Alerts are immutable. {@link #acknowledge()} returns an acknowledged copy,
 * which the alert index stores in place of the original. Instances already
 * handed to subscribers keep the state they were published with.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"id", "entityId", "metricName", "severity", "deviationPct",
        "baselineValue", "currentValue", "timestamp", "acknowledged", "details"})
public final class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String entityId;
    private final String metricName;
    private final Severity severity;

    /** Deviation from the baseline, in percent. */
    private final double deviationPct;

    private final double baselineValue;
    private final double currentValue;
    private final Instant timestamp;
    private final boolean acknowledged;

    /** Human-readable description of what was detected. */
    private final String details;

    private Alert(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.entityId = Objects.requireNonNull(builder.entityId, "entityId must not be null");
        this.metricName = Objects.requireNonNull(builder.metricName, "metricName must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.deviationPct = builder.deviationPct;
        this.baselineValue = builder.baselineValue;
        this.currentValue = builder.currentValue;
        this.acknowledged = builder.acknowledged;
        this.details = builder.details;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String id;
        private String entityId;
        private String metricName;
        private Severity severity;
        private double deviationPct;
        private double baselineValue;
        private double currentValue;
        private Instant timestamp;
        private boolean acknowledged;
        private String details;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder deviationPct(double deviationPct) {
            this.deviationPct = deviationPct;
            return this;
        }

        public Builder baselineValue(double baselineValue) {
            this.baselineValue = baselineValue;
            return this;
        }

        public Builder currentValue(double currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder acknowledged(boolean acknowledged) {
            this.acknowledged = acknowledged;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        /**
         * Build the alert.
         *
         * @return a new {@link Alert}
         * @throws NullPointerException if a required field is {@code null}
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    /**
     * @return an acknowledged copy of this alert, or {@code this} if it is
     *         already acknowledged
     */
    public Alert acknowledge() {
        if (acknowledged) {
            return this;
        }
        return builder()
                .id(id)
                .entityId(entityId)
                .metricName(metricName)
                .severity(severity)
                .deviationPct(deviationPct)
                .baselineValue(baselineValue)
                .currentValue(currentValue)
                .timestamp(timestamp)
                .details(details)
                .acknowledged(true)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getMetricName() {
        return metricName;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getDeviationPct() {
        return deviationPct;
    }

    public double getBaselineValue() {
        return baselineValue;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean isAcknowledged() {
        return acknowledged;
    }

    public String getDetails() {
        return details;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return id.equals(alert.id) && acknowledged == alert.acknowledged;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, acknowledged);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", entityId='" + entityId + '\'' +
                ", metricName='" + metricName + '\'' +
                ", severity=" + severity +
                ", deviationPct=" + deviationPct +
                ", timestamp=" + timestamp +
                ", acknowledged=" + acknowledged +
                '}';
    }
}
