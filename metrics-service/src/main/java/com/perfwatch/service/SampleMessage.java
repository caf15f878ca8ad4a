package com.perfwatch.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.perfwatch.core.model.MetricSample;

import java.time.Instant;
import java.util.Objects;

/**
 * Wire form of one measurement on the samples topic.
 *
 * <pre>
 * {"entityId":"marketing","metric":"quality","value":0.82,"timestamp":"2024-03-04T10:00:00Z"}
 * </pre>
 *
 * <p>
 * {@code timestamp} is optional; samples without one are stamped with the
 * ingestion time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SampleMessage {

    private String entityId;
    private String metric;
    private Double value;
    private Instant timestamp;

    public SampleMessage() {
    }

    public SampleMessage(String entityId, String metric, Double value, Instant timestamp) {
        this.entityId = entityId;
        this.metric = metric;
        this.value = value;
        this.timestamp = timestamp;
    }

    /**
     * Convert to an engine sample.
     *
     * @param ingestionTime used when the message carries no timestamp
     * @return the sample
     * @throws IllegalArgumentException if a required field is missing or the value is not finite
     */
    public MetricSample toSample(Instant ingestionTime) {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("Sample has no entityId");
        }
        if (metric == null || metric.isBlank()) {
            throw new IllegalArgumentException("Sample of '" + entityId + "' has no metric");
        }
        if (value == null) {
            throw new IllegalArgumentException("Sample " + entityId + "/" + metric + " has no value");
        }
        Instant ts = timestamp != null ? timestamp : Objects.requireNonNull(ingestionTime, "ingestionTime");
        return new MetricSample(entityId, metric, value, ts);
    }

    public String getEntityId() {
        return entityId;
    }

    public void setEntityId(String entityId) {
        this.entityId = entityId;
    }

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public Double getValue() {
        return value;
    }

    public void setValue(Double value) {
        this.value = value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return "SampleMessage{entityId='" + entityId + "', metric='" + metric
                + "', value=" + value + ", timestamp=" + timestamp + '}';
    }
}
