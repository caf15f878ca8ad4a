package com.perfwatch.service;

import com.perfwatch.core.alert.AlertListener;
import com.perfwatch.core.metrics.PerfWatchMetrics;
import com.perfwatch.core.model.Alert;
import com.perfwatch.core.model.TrendEvent;
import com.perfwatch.core.trend.TrendListener;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Engine subscriber forwarding alerts and trend events to Kafka.
 *
 * <p>
 * Records are keyed by entity id, so all events of one entity land on the
 * same partition in the order the engine published them. Send failures are
 * logged and counted on {@code perfwatch.publish.failures}; they never reach
 * the engine.
 * </p>
 *
 * @since 1.0.0
 */
public class KafkaEventPublisher implements AlertListener, TrendListener, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaEventPublisher.class);

    private final Producer<String, Object> producer;
    private final String alertsTopic;
    private final String trendsTopic;
    private final PerfWatchMetrics metrics;

    public KafkaEventPublisher(Producer<String, Object> producer, String alertsTopic, String trendsTopic,
                               PerfWatchMetrics metrics) {
        this.producer = Objects.requireNonNull(producer, "producer must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.alertsTopic = Objects.requireNonNull(alertsTopic, "alertsTopic must not be null");
        this.trendsTopic = Objects.requireNonNull(trendsTopic, "trendsTopic must not be null");
    }

    @Override
    public void onAlert(Alert alert) {
        send(alertsTopic, alert.getEntityId(), alert);
    }

    @Override
    public void onTrend(TrendEvent event) {
        send(trendsTopic, event.getEntityId(), event);
    }

    private void send(String topic, String key, Object event) {
        try {
            producer.send(new ProducerRecord<>(topic, key, event), (metadata, e) -> {
                if (e != null) {
                    metrics.recordPublishFailure();
                    LOG.error("Failed to publish {} to '{}': {}", event, topic, e.getMessage(), e);
                }
            });
        } catch (KafkaException e) {
            metrics.recordPublishFailure();
            LOG.error("Failed to publish {} to '{}': {}", event, topic, e.getMessage(), e);
        }
    }

    /**
     * Flush pending records and close the producer.
     */
    @Override
    public void close() {
        producer.flush();
        producer.close(Duration.ofSeconds(5));
        LOG.info("Event publisher closed ({} failure(s))", metrics.publishFailures());
    }
}
