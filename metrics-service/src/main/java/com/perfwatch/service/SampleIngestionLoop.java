package com.perfwatch.service;

import com.perfwatch.core.engine.MetricsEngine;
import com.perfwatch.core.error.MetricsException;
import com.perfwatch.core.metrics.PerfWatchMetrics;
import com.perfwatch.core.model.MetricSample;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls the samples topic and feeds every record into the engine.
 *
 * <h3>Delivery</h3>
 * <p>
 * Offsets are committed synchronously after a polled batch has been
 * handed to the engine, which gives at-least-once ingestion. A replayed
 * sample overwrites itself in the store, so redelivery is harmless.
 * </p>
 *
 * <h3>Bad records</h3>
 * <p>
 * Undecodable records (a {@code null} value from
 * {@link SampleMessageDeserializer}), incomplete samples and samples for
 * unknown entities are logged and skipped; they never stop the loop. Skips
 * are counted on {@code perfwatch.samples.skipped}, accepted samples on the
 * engine's {@code perfwatch.samples.recorded}.
 * </p>
 *
 * @since 1.0.0
 */
public class SampleIngestionLoop implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(SampleIngestionLoop.class);

    private final Consumer<String, SampleMessage> consumer;
    private final MetricsEngine engine;
    private final String topic;
    private final Duration pollTimeout;
    private final Clock clock;

    private final PerfWatchMetrics metrics;

    private final AtomicBoolean running = new AtomicBoolean();

    public SampleIngestionLoop(Consumer<String, SampleMessage> consumer, MetricsEngine engine,
                               String topic, Duration pollTimeout, Clock clock) {
        this.consumer = Objects.requireNonNull(consumer, "consumer must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = engine.metrics();
    }

    /**
     * Subscribe and poll until {@link #stop()} is called. Closes the
     * consumer on exit.
     */
    @Override
    public void run() {
        running.set(true);
        try {
            consumer.subscribe(List.of(topic));
            LOG.info("Ingesting samples from topic '{}'", topic);
            while (running.get()) {
                pollOnce();
            }
        } catch (WakeupException e) {
            if (running.get()) {
                throw e;
            }
        } finally {
            consumer.close();
            LOG.info("Sample ingestion stopped: {} recorded, {} skipped",
                    metrics.samplesRecorded(), metrics.samplesSkipped());
        }
    }

    /**
     * Poll one batch, record it and commit its offsets.
     *
     * @return number of samples recorded
     */
    public int pollOnce() {
        ConsumerRecords<String, SampleMessage> records = consumer.poll(pollTimeout);
        if (records.isEmpty()) {
            return 0;
        }
        int recorded = 0;
        for (ConsumerRecord<String, SampleMessage> record : records) {
            if (ingest(record)) {
                recorded++;
            }
        }
        consumer.commitSync();
        LOG.debug("Batch of {} record(s): {} recorded", records.count(), recorded);
        return recorded;
    }

    private boolean ingest(ConsumerRecord<String, SampleMessage> record) {
        SampleMessage message = record.value();
        if (message == null) {
            metrics.recordSampleSkipped();
            return false;
        }
        try {
            MetricSample sample = message.toSample(clock.instant());
            engine.recordSample(sample.getEntityId(), sample.getMetricName(), sample.getValue(),
                    sample.getTimestamp());
            return true;
        } catch (MetricsException | IllegalArgumentException e) {
            metrics.recordSampleSkipped();
            LOG.warn("Skipping record at {}-{}@{}: {}", record.topic(), record.partition(), record.offset(),
                    e.getMessage());
            return false;
        }
    }

    /**
     * Ask the loop to exit; safe to call from any thread.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            consumer.wakeup();
        }
    }

    public boolean isRunning() {
        return running.get();
    }
}
