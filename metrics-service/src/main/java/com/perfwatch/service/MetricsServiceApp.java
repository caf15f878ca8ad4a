package com.perfwatch.service;

import com.perfwatch.core.config.EngineConfig;
import com.perfwatch.core.config.EngineConfigLoader;
import com.perfwatch.core.engine.MetricsEngine;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Main entry point of the PerfWatch metrics service.
 *
 * <h3>Wiring</h3>
 *
 * <pre>
 *   Kafka (samples topic)
 *     → SampleMessageDeserializer → SampleIngestionLoop
 *     → MetricsEngine (baselines, scores, alerts, trends, tiers)
 *     → KafkaEventPublisher
 *     → Kafka (alerts topic, trends topic)
 * </pre>
 * <p>
 * Engine and service meters share one Prometheus registry, served by
 * {@link HealthServer} on {@code /metrics}.
 * </p>
 *
 * <h3>Configuration</h3>
 * <p>
 * Process settings come from environment variables via
 * {@link ServiceConfig}; engine settings from {@code perfwatch.yml} via
 * {@link EngineConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricsServiceApp {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsServiceApp.class);

    private MetricsServiceApp() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting PerfWatch metrics service with config: {}", config);
        EngineConfig engineConfig = EngineConfigLoader.load(config.getEngineConfigPath());
        LOG.info("Engine configured with {} entit(y/ies)", engineConfig.getEntities().size());

        // 2. Engine and outbound events
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        MetricsEngine engine = new MetricsEngine(engineConfig, Clock.systemUTC(), registry);
        KafkaEventPublisher publisher = new KafkaEventPublisher(
                new KafkaProducer<>(config.kafkaProducerProperties(), new StringSerializer(),
                        new EngineEventSerializer()),
                config.getAlertsTopic(), config.getTrendsTopic(), engine.metrics());
        engine.subscribeAlerts(publisher);
        engine.subscribeTrends(publisher);

        // 3. Inbound samples
        SampleIngestionLoop ingestion = new SampleIngestionLoop(
                new KafkaConsumer<>(config.kafkaConsumerProperties(), new StringDeserializer(),
                        new SampleMessageDeserializer()),
                engine, config.getSamplesTopic(), Duration.ofMillis(config.getPollTimeoutMs()),
                Clock.systemUTC());
        Thread ingestionThread = new Thread(ingestion, "sample-ingestion");

        // 4. Health, stats and metrics endpoints
        HealthServer healthServer = new HealthServer(engine, registry);
        healthServer.start(config.getHealthPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown requested");
            ingestion.stop();
            try {
                ingestionThread.join(engineConfig.getShutdownTimeoutMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            engine.close();
            publisher.close();
            healthServer.stop();
            registry.close();
        }, "perfwatch-shutdown"));

        // 5. Run
        engine.start();
        ingestionThread.start();
        ingestionThread.join();
    }
}
