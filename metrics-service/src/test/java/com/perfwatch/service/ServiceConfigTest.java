package com.perfwatch.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ServiceConfig}.
 */
class ServiceConfigTest {

    @Test
    @DisplayName("Should fall back to defaults for an empty environment")
    void shouldUseDefaults() {
        ServiceConfig config = ServiceConfig.fromEnvironment(Map.of());

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getSamplesTopic()).isEqualTo("perf-samples");
        assertThat(config.getAlertsTopic()).isEqualTo("perf-alerts");
        assertThat(config.getTrendsTopic()).isEqualTo("perf-trends");
        assertThat(config.getGroupId()).isEqualTo("perfwatch");
        assertThat(config.getPollTimeoutMs()).isEqualTo(500);
        assertThat(config.getEngineConfigPath()).isEmpty();
        assertThat(config.getHealthPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("Should read values from the environment and ignore blank ones")
    void shouldReadEnvironment() {
        ServiceConfig config = ServiceConfig.fromEnvironment(Map.of(
                "KAFKA_BOOTSTRAP_SERVERS", "kafka:29092",
                "KAFKA_SAMPLES_TOPIC", "samples",
                "KAFKA_TRENDS_TOPIC", "  ",
                "HEALTH_PORT", "9090",
                "PERFWATCH_CONFIG_PATH", "/etc/perfwatch.yml"));

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("kafka:29092");
        assertThat(config.getSamplesTopic()).isEqualTo("samples");
        assertThat(config.getTrendsTopic()).isEqualTo("perf-trends");
        assertThat(config.getHealthPort()).isEqualTo(9090);
        assertThat(config.getEngineConfigPath()).isEqualTo("/etc/perfwatch.yml");
    }

    @Test
    @DisplayName("Should report unparseable numbers as IllegalStateException")
    void shouldRejectBadNumber() {
        assertThatThrownBy(() -> ServiceConfig.fromEnvironment(Map.of("POLL_TIMEOUT_MS", "soon")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("soon");
    }

    @Test
    @DisplayName("Should validate ranges and blank names in the builder")
    void shouldValidateBuilder() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
        assertThatThrownBy(() -> new ServiceConfig.Builder().pollTimeoutMs(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ServiceConfig.Builder().alertsTopic("").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("alertsTopic");
    }

    @Test
    @DisplayName("Should disable auto-commit for the consumer")
    void shouldBuildKafkaProperties() {
        ServiceConfig config = new ServiceConfig.Builder().groupId("g1").build();

        Properties consumer = config.kafkaConsumerProperties();
        Properties producer = config.kafkaProducerProperties();

        assertThat(consumer.getProperty("group.id")).isEqualTo("g1");
        assertThat(consumer.getProperty("enable.auto.commit")).isEqualTo("false");
        assertThat(producer.getProperty("acks")).isEqualTo("all");
    }
}
