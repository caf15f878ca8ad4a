package com.perfwatch.service;

import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable configuration of the metrics service process.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the
 * service is configured through container env vars or a shell environment.
 * The engine itself is configured separately through {@code perfwatch.yml}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String samplesTopic;
    private final String alertsTopic;
    private final String trendsTopic;
    private final String groupId;
    private final long pollTimeoutMs;

    // ---------------------------------------------------------------
    // Engine
    // ---------------------------------------------------------------
    private final String engineConfigPath;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final int healthPort;

    private ServiceConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.samplesTopic = b.samplesTopic;
        this.alertsTopic = b.alertsTopic;
        this.trendsTopic = b.trendsTopic;
        this.groupId = b.groupId;
        this.pollTimeoutMs = b.pollTimeoutMs;
        this.engineConfigPath = b.engineConfigPath;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static ServiceConfig fromEnvironment(Map<String, String> env) {
        try {
            return new Builder()
                    .kafkaBootstrapServers(value(env, "KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .samplesTopic(value(env, "KAFKA_SAMPLES_TOPIC", "perf-samples"))
                    .alertsTopic(value(env, "KAFKA_ALERTS_TOPIC", "perf-alerts"))
                    .trendsTopic(value(env, "KAFKA_TRENDS_TOPIC", "perf-trends"))
                    .groupId(value(env, "KAFKA_GROUP_ID", "perfwatch"))
                    .pollTimeoutMs(Long.parseLong(value(env, "POLL_TIMEOUT_MS", "500")))
                    .engineConfigPath(value(env, "PERFWATCH_CONFIG_PATH", ""))
                    .healthPort(Integer.parseInt(value(env, "HEALTH_PORT", "8080")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * Consumer properties. Auto-commit is off; the ingestion loop commits
     * after each processed batch.
     */
    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("group.id", groupId);
        props.setProperty("auto.offset.reset", "earliest");
        props.setProperty("enable.auto.commit", "false");
        return props;
    }

    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("acks", "all");
        props.setProperty("enable.idempotence", "true");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getSamplesTopic() {
        return samplesTopic;
    }

    public String getAlertsTopic() {
        return alertsTopic;
    }

    public String getTrendsTopic() {
        return trendsTopic;
    }

    public String getGroupId() {
        return groupId;
    }

    public long getPollTimeoutMs() {
        return pollTimeoutMs;
    }

    /**
     * @return file path of the engine YAML, blank to use the classpath default
     */
    public String getEngineConfigPath() {
        return engineConfigPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * {@link #build()} checks that topic names and the group id are not
     * blank, that the poll timeout is positive and that the health port is
     * in [0, 65535] (0 binds an ephemeral port).
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String samplesTopic = "perf-samples";
        private String alertsTopic = "perf-alerts";
        private String trendsTopic = "perf-trends";
        private String groupId = "perfwatch";
        private long pollTimeoutMs = 500;
        private String engineConfigPath = "";
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder samplesTopic(String v) {
            this.samplesTopic = v;
            return this;
        }

        public Builder alertsTopic(String v) {
            this.alertsTopic = v;
            return this;
        }

        public Builder trendsTopic(String v) {
            this.trendsTopic = v;
            return this;
        }

        public Builder groupId(String v) {
            this.groupId = v;
            return this;
        }

        public Builder pollTimeoutMs(long v) {
            this.pollTimeoutMs = v;
            return this;
        }

        public Builder engineConfigPath(String v) {
            this.engineConfigPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(samplesTopic, "samplesTopic");
            requireNonBlank(alertsTopic, "alertsTopic");
            requireNonBlank(trendsTopic, "trendsTopic");
            requireNonBlank(groupId, "groupId");

            if (pollTimeoutMs < 1) {
                throw new IllegalArgumentException("pollTimeoutMs must be >= 1, got: " + pollTimeoutMs);
            }
            if (healthPort < 0 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [0, 65535], got: " + healthPort);
            }
            if (engineConfigPath == null) {
                engineConfigPath = "";
            }
            return new ServiceConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", samplesTopic='" + samplesTopic + '\'' +
                ", alertsTopic='" + alertsTopic + '\'' +
                ", trendsTopic='" + trendsTopic + '\'' +
                ", groupId='" + groupId + '\'' +
                ", pollTimeoutMs=" + pollTimeoutMs +
                ", engineConfigPath='" + engineConfigPath + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
