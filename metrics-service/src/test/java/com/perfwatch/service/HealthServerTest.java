package com.perfwatch.service;

import com.perfwatch.core.config.EngineConfig;
import com.perfwatch.core.engine.MetricsEngine;
import com.perfwatch.core.model.EntityKind;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HealthServer}.
 */
class HealthServerTest {

    private final HttpClient client = HttpClient.newHttpClient();

    private PrometheusMeterRegistry registry;
    private MetricsEngine engine;
    private HealthServer server;

    @BeforeEach
    void setUp() {
        registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        engine = new MetricsEngine(new EngineConfig(), Clock.systemUTC(), registry);
        server = new HealthServer(engine, registry);
        server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
        engine.close();
        registry.close();
    }

    @Test
    @DisplayName("Should answer /health with UP")
    void shouldReportHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("{\"status\":\"UP\"}");
    }

    @Test
    @DisplayName("Should report not ready until the engine runs")
    void shouldFollowEngineForReadiness() throws Exception {
        assertThat(get("/readiness").statusCode()).isEqualTo(503);

        engine.start();

        assertThat(get("/readiness").statusCode()).isEqualTo(200);
    }

    @Test
    @DisplayName("Should expose engine statistics as JSON")
    void shouldExposeStats() throws Exception {
        HttpResponse<String> response = get("/stats");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("\"running\":false").contains("\"recordsPerTier\"");
    }

    @Test
    @DisplayName("Should expose engine meters in the Prometheus text format")
    void shouldExposePrometheusMetrics() throws Exception {
        engine.registerEntity("marketing", EntityKind.TEAM, Map.of("quality", 1.0), Map.of());
        engine.recordSample("marketing", "quality", 0.8, Instant.now());
        engine.runMonitoringCycle();

        HttpResponse<String> response = get("/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                type -> assertThat(type).startsWith("text/plain"));
        assertThat(response.body())
                .contains("perfwatch_samples_recorded_total 1")
                .contains("perfwatch_cycle_latency_seconds_count{cycle=\"monitoring\"}")
                .contains("perfwatch_events_dropped_total{channel=\"alerts\"}");
    }

    @Test
    @DisplayName("Should reject ports outside the valid range and stop idempotently")
    void shouldValidatePortAndStop() {
        assertThatThrownBy(() -> new HealthServer(engine, registry).start(-1))
                .isInstanceOf(IllegalArgumentException.class);

        server.stop();
        server.stop();

        assertThat(server.isRunning()).isFalse();
        assertThat(server.port()).isEqualTo(-1);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(
                URI.create("http://localhost:" + server.port() + path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
