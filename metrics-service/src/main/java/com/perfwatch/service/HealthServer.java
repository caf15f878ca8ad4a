package com.perfwatch.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.perfwatch.core.engine.MetricsEngine;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server exposing health, readiness, engine statistics and
 * Prometheus metrics.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} – {@code 200 OK} with body {@code {"status":"UP"}}
 * while the process is alive</li>
 * <li>{@code GET /readiness} – {@code 200} when the engine is running,
 * otherwise {@code 503} with {@code {"status":"DOWN"}}</li>
 * <li>{@code GET /stats} – the engine's {@code SystemStats} as JSON</li>
 * <li>{@code GET /metrics} – every meter of the registry in the Prometheus
 * text format</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final byte[] UP = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] DOWN = "{\"status\":\"DOWN\"}".getBytes(StandardCharsets.UTF_8);
    private static final String JSON = "application/json";
    private static final String PROMETHEUS_TEXT = "text/plain; version=0.0.4; charset=utf-8";

    private final MetricsEngine engine;
    private final PrometheusMeterRegistry registry;
    private final ObjectMapper mapper = EngineEventSerializer.newObjectMapper();

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthServer(MetricsEngine engine, PrometheusMeterRegistry registry) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to; 0 picks a free port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", exchange -> respond(exchange, 200, JSON, UP));
            server.createContext("/readiness", this::handleReadiness);
            server.createContext("/stats", this::handleStats);
            server.createContext("/metrics", this::handleMetrics);

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", port());
        } catch (IOException e) {
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Health server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or -1 if the server is not running
     */
    public int port() {
        return running.get() ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleReadiness(HttpExchange exchange) throws IOException {
        if (engine.isRunning()) {
            respond(exchange, 200, JSON, UP);
        } else {
            respond(exchange, 503, JSON, DOWN);
        }
    }

    private void handleStats(HttpExchange exchange) throws IOException {
        respond(exchange, 200, JSON, mapper.writeValueAsBytes(engine.systemStats()));
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        respond(exchange, 200, PROMETHEUS_TEXT, registry.scrape().getBytes(StandardCharsets.UTF_8));
    }

    private static void respond(HttpExchange exchange, int status, String contentType, byte[] body)
            throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
