package com.perfwatch.core.metrics;

import com.perfwatch.core.model.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Meters exposed by the engine and the service around it.
 *
 * <p>
 * The registry decides where the numbers go: the service binds a Prometheus
 * registry and serves it on {@code /metrics}, tests and embedded use fall
 * back to a simple in-memory registry.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code perfwatch.samples.recorded} counter of accepted samples</li>
 *   <li>{@code perfwatch.samples.skipped} counter of rejected input records</li>
 *   <li>{@code perfwatch.alerts.raised} counter of alerts, tagged by {@code severity}</li>
 *   <li>{@code perfwatch.trend.events} counter of published trend changes</li>
 *   <li>{@code perfwatch.events.dropped} counter of events lost to full
 *       subscriber queues, tagged by {@code channel}</li>
 *   <li>{@code perfwatch.publish.failures} counter of failed downstream sends</li>
 *   <li>{@code perfwatch.cycle.latency} timer of periodic work, tagged by {@code cycle}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class PerfWatchMetrics {

    public static final String CYCLE_MONITORING = "monitoring";
    public static final String CYCLE_TREND = "trend";
    public static final String CYCLE_MAINTENANCE = "maintenance";
    public static final String CYCLE_AGGREGATION = "aggregation";

    private final MeterRegistry registry;

    private final Counter samplesRecorded;
    private final Counter samplesSkipped;
    private final Counter trendEvents;
    private final Counter publishFailures;
    private final Map<Severity, Counter> alertsRaised = new EnumMap<>(Severity.class);

    public PerfWatchMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");

        samplesRecorded = Counter.builder("perfwatch.samples.recorded")
                .description("Samples accepted by the engine")
                .register(registry);
        samplesSkipped = Counter.builder("perfwatch.samples.skipped")
                .description("Input records rejected before or during ingestion")
                .register(registry);
        trendEvents = Counter.builder("perfwatch.trend.events")
                .description("Trend changes published to subscribers")
                .register(registry);
        publishFailures = Counter.builder("perfwatch.publish.failures")
                .description("Events that could not be sent downstream")
                .register(registry);
        for (Severity severity : Severity.values()) {
            alertsRaised.put(severity, Counter.builder("perfwatch.alerts.raised")
                    .description("Alerts raised by baseline evaluation")
                    .tag("severity", severity.name().toLowerCase(Locale.ROOT))
                    .register(registry));
        }
    }

    public MeterRegistry registry() {
        return registry;
    }

    public void recordSampleRecorded() {
        samplesRecorded.increment();
    }

    public void recordSampleSkipped() {
        samplesSkipped.increment();
    }

    public void recordAlert(Severity severity) {
        alertsRaised.get(Objects.requireNonNull(severity, "severity must not be null")).increment();
    }

    public void recordTrendEvent() {
        trendEvents.increment();
    }

    public void recordPublishFailure() {
        publishFailures.increment();
    }

    /**
     * Counter of events a dispatcher dropped on {@code channel}. Meters are
     * shared, so asking twice for one channel yields the same counter.
     */
    public Counter droppedCounter(String channel) {
        return Counter.builder("perfwatch.events.dropped")
                .description("Events dropped because a subscriber queue was full")
                .tag("channel", Objects.requireNonNull(channel, "channel must not be null"))
                .register(registry);
    }

    public Timer cycleTimer(String cycle) {
        return Timer.builder("perfwatch.cycle.latency")
                .description("Duration of periodic engine work")
                .tag("cycle", Objects.requireNonNull(cycle, "cycle must not be null"))
                .register(registry);
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    // ---------------------------------------------------------------
    // Read-back
    // ---------------------------------------------------------------

    public long samplesRecorded() {
        return (long) samplesRecorded.count();
    }

    public long samplesSkipped() {
        return (long) samplesSkipped.count();
    }

    public long alertsRaised(Severity severity) {
        return (long) alertsRaised.get(severity).count();
    }

    public long trendEvents() {
        return (long) trendEvents.count();
    }

    public long publishFailures() {
        return (long) publishFailures.count();
    }

    /**
     * @return events dropped across every channel
     */
    public long droppedEvents() {
        return (long) registry.find("perfwatch.events.dropped").counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }
}
