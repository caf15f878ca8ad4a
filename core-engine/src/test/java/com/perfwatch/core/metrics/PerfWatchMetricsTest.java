package com.perfwatch.core.metrics;

import com.perfwatch.core.model.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PerfWatchMetrics}.
 */
class PerfWatchMetricsTest {

    private SimpleMeterRegistry registry;
    private PerfWatchMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PerfWatchMetrics(registry);
    }

    @Test
    @DisplayName("Should register every counter up front at zero")
    void shouldRegisterCounters() {
        assertThat(registry.get("perfwatch.samples.recorded").counter().count()).isZero();
        assertThat(registry.get("perfwatch.samples.skipped").counter().count()).isZero();
        assertThat(registry.get("perfwatch.trend.events").counter().count()).isZero();
        assertThat(registry.get("perfwatch.publish.failures").counter().count()).isZero();
        assertThat(registry.get("perfwatch.alerts.raised").counters()).hasSize(Severity.values().length);
    }

    @Test
    @DisplayName("Should count alerts per severity")
    void shouldTagAlertsBySeverity() {
        metrics.recordAlert(Severity.WARNING);
        metrics.recordAlert(Severity.WARNING);
        metrics.recordAlert(Severity.CRITICAL);

        assertThat(metrics.alertsRaised(Severity.WARNING)).isEqualTo(2);
        assertThat(metrics.alertsRaised(Severity.CRITICAL)).isEqualTo(1);
        assertThat(metrics.alertsRaised(Severity.INFO)).isZero();
        assertThat(registry.get("perfwatch.alerts.raised").tag("severity", "warning").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should share one dropped counter per channel and sum across channels")
    void shouldSumDroppedEvents() {
        Counter alerts = metrics.droppedCounter("alerts");
        alerts.increment();
        metrics.droppedCounter("alerts").increment();
        metrics.droppedCounter("trends").increment(3);

        assertThat(metrics.droppedCounter("alerts")).isSameAs(alerts);
        assertThat(alerts.count()).isEqualTo(2.0);
        assertThat(metrics.droppedEvents()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should report zero dropped events before any channel exists")
    void shouldReportNoDropsInitially() {
        assertThat(metrics.droppedEvents()).isZero();
    }

    @Test
    @DisplayName("Should time cycles under their own tag")
    void shouldTimeCycles() {
        Timer monitoring = metrics.cycleTimer(PerfWatchMetrics.CYCLE_MONITORING);
        monitoring.record(Duration.ofMillis(40));
        monitoring.record(Duration.ofMillis(60));
        metrics.cycleTimer(PerfWatchMetrics.CYCLE_TREND).record(Duration.ofMillis(5));

        assertThat(monitoring.count()).isEqualTo(2);
        assertThat(monitoring.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(100.0);
        assertThat(registry.get("perfwatch.cycle.latency").timers()).hasSize(2);
    }

    @Test
    @DisplayName("Should read back simple counters as whole numbers")
    void shouldReadBackCounts() {
        metrics.recordSampleRecorded();
        metrics.recordSampleRecorded();
        metrics.recordSampleSkipped();
        metrics.recordTrendEvent();
        metrics.recordPublishFailure();

        assertThat(metrics.samplesRecorded()).isEqualTo(2);
        assertThat(metrics.samplesSkipped()).isEqualTo(1);
        assertThat(metrics.trendEvents()).isEqualTo(1);
        assertThat(metrics.publishFailures()).isEqualTo(1);
    }
}
