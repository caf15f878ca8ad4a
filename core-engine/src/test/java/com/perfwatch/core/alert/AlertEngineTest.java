package com.perfwatch.core.alert;

import com.perfwatch.core.MutableClock;
import com.perfwatch.core.baseline.BaselineManager;
import com.perfwatch.core.config.AlertThresholds;
import com.perfwatch.core.config.MetricCatalog;
import com.perfwatch.core.model.Alert;
import com.perfwatch.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AlertEngine}.
 */
class AlertEngineTest {

    private static final Instant T0 = Instant.parse("2024-03-04T10:00:00Z");

    private MutableClock clock;
    private BaselineManager baselines;
    private List<Alert> published;
    private AlertEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        baselines = new BaselineManager(clock);
        published = new ArrayList<>();
        engine = new AlertEngine(baselines, MetricCatalog.defaults(), new AlertThresholds(),
                Duration.ofHours(24), clock, published::add);
    }

    @Test
    @DisplayName("Should raise CRITICAL when quality drops from 0.80 to 0.68")
    void shouldRaiseCriticalOnQualityDrop() {
        baselines.establish("marketing", "quality", 0.80, false);

        Optional<Alert> alert = engine.evaluate("marketing", "quality", 0.68);

        assertThat(alert).isPresent();
        assertThat(alert.get().getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(alert.get().getDeviationPct()).isCloseTo(15.0, within(1e-6));
        assertThat(alert.get().getBaselineValue()).isEqualTo(0.80);
        assertThat(alert.get().getCurrentValue()).isEqualTo(0.68);
        assertThat(alert.get().getTimestamp()).isEqualTo(T0);
        assertThat(alert.get().isAcknowledged()).isFalse();
        assertThat(published).containsExactly(alert.get());
    }

    @Test
    @DisplayName("Should raise CRITICAL when response time rises from 1000 to 1200")
    void shouldRaiseCriticalOnResponseTimeRise() {
        baselines.establish("marketing", "responseTime", 1000.0, false);

        Optional<Alert> alert = engine.evaluate("marketing", "responseTime", 1200.0);

        assertThat(alert).map(Alert::getSeverity).contains(Severity.CRITICAL);
        assertThat(alert.get().getDeviationPct()).isCloseTo(20.0, within(1e-6));
    }

    @Test
    @DisplayName("Should not alert when a lower-is-better metric improves")
    void shouldIgnoreImprovementOfLowerIsBetter() {
        baselines.establish("marketing", "responseTime", 1000.0, false);

        assertThat(engine.evaluate("marketing", "responseTime", 500.0)).isEmpty();
        assertThat(published).isEmpty();
    }

    @Test
    @DisplayName("Should not alert when a higher-is-better metric improves")
    void shouldIgnoreImprovementOfHigherIsBetter() {
        baselines.establish("marketing", "quality", 0.80, false);

        assertThat(engine.evaluate("marketing", "quality", 0.95)).isEmpty();
    }

    @Test
    @DisplayName("Should classify each severity band with inclusive thresholds")
    void shouldClassifyBands() {
        baselines.establish("marketing", "efficiency", 1.0, false);

        assertThat(engine.evaluate("marketing", "efficiency", 0.97)).isEmpty();
        assertThat(engine.evaluate("marketing", "efficiency", 0.95)).map(Alert::getSeverity).contains(Severity.INFO);
        assertThat(engine.evaluate("marketing", "efficiency", 0.92)).map(Alert::getSeverity).contains(Severity.INFO);
        assertThat(engine.evaluate("marketing", "efficiency", 0.90)).map(Alert::getSeverity).contains(Severity.WARNING);
        assertThat(engine.evaluate("marketing", "efficiency", 0.86)).map(Alert::getSeverity).contains(Severity.WARNING);
        assertThat(engine.evaluate("marketing", "efficiency", 0.85)).map(Alert::getSeverity).contains(Severity.CRITICAL);
        assertThat(engine.evaluate("marketing", "efficiency", 0.10)).map(Alert::getSeverity).contains(Severity.CRITICAL);
    }

    @Test
    @DisplayName("Should never lower severity as deviation grows")
    void shouldBeMonotonicInDeviation() {
        AlertThresholds thresholds = new AlertThresholds();
        Severity previous = null;
        for (int i = 0; i <= 100; i++) {
            double deviation = i / 200.0;
            Severity current = AlertEngine.classify(thresholds, deviation).orElse(null);
            if (previous != null) {
                assertThat(current).isNotNull();
                assertThat(current.compareTo(previous)).isGreaterThanOrEqualTo(0);
            }
            previous = current;
        }
        assertThat(previous).isEqualTo(Severity.CRITICAL);
    }

    @Test
    @DisplayName("Should skip evaluation without a baseline")
    void shouldSkipWithoutBaseline() {
        assertThat(engine.evaluate("marketing", "quality", 0.1)).isEmpty();
        assertThat(engine.alerts()).isEmpty();
    }

    @Test
    @DisplayName("Should skip evaluation when the baseline is zero")
    void shouldSkipZeroBaseline() {
        baselines.establish("marketing", "errorRate", 0.0, false);

        assertThat(engine.evaluate("marketing", "errorRate", 0.05)).isEmpty();
    }

    @Test
    @DisplayName("Should raise a new alert on every evaluation of a persisting deviation")
    void shouldRepeatAlerts() {
        baselines.establish("marketing", "quality", 0.80, false);

        engine.evaluate("marketing", "quality", 0.50);
        engine.evaluate("marketing", "quality", 0.50);

        assertThat(published).hasSize(2);
        assertThat(published.get(0).getId()).isNotEqualTo(published.get(1).getId());
    }

    @Test
    @DisplayName("Should acknowledge an alert in the index without touching the published copy")
    void shouldAcknowledge() {
        baselines.establish("marketing", "quality", 0.80, false);
        Alert raised = engine.evaluate("marketing", "quality", 0.50).orElseThrow();

        Optional<Alert> acknowledged = engine.acknowledge(raised.getId());

        assertThat(acknowledged).map(Alert::isAcknowledged).contains(true);
        assertThat(raised.isAcknowledged()).isFalse();
        assertThat(engine.activeAlerts()).isEmpty();
        assertThat(engine.alerts("marketing")).hasSize(1);
        assertThat(engine.acknowledge("unknown")).isEmpty();
    }

    @Test
    @DisplayName("Should purge alerts older than the retention period")
    void shouldPurgeExpiredAlerts() {
        baselines.establish("marketing", "quality", 0.80, false);
        engine.evaluate("marketing", "quality", 0.50);
        clock.advance(Duration.ofHours(23));
        engine.evaluate("marketing", "quality", 0.50);

        int removed = engine.purgeExpired(T0.plus(Duration.ofHours(25)));

        assertThat(removed).isEqualTo(1);
        assertThat(engine.alerts()).hasSize(1);
    }

    @Test
    @DisplayName("Should keep alerting when the sink throws")
    void shouldIsolateSinkFailure() {
        AlertEngine failing = new AlertEngine(baselines, MetricCatalog.defaults(), new AlertThresholds(),
                Duration.ofHours(24), clock, a -> {
                    throw new IllegalStateException("sink down");
                });
        baselines.establish("marketing", "quality", 0.80, false);

        assertThat(failing.evaluate("marketing", "quality", 0.50)).isPresent();
        assertThat(failing.size()).isEqualTo(1);
    }
}
