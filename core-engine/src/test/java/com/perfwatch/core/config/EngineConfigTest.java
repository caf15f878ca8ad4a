package com.perfwatch.core.config;

import com.perfwatch.core.model.MetricDirection;
import com.perfwatch.core.model.Tier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EngineConfig} validation and {@link MetricCatalog}.
 */
class EngineConfigTest {

    @Test
    @DisplayName("Should accept the default configuration")
    void shouldAcceptDefaults() {
        assertThatCode(() -> new EngineConfig().validate()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should expose default retention horizons per tier")
    void shouldExposeRetentionHorizons() {
        RetentionConfig retention = new RetentionConfig();

        assertThat(retention.horizon(Tier.REALTIME)).isEqualTo(Duration.ofHours(1));
        assertThat(retention.horizon(Tier.HOURLY)).isEqualTo(Duration.ofHours(24));
        assertThat(retention.horizon(Tier.DAILY)).isEqualTo(Duration.ofDays(7));
        assertThat(retention.horizon(Tier.WEEKLY)).isEqualTo(Duration.ofDays(30));
    }

    @Test
    @DisplayName("Should reject an hourly retention shorter than one day")
    void shouldRejectShortHourlyRetention() {
        EngineConfig config = new EngineConfig();
        config.getRetention().setHourlyMs(Duration.ofHours(2).toMillis());

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("retention.hourlyMs");
    }

    @Test
    @DisplayName("Should reject a realtime retention shorter than one hour")
    void shouldRejectShortRealtimeRetention() {
        EngineConfig config = new EngineConfig();
        config.getRetention().setRealtimeMs(Duration.ofMinutes(30).toMillis());

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("retention.realtimeMs");
    }

    @Test
    @DisplayName("Should accept a realtime retention of exactly one hour")
    void shouldAcceptOneHourRealtimeRetention() {
        EngineConfig config = new EngineConfig();
        config.getRetention().setRealtimeMs(Duration.ofHours(1).toMillis());

        assertThatCode(config::validate).doesNotThrowAnyException();
        assertThat(config.getRetention().horizon(Tier.REALTIME)).isEqualTo(Duration.ofHours(1));
    }

    @Test
    @DisplayName("Should reject a lower-is-better metric without a cap")
    void shouldRequireCapForLowerIsBetter() {
        EngineConfig config = new EngineConfig();
        config.setMetrics(List.of(new MetricDefinition("queueDepth", "lower", null)));

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("requires 'cap'");
    }

    @Test
    @DisplayName("Should reject an unknown metric direction")
    void shouldRejectUnknownDirection() {
        EngineConfig config = new EngineConfig();
        config.setMetrics(List.of(new MetricDefinition("queueDepth", "sideways", 10.0)));

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Unknown metric direction");
    }

    @Test
    @DisplayName("Should reject entity weights that do not sum to 1")
    void shouldRejectBadWeightSum() {
        EntityDefinition entity = new EntityDefinition();
        entity.setId("sales");
        entity.setWeights(Map.of("efficiency", 0.5, "quality", 0.2));
        EngineConfig config = new EngineConfig();
        config.setEntities(List.of(entity));

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must sum to 1");
    }

    @Test
    @DisplayName("Should know the built-in metric directions and caps")
    void shouldProvideDefaultCatalog() {
        MetricCatalog catalog = MetricCatalog.defaults();

        assertThat(catalog.direction("efficiency")).isEqualTo(MetricDirection.HIGHER_IS_BETTER);
        assertThat(catalog.direction("responseTime")).isEqualTo(MetricDirection.LOWER_IS_BETTER);
        assertThat(catalog.cap("responseTime")).hasValue(2000.0);
        assertThat(catalog.cap("errorRate")).hasValue(0.1);
        assertThat(catalog.cap("quality")).isEmpty();
    }

    @Test
    @DisplayName("Should treat unknown metrics as higher-is-better ratios")
    void shouldDefaultUnknownMetrics() {
        MetricCatalog catalog = MetricCatalog.defaults();

        assertThat(catalog.direction("throughput")).isEqualTo(MetricDirection.HIGHER_IS_BETTER);
        assertThat(catalog.cap("throughput")).isEmpty();
    }

    @Test
    @DisplayName("Should let a configured metric replace a built-in one")
    void shouldOverrideBuiltIn() {
        MetricCatalog catalog = MetricCatalog.of(List.of(new MetricDefinition("responseTime", "lower", 500.0)));

        assertThat(catalog.cap("responseTime")).hasValue(500.0);
    }
}
