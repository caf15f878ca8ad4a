package com.perfwatch.core.store;

import com.perfwatch.core.model.AggregatedBucket;
import com.perfwatch.core.model.MetricSample;
import com.perfwatch.core.model.Tier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MetricStore}.
 */
class MetricStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-04T10:00:00Z");

    private MetricStore store;

    @BeforeEach
    void setUp() {
        store = new MetricStore();
    }

    @Test
    @DisplayName("Should return realtime samples as single-sample buckets in time order")
    void shouldQueryRealtimeInOrder() {
        store.record(sample("marketing", "quality", 0.7, T0.plusSeconds(20)));
        store.record(sample("marketing", "quality", 0.9, T0));
        store.record(sample("marketing", "quality", 0.8, T0.plusSeconds(10)));

        List<AggregatedBucket> result = store.query("marketing", "quality", Tier.REALTIME,
                T0, T0.plusSeconds(60));

        assertThat(result).extracting(AggregatedBucket::getMean).containsExactly(0.9, 0.8, 0.7);
        assertThat(result).allSatisfy(b -> {
            assertThat(b.getSampleCount()).isEqualTo(1);
            assertThat(b.getTier()).isEqualTo(Tier.REALTIME);
        });
    }

    @Test
    @DisplayName("Should treat the query range as half-open")
    void shouldUseHalfOpenRange() {
        store.record(sample("marketing", "quality", 0.9, T0));
        store.record(sample("marketing", "quality", 0.8, T0.plusSeconds(60)));

        assertThat(store.querySamples("marketing", "quality", T0, T0.plusSeconds(60)))
                .extracting(MetricSample::getValue)
                .containsExactly(0.9);
    }

    @Test
    @DisplayName("Should overwrite a sample recorded twice with the same timestamp")
    void shouldBeIdempotentOnTimestamp() {
        store.record(sample("marketing", "quality", 0.9, T0));
        store.record(sample("marketing", "quality", 0.6, T0));

        List<MetricSample> samples = store.querySamples("marketing", "quality", T0, T0.plusSeconds(1));
        assertThat(samples).hasSize(1);
        assertThat(samples.get(0).getValue()).isEqualTo(0.6);
        assertThat(store.size(Tier.REALTIME)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should return an empty result for an unknown series")
    void shouldReturnEmptyForUnknownSeries() {
        assertThat(store.query("ghost", "quality", Tier.HOURLY, T0, T0.plusSeconds(3600))).isEmpty();
        assertThat(store.latestSample("ghost", "quality")).isEmpty();
    }

    @Test
    @DisplayName("Should reject a range whose start is after its end")
    void shouldRejectInvertedRange() {
        assertThatThrownBy(() -> store.query("marketing", "quality", Tier.REALTIME, T0.plusSeconds(1), T0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should not change a returned result when the store changes afterwards")
    void shouldReturnSnapshots() {
        store.record(sample("marketing", "quality", 0.9, T0));
        List<MetricSample> before = store.querySamples("marketing", "quality", T0, T0.plusSeconds(60));

        store.record(sample("marketing", "quality", 0.8, T0.plusSeconds(1)));

        assertThat(before).hasSize(1);
    }

    @Test
    @DisplayName("Should replace a bucket written twice for the same window")
    void shouldReplaceBucketForSameWindow() {
        store.record(sample("marketing", "quality", 0.5, T0));
        store.writeBucket(hourly("marketing", "quality", T0, 0.5, 10));
        store.writeBucket(hourly("marketing", "quality", T0, 0.6, 12));

        List<AggregatedBucket> buckets = store.query("marketing", "quality", Tier.HOURLY,
                T0, T0.plus(Duration.ofHours(1)));
        assertThat(buckets).hasSize(1);
        assertThat(buckets.get(0).getSampleCount()).isEqualTo(12);
    }

    @Test
    @DisplayName("Should refuse realtime buckets")
    void shouldRefuseRealtimeBuckets() {
        AggregatedBucket realtime = AggregatedBucket.ofSample(sample("marketing", "quality", 0.5, T0));

        assertThatThrownBy(() -> store.writeBucket(realtime))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should purge samples older than the cutoff and keep the rest")
    void shouldPurgeSamples() {
        store.record(sample("marketing", "quality", 0.9, T0));
        store.record(sample("marketing", "quality", 0.8, T0.plusSeconds(30)));
        store.record(sample("sales", "quality", 0.7, T0.plusSeconds(90)));

        int removed = store.purge(Tier.REALTIME, T0.plusSeconds(60));

        assertThat(removed).isEqualTo(2);
        assertThat(store.size(Tier.REALTIME)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should purge buckets by window end")
    void shouldPurgeBucketsByWindowEnd() {
        store.record(sample("marketing", "quality", 0.5, T0));
        store.writeBucket(hourly("marketing", "quality", T0, 0.5, 1));
        store.writeBucket(hourly("marketing", "quality", T0.plus(Duration.ofHours(1)), 0.5, 1));

        // first bucket ends exactly at the cutoff and is still kept
        assertThat(store.purge(Tier.HOURLY, T0.plus(Duration.ofHours(1)))).isZero();
        assertThat(store.purge(Tier.HOURLY, T0.plus(Duration.ofMinutes(61)))).isEqualTo(1);
        assertThat(store.size(Tier.HOURLY)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should find the oldest record of a tier")
    void shouldFindEarliest() {
        store.record(sample("marketing", "quality", 0.9, T0.plusSeconds(30)));
        store.record(sample("sales", "quality", 0.9, T0));

        assertThat(store.earliest(Tier.REALTIME)).contains(T0);
        assertThat(store.earliest(Tier.DAILY)).isEmpty();
    }

    @Test
    @DisplayName("Should drop every series of a removed entity")
    void shouldRemoveEntity() {
        store.record(sample("marketing", "quality", 0.9, T0));
        store.record(sample("marketing", "efficiency", 0.9, T0));
        store.record(sample("sales", "quality", 0.9, T0));

        assertThat(store.metricNames("marketing")).containsExactly("efficiency", "quality");
        assertThat(store.removeEntity("marketing")).isTrue();
        assertThat(store.entityIds()).containsExactly("sales");
        assertThat(store.removeEntity("marketing")).isFalse();
    }

    @Test
    @DisplayName("Should not bring a removed entity back through a late bucket write")
    void shouldDropBucketOfRemovedEntity() {
        store.record(sample("marketing", "quality", 0.9, T0));
        store.removeEntity("marketing");

        boolean written = store.writeBucket(hourly("marketing", "quality", T0, 0.9, 1));

        assertThat(written).isFalse();
        assertThat(store.entityIds()).isEmpty();
        assertThat(store.size(Tier.HOURLY)).isZero();
    }

    @Test
    @DisplayName("Should write a bucket for a new metric of a known entity")
    void shouldWriteBucketForKnownEntity() {
        store.record(sample("marketing", "quality", 0.9, T0));

        assertThat(store.writeBucket(hourly("marketing", "efficiency", T0, 0.4, 3))).isTrue();
        assertThat(store.metricNames("marketing")).containsExactly("efficiency", "quality");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static MetricSample sample(String entity, String metric, double value, Instant ts) {
        return new MetricSample(entity, metric, value, ts);
    }

    private static AggregatedBucket hourly(String entity, String metric, Instant start, double mean, long count) {
        return new AggregatedBucket(entity, metric, Tier.HOURLY, start, start.plus(Duration.ofHours(1)), mean, count);
    }
}
