package com.perfwatch.core.aggregation;

import com.perfwatch.core.MutableClock;
import com.perfwatch.core.config.RetentionConfig;
import com.perfwatch.core.error.AggregationException;
import com.perfwatch.core.model.AggregatedBucket;
import com.perfwatch.core.model.MetricSample;
import com.perfwatch.core.model.Tier;
import com.perfwatch.core.store.MetricStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AggregationScheduler}.
 */
class AggregationSchedulerTest {

    private static final Instant HOUR_10 = Instant.parse("2024-03-04T10:00:00Z");
    private static final Instant HOUR_11 = Instant.parse("2024-03-04T11:00:00Z");

    private MutableClock clock;
    private MetricStore store;
    private AggregationScheduler scheduler;
    private ScheduledExecutorService executor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(HOUR_10);
        store = new MetricStore();
        scheduler = new AggregationScheduler(store, new RetentionConfig(), clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should roll 60 one-minute samples into one hourly bucket")
    void shouldAggregateHour() {
        for (int minute = 0; minute < 60; minute++) {
            store.record(new MetricSample("marketing", "responseTime", 10.0, HOUR_10.plusSeconds(minute * 60L)));
        }

        int committed = scheduler.runTier(Tier.HOURLY, HOUR_11);

        List<AggregatedBucket> buckets = store.query("marketing", "responseTime", Tier.HOURLY, HOUR_10, HOUR_11);
        assertThat(committed).isEqualTo(1);
        assertThat(buckets).hasSize(1);
        assertThat(buckets.get(0).getMean()).isEqualTo(10.0);
        assertThat(buckets.get(0).getSampleCount()).isEqualTo(60);
        assertThat(buckets.get(0).getWindowStart()).isEqualTo(HOUR_10);
        assertThat(buckets.get(0).getWindowEnd()).isEqualTo(HOUR_11);
        assertThat(scheduler.state(Tier.HOURLY)).isEqualTo(TierState.COMMITTED);
        assertThat(scheduler.lastCommittedWindowEnd(Tier.HOURLY)).contains(HOUR_11);
    }

    @Test
    @DisplayName("Should leave the open window alone")
    void shouldNotAggregateOpenWindow() {
        store.record(new MetricSample("marketing", "quality", 0.9, HOUR_10.plusSeconds(30)));

        assertThat(scheduler.runTier(Tier.HOURLY, HOUR_10.plus(Duration.ofMinutes(59)))).isZero();
        assertThat(store.size(Tier.HOURLY)).isZero();
        assertThat(scheduler.state(Tier.HOURLY)).isEqualTo(TierState.IDLE);
    }

    @Test
    @DisplayName("Should cascade into a daily bucket whose mean equals the raw mean")
    void shouldCascadeWithWeightedMean() {
        Instant nextDay = Instant.parse("2024-03-05T00:00:00Z");
        for (int i = 0; i < 30; i++) {
            store.record(new MetricSample("marketing", "quality", 1.0, HOUR_10.plusSeconds(i * 60L)));
        }
        for (int i = 0; i < 10; i++) {
            store.record(new MetricSample("marketing", "quality", 5.0, HOUR_11.plusSeconds(i * 60L)));
        }

        scheduler.runTier(Tier.HOURLY, nextDay);
        scheduler.runTier(Tier.DAILY, nextDay);

        List<AggregatedBucket> daily = store.query("marketing", "quality", Tier.DAILY,
                Instant.parse("2024-03-04T00:00:00Z"), nextDay);
        assertThat(daily).hasSize(1);
        assertThat(daily.get(0).getSampleCount()).isEqualTo(40);
        assertThat(daily.get(0).getMean()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    @DisplayName("Should hold the daily window until the hourly tier has closed its last hour")
    void shouldWaitForSourceTierBeforeDailyCommit() {
        Instant dayStart = Instant.parse("2024-03-04T00:00:00Z");
        Instant nextDay = Instant.parse("2024-03-05T00:00:00Z");
        Instant hour23 = Instant.parse("2024-03-04T23:00:00Z");
        for (int i = 0; i < 10; i++) {
            store.record(new MetricSample("marketing", "quality", 1.0, HOUR_10.plusSeconds(i * 60L)));
            store.record(new MetricSample("marketing", "quality", 5.0, hour23.plusSeconds(i * 60L)));
        }

        scheduler.runTier(Tier.HOURLY, hour23.plus(Duration.ofMinutes(30)));
        assertThat(scheduler.runTier(Tier.DAILY, nextDay.plusMillis(1))).isZero();
        assertThat(store.size(Tier.DAILY)).isZero();

        scheduler.runTier(Tier.HOURLY, nextDay.plusMillis(2));
        assertThat(scheduler.runTier(Tier.DAILY, nextDay.plus(Duration.ofHours(1)))).isEqualTo(1);

        List<AggregatedBucket> daily = store.query("marketing", "quality", Tier.DAILY, dayStart, nextDay);
        assertThat(daily).hasSize(1);
        assertThat(daily.get(0).getSampleCount()).isEqualTo(20);
        assertThat(daily.get(0).getMean()).isCloseTo(3.0, within(1e-9));
    }

    @Test
    @DisplayName("Should not build daily buckets before any hourly commit")
    void shouldNotRunDailyWithoutHourlyCommit() {
        store.record(new MetricSample("marketing", "quality", 0.8, HOUR_10.plusSeconds(10)));
        store.writeBucket(new AggregatedBucket("marketing", "quality", Tier.HOURLY,
                HOUR_10, HOUR_11, 0.8, 4));

        assertThat(scheduler.runTier(Tier.DAILY, Instant.parse("2024-03-06T00:00:00Z"))).isZero();
        assertThat(scheduler.lastCommittedWindowEnd(Tier.DAILY)).isEmpty();
    }

    @Test
    @DisplayName("Should close the day from the hourly run at midnight")
    void shouldCascadeFromHourlyRun() {
        Instant nextDay = Instant.parse("2024-03-05T00:00:00Z");
        store.record(new MetricSample("marketing", "quality", 2.0, HOUR_10.plusSeconds(10)));
        store.record(new MetricSample("marketing", "quality", 4.0, Instant.parse("2024-03-04T23:59:00Z")));

        int committed = scheduler.runCascade(Tier.HOURLY, nextDay);

        assertThat(committed).isEqualTo(15);
        assertThat(scheduler.lastCommittedWindowEnd(Tier.DAILY)).contains(nextDay);
        assertThat(scheduler.lastCommittedWindowEnd(Tier.WEEKLY)).isEmpty();
        List<AggregatedBucket> daily = store.query("marketing", "quality", Tier.DAILY,
                Instant.parse("2024-03-04T00:00:00Z"), nextDay);
        assertThat(daily).singleElement()
                .satisfies(b -> assertThat(b.getMean()).isCloseTo(3.0, within(1e-9)));
    }

    @Test
    @DisplayName("Should catch up on every closed window since the last commit")
    void shouldCatchUpMissedWindows() {
        store.record(new MetricSample("marketing", "quality", 0.5, HOUR_10.plusSeconds(10)));
        store.record(new MetricSample("marketing", "quality", 0.7, HOUR_11.plusSeconds(10)));

        int committed = scheduler.runTier(Tier.HOURLY, HOUR_11.plus(Duration.ofHours(2)));

        assertThat(committed).isEqualTo(3);
        assertThat(store.query("marketing", "quality", Tier.HOURLY, HOUR_10, HOUR_11.plus(Duration.ofHours(2))))
                .extracting(AggregatedBucket::getMean)
                .containsExactly(0.5, 0.7);
    }

    @Test
    @DisplayName("Should keep a failed window uncommitted and retry it on the next run")
    void shouldRetryFailedWindow() {
        AtomicInteger attempts = new AtomicInteger();
        AggregationScheduler flaky = new AggregationScheduler(store, new RetentionConfig(), clock, bucket -> {
            if (attempts.getAndIncrement() == 0) {
                throw new IllegalStateException("store unavailable");
            }
            store.writeBucket(bucket);
        });
        store.record(new MetricSample("marketing", "quality", 0.8, HOUR_10.plusSeconds(10)));

        assertThatThrownBy(() -> flaky.runTier(Tier.HOURLY, HOUR_11))
                .isInstanceOfSatisfying(AggregationException.class, e -> {
                    assertThat(e.getTier()).isEqualTo(Tier.HOURLY);
                    assertThat(e.getWindowStart()).isEqualTo(HOUR_10);
                });
        assertThat(flaky.state(Tier.HOURLY)).isEqualTo(TierState.IDLE);
        assertThat(flaky.lastCommittedWindowEnd(Tier.HOURLY)).isEmpty();

        assertThat(flaky.runTier(Tier.HOURLY, HOUR_11.plusSeconds(5))).isEqualTo(1);
        assertThat(store.size(Tier.HOURLY)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not commit anything after being stopped")
    void shouldNotCommitAfterStop() {
        store.record(new MetricSample("marketing", "quality", 0.8, HOUR_10.plusSeconds(10)));

        scheduler.stop();

        assertThat(scheduler.runTier(Tier.HOURLY, HOUR_11)).isZero();
        assertThat(store.size(Tier.HOURLY)).isZero();
    }

    @Test
    @DisplayName("Should purge every tier against its retention horizon")
    void shouldPurgeExpired() {
        store.record(new MetricSample("marketing", "quality", 0.8, HOUR_10));
        store.record(new MetricSample("marketing", "quality", 0.8, HOUR_11));
        store.writeBucket(new AggregatedBucket("marketing", "quality", Tier.HOURLY,
                HOUR_10.minus(Duration.ofDays(2)), HOUR_11.minus(Duration.ofDays(2)), 0.8, 1));

        int removed = scheduler.purgeExpired(HOUR_11.plus(Duration.ofMinutes(30)));

        assertThat(removed).isEqualTo(2);
        assertThat(store.size(Tier.REALTIME)).isEqualTo(1);
        assertThat(store.size(Tier.HOURLY)).isZero();
    }

    @Test
    @DisplayName("Should reject the realtime tier")
    void shouldRejectRealtimeTier() {
        assertThatThrownBy(() -> scheduler.runTier(Tier.REALTIME, HOUR_11))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should fire the hourly timer at the next hour boundary")
    void shouldFireOnBoundary() throws InterruptedException {
        store.record(new MetricSample("marketing", "quality", 0.8, HOUR_10.plusSeconds(10)));
        clock.set(HOUR_11.minusMillis(200));
        executor = Executors.newSingleThreadScheduledExecutor();

        scheduler.start(executor);
        clock.set(HOUR_11);

        long deadline = System.currentTimeMillis() + 5_000;
        while (scheduler.lastCommittedWindowEnd(Tier.HOURLY).isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(scheduler.lastCommittedWindowEnd(Tier.HOURLY)).contains(HOUR_11);
    }
}
