package com.perfwatch.core.model;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Resolution level of the time-series store.
 *
 * <p>
 * Every tier above {@link #REALTIME} is built from the tier directly below
 * it: hourly buckets from raw samples, daily buckets from hourly buckets and
 * weekly buckets from daily buckets. Windows are aligned to UTC wall-clock
 * boundaries; weeks start on Monday.
 * </p>
 *
 * @since 1.0.0
 */
public enum Tier {

    REALTIME(Duration.ZERO),
    HOURLY(Duration.ofHours(1)),
    DAILY(Duration.ofDays(1)),
    WEEKLY(Duration.ofDays(7));

    private final Duration window;

    Tier(Duration window) {
        this.window = window;
    }

    /**
     * @return window length; zero for {@link #REALTIME}
     */
    public Duration window() {
        return window;
    }

    /**
     * @return {@code true} if this tier holds aggregated buckets
     */
    public boolean isAggregated() {
        return this != REALTIME;
    }

    /**
     * @return the tier this one is aggregated from
     * @throws IllegalStateException for {@link #REALTIME}
     */
    public Tier source() {
        return switch (this) {
            case HOURLY -> REALTIME;
            case DAILY -> HOURLY;
            case WEEKLY -> DAILY;
            case REALTIME -> throw new IllegalStateException("REALTIME tier has no source tier");
        };
    }

    /**
     * Start of the window containing {@code instant}.
     *
     * @param instant any instant
     * @return aligned window start
     * @throws IllegalStateException for {@link #REALTIME}
     */
    public Instant windowStart(Instant instant) {
        return switch (this) {
            case HOURLY -> instant.truncatedTo(ChronoUnit.HOURS);
            case DAILY -> instant.truncatedTo(ChronoUnit.DAYS);
            case WEEKLY -> instant.atZone(ZoneOffset.UTC)
                    .truncatedTo(ChronoUnit.DAYS)
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                    .toInstant();
            case REALTIME -> throw new IllegalStateException("REALTIME tier has no windows");
        };
    }

    /**
     * @param instant any instant
     * @return the first window boundary strictly after {@code instant}
     */
    public Instant nextBoundary(Instant instant) {
        return windowStart(instant).plus(window);
    }
}
