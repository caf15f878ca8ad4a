package com.perfwatch.core.config;

import com.perfwatch.core.model.Tier;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Retention horizon of every store tier, in milliseconds.
 *
 * <pre>
 * retention:
 *   realtimeMs: 3600000
 *   hourlyMs: 86400000
 *   dailyMs: 604800000
 *   weeklyMs: 2592000000
 * </pre>
 *
 * @since 1.0.0
 */
public class RetentionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private long realtimeMs = Duration.ofHours(1).toMillis();
    private long hourlyMs = Duration.ofHours(24).toMillis();
    private long dailyMs = Duration.ofDays(7).toMillis();
    private long weeklyMs = Duration.ofDays(30).toMillis();

    /**
     * @param tier store tier
     * @return how long records of that tier are kept
     */
    public Duration horizon(Tier tier) {
        return Duration.ofMillis(switch (tier) {
            case REALTIME -> realtimeMs;
            case HOURLY -> hourlyMs;
            case DAILY -> dailyMs;
            case WEEKLY -> weeklyMs;
        });
    }

    void validate(List<String> errors) {
        for (Tier tier : Tier.values()) {
            if (horizon(tier).toMillis() <= 0) {
                errors.add("retention for tier " + tier + " must be > 0");
            }
        }
        // a tier must outlive one window of the tier built from it
        if (realtimeMs < Tier.HOURLY.window().toMillis()) {
            errors.add("retention.realtimeMs must cover at least one hour so hourly buckets can be built");
        }
        if (hourlyMs < Tier.DAILY.window().toMillis()) {
            errors.add("retention.hourlyMs must cover at least one day so daily buckets can be built");
        }
        if (dailyMs < Tier.WEEKLY.window().toMillis()) {
            errors.add("retention.dailyMs must cover at least one week so weekly buckets can be built");
        }
    }

    public long getRealtimeMs() {
        return realtimeMs;
    }

    public void setRealtimeMs(long realtimeMs) {
        this.realtimeMs = realtimeMs;
    }

    public long getHourlyMs() {
        return hourlyMs;
    }

    public void setHourlyMs(long hourlyMs) {
        this.hourlyMs = hourlyMs;
    }

    public long getDailyMs() {
        return dailyMs;
    }

    public void setDailyMs(long dailyMs) {
        this.dailyMs = dailyMs;
    }

    public long getWeeklyMs() {
        return weeklyMs;
    }

    public void setWeeklyMs(long weeklyMs) {
        this.weeklyMs = weeklyMs;
    }

    @Override
    public String toString() {
        return "RetentionConfig{" +
                "realtimeMs=" + realtimeMs +
                ", hourlyMs=" + hourlyMs +
                ", dailyMs=" + dailyMs +
                ", weeklyMs=" + weeklyMs +
                '}';
    }
}
