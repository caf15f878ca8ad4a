package com.perfwatch.core.model;

import java.util.Locale;

/**
 * Which way a metric moves when performance improves.
 *
 * @since 1.0.0
 */
public enum MetricDirection {

    /** Efficiency, quality, satisfaction and similar ratios. */
    HIGHER_IS_BETTER,

    /** Response time, error rate and similar costs. */
    LOWER_IS_BETTER;

    /**
     * Directional deviation of {@code current} from {@code baseline}.
     * Positive values mean performance got worse.
     *
     * @param baseline reference value; must not be zero
     * @param current  observed value
     * @return relative degradation
     */
    public double deviation(double baseline, double current) {
        return switch (this) {
            case HIGHER_IS_BETTER -> (baseline - current) / baseline;
            case LOWER_IS_BETTER -> (current - baseline) / baseline;
        };
    }

    /**
     * Accepts {@code higher}, {@code lower} or the constant names.
     *
     * @param value configuration value
     * @return the parsed direction
     * @throws IllegalArgumentException if the value is unknown
     */
    public static MetricDirection parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Metric direction must not be blank");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "higher", "higher_is_better" -> HIGHER_IS_BETTER;
            case "lower", "lower_is_better" -> LOWER_IS_BETTER;
            default -> throw new IllegalArgumentException(
                    "Unknown metric direction: '" + value + "'. Supported: higher, lower");
        };
    }
}
