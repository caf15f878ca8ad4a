package com.perfwatch.core.error;

import com.perfwatch.core.model.Tier;

import java.time.Instant;

/**
 * Raised when rolling one window into a tier fails. The window stays
 * uncommitted and is retried on the tier's next tick.
 *
 * @since 1.0.0
 */
public class AggregationException extends MetricsException {

    private static final long serialVersionUID = 1L;

    private final Tier tier;
    private final Instant windowStart;

    public AggregationException(Tier tier, Instant windowStart, Throwable cause) {
        super("Aggregation of " + tier + " window starting " + windowStart + " failed: "
                + (cause != null ? cause.getMessage() : "unknown cause"), cause);
        this.tier = tier;
        this.windowStart = windowStart;
    }

    public Tier getTier() {
        return tier;
    }

    public Instant getWindowStart() {
        return windowStart;
    }
}
