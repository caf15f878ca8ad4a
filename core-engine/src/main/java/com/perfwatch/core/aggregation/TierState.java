package com.perfwatch.core.aggregation;

/**
 * Lifecycle of one tier's aggregation job.
 *
 * <pre>
 * IDLE -&gt; AGGREGATING -&gt; COMMITTED -&gt; AGGREGATING -&gt; ...
 *              \-&gt; IDLE (a window failed)
 * </pre>
 *
 * @since 1.0.0
 */
public enum TierState {

    /** Never ran, or the last run failed. */
    IDLE,

    /** A run is in progress. */
    AGGREGATING,

    /** The last run committed at least one window. */
    COMMITTED
}
