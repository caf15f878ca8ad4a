package com.perfwatch.core.trend;

import com.perfwatch.core.model.TrendEvent;

/**
 * Receives trend changes detected by the engine.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface TrendListener {

    void onTrend(TrendEvent event);
}
