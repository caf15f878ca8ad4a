package com.perfwatch.core.model;

/**
 * Direction of a composite score or a single metric over its analysis window.
 *
 * @since 1.0.0
 */
public enum TrendDirection {
    IMPROVING,
    DECLINING,
    STABLE
}
