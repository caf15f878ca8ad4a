package com.perfwatch.core.model;

/**
 * Alert severity, declared from least to most severe.
 *
 * @since 1.0.0
 */
public enum Severity {
    INFO,
    WARNING,
    CRITICAL
}
