package com.perfwatch.core.error;

/**
 * Base class for failures reported by the metrics engine to its callers.
 *
 * @since 1.0.0
 */
public class MetricsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MetricsException(String message) {
        super(message);
    }

    public MetricsException(String message, Throwable cause) {
        super(message, cause);
    }
}
