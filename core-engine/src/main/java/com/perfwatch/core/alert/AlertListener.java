package com.perfwatch.core.alert;

import com.perfwatch.core.model.Alert;

/**
 * Receives alerts raised by the engine.
 *
 * <p>
 * Called on the subscriber's own delivery thread, in the order the alerts
 * were raised. Exceptions are logged and do not affect other subscribers.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AlertListener {

    void onAlert(Alert alert);
}
