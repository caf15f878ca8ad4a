package com.perfwatch.core.event;

/**
 * Handle of a registered listener. Closing it stops further deliveries;
 * events already queued for the listener are still delivered.
 *
 * @since 1.0.0
 */
public interface Subscription extends AutoCloseable {

    boolean isActive();

    @Override
    void close();
}
