/**
 * Ordered, buffered delivery of alerts and trend events to subscribers.
 *
 * @since 1.0.0
 */
package com.perfwatch.core.event;
