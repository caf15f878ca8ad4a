/**
 * Domain model classes for PerfWatch.
 *
 * <p>
 * This package contains the immutable value types shared between the engine
 * components and the service layer:
 * </p>
 * <ul>
 * <li>{@link com.perfwatch.core.model.MetricSample} and
 * {@link com.perfwatch.core.model.AggregatedBucket}: raw and rolled-up
 * measurements</li>
 * <li>{@link com.perfwatch.core.model.MonitoredEntity} and
 * {@link com.perfwatch.core.model.Baseline}: what is monitored and what
 * "normal" looks like</li>
 * <li>{@link com.perfwatch.core.model.Alert} and
 * {@link com.perfwatch.core.model.TrendEvent}: events pushed to
 * subscribers</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.perfwatch.core.model;
