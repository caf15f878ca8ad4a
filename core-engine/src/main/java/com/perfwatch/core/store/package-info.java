/**
 * In-memory, multi-resolution metric storage.
 *
 * <p>
 * {@link com.perfwatch.core.store.MetricStore} keeps raw samples in the
 * realtime tier and rolled-up buckets in the hourly, daily and weekly tiers.
 * </p>
 *
 * @since 1.0.0
 */
package com.perfwatch.core.store;
