/**
 * The {@link com.perfwatch.core.engine.MetricsEngine} facade and the report
 * types it produces.
 *
 * @since 1.0.0
 */
package com.perfwatch.core.engine;
