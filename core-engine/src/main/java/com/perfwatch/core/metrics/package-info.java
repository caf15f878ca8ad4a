/**
 * Micrometer instrumentation of the engine and its host process.
 *
 * @since 1.0.0
 */
package com.perfwatch.core.metrics;
