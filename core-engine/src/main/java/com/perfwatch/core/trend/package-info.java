/**
 * Score history and linear-regression trend detection.
 *
 * @since 1.0.0
 */
package com.perfwatch.core.trend;
