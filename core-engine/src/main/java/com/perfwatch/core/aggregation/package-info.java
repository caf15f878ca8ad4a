/**
 * Scheduled roll-up of finer tiers into coarser ones and retention purging.
 *
 * @since 1.0.0
 */
package com.perfwatch.core.aggregation;
