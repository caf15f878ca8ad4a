/**
 * Composite performance scoring.
 *
 * @since 1.0.0
 */
package com.perfwatch.core.scoring;
