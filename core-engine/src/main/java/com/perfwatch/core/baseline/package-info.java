/**
 * Per-metric reference values.
 */
package com.perfwatch.core.baseline;
