/**
 * Baseline deviation alerting.
 *
 * @since 1.0.0
 */
package com.perfwatch.core.alert;
