/**
 * Unchecked exceptions raised by the engine.
 *
 * @since 1.0.0
 */
package com.perfwatch.core.error;
