/**
 * Engine configuration loading and validation.
 *
 * <p>
 * Settings, metric definitions and entity registrations are defined in YAML
 * and loaded by {@link com.perfwatch.core.config.EngineConfigLoader} into an
 * {@link com.perfwatch.core.config.EngineConfig} instance, which is
 * validated right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.perfwatch.core.config;
