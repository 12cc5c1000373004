/**
 * Engine configuration and YAML rule loading.
 *
 * <p>
 * {@link com.visionsentinel.core.config.EngineConfig} holds the immutable
 * tuning parameters passed to every component. Alarm rules and the
 * algorithm catalog are defined in YAML and loaded by
 * {@link com.visionsentinel.core.config.RulesLoader} into a
 * {@link com.visionsentinel.core.config.RulesConfig}; validation runs
 * automatically after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.visionsentinel.core.config;
