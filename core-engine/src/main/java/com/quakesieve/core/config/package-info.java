/**
 * Configuration loading and validation for Quake Sieve runs.
 *
 * <p>
 * A run is described in YAML and loaded by
 * {@link com.quakesieve.core.config.DeclusterConfigLoader} into a
 * {@link com.quakesieve.core.config.DeclusterConfig} instance. Validation
 * is performed automatically after parsing to ensure fail-fast behaviour.
 * </p>
 *
 * @since 1.0.0
 */
package com.quakesieve.core.config;
