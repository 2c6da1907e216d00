/**
 * Magnitude-dependent space-time window models.
 *
 * @since 1.0.0
 */
package com.quakesieve.core.window;
