/**
 * Spherical geodesy used by the declustering engines.
 *
 * @since 1.0.0
 */
package com.quakesieve.core.geo;
