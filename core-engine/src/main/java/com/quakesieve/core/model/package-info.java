/**
 * Domain model classes for Quake Sieve.
 *
 * <p>
 * This package contains the value types shared between the declustering
 * engines, the record layer and the CLI job:
 * </p>
 * <ul>
 * <li>{@link com.quakesieve.core.model.Event} — immutable catalog event</li>
 * <li>{@link com.quakesieve.core.model.Window} — space-time neighbourhood</li>
 * <li>{@link com.quakesieve.core.model.ClassificationState} — per-run mutable
 * tag and attribution</li>
 * <li>{@link com.quakesieve.core.model.DeclusteringResult} — the final
 * independent/dependent partition</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.quakesieve.core.model;
