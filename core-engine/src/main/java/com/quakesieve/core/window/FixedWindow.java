package com.quakesieve.core.window;

import com.quakesieve.core.model.Window;

/**
 * Constant window, independent of magnitude.
 *
 * <p>
 * Degenerates the pairwise search to a uniform radius/time test. The
 * defaults (83.2 km, 95.6 days) are the values used for the "informed"
 * fixed-window runs.
 * </p>
 *
 * @since 1.0.0
 */
public final class FixedWindow implements WindowModel {

    public static final double DEFAULT_RADIUS_KM = 83.2;
    public static final double DEFAULT_WINDOW_DAYS = 95.6;

    private final Window window;

    /**
     * @param radiusKm   spatial radius in km; must be &gt; 0
     * @param windowDays temporal half-width in days; must be &gt; 0
     * @throws IllegalArgumentException if either extent is not positive
     */
    public FixedWindow(double radiusKm, double windowDays) {
        this.window = new Window(radiusKm, windowDays);
    }

    @Override
    public Window windowFor(double magnitude) {
        return window;
    }

    @Override
    public String getName() {
        return "fixed";
    }

    @Override
    public String toString() {
        return "FixedWindow{" + window + '}';
    }
}
