package com.quakesieve.core.window;

import com.quakesieve.core.model.Window;

/**
 * Continuous Gardner &amp; Knopoff (1974) window.
 *
 * <pre>
 *   distance = 10^(0.1238·M + 0.983)                  km
 *   time     = 10^(0.5409·M − 0.547)   for M &lt; 6.5   days
 *              10^(0.032·M + 2.7389)   for M ≥ 6.5
 * </pre>
 *
 * <p>
 * This is the fitted curve, not the published step table; see
 * {@link GardnerKnopoffTableWindow} for the latter.
 * </p>
 *
 * @since 1.0.0
 */
public final class GardnerKnopoffFormulaWindow implements WindowModel {

    static final double TIME_BREAK_MAGNITUDE = 6.5;

    @Override
    public Window windowFor(double magnitude) {
        if (!Double.isFinite(magnitude)) {
            throw new IllegalArgumentException("magnitude must be finite, got: " + magnitude);
        }
        return new Window(distanceKm(magnitude), timeDays(magnitude));
    }

    static double distanceKm(double magnitude) {
        return Math.pow(10, 0.1238 * magnitude + 0.983);
    }

    static double timeDays(double magnitude) {
        if (magnitude >= TIME_BREAK_MAGNITUDE) {
            return Math.pow(10, 0.032 * magnitude + 2.7389);
        }
        return Math.pow(10, 0.5409 * magnitude - 0.547);
    }

    @Override
    public String getName() {
        return "gk-formula";
    }

    @Override
    public String toString() {
        return "GardnerKnopoffFormulaWindow";
    }
}
