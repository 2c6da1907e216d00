package com.quakesieve.core.window;

import com.quakesieve.core.model.Window;

/**
 * Contract for magnitude-dependent window models.
 * <p>
 * Implementations are <strong>stateless</strong> and may be shared across
 * runs and threads. The set of models is fixed and built by
 * {@link com.quakesieve.core.cluster.DeclustererFactory#createWindowModel}; the adaptive Reasenberg scheme is a separate
 * engine rather than a window model because its extents depend on cluster
 * state, not on a single magnitude.
 * </p>
 */
public interface WindowModel {

    /**
     * Return the space-time window of an event of the given magnitude.
     *
     * @param magnitude event magnitude
     * @return the window; never {@code null}
     * @throws IllegalArgumentException if the model cannot serve the magnitude
     */
    Window windowFor(double magnitude);

    /**
     * Return a short name describing this model, used in logs and summaries.
     *
     * @return model name
     */
    String getName();
}
