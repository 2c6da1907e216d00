package com.quakesieve.core.window;

import com.quakesieve.core.model.Window;

import java.util.Objects;

/**
 * Decorator that multiplies both extents of another model's window.
 *
 * <p>
 * A scale of 0.75 tightens the windows, 1.25 widens them. The factor is
 * validated at construction so a bad value is rejected before any event is
 * processed.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScaledWindowModel implements WindowModel {

    private final WindowModel delegate;
    private final double scale;

    /**
     * @param delegate the model to scale; must not be {@code null}
     * @param scale    multiplier; must be finite and &gt; 0
     * @throws IllegalArgumentException if {@code scale} is not positive
     */
    public ScaledWindowModel(WindowModel delegate, double scale) {
        this.delegate = Objects.requireNonNull(delegate, "Delegate window model must not be null");
        if (!Double.isFinite(scale) || scale <= 0) {
            throw new IllegalArgumentException("Window scale must be finite and > 0, got: " + scale);
        }
        this.scale = scale;
    }

    @Override
    public Window windowFor(double magnitude) {
        Window base = delegate.windowFor(magnitude);
        return scale == 1.0 ? base : base.scale(scale);
    }

    public WindowModel getDelegate() {
        return delegate;
    }

    public double getScale() {
        return scale;
    }

    @Override
    public String getName() {
        return delegate.getName() + "x" + scale;
    }

    @Override
    public String toString() {
        return "ScaledWindowModel{delegate=" + delegate + ", scale=" + scale + '}';
    }
}
