/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

/**
 * Indicator of a box constraint: g(x) = 0 if every x[i] lies in its bound, +∞ otherwise.
 * <p>
 * The proximal operator is the projection onto the box, so g at the returned point is always 0.
 * </p>
 *
 * <pre>{@code
 * // Nonnegative least squares
 * ProximalFunction g = new IndicatorBox(Bound.atLeast(0));
 * }</pre>
 */
public final class IndicatorBox implements ProximalFunction {

    private final Bound[] bounds;
    private final Bound common;

    /**
     * Creates a box applying the same bound to every variable.
     * @param bound Bound for all variables
     */
    public IndicatorBox(Bound bound) {
        if (bound == null) {
            throw new IllegalArgumentException("Bound cannot be null");
        }
        this.bounds = null;
        this.common = bound;
    }

    /**
     * Creates a box with one bound per variable.
     * @param bounds Bounds, one per variable (null entries mean unbounded)
     */
    public IndicatorBox(Bound[] bounds) {
        if (bounds == null || bounds.length == 0) {
            throw new IllegalArgumentException("Bounds cannot be null or empty");
        }
        this.bounds = bounds.clone();
        this.common = null;
    }

    @Override
    public double prox(double[] v, double gamma, double[] p) {
        if (bounds != null && bounds.length != v.length) {
            throw new IllegalArgumentException("Bounds array length must match dimension " + v.length);
        }
        for (int i = 0; i < v.length; i++) {
            Bound b = common != null ? common : bounds[i];
            p[i] = b != null ? b.project(v[i]) : v[i];
        }
        return 0.0;
    }

    /**
     * Evaluates the indicator at a point.
     * @param x Point
     * @return 0 if x is inside the box, +∞ otherwise
     */
    public double value(double[] x) {
        for (int i = 0; i < x.length; i++) {
            Bound b = common != null ? common : bounds[i];
            if (b != null && !b.contains(x[i])) {
                return Double.POSITIVE_INFINITY;
            }
        }
        return 0.0;
    }
}
