/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

/**
 * Limited-memory BFGS approximation of the inverse Jacobian of the fixed-point residual.
 * <p>
 * Secant pairs (s, y) are stored in a circular buffer of fixed capacity. When the buffer
 * is full the oldest pair is overwritten. {@link #apply} computes d = -H r by the two-loop
 * recursion, with the initial scaling H₀ = sᵗy / yᵗy of the most recent pair.
 * </p>
 * <p>
 * This class is <b>not thread-safe</b>; each solve owns its own instance.
 * </p>
 */
final class LbfgsDirection {

    /** Relative curvature below which a pair is rejected */
    static final double CURVATURE_EPSILON = 1e-12;

    private final int capacity;
    private final double[][] s;
    private final double[][] y;
    private final double[] rho;
    private final double[] alpha;

    // candidate pair, swapped into the history when accepted
    private double[] sNext;
    private double[] yNext;

    private int newest = -1;
    private int size = 0;
    private double h0 = 1.0;

    LbfgsDirection(int dimension, int capacity) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive");
        }
        if (capacity < 0) {
            throw new IllegalArgumentException("Memory must be non-negative");
        }
        this.capacity = capacity;
        this.s = new double[capacity][dimension];
        this.y = new double[capacity][dimension];
        this.rho = new double[capacity];
        this.alpha = new double[capacity];
        this.sNext = new double[dimension];
        this.yNext = new double[dimension];
    }

    /**
     * Records the secant pair s = x - xPrev, y = r - rPrev.
     *
     * @return true if the pair was stored, false if it was skipped
     */
    boolean update(double[] x, double[] xPrev, double[] r, double[] rPrev) {
        if (capacity == 0) {
            return false;
        }
        Vectors.subtract(x, xPrev, sNext);
        Vectors.subtract(r, rPrev, yNext);

        double ys = Vectors.dot(sNext, yNext);
        double yy = Vectors.dot(yNext, yNext);
        double ss = Vectors.dot(sNext, sNext);
        if (!Double.isFinite(ys) || !Double.isFinite(yy) || !Double.isFinite(ss)
                || ss == 0.0 || yy == 0.0
                || ys <= CURVATURE_EPSILON * Math.sqrt(ss) * Math.sqrt(yy)) {
            return false;
        }

        int slot = (newest + 1) % capacity;
        double[] evictedS = s[slot];
        double[] evictedY = y[slot];
        s[slot] = sNext;
        y[slot] = yNext;
        sNext = evictedS;
        yNext = evictedY;

        rho[slot] = 1.0 / ys;
        h0 = ys / yy;
        newest = slot;
        if (size < capacity) {
            size++;
        }
        return true;
    }

    /**
     * Computes d = -H r. With an empty history, or when the recursion produces
     * non-finite values, d = -r.
     */
    void apply(double[] r, double[] d) {
        if (size == 0) {
            Vectors.negate(r, d);
            return;
        }
        Vectors.copy(r, d);

        int k = newest;
        for (int j = 0; j < size; j++) {
            alpha[k] = rho[k] * Vectors.dot(s[k], d);
            Vectors.addScaled(d, -alpha[k], y[k], d);
            k = k == 0 ? capacity - 1 : k - 1;
        }
        for (int i = 0; i < d.length; i++) {
            d[i] *= h0;
        }
        for (int j = 0; j < size; j++) {
            k = k == capacity - 1 ? 0 : k + 1;
            double beta = rho[k] * Vectors.dot(y[k], d);
            Vectors.addScaled(d, alpha[k] - beta, s[k], d);
        }
        Vectors.negate(d, d);

        if (!Vectors.isFinite(d)) {
            Vectors.negate(r, d);
        }
    }

    int size() {
        return size;
    }

    int capacity() {
        return capacity;
    }
}
