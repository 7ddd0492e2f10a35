/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

/**
 * Weighted ℓ1 norm g(x) = λ‖x‖₁, whose proximal operator is the soft threshold.
 */
public final class NormL1 implements ProximalFunction {

    private final double lambda;

    /**
     * @param lambda Regularization weight (must be non-negative)
     */
    public NormL1(double lambda) {
        if (lambda < 0 || !Double.isFinite(lambda)) {
            throw new IllegalArgumentException("Lambda must be non-negative and finite");
        }
        this.lambda = lambda;
    }

    /**
     * Soft threshold of a scalar.
     * @param v Value
     * @param threshold Threshold (non-negative)
     * @return sign(v)·max(|v| - threshold, 0)
     */
    public static double softThreshold(double v, double threshold) {
        if (v > threshold) return v - threshold;
        if (v < -threshold) return v + threshold;
        return 0.0;
    }

    @Override
    public double prox(double[] v, double gamma, double[] p) {
        double threshold = lambda * gamma;
        double norm = 0.0;
        for (int i = 0; i < v.length; i++) {
            p[i] = softThreshold(v[i], threshold);
            norm += Math.abs(p[i]);
        }
        return lambda * norm;
    }

    public double getLambda() {
        return lambda;
    }

    @Override
    public String toString() {
        return "NormL1{lambda=" + lambda + '}';
    }
}
