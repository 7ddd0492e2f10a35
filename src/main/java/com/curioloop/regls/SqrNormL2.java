/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

/**
 * Ridge penalty g(x) = (λ/2)‖x‖².
 * <p>
 * prox_γg(v) = v / (1 + λγ)
 * </p>
 */
public final class SqrNormL2 implements ProximalFunction {

    private final double lambda;

    /**
     * @param lambda Regularization weight (must be non-negative)
     */
    public SqrNormL2(double lambda) {
        if (lambda < 0 || !Double.isFinite(lambda)) {
            throw new IllegalArgumentException("Lambda must be non-negative and finite");
        }
        this.lambda = lambda;
    }

    @Override
    public double prox(double[] v, double gamma, double[] p) {
        double scale = 1.0 / (1.0 + lambda * gamma);
        double sq = 0.0;
        for (int i = 0; i < v.length; i++) {
            p[i] = scale * v[i];
            sq += p[i] * p[i];
        }
        return 0.5 * lambda * sq;
    }

    public double getLambda() {
        return lambda;
    }

    @Override
    public String toString() {
        return "SqrNormL2{lambda=" + lambda + '}';
    }
}
