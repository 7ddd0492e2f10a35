/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

/**
 * Nonconvex ℓ0 penalty g(x) = λ·nnz(x), whose proximal operator is the hard threshold.
 * <p>
 * Entries with |v| &gt; √(2λγ) are kept unchanged, the rest are set to zero.
 * </p>
 */
public final class NormL0 implements ProximalFunction {

    private final double lambda;

    /**
     * @param lambda Penalty per nonzero entry (must be non-negative)
     */
    public NormL0(double lambda) {
        if (lambda < 0 || !Double.isFinite(lambda)) {
            throw new IllegalArgumentException("Lambda must be non-negative and finite");
        }
        this.lambda = lambda;
    }

    @Override
    public double prox(double[] v, double gamma, double[] p) {
        double threshold = Math.sqrt(2.0 * lambda * gamma);
        int nonzeros = 0;
        for (int i = 0; i < v.length; i++) {
            if (Math.abs(v[i]) > threshold) {
                p[i] = v[i];
                nonzeros++;
            } else {
                p[i] = 0.0;
            }
        }
        return lambda * nonzeros;
    }

    public double getLambda() {
        return lambda;
    }

    @Override
    public String toString() {
        return "NormL0{lambda=" + lambda + '}';
    }
}
