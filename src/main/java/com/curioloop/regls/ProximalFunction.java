/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

/**
 * Functional interface for the nonsmooth term g, accessed only through its proximal operator.
 * <p>
 * prox_γg(v) = argmin_x g(x) + (1/2γ)‖x - v‖²
 * </p>
 * <p>
 * g may be nonconvex, in which case any minimizer is acceptable.
 * </p>
 *
 * <h2>Example usage</h2>
 * <pre>{@code
 * // Lasso regularizer λ‖x‖₁
 * ProximalFunction g = new NormL1(0.1);
 *
 * // Custom regularizer: nonnegativity constraint
 * ProximalFunction nonneg = (v, gamma, p) -> {
 *     for (int i = 0; i < v.length; i++) {
 *         p[i] = Math.max(v[i], 0.0);
 *     }
 *     return 0.0;
 * };
 * }</pre>
 */
@FunctionalInterface
public interface ProximalFunction {

    /**
     * Evaluates the proximal operator and the function value at the result.
     *
     * @param v Point to evaluate the proximal operator at (read-only)
     * @param gamma Step size γ (positive)
     * @param p Output array for prox_γg(v), same length as v, never aliased with v
     * @return g(p)
     */
    double prox(double[] v, double gamma, double[] p);

    /**
     * Creates the zero function, whose proximal operator is the identity.
     * @return Zero function
     */
    static ProximalFunction zero() {
        return (v, gamma, p) -> {
            System.arraycopy(v, 0, p, 0, v.length);
            return 0.0;
        };
    }
}
