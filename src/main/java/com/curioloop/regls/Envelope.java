/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

/**
 * Forward-backward envelope of f + g.
 * <p>
 * For a point x with forward-backward step xbar = prox_γg(x - γ∇f(x)) and residual r = x - xbar:
 * </p>
 * <pre>
 *   uppbnd = f(x) - ⟨∇f(x), r⟩ + ‖r‖² / (2γ)
 *   FBE(x) = uppbnd + g(xbar)
 * </pre>
 * <p>
 * uppbnd is the quadratic model of f around x evaluated at xbar; it majorizes f(xbar) when
 * γ is at most the inverse Lipschitz constant of ∇f. All functions are deterministic: the
 * same inputs give bit-identical outputs.
 * </p>
 */
final class Envelope {

    private Envelope() {}

    /**
     * Computes r = x - xbar.
     * @return ‖r‖
     */
    static double residual(double[] x, double[] xbar, double[] r) {
        Vectors.subtract(x, xbar, r);
        return Vectors.norm(r);
    }

    static double upperBound(double fx, double[] gradx, double[] r, double normFpr, double gamma) {
        return fx - Vectors.dot(gradx, r) + 1 / (2 * gamma) * normFpr * normFpr;
    }

    static double value(double uppbnd, double gxbar) {
        return uppbnd + gxbar;
    }

    /**
     * Performs the forward-backward step from the state's x with its current γ.
     * <p>
     * Reads x, gradx, fx, gamma. Writes gradstep, xbar, gxbar, r, normFpr, uppbnd.
     * </p>
     *
     * @return Envelope value at x
     */
    static double evaluate(SolverState state) {
        Vectors.addScaled(state.x, -state.gamma, state.gradx, state.gradstep);
        state.gxbar = state.prox(state.gradstep, state.xbar);
        state.normFpr = residual(state.x, state.xbar, state.r);
        state.uppbnd = upperBound(state.fx, state.gradx, state.r, state.normFpr, state.gamma);
        return value(state.uppbnd, state.gxbar);
    }
}
