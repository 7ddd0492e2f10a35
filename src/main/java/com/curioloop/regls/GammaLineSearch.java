/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

/**
 * Backtracking on the step size γ.
 * <p>
 * The initial γ comes from a finite-difference estimate of the Lipschitz constant, which may
 * be optimistic. The search halves γ until the quadratic upper bound of f at the prox point
 * holds, f(xbar) ≤ uppbnd. Each trial costs one proximal evaluation and one operator application.
 * </p>
 */
final class GammaLineSearch {

    private GammaLineSearch() {}

    /**
     * Runs the search from the state's x, xbar and fxbar.
     * <p>
     * Reads x, gradx, fx, fxbar, uppbnd. On each trial writes gamma, sigma, xbar, gxbar, r,
     * normFpr, uppbnd, resxbar and fxbar.
     * </p>
     *
     * @param state Solver state, resxbar = A xbar must be current
     * @param maxTrials Maximum number of halvings
     * @return true if f(xbar) ≤ uppbnd holds on return
     * @throws OptimizationException if f(xbar) or uppbnd is not finite, before γ is shrunk
     */
    static boolean search(SolverState state, int maxTrials) {
        for (int j = 0; j < maxTrials; j++) {
            state.requireFinite(state.fxbar, "Smooth term at the prox point");
            state.requireFinite(state.uppbnd, "Upper bound");
            if (state.fxbar <= state.uppbnd) {
                return true;
            }
            state.shrinkStepSize();
            Envelope.evaluate(state);
            state.apply(state.xbar, state.resxbar);
            state.fxbar = 0.5 * Vectors.dot(state.resxbar, state.resxbar);
        }
        state.requireFinite(state.fxbar, "Smooth term at the prox point");
        state.requireFinite(state.uppbnd, "Upper bound");
        return state.fxbar <= state.uppbnd;
    }
}
