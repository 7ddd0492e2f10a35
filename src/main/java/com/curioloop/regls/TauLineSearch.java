/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

/**
 * Backtracking on the step length τ along the quasi-Newton direction d.
 * <p>
 * Candidates are x = xbarPrev + τd for τ = 1, 0.4, 0.16, ... A candidate is accepted when its
 * envelope value does not exceed level = FBE - σ‖r‖². Since A is linear along d, A d and AᵗA d
 * are computed once and the residual and gradient of each candidate are updated incrementally:
 * </p>
 * <pre>
 *   A x   = A xbarPrev + τ A d
 *   ∇f(x) = ∇f(xbarPrev) + τ AᵗA d
 * </pre>
 */
final class TauLineSearch {

    /** Backtracking factor for τ */
    static final double SHRINK = 0.4;

    private TauLineSearch() {}

    /**
     * Runs the search.
     * <p>
     * Reads xbarPrev, resxbar, gradxbar, d, fbe, sigma, normFpr, gamma. Writes Ad, ATAd, x, resx,
     * fx, gradx, and through the envelope xbar, gxbar, r, normFpr, uppbnd.
     * </p>
     *
     * @param state Solver state after the direction has been computed
     * @param maxTrials Maximum number of candidates
     * @return true if a candidate met the level, false if the last candidate was kept anyway
     * @throws OptimizationException on the first candidate with a non-finite smooth term or envelope
     */
    static boolean search(SolverState state, int maxTrials) {
        double level = state.fbe - state.sigma * state.normFpr * state.normFpr;

        state.applyLinear(state.d, state.Ad);
        state.applyAdjoint(state.Ad, state.ATAd);

        double tau = 1.0;
        for (int j = 0; j < maxTrials; j++) {
            Vectors.addScaled(state.xbarPrev, tau, state.d, state.x);
            Vectors.addScaled(state.resxbar, tau, state.Ad, state.resx);
            state.fx = 0.5 * Vectors.dot(state.resx, state.resx);
            state.requireFinite(state.fx, "Smooth term at the tau candidate");
            Vectors.addScaled(state.gradxbar, tau, state.ATAd, state.gradx);
            double candidate = Envelope.evaluate(state);
            state.requireFinite(candidate, "Envelope at the tau candidate");
            if (candidate <= level) {
                return true;
            }
            tau = SHRINK * tau;
        }
        return false;
    }
}
