/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

/**
 * Stopping rule checked at the start of every iteration.
 * <p>
 * Example: stop as soon as the residual is below the configured tolerance in absolute terms.
 * </p>
 * <pre>{@code
 * HaltingCriterion absolute = (state, normFpr0, fCurr, fPrev) ->
 *     state.getNormFpr() <= state.getConfig().getTolerance();
 * }</pre>
 */
@FunctionalInterface
public interface HaltingCriterion {

    /**
     * Decides whether the solver should stop.
     *
     * @param state Read-only view of the solver state
     * @param normFpr0 Fixed-point residual of the first iteration (NaN before it completes)
     * @param fCurr Envelope value at the current iterate
     * @param fPrev Envelope value at the previous iterate (NaN on the first check)
     * @return true to stop
     */
    boolean halt(SolverState state, double normFpr0, double fCurr, double fPrev);

    /**
     * Default rule: ‖r‖ / (1 + ‖r₀‖) ≤ tolerance, where r₀ is the residual of the first iteration.
     * Never fires before the first iteration has completed.
     *
     * @return Default halting criterion
     */
    static HaltingCriterion relativeResidual() {
        return (state, normFpr0, fCurr, fPrev) ->
                state.getNormFpr() / (1 + normFpr0) <= state.getConfig().getTolerance();
    }
}
