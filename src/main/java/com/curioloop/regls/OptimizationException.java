/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

/**
 * Exception thrown when a solve fails.
 * <p>
 * Carries the status and the last valid diagnostics of the run: iteration, step size γ
 * and fixed-point residual.
 * </p>
 */
public class OptimizationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final OptimizationStatus status;
    private final int iteration;
    private final double stepSize;
    private final double normFpr;

    /**
     * Creates an exception from the state of a failed run.
     * @param message Error message
     * @param status Optimization status
     * @param state State at the time of failure
     */
    OptimizationException(String message, OptimizationStatus status, SolverState state) {
        this(message, status, state, null);
    }

    /**
     * Creates an exception from the state of a failed run, with cause.
     * @param message Error message
     * @param status Optimization status
     * @param state State at the time of failure
     * @param cause Underlying cause
     */
    OptimizationException(String message, OptimizationStatus status, SolverState state, Throwable cause) {
        super(message + " (iteration " + state.iteration + ", gamma " + state.validGamma
                + ", normfpr " + state.validNormFpr + ")", cause);
        this.status = status;
        this.iteration = state.iteration;
        this.stepSize = state.validGamma;
        this.normFpr = state.validNormFpr;
    }

    public OptimizationStatus getStatus() {
        return status;
    }

    /**
     * Gets the number of iterations completed before the failure.
     * @return Iteration count
     */
    public int getIteration() {
        return iteration;
    }

    /**
     * Gets the last finite step size γ, NaN if the failure came before the first one.
     * @return Step size
     */
    public double getStepSize() {
        return stepSize;
    }

    /**
     * Gets the last finite fixed-point residual, +∞ if the failure came before the first one.
     * @return Fixed-point residual norm
     */
    public double getNormFpr() {
        return normFpr;
    }
}
