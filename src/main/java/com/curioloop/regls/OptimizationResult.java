/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

import java.util.Arrays;

/**
 * Result of a {@link ZeroFprSolver} run.
 */
public final class OptimizationResult {

    private final double[] solution;
    private final OptimizationStatus status;
    private final int iterations;
    private final double normFpr;
    private final double cost;
    private final double stepSize;
    private final double elapsedTime;
    private final int operatorApplications;
    private final int proximalEvaluations;
    private final int gammaSearchFailures;
    private final int tauSearchFailures;

    OptimizationResult(SolverState state, OptimizationStatus status) {
        this.solution = state.xbar.clone();
        this.status = status;
        this.iterations = state.iteration;
        this.normFpr = state.normFpr;
        this.cost = state.cost;
        this.stepSize = state.gamma;
        this.elapsedTime = state.elapsedSeconds();
        this.operatorApplications = state.operatorApplications;
        this.proximalEvaluations = state.proximalEvaluations;
        this.gammaSearchFailures = state.gammaSearchFailures;
        this.tauSearchFailures = state.tauSearchFailures;
    }

    /**
     * Gets the solution, the last prox point xbar.
     * @return Copy of solution vector
     */
    public double[] getSolution() {
        return solution.clone();
    }

    public OptimizationStatus getStatus() {
        return status;
    }

    /**
     * Checks if the halting criterion fired.
     * @return true if converged
     */
    public boolean isConverged() {
        return status.isConverged();
    }

    /**
     * Gets the number of completed iterations.
     * <p>
     * A run stopped by the halting criterion at the check that opens iteration k reports k - 1,
     * since iteration k never ran. This is one less than a loop counter left at k would show.
     * A run that exhausts the budget reports maxIterations.
     * </p>
     * @return Iteration count
     */
    public int getIterations() {
        return iterations;
    }

    /**
     * Gets the final fixed-point residual ‖x - xbar‖.
     * @return Fixed-point residual norm
     */
    public double getNormFpr() {
        return normFpr;
    }

    /**
     * Gets f(xbar) + g(xbar) of the last completed iteration.
     * @return Cost, NaN when no iteration was performed
     */
    public double getCost() {
        return cost;
    }

    /**
     * Gets the final step size γ.
     * @return Step size
     */
    public double getStepSize() {
        return stepSize;
    }

    /**
     * Gets the wall-clock time of the run.
     * @return Elapsed time in seconds
     */
    public double getElapsedTime() {
        return elapsedTime;
    }

    public int getOperatorApplications() {
        return operatorApplications;
    }

    public int getProximalEvaluations() {
        return proximalEvaluations;
    }

    /**
     * Gets the number of γ line searches that ran out of trials.
     * @return Failure count
     */
    public int getGammaSearchFailures() {
        return gammaSearchFailures;
    }

    /**
     * Gets the number of τ line searches that ran out of trials.
     * @return Failure count
     */
    public int getTauSearchFailures() {
        return tauSearchFailures;
    }

    public int getDimension() {
        return solution.length;
    }

    @Override
    public String toString() {
        return "OptimizationResult{" +
                "status=" + status +
                ", iterations=" + iterations +
                ", normFpr=" + normFpr +
                ", cost=" + cost +
                ", stepSize=" + stepSize +
                ", elapsedTime=" + elapsedTime +
                ", operatorApplications=" + operatorApplications +
                ", proximalEvaluations=" + proximalEvaluations +
                ", solution=" + Arrays.toString(solution) +
                '}';
    }
}
