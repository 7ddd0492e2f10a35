/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

/**
 * Mutable state of a single {@link ZeroFprSolver#solve} call.
 * <p>
 * The state owns every working buffer of the iteration, so no array is allocated inside
 * the loop. Input-space buffers have length n = {@link Operator#inputDimension()},
 * output-space buffers (residuals) have length m = {@link Operator#outputDimension()}.
 * </p>
 * <ul>
 *   <li><b>x, resx, gradx, fx</b>: current point, A x, Aᵗ A x, ½‖A x‖²</li>
 *   <li><b>xbar, gxbar, r, normFpr, uppbnd</b>: prox step from x, g(xbar), x - xbar, ‖r‖,
 *       quadratic upper bound of f at xbar</li>
 *   <li><b>resxbar, gradxbar, fxbar</b>: A xbar, Aᵗ A xbar, ½‖A xbar‖²</li>
 *   <li><b>xbarbar, rbar</b>: prox step from xbar and its residual xbar - xbarbar</li>
 *   <li><b>xbarPrev, rbarPrev</b>: xbar and rbar of the previous iteration</li>
 *   <li><b>d, Ad, ATAd</b>: search direction and its images under A and AᵗA</li>
 *   <li><b>gradstep</b>: scratch for forward steps x - γ∇f(x)</li>
 * </ul>
 * <p>
 * All calls into the operator and the proximal function go through {@link #apply},
 * {@link #applyAdjoint}, {@link #applyLinear} and {@link #prox}, which keep the call
 * counters exact.
 * </p>
 * <p>
 * The public getters are meant for {@link HaltingCriterion} implementations.
 * This class is <b>not thread-safe</b>.
 * </p>
 */
public final class SolverState {

    private final Operator operator;
    private final ProximalFunction regularizer;
    private final SolverConfig config;

    final double[] x;
    final double[] xbar;
    final double[] xbarPrev;
    final double[] gradx;
    final double[] gradxbar;
    final double[] r;
    final double[] rbar;
    final double[] rbarPrev;
    final double[] d;
    final double[] ATAd;
    final double[] gradstep;
    final double[] xbarbar;

    final double[] resx;
    final double[] resxbar;
    final double[] Ad;

    final LbfgsDirection lbfgs;

    double fx = Double.NaN;
    double fxbar = Double.NaN;
    double gxbar = Double.NaN;
    double uppbnd = Double.NaN;
    double normFpr = Double.POSITIVE_INFINITY;
    double fbe = Double.NaN;
    double fbePrev = Double.NaN;
    double cost = Double.NaN;
    double gamma;
    double sigma;
    int iteration;

    double validGamma = Double.NaN;
    double validNormFpr = Double.POSITIVE_INFINITY;

    int operatorApplications;
    int proximalEvaluations;
    int gammaSearchFailures;
    int tauSearchFailures;

    private final long startNanos;

    private SolverState(Operator operator, ProximalFunction regularizer, SolverConfig config, double[] x0) {
        this.operator = operator;
        this.regularizer = regularizer;
        this.config = config;

        int n = operator.inputDimension();
        int m = operator.outputDimension();

        this.x = x0.clone();
        this.xbar = new double[n];
        this.xbarPrev = new double[n];
        this.gradx = new double[n];
        this.gradxbar = new double[n];
        this.r = new double[n];
        this.rbar = new double[n];
        this.rbarPrev = new double[n];
        this.d = new double[n];
        this.ATAd = new double[n];
        this.gradstep = new double[n];
        this.xbarbar = new double[n];

        this.resx = new double[m];
        this.resxbar = new double[m];
        this.Ad = new double[m];

        this.lbfgs = new LbfgsDirection(n, config.getMemory());
        this.startNanos = System.nanoTime();
    }

    /**
     * Allocates the state for one solve.
     *
     * @param operator Operator A
     * @param regularizer Nonsmooth term g
     * @param config Solver configuration
     * @param x0 Initial point, copied
     * @return New state
     * @throws IllegalArgumentException if x0 does not match the operator's input dimension
     */
    static SolverState allocate(Operator operator, ProximalFunction regularizer, SolverConfig config, double[] x0) {
        if (x0 == null || x0.length != operator.inputDimension()) {
            throw new IllegalArgumentException("Initial point must have dimension " + operator.inputDimension());
        }
        return new SolverState(operator, regularizer, config, x0);
    }

    // ==================== External calls ====================

    /** out = A in, one operator application */
    void apply(double[] in, double[] out) {
        operator.apply(in, out);
        operatorApplications++;
    }

    /** out = Aᵗ in, one operator application */
    void applyAdjoint(double[] in, double[] out) {
        operator.applyAdjoint(in, out);
        operatorApplications++;
    }

    /** out = A_lin in, without the affine offset, one operator application */
    void applyLinear(double[] in, double[] out) {
        if (operator.isLinear()) {
            operator.apply(in, out);
        } else {
            operator.linearPart().apply(in, out);
        }
        operatorApplications++;
    }

    /** out = prox_γg(in), returns g(out), one proximal evaluation */
    double prox(double[] in, double[] out) {
        double value = regularizer.prox(in, gamma, out);
        proximalEvaluations++;
        return value;
    }

    // ==================== Step size ====================

    /** Sets γ and the matching σ = β/(4γ). */
    void setStepSize(double value) {
        gamma = value;
        sigma = ZeroFprSolver.BETA / (4 * gamma);
    }

    /** Halves γ and doubles σ. */
    void shrinkStepSize() {
        gamma = 0.5 * gamma;
        sigma = 2 * sigma;
    }

    // ==================== Diagnostics ====================

    /** Records γ and ‖r‖ as the last values known to be finite. */
    void checkpoint() {
        validGamma = gamma;
        validNormFpr = normFpr;
    }

    /**
     * Fails the run on a NaN or infinite value.
     * @throws OptimizationException with status NON_FINITE_VALUE and the last checkpoint
     */
    void requireFinite(double value, String what) {
        if (!Double.isFinite(value)) {
            throw new OptimizationException(what + " is not finite: " + value,
                    OptimizationStatus.NON_FINITE_VALUE, this);
        }
    }

    double elapsedSeconds() {
        return (System.nanoTime() - startNanos) / 1e9;
    }

    // ==================== Read-only view ====================

    public SolverConfig getConfig() {
        return config;
    }

    /**
     * Gets the number of completed iterations.
     * @return Iteration count
     */
    public int getIteration() {
        return iteration;
    }

    /**
     * Gets the current fixed-point residual ‖x - xbar‖.
     * @return Fixed-point residual norm
     */
    public double getNormFpr() {
        return normFpr;
    }

    /**
     * Gets the cost f(xbar) + g(xbar) of the last completed iteration.
     * @return Cost (NaN before the first iteration)
     */
    public double getCost() {
        return cost;
    }

    public double getStepSize() {
        return gamma;
    }

    public double getSigma() {
        return sigma;
    }

    public int getOperatorApplications() {
        return operatorApplications;
    }

    public int getProximalEvaluations() {
        return proximalEvaluations;
    }

    public int getGammaSearchFailures() {
        return gammaSearchFailures;
    }

    public int getTauSearchFailures() {
        return tauSearchFailures;
    }

    /**
     * Gets a copy of the current prox point xbar.
     * @return Copy of xbar
     */
    public double[] getSolution() {
        return xbar.clone();
    }
}
