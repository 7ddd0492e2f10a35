/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ZeroFPR solver for regularized least squares problems:
 * <pre>
 *   minimize ½‖A x‖² + g(x)
 * </pre>
 * <p>
 * where A is an {@link Operator} (an {@link AffineOperator} A x - b gives the usual least
 * squares residual) and g is a possibly nonsmooth, possibly nonconvex {@link ProximalFunction}.
 * </p>
 * <p>
 * Every iteration takes a forward-backward step, adjusts γ by backtracking until the
 * quadratic upper bound of f holds, computes an L-BFGS direction for the fixed-point
 * residual and backtracks on the step length τ until the forward-backward envelope decreases
 * enough. When γ is not configured it is set from a finite-difference estimate L̂ of the
 * Lipschitz constant of ∇f: γ = (1 - β) / L̂ with β = 0.05.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * The solver itself is immutable. Each call to {@link #solve} allocates its own state,
 * so one instance can be used from several threads as long as the operator and the
 * proximal function are stateless.
 * </p>
 *
 * <h2>Example usage</h2>
 * <pre>{@code
 * // Lasso: minimize ½‖A x - b‖² + λ‖x‖₁
 * OptimizationResult result = ZeroFprSolver.builder()
 *     .operator(MatrixOperator.of(matrix).minus(b))
 *     .regularizer(new NormL1(0.1))
 *     .config(SolverConfig.builder().tolerance(1e-10).build())
 *     .build()
 *     .solve(new double[n]);
 *
 * double[] x = result.getSolution();
 * }</pre>
 */
public final class ZeroFprSolver {

    private static final Logger log = LoggerFactory.getLogger(ZeroFprSolver.class);

    /** Safety factor of the step size, also defines σ = β/(4γ) */
    static final double BETA = 0.05;

    /** Machine epsilon */
    private static final double EPSILON = Math.ulp(1.0);

    /** Perturbation used by the Lipschitz estimate */
    private static final double SQRT_EPSILON = Math.sqrt(EPSILON);

    private final Operator operator;
    private final ProximalFunction regularizer;
    private final SolverConfig config;

    private ZeroFprSolver(Builder builder) {
        this.operator = builder.operator;
        this.regularizer = builder.regularizer;
        this.config = builder.config;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Convenience static methods ====================

    /**
     * Minimizes ½‖A x‖² + g(x) with the default configuration.
     *
     * @param operator Operator A
     * @param regularizer Nonsmooth term g
     * @param initialPoint Initial guess (not modified)
     * @return Optimization result
     */
    public static OptimizationResult minimize(Operator operator, ProximalFunction regularizer, double[] initialPoint) {
        return builder()
                .operator(operator)
                .regularizer(regularizer)
                .build()
                .solve(initialPoint);
    }

    /**
     * Minimizes ½‖A x‖² + g(x) from x = 0 with the default configuration.
     *
     * @param operator Operator A
     * @param regularizer Nonsmooth term g
     * @return Optimization result
     */
    public static OptimizationResult minimize(Operator operator, ProximalFunction regularizer) {
        if (operator == null) {
            throw new IllegalArgumentException("Operator is required");
        }
        return minimize(operator, regularizer, new double[operator.inputDimension()]);
    }

    /**
     * Runs the solver.
     *
     * @param initialPoint Initial guess x₀ (not modified)
     * @return Optimization result, whose solution is the last prox point xbar
     * @throws IllegalArgumentException if x₀ does not match the operator's input dimension
     * @throws OptimizationException if the run produces non-finite values, the halting
     *         criterion throws, or the operator or proximal function throws
     */
    public OptimizationResult solve(double[] initialPoint) {
        SolverState state = SolverState.allocate(operator, regularizer, config, initialPoint);
        try {
            initialize(state);
            OptimizationStatus status = iterate(state);
            OptimizationResult result = new OptimizationResult(state, status);
            if (config.getVerbosity() != Verbosity.OFF) {
                log.info("ZeroFPR finished: {}, iterations {}, normfpr {}, cost {}, time {} s, matvecs {}, prox {}",
                        status.name(), result.getIterations(), result.getNormFpr(), result.getCost(),
                        result.getElapsedTime(), result.getOperatorApplications(), result.getProximalEvaluations());
            }
            return result;
        } catch (OptimizationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new OptimizationException("Operator or proximal function failed",
                    OptimizationStatus.CALLBACK_ERROR, state, e);
        }
    }

    public Operator getOperator() {
        return operator;
    }

    public ProximalFunction getRegularizer() {
        return regularizer;
    }

    public SolverConfig getConfig() {
        return config;
    }

    // Smooth term and gradient at x₀, step size, first forward-backward step.
    private void initialize(SolverState state) {
        state.apply(state.x, state.resx);
        state.fx = 0.5 * Vectors.dot(state.resx, state.resx);
        state.applyAdjoint(state.resx, state.gradx);
        state.requireFinite(state.fx, "Smooth term at the initial point");

        double gamma = config.getStepSize();
        if (config.isStepSizeEstimated()) {
            gamma = (1 - BETA) / estimateLipschitz(state);
        }
        state.setStepSize(gamma);

        state.fbe = Envelope.evaluate(state);
        state.requireFinite(state.fbe, "Envelope at the initial point");
        state.checkpoint();
    }

    /**
     * Estimates an upper bound of the Lipschitz constant of ∇f from a forward difference along
     * the all-ones direction: L̂ = ‖∇f(x) - ∇f(x + ε1)‖ / ‖ε1‖ with ε = √eps.
     * <p>
     * Uses gradstep, resxbar, gradxbar and r as scratch. A vanishing estimate (A = 0 along the
     * difference direction) falls back to L̂ = 1.
     * </p>
     */
    private static double estimateLipschitz(SolverState state) {
        double[] xEps = state.gradstep;
        for (int i = 0; i < xEps.length; i++) {
            xEps[i] = state.x[i] + SQRT_EPSILON;
        }
        state.apply(xEps, state.resxbar);
        state.applyAdjoint(state.resxbar, state.gradxbar);
        Vectors.subtract(state.gradx, state.gradxbar, state.r);

        double lipschitz = Vectors.norm(state.r) / Math.sqrt(EPSILON * xEps.length);
        state.requireFinite(lipschitz, "Lipschitz estimate");
        if (lipschitz <= EPSILON) {
            log.debug("Lipschitz estimate {} is degenerate, using 1", lipschitz);
            return 1.0;
        }
        return lipschitz;
    }

    private OptimizationStatus iterate(SolverState state) {
        HaltingCriterion criterion = config.getHaltingCriterion();
        int trials = config.getLineSearchTrials();
        double normFpr0 = Double.NaN;

        for (int it = 1; it <= config.getMaxIterations(); it++) {
            if (halt(criterion, state, normFpr0)) {
                return OptimizationStatus.CONVERGED;
            }
            state.fbePrev = state.fbe;

            state.apply(state.xbar, state.resxbar);
            state.fxbar = 0.5 * Vectors.dot(state.resxbar, state.resxbar);

            if (config.isLineSearch() && !GammaLineSearch.search(state, trials)) {
                state.gammaSearchFailures++;
                log.debug("Iteration {}: gamma line search exhausted {} trials, gamma {}", it, trials, state.gamma);
            }

            if (it == 1) {
                normFpr0 = state.normFpr;
            }

            state.fbe = Envelope.value(state.uppbnd, state.gxbar);
            state.cost = state.fxbar + state.gxbar;
            state.requireFinite(state.fbe, "Envelope");
            state.requireFinite(state.cost, "Cost");
            state.checkpoint();

            if (config.getVerbosity().reports(it, config.getReportInterval())) {
                log.info("it {} | normfpr {} | cost {} | gamma {} | time {} s",
                        it, state.normFpr, state.cost, state.gamma, state.elapsedSeconds());
            }

            // fixed-point residual at xbar
            state.applyAdjoint(state.resxbar, state.gradxbar);
            Vectors.addScaled(state.xbar, -state.gamma, state.gradxbar, state.gradstep);
            state.prox(state.gradstep, state.xbarbar);
            Vectors.subtract(state.xbar, state.xbarbar, state.rbar);

            if (it == 1) {
                Vectors.negate(state.rbar, state.d);
            } else {
                state.lbfgs.update(state.xbar, state.xbarPrev, state.rbar, state.rbarPrev);
                state.lbfgs.apply(state.rbar, state.d);
            }

            Vectors.copy(state.rbar, state.rbarPrev);
            Vectors.copy(state.xbar, state.xbarPrev);

            if (!TauLineSearch.search(state, trials)) {
                state.tauSearchFailures++;
                log.debug("Iteration {}: tau line search exhausted {} trials", it, trials);
            }
            state.checkpoint();

            state.iteration = it;
        }
        return OptimizationStatus.MAX_ITERATIONS_REACHED;
    }

    private static boolean halt(HaltingCriterion criterion, SolverState state, double normFpr0) {
        try {
            return criterion.halt(state, normFpr0, state.fbe, state.fbePrev);
        } catch (RuntimeException e) {
            throw new OptimizationException("Halting criterion failed",
                    OptimizationStatus.HALTING_CRITERION_ERROR, state, e);
        }
    }

    /**
     * Builder for ZeroFPR solver.
     */
    public static final class Builder {
        private Operator operator;
        private ProximalFunction regularizer = ProximalFunction.zero();
        private SolverConfig config = SolverConfig.defaults();

        private Builder() {}

        /**
         * Sets the operator A of the smooth term ½‖A x‖².
         * @param op Operator
         * @return This builder
         */
        public Builder operator(Operator op) {
            this.operator = op;
            return this;
        }

        /**
         * Sets the nonsmooth term g (defaults to the zero function).
         * @param g Proximal function
         * @return This builder
         */
        public Builder regularizer(ProximalFunction g) {
            this.regularizer = g;
            return this;
        }

        /**
         * Sets the configuration.
         * @param cfg Configuration (null for defaults)
         * @return This builder
         */
        public Builder config(SolverConfig cfg) {
            this.config = cfg != null ? cfg : SolverConfig.defaults();
            return this;
        }

        /**
         * Builds the solver.
         * @return ZeroFPR solver
         * @throws IllegalArgumentException if configuration is invalid
         */
        public ZeroFprSolver build() {
            if (operator == null) {
                throw new IllegalArgumentException("Operator is required");
            }
            if (regularizer == null) {
                throw new IllegalArgumentException("Regularizer is required");
            }
            if (operator.inputDimension() <= 0 || operator.outputDimension() <= 0) {
                throw new IllegalArgumentException("Operator dimensions must be positive");
            }
            return new ZeroFprSolver(this);
        }
    }
}
