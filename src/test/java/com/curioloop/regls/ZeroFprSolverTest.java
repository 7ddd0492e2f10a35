/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the ZeroFPR solver.
 */
public class ZeroFprSolverTest {

    private static final SolverConfig QUIET = SolverConfig.builder().verbosity(Verbosity.OFF).build();

    @Test
    @DisplayName("Identity operator without regularizer converges to the origin")
    void testIdentityConvergesToOrigin() {
        OptimizationResult result = ZeroFprSolver.builder()
                .operator(MatrixOperator.identity(2))
                .regularizer(ProximalFunction.zero())
                .config(QUIET)
                .build()
                .solve(new double[]{5.0, 5.0});

        assertThat(result.isConverged()).isTrue();
        assertThat(result.getSolution()).containsExactly(new double[]{0.0, 0.0}, within(1e-7));
        assertThat(result.getCost()).isCloseTo(0.0, within(1e-12));
        assertThat(result.getNormFpr()).isLessThan(1e-7);
    }

    @Test
    @DisplayName("Soft-threshold regularizer reaches the closed-form solution")
    void testSoftThresholdSolution() {
        // ½‖x - b‖² + ‖x‖₁ is minimized by the soft threshold of b
        OptimizationResult result = ZeroFprSolver.builder()
                .operator(MatrixOperator.identity(2).minus(new double[]{3.0, 0.0}))
                .regularizer(new NormL1(1.0))
                .config(QUIET)
                .build()
                .solve(new double[2]);

        assertThat(result.isConverged()).isTrue();
        assertThat(result.getSolution()).containsExactly(new double[]{2.0, 0.0}, within(1e-6));
        // ½(2 - 3)² + |2|
        assertThat(result.getCost()).isCloseTo(2.5, within(1e-6));
    }

    @Test
    @DisplayName("Zero iteration budget returns the initial prox step")
    void testZeroIterations() {
        double[] x0 = {3.0, -1.0};
        OptimizationResult result = ZeroFprSolver.builder()
                .operator(MatrixOperator.identity(2))
                .regularizer(ProximalFunction.zero())
                .config(QUIET.toBuilder().maxIterations(0).stepSize(0.5).build())
                .build()
                .solve(x0);

        assertThat(result.getIterations()).isZero();
        assertThat(result.getStatus()).isEqualTo(OptimizationStatus.MAX_ITERATIONS_REACHED);
        // xbar = x0 - γ x0
        assertThat(result.getSolution()).containsExactly(1.5, -0.5);
        assertThat(result.getCost()).isNaN();
        assertThat(result.getOperatorApplications()).isEqualTo(2);
        assertThat(result.getProximalEvaluations()).isEqualTo(1);
    }

    @Test
    @DisplayName("Zero operator does not break the Lipschitz estimate")
    void testZeroOperator() {
        double[] x0 = {1.0, -2.0, 0.5};
        OptimizationResult result = ZeroFprSolver.builder()
                .operator(MatrixOperator.zeros(2, 3))
                .config(QUIET)
                .build()
                .solve(x0);

        assertThat(result.isConverged()).isTrue();
        assertThat(result.getStepSize()).isCloseTo(1 - ZeroFprSolver.BETA, within(1e-15));
        assertThat(result.getSolution()).containsExactly(x0);
        assertThat(result.getNormFpr()).isZero();
        assertThat(result.getCost()).isZero();
        assertThat(result.getIterations()).isEqualTo(1);
    }

    @Test
    @DisplayName("Overdetermined least squares matches the normal equations")
    void testLeastSquares() {
        // A = [[1, 0], [0, 2], [1, 1]], b = [1, 2, 3]
        // AᵗA = [[2, 1], [1, 5]], Aᵗb = [4, 7], x* = [13/9, 10/9]
        Operator residual = MatrixOperator.of(new double[][]{
                {1, 0},
                {0, 2},
                {1, 1}
        }).minus(new double[]{1, 2, 3});

        OptimizationResult result = ZeroFprSolver.builder()
                .operator(residual)
                .config(QUIET)
                .build()
                .solve(new double[2]);

        assertThat(result.isConverged()).isTrue();
        assertThat(result.getSolution()).containsExactly(new double[]{13.0 / 9, 10.0 / 9}, within(1e-6));
        assertThat(result.getGammaSearchFailures()).isZero();
    }

    @Test
    @DisplayName("Nonnegativity constraint projects the unconstrained solution")
    void testBoxConstraint() {
        // diagonal problem: the constrained minimizer clips each coordinate independently
        Operator residual = MatrixOperator.diagonal(1.0, 2.0, 0.5).minus(new double[]{-1.0, 4.0, 1.0});

        OptimizationResult result = ZeroFprSolver.builder()
                .operator(residual)
                .regularizer(new IndicatorBox(Bound.atLeast(0.0)))
                .config(QUIET)
                .build()
                .solve(new double[]{1.0, 1.0, 1.0});

        assertThat(result.isConverged()).isTrue();
        assertThat(result.getSolution()).containsExactly(new double[]{0.0, 2.0, 2.0}, within(1e-6));
    }

    @Test
    @DisplayName("Nonconvex l0 penalty keeps only large coefficients")
    void testHardThreshold() {
        // with A = I each coordinate keeps b[i] when ½b[i]² > λ
        Operator residual = MatrixOperator.identity(3).minus(new double[]{3.0, 0.5, -2.0});

        OptimizationResult result = ZeroFprSolver.builder()
                .operator(residual)
                .regularizer(new NormL0(1.0))
                .config(QUIET)
                .build()
                .solve(new double[]{3.0, 0.0, -2.0});

        assertThat(result.isConverged()).isTrue();
        assertThat(result.getSolution()).containsExactly(new double[]{3.0, 0.0, -2.0}, within(1e-8));
    }

    @Test
    @DisplayName("Ridge penalty matches the shrunk least squares solution")
    void testRidge() {
        // (I + λI) x = b
        Operator residual = MatrixOperator.identity(2).minus(new double[]{2.0, -4.0});

        OptimizationResult result = ZeroFprSolver.minimize(residual, new SqrNormL2(1.0));

        assertThat(result.isConverged()).isTrue();
        assertThat(result.getSolution()).containsExactly(new double[]{1.0, -2.0}, within(1e-6));
    }

    @Test
    @DisplayName("Iteration budget exhaustion is reported, not thrown")
    void testMaxIterationsReached() {
        HaltingCriterion never = (state, normFpr0, fCurr, fPrev) -> false;
        OptimizationResult result = ZeroFprSolver.builder()
                .operator(MatrixOperator.diagonal(1.0, 10.0).minus(new double[]{1.0, 1.0}))
                .config(QUIET.toBuilder().maxIterations(7).haltingCriterion(never).build())
                .build()
                .solve(new double[2]);

        assertThat(result.getStatus()).isEqualTo(OptimizationStatus.MAX_ITERATIONS_REACHED);
        assertThat(result.isConverged()).isFalse();
        assertThat(result.getIterations()).isEqualTo(7);
    }

    @Test
    @DisplayName("Fixed step size without line search keeps gamma unchanged")
    void testFixedStepSizeWithoutLineSearch() {
        OptimizationResult result = ZeroFprSolver.builder()
                .operator(MatrixOperator.diagonal(2.0, 1.0).minus(new double[]{2.0, 1.0}))
                .config(QUIET.toBuilder().stepSize(0.2).lineSearch(false).build())
                .build()
                .solve(new double[2]);

        assertThat(result.isConverged()).isTrue();
        assertThat(result.getStepSize()).isEqualTo(0.2);
        assertThat(result.getSolution()).containsExactly(new double[]{1.0, 1.0}, within(1e-6));
    }

    @Test
    @DisplayName("Too large step size is reduced by the gamma line search")
    void testGammaLineSearchShrinksStepSize() {
        OptimizationResult result = ZeroFprSolver.builder()
                .operator(MatrixOperator.diagonal(4.0, 1.0).minus(new double[]{4.0, 1.0}))
                .config(QUIET.toBuilder().stepSize(1.0).build())
                .build()
                .solve(new double[2]);

        assertThat(result.isConverged()).isTrue();
        assertThat(result.getStepSize()).isLessThanOrEqualTo(1.0 / 16);
        assertThat(result.getSolution()).containsExactly(new double[]{1.0, 1.0}, within(1e-6));
    }

    @ParameterizedTest
    @EnumSource(Verbosity.class)
    @DisplayName("Verbosity only affects reporting")
    void testVerbosityDoesNotChangeResult(Verbosity verbosity) {
        Operator residual = MatrixOperator.diagonal(1.0, 3.0).minus(new double[]{1.0, 1.0});
        SolverConfig config = SolverConfig.builder().verbosity(verbosity).reportInterval(2).build();

        OptimizationResult reported = ZeroFprSolver.builder().operator(residual).config(config).build()
                .solve(new double[2]);
        OptimizationResult silent = ZeroFprSolver.builder().operator(residual).config(QUIET).build()
                .solve(new double[2]);

        assertThat(reported.getSolution()).containsExactly(silent.getSolution());
        assertThat(reported.getIterations()).isEqualTo(silent.getIterations());
        assertThat(reported.getOperatorApplications()).isEqualTo(silent.getOperatorApplications());
    }

    @Test
    @DisplayName("Custom halting criterion receives envelope values and stops the run")
    void testCustomHaltingCriterion() {
        List<Double> previous = new ArrayList<>();
        HaltingCriterion afterThree = (state, normFpr0, fCurr, fPrev) -> {
            previous.add(fPrev);
            return state.getIteration() == 3;
        };

        OptimizationResult result = ZeroFprSolver.builder()
                .operator(MatrixOperator.diagonal(1.0, 5.0).minus(new double[]{1.0, 1.0}))
                .regularizer(new NormL1(0.1))
                .config(QUIET.toBuilder().haltingCriterion(afterThree).build())
                .build()
                .solve(new double[2]);

        assertThat(result.getStatus()).isEqualTo(OptimizationStatus.CONVERGED);
        // stopped at the check opening iteration 4
        assertThat(previous).hasSize(4);
        assertThat(result.getIterations()).as("completed iterations").isEqualTo(3);
        assertThat(previous.get(0)).isNaN();
        assertThat(previous.subList(1, 4)).allMatch(Double::isFinite);
    }

    @Test
    @DisplayName("Initial point is not modified and defaults to zero")
    void testInitialPointUntouched() {
        Operator residual = MatrixOperator.identity(2).minus(new double[]{1.0, 2.0});
        double[] x0 = {7.0, 7.0};

        OptimizationResult fromX0 = ZeroFprSolver.minimize(residual, ProximalFunction.zero(), x0);
        OptimizationResult fromZero = ZeroFprSolver.minimize(residual, ProximalFunction.zero());

        assertThat(x0).containsExactly(7.0, 7.0);
        assertThat(fromX0.getSolution()).containsExactly(new double[]{1.0, 2.0}, within(1e-7));
        assertThat(fromZero.getSolution()).containsExactly(new double[]{1.0, 2.0}, within(1e-7));
        assertThat(fromZero.getDimension()).isEqualTo(2);
    }

    @Test
    @DisplayName("Memory zero falls back to residual steps and still converges")
    void testWithoutQuasiNewtonMemory() {
        OptimizationResult result = ZeroFprSolver.builder()
                .operator(MatrixOperator.diagonal(1.0, 2.0, 3.0).minus(new double[]{1.0, 2.0, 3.0}))
                .config(QUIET.toBuilder().memory(0).build())
                .build()
                .solve(new double[3]);

        assertThat(result.isConverged()).isTrue();
        assertThat(result.getSolution()).containsExactly(new double[]{1.0, 1.0, 1.0}, within(1e-6));
    }

    @Test
    @DisplayName("Result summary lists the diagnostics")
    void testResultToString() {
        OptimizationResult result = ZeroFprSolver.minimize(MatrixOperator.identity(1), ProximalFunction.zero(),
                new double[]{1.0});

        assertThat(result.toString())
                .contains("status=CONVERGED")
                .contains("iterations=")
                .contains("normFpr=")
                .contains("operatorApplications=");
        assertThat(result.getElapsedTime()).isGreaterThanOrEqualTo(0.0);
    }
}
