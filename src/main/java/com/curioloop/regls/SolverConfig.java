/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

/**
 * Immutable configuration of {@link ZeroFprSolver}.
 *
 * <pre>{@code
 * SolverConfig config = SolverConfig.builder()
 *     .tolerance(1e-10)
 *     .maxIterations(500)
 *     .memory(10)
 *     .verbosity(Verbosity.OFF)
 *     .build();
 * }</pre>
 */
public final class SolverConfig {

    /** Step size value meaning "estimate from the Lipschitz constant of ∇f" */
    public static final double ESTIMATE = Double.NaN;

    private final double tolerance;
    private final int maxIterations;
    private final int memory;
    private final Verbosity verbosity;
    private final int reportInterval;
    private final HaltingCriterion haltingCriterion;
    private final double stepSize;
    private final boolean lineSearch;
    private final int lineSearchTrials;

    private SolverConfig(Builder builder) {
        this.tolerance = builder.tolerance;
        this.maxIterations = builder.maxIterations;
        this.memory = builder.memory;
        this.verbosity = builder.verbosity;
        this.reportInterval = builder.reportInterval;
        this.haltingCriterion = builder.haltingCriterion;
        this.stepSize = builder.stepSize;
        this.lineSearch = builder.lineSearch;
        this.lineSearchTrials = builder.lineSearchTrials;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates the default configuration.
     * @return Default configuration
     */
    public static SolverConfig defaults() {
        return builder().build();
    }

    /**
     * Creates a builder initialised with this configuration.
     * @return New builder
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.tolerance = tolerance;
        b.maxIterations = maxIterations;
        b.memory = memory;
        b.verbosity = verbosity;
        b.reportInterval = reportInterval;
        b.haltingCriterion = haltingCriterion;
        b.stepSize = stepSize;
        b.lineSearch = lineSearch;
        b.lineSearchTrials = lineSearchTrials;
        return b;
    }

    public double getTolerance() {
        return tolerance;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    /**
     * Gets the number of secant pairs kept by L-BFGS.
     * @return Memory size
     */
    public int getMemory() {
        return memory;
    }

    public Verbosity getVerbosity() {
        return verbosity;
    }

    public int getReportInterval() {
        return reportInterval;
    }

    public HaltingCriterion getHaltingCriterion() {
        return haltingCriterion;
    }

    /**
     * Gets the initial step size γ.
     * @return Step size, or NaN ({@link #ESTIMATE}) when it is estimated
     */
    public double getStepSize() {
        return stepSize;
    }

    public boolean isStepSizeEstimated() {
        return Double.isNaN(stepSize);
    }

    public boolean isLineSearch() {
        return lineSearch;
    }

    /**
     * Gets the trial budget shared by the γ and τ line searches.
     * @return Maximum trials per line search
     */
    public int getLineSearchTrials() {
        return lineSearchTrials;
    }

    public static final class Builder {
        private double tolerance = 1e-8;
        private int maxIterations = 10000;
        private int memory = 5;
        private Verbosity verbosity = Verbosity.PERIODIC;
        private int reportInterval = 100;
        private HaltingCriterion haltingCriterion = HaltingCriterion.relativeResidual();
        private double stepSize = ESTIMATE;
        private boolean lineSearch = true;
        private int lineSearchTrials = 32;

        private Builder() {}

        /**
         * Sets the tolerance used by the default halting criterion.
         * @param value Tolerance (must be positive)
         * @return This builder
         */
        public Builder tolerance(double value) {
            if (!(value > 0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("Tolerance must be positive and finite");
            }
            this.tolerance = value;
            return this;
        }

        /**
         * Sets the maximum number of iterations.
         * @param value Maximum iterations (0 returns the initial prox step)
         * @return This builder
         */
        public Builder maxIterations(int value) {
            if (value < 0) {
                throw new IllegalArgumentException("Max iterations must be non-negative");
            }
            this.maxIterations = value;
            return this;
        }

        /**
         * Sets the L-BFGS memory.
         * @param value Number of secant pairs (0 disables quasi-Newton directions)
         * @return This builder
         */
        public Builder memory(int value) {
            if (value < 0) {
                throw new IllegalArgumentException("Memory must be non-negative");
            }
            this.memory = value;
            return this;
        }

        public Builder verbosity(Verbosity value) {
            if (value == null) {
                throw new IllegalArgumentException("Verbosity cannot be null");
            }
            this.verbosity = value;
            return this;
        }

        /**
         * Sets the period of {@link Verbosity#PERIODIC} reports.
         * @param value Interval in iterations (must be positive)
         * @return This builder
         */
        public Builder reportInterval(int value) {
            if (value <= 0) {
                throw new IllegalArgumentException("Report interval must be positive");
            }
            this.reportInterval = value;
            return this;
        }

        public Builder haltingCriterion(HaltingCriterion value) {
            if (value == null) {
                throw new IllegalArgumentException("Halting criterion cannot be null");
            }
            this.haltingCriterion = value;
            return this;
        }

        /**
         * Sets the initial step size γ.
         * @param value Step size (positive and finite), or {@link #ESTIMATE}
         * @return This builder
         */
        public Builder stepSize(double value) {
            if (!Double.isNaN(value) && (!(value > 0) || Double.isInfinite(value))) {
                throw new IllegalArgumentException("Step size must be positive and finite");
            }
            this.stepSize = value;
            return this;
        }

        /**
         * Enables or disables the line search on γ.
         * @param value true to backtrack on γ
         * @return This builder
         */
        public Builder lineSearch(boolean value) {
            this.lineSearch = value;
            return this;
        }

        /**
         * Sets the trial budget of both line searches.
         * @param value Maximum trials (must be positive)
         * @return This builder
         */
        public Builder lineSearchTrials(int value) {
            if (value <= 0) {
                throw new IllegalArgumentException("Line search trials must be positive");
            }
            this.lineSearchTrials = value;
            return this;
        }

        public SolverConfig build() {
            return new SolverConfig(this);
        }
    }

    @Override
    public String toString() {
        return "SolverConfig{" +
                "tolerance=" + tolerance +
                ", maxIterations=" + maxIterations +
                ", memory=" + memory +
                ", verbosity=" + verbosity +
                ", reportInterval=" + reportInterval +
                ", stepSize=" + (isStepSizeEstimated() ? "estimate" : String.valueOf(stepSize)) +
                ", lineSearch=" + lineSearch +
                ", lineSearchTrials=" + lineSearchTrials +
                '}';
    }
}
