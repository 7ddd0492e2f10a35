/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

/**
 * Enumeration of solver status codes.
 */
public enum OptimizationStatus {

    /** Halting criterion satisfied */
    CONVERGED(0, "Halting criterion satisfied"),

    /** Maximum iterations reached without the halting criterion firing */
    MAX_ITERATIONS_REACHED(1, "Maximum iterations reached"),

    /** Smooth value, envelope or cost became NaN or infinite */
    NON_FINITE_VALUE(-1, "Non-finite value encountered"),

    /** Custom halting criterion threw an exception */
    HALTING_CRITERION_ERROR(-2, "Halting criterion failed"),

    /** Operator or proximal function threw an exception */
    CALLBACK_ERROR(-3, "Operator or proximal function failed");

    private final int code;
    private final String message;

    OptimizationStatus(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Checks if this status indicates that the halting criterion fired.
     * @return true if converged
     */
    public boolean isConverged() {
        return this == CONVERGED;
    }

    /**
     * Checks if this status indicates an error.
     * @return true if error
     */
    public boolean isError() {
        return code < 0;
    }

    @Override
    public String toString() {
        return name() + "(" + code + "): " + message;
    }
}
