/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.regls;

/**
 * Amount of progress reporting done by {@link ZeroFprSolver}.
 */
public enum Verbosity {

    /** No reports */
    OFF,

    /** A report every {@link SolverConfig#getReportInterval()} iterations and a final summary */
    PERIODIC,

    /** A report every iteration and a final summary */
    EVERY_ITERATION;

    boolean reports(int iteration, int interval) {
        switch (this) {
            case EVERY_ITERATION:
                return true;
            case PERIODIC:
                return iteration == 1 || iteration % interval == 0;
            default:
                return false;
        }
    }
}
