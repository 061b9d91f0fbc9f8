/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.qp;

/**
 * Solver-independent status of a QP solve.
 */
public enum QpStatus {

    /** Optimal solution found */
    OPTIMAL("Optimal solution found"),

    /** Solution found but optimality tolerances not fully met */
    OPTIMAL_INACCURATE("Optimal solution found with reduced accuracy"),

    /** Problem is infeasible */
    INFEASIBLE("Problem is infeasible"),

    /** Problem is unbounded */
    UNBOUNDED("Problem is unbounded"),

    /** Backend reported a status with no mapping, or failed */
    SOLVER_ERROR("Solver error");

    private final String message;

    QpStatus(String message) {
        this.message = message;
    }

    /**
     * Gets the status message.
     * @return Status message
     */
    public String getMessage() {
        return message;
    }

    /**
     * Checks if a primal solution can be trusted as optimal.
     * @return true for OPTIMAL and OPTIMAL_INACCURATE
     */
    public boolean isOptimal() {
        return this == OPTIMAL || this == OPTIMAL_INACCURATE;
    }

    /**
     * Checks if this status indicates a solver error.
     * @return true if error
     */
    public boolean isError() {
        return this == SOLVER_ERROR;
    }

    @Override
    public String toString() {
        return name() + ": " + message;
    }
}
