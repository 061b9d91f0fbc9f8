/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.qp;

/**
 * Backend capable of solving a {@link QuadraticProgram}.
 */
public interface QpSolver {

    /**
     * Solves the problem.
     * <p>
     * Implementations may rewrite the problem's bound arrays in place.
     * </p>
     * @param problem Problem to solve
     * @return Solve result
     * @throws QpSolverException if the backend fails
     */
    QpResult solve(QuadraticProgram problem);

    /**
     * Gets the backend name.
     * @return Name
     */
    String getName();
}
