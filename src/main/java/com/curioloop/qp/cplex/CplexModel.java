/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.qp.cplex;

/**
 * The subset of the CPLEX modeling API needed to load and solve a QP.
 * <p>
 * Row and quadratic data use CPLEX's row-sparse encoding: a pointer array of
 * length {@code rows + 1} followed by column indices and values.
 * </p>
 * <p>
 * Any method may throw {@link com.curioloop.qp.QpSolverException} when CPLEX
 * reports an error.
 * </p>
 */
public interface CplexModel extends AutoCloseable {

    /** CPLEX infinity ({@code CPX_INFBOUND}) */
    double INFINITY = 1.0e20;

    /** Row sense for {@code a x = b} */
    char SENSE_EQUAL = 'E';

    /** Row sense for {@code a x <= b} */
    char SENSE_LESS_EQUAL = 'L';

    /**
     * Sets the objective sense to minimize.
     */
    void setMinimize();

    /**
     * Adds one column per entry of {@code objective}.
     * @param objective Linear objective coefficients
     * @param lower Lower bounds, using {@link #INFINITY} for open sides
     * @param upper Upper bounds, using {@link #INFINITY} for open sides
     */
    void addVariables(double[] objective, double[] lower, double[] upper);

    /**
     * Adds constraint rows.
     * @param rowPointers Row pointers, length {@code rows + 1}
     * @param columnIndices Column indices
     * @param values Coefficients
     * @param senses Sense character per row
     * @param rhs Right-hand side per row
     */
    void addRows(int[] rowPointers, int[] columnIndices, double[] values, char[] senses, double[] rhs);

    /**
     * Sets the quadratic objective matrix, one row per variable.
     * @param rowPointers Row pointers, length {@code n + 1}
     * @param columnIndices Column indices
     * @param values Coefficients
     */
    void setQuadratic(int[] rowPointers, int[] columnIndices, double[] values);

    /**
     * Runs the QP optimizer on the loaded problem.
     */
    void solve();

    /**
     * Reads the CPLEX timer.
     * @return Time stamp in seconds
     */
    double getTime();

    /**
     * Gets the raw CPLEX solution status code.
     * @return Status code
     */
    int getStatus();

    /**
     * Gets the objective value of the current solution.
     * @return Objective value
     */
    double getObjectiveValue();

    /**
     * Gets the primal solution.
     * @return One value per column
     */
    double[] getValues();

    /**
     * Gets the row duals in the order rows were added.
     * @return Dual values
     */
    double[] getDualValues();

    /**
     * Gets the reduced costs.
     * @return One reduced cost per column
     */
    double[] getReducedCosts();

    /**
     * Releases the model and its CPLEX resources.
     */
    @Override
    void close();
}
