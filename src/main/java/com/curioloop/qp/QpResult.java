/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.qp;

import java.util.Arrays;

/**
 * Result of a QP solve.
 */
public final class QpResult {

    private final QpStatus status;
    private final double objectiveValue;
    private final double[] solution;
    private final double[] equalityDuals;
    private final double[] inequalityDuals;
    private final double[] lowerBoundDuals;
    private final double[] upperBoundDuals;
    private final double solveTime;

    /**
     * Creates a QP result.
     * @param status Solve status
     * @param objectiveValue Objective value at the solution
     * @param solution Primal solution
     * @param equalityDuals Duals of the equality constraints
     * @param inequalityDuals Duals of the inequality constraints
     * @param lowerBoundDuals Duals of the variable lower bounds
     * @param upperBoundDuals Duals of the variable upper bounds
     * @param solveTime Solve time in seconds
     */
    public QpResult(QpStatus status, double objectiveValue, double[] solution,
                    double[] equalityDuals, double[] inequalityDuals,
                    double[] lowerBoundDuals, double[] upperBoundDuals,
                    double solveTime) {
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        this.status = status;
        this.objectiveValue = objectiveValue;
        this.solution = copy(solution);
        this.equalityDuals = copy(equalityDuals);
        this.inequalityDuals = copy(inequalityDuals);
        this.lowerBoundDuals = copy(lowerBoundDuals);
        this.upperBoundDuals = copy(upperBoundDuals);
        this.solveTime = solveTime;
    }

    private static double[] copy(double[] a) {
        return a != null ? a.clone() : new double[0];
    }

    /**
     * Gets the solve status.
     * @return Status
     */
    public QpStatus getStatus() {
        return status;
    }

    /**
     * Checks if the solve reached an optimal (possibly inaccurate) solution.
     * @return true if optimal
     */
    public boolean isOptimal() {
        return status.isOptimal();
    }

    /**
     * Gets the objective value.
     * @return Objective value
     */
    public double getObjectiveValue() {
        return objectiveValue;
    }

    /**
     * Gets the primal solution.
     * @return Copy of solution vector
     */
    public double[] getSolution() {
        return solution.clone();
    }

    /**
     * Gets the equality constraint duals.
     * @return Copy of equality duals
     */
    public double[] getEqualityDuals() {
        return equalityDuals.clone();
    }

    /**
     * Gets the inequality constraint duals.
     * @return Copy of inequality duals
     */
    public double[] getInequalityDuals() {
        return inequalityDuals.clone();
    }

    /**
     * Gets the lower bound duals.
     * @return Copy of lower bound duals
     */
    public double[] getLowerBoundDuals() {
        return lowerBoundDuals.clone();
    }

    /**
     * Gets the upper bound duals.
     * @return Copy of upper bound duals
     */
    public double[] getUpperBoundDuals() {
        return upperBoundDuals.clone();
    }

    /**
     * Gets the solve time as measured by the backend.
     * @return Seconds spent in the solve call
     */
    public double getSolveTime() {
        return solveTime;
    }

    /**
     * Gets the dimension of the solution.
     * @return Solution dimension
     */
    public int getDimension() {
        return solution.length;
    }

    @Override
    public String toString() {
        return "QpResult{" +
                "status=" + status.name() +
                ", objectiveValue=" + objectiveValue +
                ", solveTime=" + solveTime +
                ", solution=" + Arrays.toString(solution) +
                '}';
    }
}
