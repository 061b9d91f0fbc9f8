/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.qp;

import java.util.Arrays;

/**
 * Convex quadratic program in the form
 * <pre>
 *   minimize   ½ xᵀQx + cᵀx
 *   subject to Aeq x   = beq
 *              Aineq x &lt;= bineq
 *              lb &lt;= x &lt;= ub
 * </pre>
 * <p>
 * All matrices are held in CSR layout. Positive semidefiniteness of Q is
 * left to the backend.
 * </p>
 * <p>
 * The bound vectors are <b>not</b> copied: backends rewrite infinite entries
 * to their own sentinel in place, so callers must not rely on them being
 * preserved across a solve.
 * </p>
 *
 * <h2>Example usage</h2>
 * <pre>{@code
 * QuadraticProgram problem = QuadraticProgram.builder()
 *     .quadraticCost(SparseMatrix.fromDense(new double[][]{{2, 0}, {0, 2}}))
 *     .linearCost(new double[]{0, 0})
 *     .equalities(SparseMatrix.fromDense(new double[][]{{1, 1}}), new double[]{1})
 *     .bounds(Bound.between(0.0, 1.0))
 *     .build();
 * }</pre>
 */
public final class QuadraticProgram {

    private final SparseMatrix quadraticCost;
    private final double[] linearCost;
    private final SparseMatrix equalityMatrix;
    private final double[] equalityRhs;
    private final SparseMatrix inequalityMatrix;
    private final double[] inequalityRhs;
    private final double[] lowerBounds;
    private final double[] upperBounds;

    private QuadraticProgram(SparseMatrix quadraticCost, double[] linearCost,
                             SparseMatrix equalityMatrix, double[] equalityRhs,
                             SparseMatrix inequalityMatrix, double[] inequalityRhs,
                             double[] lowerBounds, double[] upperBounds) {
        this.quadraticCost = quadraticCost;
        this.linearCost = linearCost;
        this.equalityMatrix = equalityMatrix;
        this.equalityRhs = equalityRhs;
        this.inequalityMatrix = inequalityMatrix;
        this.inequalityRhs = inequalityRhs;
        this.lowerBounds = lowerBounds;
        this.upperBounds = upperBounds;
    }

    /**
     * Creates a new builder.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Gets the number of variables.
     * @return n
     */
    public int getVariableCount() {
        return quadraticCost.getRows();
    }

    /**
     * Gets the number of equality constraints.
     * @return m_eq
     */
    public int getEqualityCount() {
        return equalityMatrix.getRows();
    }

    /**
     * Gets the number of inequality constraints.
     * @return m_ineq
     */
    public int getInequalityCount() {
        return inequalityMatrix.getRows();
    }

    public SparseMatrix getQuadraticCost() {
        return quadraticCost;
    }

    public double[] getLinearCost() {
        return linearCost.clone();
    }

    public SparseMatrix getEqualityMatrix() {
        return equalityMatrix;
    }

    public double[] getEqualityRhs() {
        return equalityRhs.clone();
    }

    public SparseMatrix getInequalityMatrix() {
        return inequalityMatrix;
    }

    public double[] getInequalityRhs() {
        return inequalityRhs.clone();
    }

    /**
     * Gets the live lower bound vector.
     * @return Lower bounds (not a copy)
     */
    public double[] getLowerBounds() {
        return lowerBounds;
    }

    /**
     * Gets the live upper bound vector.
     * @return Upper bounds (not a copy)
     */
    public double[] getUpperBounds() {
        return upperBounds;
    }

    @Override
    public String toString() {
        return "QuadraticProgram{" +
                "n=" + getVariableCount() +
                ", meq=" + getEqualityCount() +
                ", mineq=" + getInequalityCount() +
                ", nnzQ=" + quadraticCost.getNonZeros() +
                ", lb=" + Arrays.toString(lowerBounds) +
                ", ub=" + Arrays.toString(upperBounds) +
                '}';
    }

    /**
     * Builder for quadratic programs.
     */
    public static final class Builder {
        private SparseMatrix quadraticCost;
        private double[] linearCost;
        private SparseMatrix equalityMatrix;
        private double[] equalityRhs;
        private SparseMatrix inequalityMatrix;
        private double[] inequalityRhs;
        private double[] lowerBounds;
        private double[] upperBounds;
        private Bound[] bounds;
        private Bound uniformBound;

        private Builder() {}

        /**
         * Sets the quadratic cost matrix Q (n x n).
         * @param q Cost matrix
         * @return This builder
         */
        public Builder quadraticCost(SparseMatrix q) {
            this.quadraticCost = q;
            return this;
        }

        /**
         * Sets the linear cost vector c.
         * @param c Cost vector (copied)
         * @return This builder
         */
        public Builder linearCost(double[] c) {
            this.linearCost = c != null ? c.clone() : null;
            return this;
        }

        /**
         * Sets the equality constraints Aeq x = beq.
         * @param a Constraint matrix
         * @param b Right-hand side (copied)
         * @return This builder
         */
        public Builder equalities(SparseMatrix a, double[] b) {
            this.equalityMatrix = a;
            this.equalityRhs = b != null ? b.clone() : null;
            return this;
        }

        /**
         * Sets the inequality constraints Aineq x &lt;= bineq.
         * @param a Constraint matrix
         * @param b Right-hand side (copied)
         * @return This builder
         */
        public Builder inequalities(SparseMatrix a, double[] b) {
            this.inequalityMatrix = a;
            this.inequalityRhs = b != null ? b.clone() : null;
            return this;
        }

        /**
         * Sets the bound vectors. The arrays are kept by reference.
         * @param lb Lower bounds, infinite entries allowed
         * @param ub Upper bounds, infinite entries allowed
         * @return This builder
         */
        public Builder bounds(double[] lb, double[] ub) {
            this.lowerBounds = lb;
            this.upperBounds = ub;
            this.bounds = null;
            this.uniformBound = null;
            return this;
        }

        /**
         * Sets a bound per variable.
         * @param bounds Bounds (null entries mean free)
         * @return This builder
         */
        public Builder bounds(Bound[] bounds) {
            this.bounds = bounds != null ? bounds.clone() : null;
            this.lowerBounds = null;
            this.upperBounds = null;
            this.uniformBound = null;
            return this;
        }

        /**
         * Sets a single bound that applies to all variables.
         * @param bound Bound to apply to all variables
         * @return This builder
         */
        public Builder bounds(Bound bound) {
            this.uniformBound = bound;
            this.bounds = null;
            this.lowerBounds = null;
            this.upperBounds = null;
            return this;
        }

        /**
         * Builds the problem.
         * @return Quadratic program
         * @throws IllegalArgumentException if dimensions are inconsistent
         */
        public QuadraticProgram build() {
            if (quadraticCost == null) {
                throw new IllegalArgumentException("Quadratic cost matrix is required");
            }
            if (!quadraticCost.isSquare()) {
                throw new IllegalArgumentException("Quadratic cost matrix must be square, got "
                        + quadraticCost.getRows() + "x" + quadraticCost.getCols());
            }
            int n = quadraticCost.getRows();
            if (n == 0) {
                throw new IllegalArgumentException("Problem must have at least one variable");
            }
            double[] c = linearCost != null ? linearCost.clone() : new double[n];
            if (c.length != n) {
                throw new IllegalArgumentException("Linear cost must have length " + n);
            }
            SparseMatrix aeq = equalityMatrix != null ? equalityMatrix : SparseMatrix.empty(0, n);
            double[] beq = equalityMatrix != null ? equalityRhs : new double[0];
            SparseMatrix aineq = inequalityMatrix != null ? inequalityMatrix : SparseMatrix.empty(0, n);
            double[] bineq = inequalityMatrix != null ? inequalityRhs : new double[0];
            checkConstraints("Equality", aeq, beq, n);
            checkConstraints("Inequality", aineq, bineq, n);

            double[] lb;
            double[] ub;
            if (lowerBounds != null || upperBounds != null) {
                lb = lowerBounds != null ? lowerBounds : filled(n, Double.NEGATIVE_INFINITY);
                ub = upperBounds != null ? upperBounds : filled(n, Double.POSITIVE_INFINITY);
            } else {
                if (bounds != null && bounds.length != n) {
                    throw new IllegalArgumentException("Bounds array length must match dimension " + n);
                }
                lb = new double[n];
                ub = new double[n];
                for (int i = 0; i < n; i++) {
                    Bound b = bounds != null ? bounds[i] : uniformBound;
                    if (b == null) {
                        b = Bound.free();
                    }
                    lb[i] = b.lowerValue();
                    ub[i] = b.upperValue();
                }
            }
            if (lb.length != n || ub.length != n) {
                throw new IllegalArgumentException("Bound vectors must have length " + n);
            }
            return new QuadraticProgram(quadraticCost, c, aeq, beq.clone(), aineq, bineq.clone(), lb, ub);
        }

        private static void checkConstraints(String kind, SparseMatrix a, double[] b, int n) {
            if (a.getCols() != n) {
                throw new IllegalArgumentException(kind + " matrix must have " + n + " columns, got " + a.getCols());
            }
            if (b == null || b.length != a.getRows()) {
                throw new IllegalArgumentException(kind + " right-hand side must have length " + a.getRows());
            }
        }

        private static double[] filled(int n, double value) {
            double[] a = new double[n];
            Arrays.fill(a, value);
            return a;
        }
    }
}
