/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.qp.cplex;

import com.curioloop.qp.QpResult;
import com.curioloop.qp.QpSolver;
import com.curioloop.qp.QpStatus;
import com.curioloop.qp.QuadraticProgram;
import com.curioloop.qp.SparseMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link QpSolver} backed by IBM ILOG CPLEX.
 * <p>
 * The problem is loaded into a fresh {@link CplexModel} as
 * </p>
 * <pre>
 *   columns : x, objective c, bounds [lb, ub]
 *   rows    : Aeq (sense 'E', rhs beq) followed by Aineq (sense 'L', rhs bineq)
 *   quad    : Q, rows passed through unchanged
 * </pre>
 * <p>
 * and the CPLEX solution is translated back:
 * </p>
 * <ul>
 *   <li>status codes outside the mapping table become {@link QpStatus#SOLVER_ERROR}</li>
 *   <li>equality duals are negated (CPLEX reports them with the opposite sign)</li>
 *   <li>bound duals are split from the reduced costs at {@link #REDUCED_COST_THRESHOLD}</li>
 *   <li>solve time covers the optimize call only, measured with the CPLEX timer</li>
 * </ul>
 * <p>
 * Infinite entries of the problem's bound vectors are rewritten to
 * {@link CplexModel#INFINITY} in place. Exceptions raised by the model are
 * not caught.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * The solver holds no per-solve state and opens one model per call, so
 * concurrent calls are as safe as the CPLEX library allows.
 * </p>
 */
public final class CplexQpSolver implements QpSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(CplexQpSolver.class);

    /** Reduced costs at or above this value are attributed to the lower bound */
    public static final double REDUCED_COST_THRESHOLD = 1e-7;

    private static final Map<Integer, QpStatus> STATUS_MAP = Map.of(
            1, QpStatus.OPTIMAL,                // CPX_STAT_OPTIMAL
            2, QpStatus.UNBOUNDED,              // CPX_STAT_UNBOUNDED
            3, QpStatus.INFEASIBLE,             // CPX_STAT_INFEASIBLE
            6, QpStatus.OPTIMAL_INACCURATE);    // CPX_STAT_NUM_BEST

    private final Supplier<? extends CplexModel> modelFactory;

    /**
     * Creates a solver using the native CPLEX binding and default settings.
     */
    public CplexQpSolver() {
        this(CplexSettings.defaults());
    }

    /**
     * Creates a solver using the native CPLEX binding.
     * @param settings Options applied to every model
     */
    public CplexQpSolver(CplexSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("Settings cannot be null");
        }
        this.modelFactory = () -> NativeCplexModel.open(settings);
    }

    /**
     * Creates a solver with a custom model factory.
     * @param modelFactory Opens a new, empty model for each solve
     */
    public CplexQpSolver(Supplier<? extends CplexModel> modelFactory) {
        if (modelFactory == null) {
            throw new IllegalArgumentException("Model factory cannot be null");
        }
        this.modelFactory = modelFactory;
    }

    @Override
    public String getName() {
        return "CPLEX";
    }

    @Override
    public QpResult solve(QuadraticProgram problem) {
        if (problem == null) {
            throw new IllegalArgumentException("Problem cannot be null");
        }
        int n = problem.getVariableCount();
        int neq = problem.getEqualityCount();
        int nineq = problem.getInequalityCount();

        double[] lb = problem.getLowerBounds();
        double[] ub = problem.getUpperBounds();
        replaceInfinities(lb);
        replaceInfinities(ub);

        SparseMatrix rows = SparseMatrix.stack(problem.getEqualityMatrix(), problem.getInequalityMatrix());
        char[] senses = new char[neq + nineq];
        Arrays.fill(senses, 0, neq, CplexModel.SENSE_EQUAL);
        Arrays.fill(senses, neq, neq + nineq, CplexModel.SENSE_LESS_EQUAL);
        double[] rhs = concat(problem.getEqualityRhs(), problem.getInequalityRhs());
        SparseMatrix q = problem.getQuadraticCost();

        LOGGER.debug("Loading QP into CPLEX: n={}, meq={}, mineq={}, nnz(A)={}, nnz(Q)={}",
                n, neq, nineq, rows.getNonZeros(), q.getNonZeros());

        try (CplexModel model = modelFactory.get()) {
            model.setMinimize();
            model.addVariables(problem.getLinearCost(), lb, ub);
            model.addRows(rows.getRowPointers(), rows.getColumnIndices(), rows.getValues(), senses, rhs);
            model.setQuadratic(q.getRowPointers(), q.getColumnIndices(), q.getValues());

            double start = model.getTime();
            model.solve();
            double end = model.getTime();

            double objective = model.getObjectiveValue();
            QpStatus status = toQpStatus(model.getStatus());
            double[] x = model.getValues();

            double[] duals = model.getDualValues();
            double[] equalityDuals = new double[neq];
            for (int i = 0; i < neq; i++) {
                equalityDuals[i] = -duals[i];
            }
            double[] inequalityDuals = Arrays.copyOfRange(duals, neq, neq + nineq);

            double[] lowerDuals = new double[n];
            double[] upperDuals = new double[n];
            splitReducedCosts(model.getReducedCosts(), lowerDuals, upperDuals);

            double solveTime = end - start;
            LOGGER.debug("CPLEX finished: status={}, objective={}, time={}s", status.name(), objective, solveTime);

            return new QpResult(status, objective, x, equalityDuals, inequalityDuals,
                    lowerDuals, upperDuals, solveTime);
        }
    }

    /**
     * Maps a CPLEX solution status code.
     * @param code Raw CPLEX status
     * @return Mapped status, {@link QpStatus#SOLVER_ERROR} if unmapped
     */
    static QpStatus toQpStatus(int code) {
        QpStatus status = STATUS_MAP.get(code);
        if (status == null) {
            LOGGER.warn("Unmapped CPLEX status code {}, reporting {}", code, QpStatus.SOLVER_ERROR.name());
            return QpStatus.SOLVER_ERROR;
        }
        return status;
    }

    /**
     * Rewrites infinite entries to the CPLEX sentinel, in place.
     * @param bounds Bound vector
     */
    static void replaceInfinities(double[] bounds) {
        for (int i = 0; i < bounds.length; i++) {
            if (bounds[i] == Double.NEGATIVE_INFINITY) {
                bounds[i] = -CplexModel.INFINITY;
            } else if (bounds[i] == Double.POSITIVE_INFINITY) {
                bounds[i] = CplexModel.INFINITY;
            }
        }
    }

    /**
     * Attributes each reduced cost to exactly one bound dual.
     * <p>
     * This approximates per-bound duals: a reduced cost at or above
     * {@link #REDUCED_COST_THRESHOLD} goes to the lower bound as is, anything
     * else goes to the upper bound negated.
     * </p>
     * @param reducedCosts Reduced costs from CPLEX
     * @param lowerDuals Output lower bound duals, zero-initialised
     * @param upperDuals Output upper bound duals, zero-initialised
     */
    static void splitReducedCosts(double[] reducedCosts, double[] lowerDuals, double[] upperDuals) {
        for (int i = 0; i < lowerDuals.length; i++) {
            if (reducedCosts[i] >= REDUCED_COST_THRESHOLD) {
                lowerDuals[i] = reducedCosts[i];
            } else {
                upperDuals[i] = -reducedCosts[i];
            }
        }
    }

    private static double[] concat(double[] a, double[] b) {
        double[] r = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, r, a.length, b.length);
        return r;
    }
}
