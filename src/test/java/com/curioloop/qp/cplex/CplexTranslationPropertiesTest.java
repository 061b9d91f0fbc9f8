/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.qp.cplex;

import com.curioloop.qp.QpResult;
import com.curioloop.qp.QpStatus;
import com.curioloop.qp.QuadraticProgram;
import com.curioloop.qp.SparseMatrix;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the CPLEX result and input translation.
 */
public class CplexTranslationPropertiesTest {

    private static final Set<Integer> MAPPED_CODES = Set.of(1, 2, 3, 6);

    /**
     * For any bound vectors, no infinite value reaches the model and finite
     * values pass through untouched.
     */
    @Property(tries = 200)
    @Label("Infinite bounds never reach the CPLEX model")
    void infiniteBoundsAreAlwaysRemapped(@ForAll("boundPairs") double[][] bounds) {
        double[] lb = bounds[0];
        double[] ub = bounds[1];
        double[] lbBefore = lb.clone();
        double[] ubBefore = ub.clone();
        int n = lb.length;
        RecordingCplexModel model = new RecordingCplexModel().withReducedCosts(new double[n]);

        new CplexQpSolver(() -> model).solve(QuadraticProgram.builder()
                .quadraticCost(identity(n))
                .bounds(lb, ub)
                .build());

        for (int i = 0; i < n; i++) {
            assertThat(model.lower[i]).isFinite().isEqualTo(expectedSentinel(lbBefore[i]));
            assertThat(model.upper[i]).isFinite().isEqualTo(expectedSentinel(ubBefore[i]));
        }
    }

    /**
     * The returned equality duals are the negated raw duals; inequality duals
     * are the raw tail unchanged.
     */
    @Property(tries = 200)
    @Label("Equality duals are the negation of the raw CPLEX duals")
    void equalityDualsAreNegated(
            @ForAll @Size(min = 1, max = 12) List<@DoubleRange(min = -1e3, max = 1e3) Double> rawDuals,
            @ForAll @IntRange(min = 0, max = 12) int split
    ) {
        int m = rawDuals.size();
        int neq = Math.min(split, m);
        double[] duals = rawDuals.stream().mapToDouble(Double::doubleValue).toArray();
        RecordingCplexModel model = new RecordingCplexModel()
                .withDuals(duals)
                .withReducedCosts(0.0);

        QpResult result = new CplexQpSolver(() -> model).solve(QuadraticProgram.builder()
                .quadraticCost(identity(1))
                .equalities(ones(neq), new double[neq])
                .inequalities(ones(m - neq), new double[m - neq])
                .build());

        double[] eq = result.getEqualityDuals();
        double[] ineq = result.getInequalityDuals();
        assertThat(eq).hasSize(neq);
        assertThat(ineq).hasSize(m - neq);
        for (int i = 0; i < neq; i++) {
            assertThat(eq[i]).isEqualTo(-duals[i]);
        }
        for (int i = 0; i < m - neq; i++) {
            assertThat(ineq[i]).isEqualTo(duals[neq + i]);
        }
    }

    /**
     * Every nonzero reduced cost lands in exactly one bound dual slot.
     */
    @Property(tries = 200)
    @Label("Exactly one bound dual per variable is nonzero")
    void exactlyOneBoundDualIsNonZero(@ForAll("reducedCosts") List<Double> costs) {
        int n = costs.size();
        double[] rc = costs.stream().mapToDouble(Double::doubleValue).toArray();
        RecordingCplexModel model = new RecordingCplexModel().withReducedCosts(rc);

        QpResult result = new CplexQpSolver(() -> model).solve(QuadraticProgram.builder()
                .quadraticCost(identity(n))
                .build());

        double[] lower = result.getLowerBoundDuals();
        double[] upper = result.getUpperBoundDuals();
        for (int i = 0; i < n; i++) {
            boolean lowerSet = lower[i] != 0.0;
            boolean upperSet = upper[i] != 0.0;
            assertThat(lowerSet ^ upperSet)
                    .as("variable %d with reduced cost %s", i, rc[i])
                    .isTrue();
            if (rc[i] >= CplexQpSolver.REDUCED_COST_THRESHOLD) {
                assertThat(lower[i]).isEqualTo(rc[i]);
            } else {
                assertThat(upper[i]).isEqualTo(-rc[i]);
            }
        }
    }

    /**
     * Codes outside the mapping table never raise.
     */
    @Property(tries = 300)
    @Label("Unmapped status codes yield SOLVER_ERROR")
    void unmappedStatusYieldsSolverError(@ForAll int code) {
        Assume.that(!MAPPED_CODES.contains(code));
        RecordingCplexModel model = new RecordingCplexModel()
                .withStatus(code)
                .withReducedCosts(0.0);

        QpResult result = new CplexQpSolver(() -> model).solve(QuadraticProgram.builder()
                .quadraticCost(identity(1))
                .build());

        assertThat(result.getStatus()).isEqualTo(QpStatus.SOLVER_ERROR);
    }

    @Provide
    Arbitrary<double[][]> boundPairs() {
        Arbitrary<Double> entry = Arbitraries.oneOf(
                Arbitraries.doubles().between(-1e6, 1e6),
                Arbitraries.of(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY));
        return Arbitraries.integers().between(1, 20).flatMap(n ->
                Combinators.combine(vector(entry, n), vector(entry, n)).as((lb, ub) -> new double[][]{lb, ub}));
    }

    @Provide
    Arbitrary<List<Double>> reducedCosts() {
        Arbitrary<Double> entry = Arbitraries.oneOf(
                Arbitraries.doubles().between(-10.0, 10.0),
                Arbitraries.doubles().between(-1e-6, 1e-6).ofScale(12),
                Arbitraries.of(1e-7, -1e-7, 9.99e-8));
        return entry.filter(d -> d != 0.0).list().ofMinSize(1).ofMaxSize(20);
    }

    private static Arbitrary<double[]> vector(Arbitrary<Double> entry, int n) {
        return entry.list().ofSize(n).map(l -> l.stream().mapToDouble(Double::doubleValue).toArray());
    }

    private static double expectedSentinel(double bound) {
        if (bound == Double.NEGATIVE_INFINITY) return -CplexModel.INFINITY;
        if (bound == Double.POSITIVE_INFINITY) return CplexModel.INFINITY;
        return bound;
    }

    private static SparseMatrix identity(int n) {
        int[] idx = new int[n];
        double[] ones = new double[n];
        for (int i = 0; i < n; i++) {
            idx[i] = i;
            ones[i] = 1.0;
        }
        return SparseMatrix.fromTriplets(n, n, idx, idx, ones);
    }

    private static SparseMatrix ones(int rows) {
        double[][] dense = new double[rows][1];
        for (double[] row : dense) {
            row[0] = 1.0;
        }
        return SparseMatrix.fromDense(dense, 1);
    }
}
