/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.qp.cplex;

/**
 * {@link CplexModel} backed by the CPLEX callable library through JNI.
 * <p>
 * Each instance owns one CPLEX environment and one problem object, both freed
 * by {@link #close()}. Native errors are raised as
 * {@link com.curioloop.qp.QpSolverException} carrying the CPLEX error code.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is <b>not thread-safe</b>. Open one model per solve and per thread.
 * </p>
 */
public final class NativeCplexModel implements CplexModel {

    private final CplexCalls cplex;
    private final long env;
    private final long lp;
    private int columns;
    private int rows;
    private volatile boolean closed = false;

    private NativeCplexModel(CplexCalls cplex, long env, long lp) {
        this.cplex = cplex;
        this.env = env;
        this.lp = lp;
    }

    /**
     * Opens a CPLEX environment and an empty problem.
     * @param settings Library-level options
     * @return Open model
     * @throws com.curioloop.qp.QpSolverException if the library cannot be
     *         loaded or CPLEX fails to start
     */
    public static NativeCplexModel open(CplexSettings settings) {
        return open(JniCplexCalls.load(), settings);
    }

    static NativeCplexModel open(CplexCalls cplex, CplexSettings settings) {
        long env = cplex.openEnvironment(settings.isVerbose(), settings.getThreads());
        long lp;
        try {
            lp = cplex.createProblem(env);
        } catch (RuntimeException e) {
            cplex.closeEnvironment(env, 0L);
            throw e;
        }
        return new NativeCplexModel(cplex, env, lp);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("CPLEX model has been closed");
        }
    }

    @Override
    public void setMinimize() {
        ensureOpen();
        cplex.setMinimize(env, lp);
    }

    @Override
    public void addVariables(double[] objective, double[] lower, double[] upper) {
        ensureOpen();
        if (lower.length != objective.length || upper.length != objective.length) {
            throw new IllegalArgumentException("Objective and bound arrays must have the same length");
        }
        cplex.newColumns(env, lp, objective.length, objective, lower, upper);
        columns += objective.length;
    }

    @Override
    public void addRows(int[] rowPointers, int[] columnIndices, double[] values, char[] senses, double[] rhs) {
        ensureOpen();
        int count = rowPointers.length - 1;
        if (senses.length != count || rhs.length != count) {
            throw new IllegalArgumentException("Sense and rhs arrays must have length " + count);
        }
        if (count == 0) {
            return;
        }
        cplex.addRows(env, lp, count, values.length, rhs, senses, rowPointers, columnIndices, values);
        rows += count;
    }

    @Override
    public void setQuadratic(int[] rowPointers, int[] columnIndices, double[] values) {
        ensureOpen();
        if (rowPointers.length != columns + 1) {
            throw new IllegalArgumentException("Quadratic matrix must have " + columns + " rows");
        }
        cplex.copyQuadratic(env, lp, rowPointers, columnIndices, values);
    }

    @Override
    public void solve() {
        ensureOpen();
        cplex.optimize(env, lp);
    }

    @Override
    public double getTime() {
        ensureOpen();
        return cplex.getTime(env);
    }

    @Override
    public int getStatus() {
        ensureOpen();
        return cplex.getStatus(env, lp);
    }

    @Override
    public double getObjectiveValue() {
        ensureOpen();
        return cplex.getObjectiveValue(env, lp);
    }

    @Override
    public double[] getValues() {
        ensureOpen();
        double[] x = new double[columns];
        cplex.getX(env, lp, x);
        return x;
    }

    @Override
    public double[] getDualValues() {
        ensureOpen();
        double[] pi = new double[rows];
        if (rows > 0) {
            cplex.getPi(env, lp, pi);
        }
        return pi;
    }

    @Override
    public double[] getReducedCosts() {
        ensureOpen();
        double[] dj = new double[columns];
        cplex.getDj(env, lp, dj);
        return dj;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        cplex.closeEnvironment(env, lp);
    }
}
