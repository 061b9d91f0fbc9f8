/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.qp.cplex;

/**
 * CPLEX callable-library routines used by {@link NativeCplexModel}, one
 * method per routine. Environment and problem pointers travel as
 * {@code long} handles. Failures are raised as
 * {@link com.curioloop.qp.QpSolverException} with the CPLEX error code.
 */
interface CplexCalls {

    /** CPXopenCPLEX, then CPX_PARAM_SCRIND and CPX_PARAM_THREADS */
    long openEnvironment(boolean screenOutput, int threads);

    /** CPXcreateprob */
    long createProblem(long env);

    /** CPXfreeprob when {@code lp != 0}, then CPXcloseCPLEX */
    void closeEnvironment(long env, long lp);

    /** CPXchgobjsen(CPX_MIN) */
    void setMinimize(long env, long lp);

    /** CPXnewcols */
    void newColumns(long env, long lp, int count, double[] obj, double[] lb, double[] ub);

    /** CPXaddrows */
    void addRows(long env, long lp, int rowCount, int nonZeros, double[] rhs, char[] sense,
                 int[] rowBegin, int[] rowIndex, double[] rowValue);

    /** CPXcopyquad; Q is symmetric so its CSR arrays are also its CSC arrays */
    void copyQuadratic(long env, long lp, int[] begin, int[] index, double[] value);

    /** CPXqpopt */
    void optimize(long env, long lp);

    /** CPXgettime */
    double getTime(long env);

    /** CPXgetstat */
    int getStatus(long env, long lp);

    /** CPXgetobjval */
    double getObjectiveValue(long env, long lp);

    /** CPXgetx */
    void getX(long env, long lp, double[] x);

    /** CPXgetpi */
    void getPi(long env, long lp, double[] pi);

    /** CPXgetdj */
    void getDj(long env, long lp, double[] dj);
}
