/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.qp.cplex;

/**
 * {@link CplexCalls} implemented by the {@code cplexjni} shim
 * ({@code src/main/native/cplexjni.c}).
 */
final class JniCplexCalls implements CplexCalls {

    static final JniCplexCalls INSTANCE = new JniCplexCalls();

    private JniCplexCalls() {}

    /**
     * Gets the shared instance, loading the shim on first use.
     * @return JNI calls
     * @throws com.curioloop.qp.QpSolverException if the shim cannot be loaded
     */
    static JniCplexCalls load() {
        NativeLibraryLoader.load();
        return INSTANCE;
    }

    @Override
    public long openEnvironment(boolean screenOutput, int threads) {
        return nativeOpen(screenOutput, threads);
    }

    @Override
    public long createProblem(long env) {
        return nativeCreateProblem(env);
    }

    @Override
    public void closeEnvironment(long env, long lp) {
        nativeClose(env, lp);
    }

    @Override
    public void setMinimize(long env, long lp) {
        nativeSetMinimize(env, lp);
    }

    @Override
    public void newColumns(long env, long lp, int count, double[] obj, double[] lb, double[] ub) {
        nativeNewColumns(env, lp, count, obj, lb, ub);
    }

    @Override
    public void addRows(long env, long lp, int rowCount, int nonZeros, double[] rhs, char[] sense,
                        int[] rowBegin, int[] rowIndex, double[] rowValue) {
        nativeAddRows(env, lp, rowCount, nonZeros, rhs, sense, rowBegin, rowIndex, rowValue);
    }

    @Override
    public void copyQuadratic(long env, long lp, int[] begin, int[] index, double[] value) {
        nativeCopyQuadratic(env, lp, begin, index, value);
    }

    @Override
    public void optimize(long env, long lp) {
        nativeQpOpt(env, lp);
    }

    @Override
    public double getTime(long env) {
        return nativeGetTime(env);
    }

    @Override
    public int getStatus(long env, long lp) {
        return nativeGetStatus(env, lp);
    }

    @Override
    public double getObjectiveValue(long env, long lp) {
        return nativeGetObjectiveValue(env, lp);
    }

    @Override
    public void getX(long env, long lp, double[] x) {
        nativeGetX(env, lp, x);
    }

    @Override
    public void getPi(long env, long lp, double[] pi) {
        nativeGetPi(env, lp, pi);
    }

    @Override
    public void getDj(long env, long lp, double[] dj) {
        nativeGetDj(env, lp, dj);
    }

    private static native long nativeOpen(boolean screenOutput, int threads);

    private static native long nativeCreateProblem(long env);

    private static native void nativeClose(long env, long lp);

    private static native void nativeSetMinimize(long env, long lp);

    private static native void nativeNewColumns(long env, long lp, int count, double[] obj, double[] lb, double[] ub);

    private static native void nativeAddRows(long env, long lp, int rowCount, int nonZeros, double[] rhs, char[] sense,
                                             int[] rowBegin, int[] rowIndex, double[] rowValue);

    private static native void nativeCopyQuadratic(long env, long lp, int[] begin, int[] index, double[] value);

    private static native void nativeQpOpt(long env, long lp);

    private static native double nativeGetTime(long env);

    private static native int nativeGetStatus(long env, long lp);

    private static native double nativeGetObjectiveValue(long env, long lp);

    private static native void nativeGetX(long env, long lp, double[] x);

    private static native void nativeGetPi(long env, long lp, double[] pi);

    private static native void nativeGetDj(long env, long lp, double[] dj);
}
