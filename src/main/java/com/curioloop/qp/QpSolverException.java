/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.qp;

/**
 * Exception thrown when a solver backend fails.
 */
public class QpSolverException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Error code used when the backend did not supply one */
    public static final int NO_ERROR_CODE = 0;

    private final int errorCode;

    /**
     * Creates a solver exception.
     * @param message Error message
     */
    public QpSolverException(String message) {
        super(message);
        this.errorCode = NO_ERROR_CODE;
    }

    /**
     * Creates a solver exception carrying a backend error code.
     * @param message Error message
     * @param errorCode Backend error code
     */
    public QpSolverException(String message, int errorCode) {
        super(message + " (error " + errorCode + ")");
        this.errorCode = errorCode;
    }

    /**
     * Creates a solver exception with cause.
     * @param message Error message
     * @param cause Underlying cause
     */
    public QpSolverException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = NO_ERROR_CODE;
    }

    /**
     * Gets the backend error code.
     * @return Error code, or {@link #NO_ERROR_CODE}
     */
    public int getErrorCode() {
        return errorCode;
    }
}
