package com.exprsolver.exception;

/**
 * Base exception for the expression solver.
 */
public class ExprSolverException extends RuntimeException {

    public ExprSolverException(String message) {
        super(message);
    }

    public ExprSolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
