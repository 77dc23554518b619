package com.exprsolver.exception;

/**
 * Exception thrown when a token sequence violates the expression grammar.
 */
public class SyntaxException extends ExprSolverException {

    private final int position;
    private final String expected;
    private final String found;

    public SyntaxException(int position, String expected, String found) {
        super("Expected " + expected + " at position " + position + " but found " + found);
        this.position = position;
        this.expected = expected;
        this.found = found;
    }

    public int getPosition() {
        return position;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }
}
