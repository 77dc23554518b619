package com.exprsolver.lexer;

/**
 * Token types for arithmetic expressions.
 */
public enum TokenType {
    // Literals
    NUMBER,

    // Operators
    PLUS,
    MINUS,
    STAR,
    SLASH,
    CARET,

    // Delimiters
    LPAREN,
    RPAREN,

    // Special
    EOF;

    /**
     * Whether this token is one of the binary operator symbols.
     */
    public boolean isOperator() {
        return this == PLUS || this == MINUS || this == STAR || this == SLASH || this == CARET;
    }
}
