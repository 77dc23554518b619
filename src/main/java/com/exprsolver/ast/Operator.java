package com.exprsolver.ast;

import com.exprsolver.lexer.TokenType;

/**
 * Closed set of binary operators with their binding precedence (higher binds tighter).
 */
public enum Operator {
    ADD("+", 1, Associativity.LEFT),
    SUBTRACT("-", 1, Associativity.LEFT),
    MULTIPLY("*", 2, Associativity.LEFT),
    DIVIDE("/", 2, Associativity.LEFT),
    POWER("^", 4, Associativity.RIGHT);

    private final String symbol;
    private final int precedence;
    private final Associativity associativity;

    Operator(String symbol, int precedence, Associativity associativity) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.associativity = associativity;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public Associativity associativity() {
        return associativity;
    }

    /**
     * Map an operator token to its operator.
     *
     * @throws IllegalArgumentException if the token type is not a binary operator
     */
    public static Operator fromToken(TokenType type) {
        return switch (type) {
            case PLUS -> ADD;
            case MINUS -> SUBTRACT;
            case STAR -> MULTIPLY;
            case SLASH -> DIVIDE;
            case CARET -> POWER;
            default -> throw new IllegalArgumentException("Not a binary operator: " + type);
        };
    }
}
