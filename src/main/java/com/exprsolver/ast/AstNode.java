package com.exprsolver.ast;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Node of an arithmetic expression tree.
 * <p>
 * Nodes are immutable and own their children exclusively; the parser never shares a subtree
 * between two parents, and rewriting produces new nodes instead of editing existing ones.
 */
public sealed interface AstNode {

    /** Binding strength of a unary minus (between multiplicative and power). */
    int UNARY_PRECEDENCE = 3;

    /** Binding strength of a leaf. */
    int ATOM_PRECEDENCE = 5;

    /**
     * Binding strength of this node when it appears as an operand.
     */
    int precedence();

    /**
     * Numeric leaf. The lexeme is kept exactly as written and parsed on demand.
     */
    record Literal(String lexeme) implements AstNode {

        public Literal {
            Objects.requireNonNull(lexeme, "lexeme");
        }

        /**
         * Create a literal holding a computed value in canonical plain form.
         */
        public static Literal of(BigDecimal value) {
            return new Literal(DecimalFormatting.toPlainString(value));
        }

        public BigDecimal decimalValue() {
            return new BigDecimal(lexeme);
        }

        /**
         * Only reduction results can be negative; the parser produces {@link UnaryMinus} instead.
         */
        public boolean isNegative() {
            return lexeme.startsWith("-");
        }

        @Override
        public int precedence() {
            return isNegative() ? UNARY_PRECEDENCE : ATOM_PRECEDENCE;
        }

        @Override
        public String toString() {
            return lexeme;
        }
    }

    record BinaryOp(Operator operator, AstNode left, AstNode right) implements AstNode {

        public BinaryOp {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public int precedence() {
            return operator.precedence();
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator.symbol() + " " + right + ")";
        }
    }

    record UnaryMinus(AstNode operand) implements AstNode {

        public UnaryMinus {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public int precedence() {
            return UNARY_PRECEDENCE;
        }

        @Override
        public String toString() {
            return "(-" + operand + ")";
        }
    }
}
