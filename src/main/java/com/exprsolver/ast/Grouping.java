package com.exprsolver.ast;

/**
 * Decides where an operand must be wrapped in explicit grouping so that re-parsing
 * the rendered text rebuilds the same tree.
 * <p>
 * Shared by the plain-text printer and both markup exporters.
 */
public final class Grouping {

    private Grouping() {
    }

    /**
     * Left operand: group when it binds looser, or equally under a right-associative operator.
     */
    public static boolean needsGroupingAsLeft(Operator parent, AstNode child) {
        if (isNegativeLiteral(child)) {
            return true;
        }
        int p = parent.precedence();
        int c = child.precedence();
        return c < p || (c == p && parent.associativity() == Associativity.RIGHT);
    }

    /**
     * Right operand: group when it binds looser, or equally under a left-associative operator.
     */
    public static boolean needsGroupingAsRight(Operator parent, AstNode child) {
        if (isNegativeLiteral(child)) {
            return true;
        }
        int p = parent.precedence();
        int c = child.precedence();
        return c < p || (c == p && parent.associativity() == Associativity.LEFT);
    }

    /**
     * Operand of a unary minus: any binary sum/product, nested negation or negative literal.
     */
    public static boolean needsGroupingAsOperand(AstNode child) {
        return child.precedence() <= AstNode.UNARY_PRECEDENCE;
    }

    private static boolean isNegativeLiteral(AstNode node) {
        return node instanceof AstNode.Literal literal && literal.isNegative();
    }
}
