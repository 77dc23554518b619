package com.exprsolver.ast;

/**
 * Renders an expression tree as normalized infix text, e.g. {@code (1 + 2) * 3} or {@code 2^3^2}.
 * Parentheses appear only where the tree shape requires them.
 */
public final class ExpressionPrinter {

    private ExpressionPrinter() {
    }

    public static String print(AstNode node) {
        StringBuilder sb = new StringBuilder();
        append(sb, node);
        return sb.toString();
    }

    private static void append(StringBuilder sb, AstNode node) {
        if (node instanceof AstNode.Literal literal) {
            sb.append(literal.lexeme());
        } else if (node instanceof AstNode.UnaryMinus unary) {
            sb.append('-');
            appendGrouped(sb, unary.operand(), Grouping.needsGroupingAsOperand(unary.operand()));
        } else if (node instanceof AstNode.BinaryOp binary) {
            Operator op = binary.operator();
            appendGrouped(sb, binary.left(), Grouping.needsGroupingAsLeft(op, binary.left()));
            sb.append(op == Operator.POWER ? "^" : " " + op.symbol() + " ");
            appendGrouped(sb, binary.right(), Grouping.needsGroupingAsRight(op, binary.right()));
        }
    }

    private static void appendGrouped(StringBuilder sb, AstNode node, boolean grouped) {
        if (grouped) {
            sb.append('(');
            append(sb, node);
            sb.append(')');
        } else {
            append(sb, node);
        }
    }
}
