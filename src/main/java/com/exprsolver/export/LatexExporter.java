package com.exprsolver.export;

import com.exprsolver.ast.AstNode;
import com.exprsolver.ast.Grouping;
import com.exprsolver.ast.Operator;

/**
 * Renders math-mode LaTeX, e.g. {@code \left(1 + 2\right) \times 3} or {@code 2^{3^{2}}}.
 * <p>
 * In {@link LatexStyle#SYMBOLIC} style exponents are always braced and other operands get
 * {@code \left( \right)} only where precedence requires it. {@link LatexStyle#PLAIN} output
 * uses only {@code + - * / ^ ( )}, e.g. {@code (1 + 2) * 3^(1 + 1)}, so without math delimiters
 * it is valid input to the expression tokenizer as is.
 */
public class LatexExporter implements ExpressionExporter {

    private final LatexStyle style;
    private final boolean mathDelimiters;

    public LatexExporter() {
        this(LatexStyle.SYMBOLIC, false);
    }

    /**
     * @param style          Operator spelling
     * @param mathDelimiters Whether to wrap the output in {@code $...$}
     */
    public LatexExporter(LatexStyle style, boolean mathDelimiters) {
        this.style = style;
        this.mathDelimiters = mathDelimiters;
    }

    @Override
    public String export(AstNode ast) {
        StringBuilder sb = new StringBuilder();
        append(sb, ast);
        return mathDelimiters ? "$" + sb + "$" : sb.toString();
    }

    private void append(StringBuilder sb, AstNode node) {
        if (node instanceof AstNode.Literal literal) {
            sb.append(literal.lexeme());
        } else if (node instanceof AstNode.UnaryMinus unary) {
            sb.append('-');
            appendGrouped(sb, unary.operand(), Grouping.needsGroupingAsOperand(unary.operand()));
        } else if (node instanceof AstNode.BinaryOp binary) {
            Operator op = binary.operator();
            appendGrouped(sb, binary.left(), Grouping.needsGroupingAsLeft(op, binary.left()));
            if (op == Operator.POWER && style == LatexStyle.SYMBOLIC) {
                sb.append("^{");
                append(sb, binary.right());
                sb.append('}');
            } else if (op == Operator.POWER) {
                sb.append('^');
                appendGrouped(sb, binary.right(), Grouping.needsGroupingAsRight(op, binary.right()));
            } else {
                sb.append(' ').append(operatorSymbol(op)).append(' ');
                appendGrouped(sb, binary.right(), Grouping.needsGroupingAsRight(op, binary.right()));
            }
        }
    }

    private void appendGrouped(StringBuilder sb, AstNode node, boolean grouped) {
        if (grouped) {
            sb.append(style == LatexStyle.SYMBOLIC ? "\\left(" : "(");
            append(sb, node);
            sb.append(style == LatexStyle.SYMBOLIC ? "\\right)" : ")");
        } else {
            append(sb, node);
        }
    }

    private String operatorSymbol(Operator op) {
        return switch (op) {
            case ADD -> "+";
            case SUBTRACT -> "-";
            case MULTIPLY -> style == LatexStyle.SYMBOLIC ? "\\times" : "*";
            case DIVIDE -> style == LatexStyle.SYMBOLIC ? "\\div" : "/";
            case POWER -> "^";
        };
    }
}
