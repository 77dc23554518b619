package com.exprsolver.export;

import com.exprsolver.ast.AstNode;
import com.exprsolver.ast.Grouping;
import com.exprsolver.ast.Operator;

/**
 * Renders MathML 3.0 presentation markup.
 * <p>
 * Numbers use {@code <mn>}, operators {@code <mo>}, every compound node its own {@code <mrow>},
 * powers {@code <msup>}; '/' is an inline {@code ÷} or an {@code <mfrac>} depending on
 * {@link DivisionStyle}. Parentheses are emitted as {@code <mo>} pairs only where precedence
 * requires them.
 */
public class MathMlExporter implements ExpressionExporter {

    public static final String MATHML_NAMESPACE = "http://www.w3.org/1998/Math/MathML";

    private final DivisionStyle divisionStyle;

    public MathMlExporter() {
        this(DivisionStyle.INLINE);
    }

    public MathMlExporter(DivisionStyle divisionStyle) {
        this.divisionStyle = divisionStyle;
    }

    @Override
    public String export(AstNode ast) {
        StringBuilder sb = new StringBuilder();
        sb.append("<math xmlns=\"").append(MATHML_NAMESPACE).append("\">");
        append(sb, ast);
        sb.append("</math>");
        return sb.toString();
    }

    private void append(StringBuilder sb, AstNode node) {
        if (node instanceof AstNode.Literal literal) {
            appendLiteral(sb, literal);
        } else if (node instanceof AstNode.UnaryMinus unary) {
            sb.append("<mrow><mo>-</mo>");
            appendGrouped(sb, unary.operand(), Grouping.needsGroupingAsOperand(unary.operand()));
            sb.append("</mrow>");
        } else if (node instanceof AstNode.BinaryOp binary) {
            appendBinary(sb, binary);
        }
    }

    private void appendLiteral(StringBuilder sb, AstNode.Literal literal) {
        if (literal.isNegative()) {
            sb.append("<mrow><mo>-</mo><mn>").append(literal.lexeme().substring(1)).append("</mn></mrow>");
        } else {
            sb.append("<mn>").append(literal.lexeme()).append("</mn>");
        }
    }

    private void appendBinary(StringBuilder sb, AstNode.BinaryOp binary) {
        Operator op = binary.operator();
        AstNode left = binary.left();
        AstNode right = binary.right();

        if (op == Operator.POWER) {
            sb.append("<msup>");
            appendGrouped(sb, left, Grouping.needsGroupingAsLeft(op, left));
            sb.append("<mrow>");
            append(sb, right);
            sb.append("</mrow></msup>");
            return;
        }
        if (op == Operator.DIVIDE && divisionStyle == DivisionStyle.FRACTION) {
            sb.append("<mfrac><mrow>");
            append(sb, left);
            sb.append("</mrow><mrow>");
            append(sb, right);
            sb.append("</mrow></mfrac>");
            return;
        }

        sb.append("<mrow>");
        appendGrouped(sb, left, Grouping.needsGroupingAsLeft(op, left));
        sb.append("<mo>").append(operatorSymbol(op)).append("</mo>");
        appendGrouped(sb, right, Grouping.needsGroupingAsRight(op, right));
        sb.append("</mrow>");
    }

    private void appendGrouped(StringBuilder sb, AstNode node, boolean grouped) {
        if (grouped) {
            sb.append("<mrow><mo>(</mo>");
            append(sb, node);
            sb.append("<mo>)</mo></mrow>");
        } else {
            append(sb, node);
        }
    }

    private static String operatorSymbol(Operator op) {
        return switch (op) {
            case ADD -> "+";
            case SUBTRACT -> "-";
            case MULTIPLY -> "×";
            case DIVIDE -> "÷";
            case POWER -> "^";
        };
    }
}
