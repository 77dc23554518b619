package com.exprsolver.evaluator;

import com.exprsolver.ast.AstNode;
import com.exprsolver.ast.DecimalFormatting;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of a successful evaluation.
 *
 * @param ast        The tree that was evaluated (unchanged)
 * @param steps      Reductions in evaluation order
 * @param finalValue Value of the whole expression
 */
public record ExpressionResult(AstNode ast, List<EvaluationStep> steps, BigDecimal finalValue) {

    public ExpressionResult {
        steps = List.copyOf(steps);
    }

    /**
     * Final value in canonical plain form, e.g. "14" or "0.3333333333".
     */
    public String finalValueText() {
        return DecimalFormatting.toPlainString(finalValue);
    }
}
