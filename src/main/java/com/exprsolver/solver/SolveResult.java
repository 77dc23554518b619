package com.exprsolver.solver;

import com.exprsolver.evaluator.ExpressionResult;

import java.util.List;

/**
 * Everything produced for one input expression.
 *
 * @param inputExpression      Text as received (LaTeX input is kept in its original form)
 * @param normalizedExpression Canonical infix rendering of the parsed tree
 * @param result               Evaluation steps and final value
 * @param formattedSteps       Display form of each step, e.g. "3 × 4 = 12"
 * @param latex                LaTeX export of the unreduced tree
 * @param mathml               MathML export of the unreduced tree
 */
public record SolveResult(
        String inputExpression,
        String normalizedExpression,
        ExpressionResult result,
        List<String> formattedSteps,
        String latex,
        String mathml
) {
    public SolveResult {
        formattedSteps = List.copyOf(formattedSteps);
    }
}
