package com.exprsolver.evaluator;

import com.exprsolver.ast.AstNode;

/**
 * One reduction in a derivation.
 *
 * @param index               0-based position in the derivation
 * @param description         Short description, e.g. "evaluate 3 * 4"
 * @param subExpressionBefore The reduced sub-expression, e.g. "3 * 4"
 * @param subExpressionAfter  Its value, e.g. "12"
 * @param resultingTree       The whole expression after this reduction
 */
public record EvaluationStep(
        int index,
        String description,
        String subExpressionBefore,
        String subExpressionAfter,
        AstNode resultingTree
) {
    @Override
    public String toString() {
        return subExpressionBefore + " = " + subExpressionAfter;
    }
}
