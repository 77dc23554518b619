package com.exprsolver.solver;

import com.exprsolver.evaluator.EvaluationStep;

/**
 * Display formatting for derivation steps.
 */
public final class StepFormatter {

    private StepFormatter() {
    }

    /**
     * Format a step as {@code before = after} with typographic operators.
     */
    public static String format(EvaluationStep step) {
        return readable(step.subExpressionBefore()) + " = " + step.subExpressionAfter();
    }

    /**
     * Replace ASCII multiplication and division with × and ÷.
     */
    public static String readable(String expression) {
        return expression.replace('*', '×').replace('/', '÷');
    }
}
