package com.exprsolver.exception;

import com.exprsolver.evaluator.EvaluationStep;

import java.util.List;

/**
 * Exception thrown when a reduction step cannot produce a real decimal value.
 * Carries the steps completed before the failure for diagnostic display.
 */
public class EvaluationException extends ExprSolverException {

    private final ArithmeticErrorKind kind;
    private final int stepIndex;
    private final List<EvaluationStep> partialSteps;

    public EvaluationException(ArithmeticErrorKind kind, int stepIndex, List<EvaluationStep> partialSteps) {
        super(kind + " at step " + stepIndex);
        this.kind = kind;
        this.stepIndex = stepIndex;
        this.partialSteps = List.copyOf(partialSteps);
    }

    public ArithmeticErrorKind getKind() {
        return kind;
    }

    /**
     * Get the 0-based index of the step that failed.
     * Equal to the number of steps completed before it.
     */
    public int getStepIndex() {
        return stepIndex;
    }

    public List<EvaluationStep> getPartialSteps() {
        return partialSteps;
    }
}
