package com.exprsolver.evaluator;

import com.exprsolver.exception.ArithmeticErrorKind;

/**
 * Raised by {@link DecimalArithmetic} for a single operation; the evaluator attaches the step context.
 */
class UndefinedResultException extends RuntimeException {

    private final ArithmeticErrorKind kind;

    UndefinedResultException(ArithmeticErrorKind kind) {
        super(kind.name());
        this.kind = kind;
    }

    UndefinedResultException(ArithmeticErrorKind kind, Throwable cause) {
        super(kind.name(), cause);
        this.kind = kind;
    }

    ArithmeticErrorKind getKind() {
        return kind;
    }
}
