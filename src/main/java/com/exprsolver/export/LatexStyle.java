package com.exprsolver.export;

/**
 * Operator spelling in LaTeX output.
 */
public enum LatexStyle {
    /** {@code \times} and {@code \div}. */
    SYMBOLIC,
    /** Bare {@code * / ^} and plain parentheses; readable by the expression tokenizer. */
    PLAIN
}
