package com.exprsolver.ast;

/**
 * Grouping direction for chains of equal-precedence operators.
 */
public enum Associativity {
    LEFT,
    RIGHT
}
