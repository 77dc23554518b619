package com.exprsolver.export;

/**
 * One rendered reduction: the whole expression before and after a step.
 */
public record DerivationLine(String before, String after) {
}
