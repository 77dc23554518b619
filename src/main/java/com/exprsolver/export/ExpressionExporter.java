package com.exprsolver.export;

import com.exprsolver.ast.AstNode;
import com.exprsolver.evaluator.EvaluationStep;
import com.exprsolver.evaluator.ExpressionResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Serializes expression trees into a markup format.
 * Implementations are total over any tree the parser or evaluator can produce.
 */
public interface ExpressionExporter {

    /**
     * Render a tree, keeping its unreduced structure.
     */
    String export(AstNode ast);

    /**
     * Render every step of a derivation as a before/after pair, in evaluation order.
     */
    default List<DerivationLine> exportDerivation(ExpressionResult result) {
        List<DerivationLine> lines = new ArrayList<>(result.steps().size());
        AstNode before = result.ast();
        for (EvaluationStep step : result.steps()) {
            lines.add(new DerivationLine(export(before), export(step.resultingTree())));
            before = step.resultingTree();
        }
        return lines;
    }
}
