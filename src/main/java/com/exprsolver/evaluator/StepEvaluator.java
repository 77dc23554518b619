package com.exprsolver.evaluator;

import com.exprsolver.ast.AstNode;
import com.exprsolver.ast.ExpressionPrinter;
import com.exprsolver.exception.EvaluationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Evaluates an expression tree one reduction at a time and records each reduction.
 * <p>
 * A node is reducible when all its operands are literals. Each round rewrites the leftmost
 * reducible node in post-order into a literal, so {@code (1+2)*(3+4)} yields
 * {@code 1 + 2}, {@code 3 + 4}, {@code 3 * 7} in that order. The input tree is never modified;
 * each round builds a new tree that reuses the untouched immutable subtrees.
 * <p>
 * Instances hold no per-call state and can be shared between threads.
 */
public class StepEvaluator {

    private static final Logger log = LoggerFactory.getLogger(StepEvaluator.class);

    private final DecimalArithmetic arithmetic;

    public StepEvaluator() {
        this(DecimalArithmetic.defaults());
    }

    public StepEvaluator(DecimalArithmetic arithmetic) {
        this.arithmetic = arithmetic;
    }

    /**
     * Evaluate an expression tree.
     *
     * @param ast Root of the tree to evaluate
     * @return Steps and final value
     * @throws EvaluationException on division by zero, a complex result or overflow;
     *                             carries the steps completed before the failure
     */
    public ExpressionResult evaluate(AstNode ast) {
        List<EvaluationStep> steps = new ArrayList<>();
        AstNode current = ast;

        while (!(current instanceof AstNode.Literal)) {
            Round round = new Round();
            AstNode next;
            try {
                next = reduceLeftmost(current, round);
            } catch (UndefinedResultException e) {
                log.debug("Evaluation stopped at step {}: {}", steps.size(), e.getKind());
                throw new EvaluationException(e.getKind(), steps.size(), steps);
            }
            EvaluationStep step = new EvaluationStep(
                    steps.size(),
                    round.description,
                    round.before,
                    round.after,
                    next
            );
            log.debug("Step {}: {} = {}", step.index(), step.subExpressionBefore(), step.subExpressionAfter());
            steps.add(step);
            current = next;
        }

        BigDecimal value = ((AstNode.Literal) current).decimalValue();
        return new ExpressionResult(ast, steps, value);
    }

    /**
     * Rebuild the tree with its leftmost reducible node replaced by its value.
     * <p>
     * Walks down the path of non-literal children, then rebuilds only the nodes on that path.
     */
    private AstNode reduceLeftmost(AstNode root, Round round) {
        Deque<PathEntry> path = new ArrayDeque<>();
        AstNode node = root;
        AstNode replacement = null;

        while (replacement == null) {
            if (node instanceof AstNode.UnaryMinus unary) {
                if (unary.operand() instanceof AstNode.Literal operand) {
                    replacement = round.record(unary, "negate " + operand.lexeme(),
                            arithmetic.negate(operand.decimalValue()));
                } else {
                    path.push(new PathEntry(unary, true));
                    node = unary.operand();
                }
            } else if (node instanceof AstNode.BinaryOp binary) {
                if (binary.left() instanceof AstNode.Literal left && binary.right() instanceof AstNode.Literal right) {
                    BigDecimal value = arithmetic.apply(binary.operator(), left.decimalValue(), right.decimalValue());
                    replacement = round.record(binary, "evaluate " + ExpressionPrinter.print(binary), value);
                } else {
                    boolean intoLeft = !(binary.left() instanceof AstNode.Literal);
                    path.push(new PathEntry(binary, intoLeft));
                    node = intoLeft ? binary.left() : binary.right();
                }
            } else {
                throw new IllegalStateException("No reducible node below " + node);
            }
        }

        AstNode rebuilt = replacement;
        while (!path.isEmpty()) {
            PathEntry entry = path.pop();
            if (entry.parent() instanceof AstNode.BinaryOp binary) {
                rebuilt = entry.left()
                        ? new AstNode.BinaryOp(binary.operator(), rebuilt, binary.right())
                        : new AstNode.BinaryOp(binary.operator(), binary.left(), rebuilt);
            } else {
                rebuilt = new AstNode.UnaryMinus(rebuilt);
            }
        }
        return rebuilt;
    }

    /** A node on the way down and whether the walk continued into its left (or only) child. */
    private record PathEntry(AstNode parent, boolean left) {
    }

    /** Collects what one reduction round did. */
    private static final class Round {
        private String description;
        private String before;
        private String after;

        AstNode.Literal record(AstNode reduced, String description, BigDecimal value) {
            AstNode.Literal literal = AstNode.Literal.of(value);
            this.description = description;
            this.before = ExpressionPrinter.print(reduced);
            this.after = literal.lexeme();
            return literal;
        }
    }
}
