package com.exprsolver.solver;

import com.exprsolver.ast.AstNode;
import com.exprsolver.ast.ExpressionPrinter;
import com.exprsolver.config.SolverConfig;
import com.exprsolver.evaluator.ExpressionResult;
import com.exprsolver.evaluator.StepEvaluator;
import com.exprsolver.exception.SyntaxException;
import com.exprsolver.export.LatexExporter;
import com.exprsolver.export.MathMlExporter;
import com.exprsolver.lexer.ExpressionTokenizer;
import com.exprsolver.lexer.LatexNormalizer;
import com.exprsolver.lexer.Token;
import com.exprsolver.parser.ExpressionParser;
import com.exprsolver.parser.TokenSequenceValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the full pipeline: text, tokens, tree, derivation, exports.
 * <p>
 * Every failure surfaces as a subclass of {@link com.exprsolver.exception.ExprSolverException}.
 * Instances are immutable and thread-safe.
 */
public class ExpressionSolver {

    private static final Logger log = LoggerFactory.getLogger(ExpressionSolver.class);

    private final SolverConfig config;
    private final StepEvaluator evaluator;
    private final LatexExporter latexExporter;
    private final MathMlExporter mathMlExporter;

    public ExpressionSolver() {
        this(SolverConfig.defaults());
    }

    public ExpressionSolver(SolverConfig config) {
        this.config = config;
        this.evaluator = new StepEvaluator(config.arithmetic());
        this.latexExporter = new LatexExporter(config.latexStyle(), config.latexMathDelimiters());
        this.mathMlExporter = new MathMlExporter(config.divisionStyle());
    }

    /**
     * Solve a plain arithmetic expression such as {@code 12 + (5 * 4) - 1}.
     */
    public SolveResult solve(String expression) {
        return solveNormalized(expression, expression);
    }

    /**
     * Solve a LaTeX expression such as {@code \frac{1}{2} \times 4}.
     */
    public SolveResult solveLatex(String latex) {
        String expression = LatexNormalizer.normalize(latex);
        log.debug("Normalized LaTeX '{}' to '{}'", latex, expression);
        return solveNormalized(latex, expression);
    }

    /**
     * Tokenize and parse without evaluating.
     */
    public AstNode parse(String expression) {
        List<Token> tokens = new ExpressionTokenizer(expression).tokenize();
        if (config.validateTokens()) {
            try {
                TokenSequenceValidator.validate(tokens);
            } catch (SyntaxException e) {
                log.warn("Rejected token sequence for '{}': {}", expression, e.getMessage());
                throw e;
            }
        }
        AstNode ast = new ExpressionParser(tokens).parse();
        log.debug("Parsed '{}' as {}", expression, ast);
        return ast;
    }

    public LatexExporter latexExporter() {
        return latexExporter;
    }

    public MathMlExporter mathMlExporter() {
        return mathMlExporter;
    }

    public StepEvaluator evaluator() {
        return evaluator;
    }

    private SolveResult solveNormalized(String input, String expression) {
        AstNode ast = parse(expression);
        ExpressionResult result = evaluator.evaluate(ast);

        List<String> formatted = result.steps().stream()
                .map(StepFormatter::format)
                .toList();

        SolveResult solved = new SolveResult(
                input,
                ExpressionPrinter.print(ast),
                result,
                formatted,
                latexExporter.export(ast),
                mathMlExporter.export(ast)
        );
        log.debug("Solved '{}' = {} in {} steps", expression, result.finalValueText(), result.steps().size());
        return solved;
    }
}
