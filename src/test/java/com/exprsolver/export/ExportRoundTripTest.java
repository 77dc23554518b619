package com.exprsolver.export;

import com.exprsolver.ast.AstNode;
import com.exprsolver.evaluator.EvaluationStep;
import com.exprsolver.evaluator.ExpressionResult;
import com.exprsolver.evaluator.StepEvaluator;
import com.exprsolver.lexer.ExpressionTokenizer;
import com.exprsolver.lexer.LatexNormalizer;
import com.exprsolver.parser.ArithmeticExpressionParser;
import com.exprsolver.parser.ExpressionParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Re-parsing exported LaTeX must rebuild a tree with the same value.
 */
class ExportRoundTripTest {

    private final StepEvaluator evaluator = new StepEvaluator();

    private static final LatexExporter[] EXPORTERS = {
            new LatexExporter(),
            new LatexExporter(LatexStyle.PLAIN, false),
            new LatexExporter(LatexStyle.SYMBOLIC, true),
            new LatexExporter(LatexStyle.PLAIN, true)
    };

    @ParameterizedTest
    @DisplayName("Exported LaTeX re-parses to the same tree and value")
    @ValueSource(strings = {
            "2+3*4", "2^3^2", "(2^3)^2", "-2^2", "(-2)^2", "1-(2-3)", "8/(4/2)", "2^-1", "--3",
            "-(1+2)*3", "3.14*2+7/2", "((1))", "2*-3", "12+(5*4)-1", "1/3*3", "(1+2)*(3+4)"
    })
    void latexRoundTrip(String expression) {
        AstNode ast = ArithmeticExpressionParser.parse(expression);
        ExpressionResult expected = evaluator.evaluate(ast);

        for (LatexExporter exporter : EXPORTERS) {
            String latex = exporter.export(ast);
            AstNode reparsed = ArithmeticExpressionParser.parse(LatexNormalizer.normalize(latex));

            assertEquals(ast, reparsed, latex);
            assertEquals(0, expected.finalValue().compareTo(evaluator.evaluate(reparsed).finalValue()), latex);
        }
    }

    @ParameterizedTest
    @DisplayName("Plain LaTeX feeds straight back into the tokenizer")
    @ValueSource(strings = {
            "(1+2)*3^(1+1)", "2^3^2", "(2^3)^2", "-2^2", "(-2)^2", "2^-1", "2^(1-3)", "--3",
            "-(1+2)*3", "8/(4/2)", "1-(2-3)", "2*-3", "3.14*2+7/2", "(1+2)*(3+4)"
    })
    void plainLatexTokenizesDirectly(String expression) {
        AstNode ast = ArithmeticExpressionParser.parse(expression);
        LatexExporter plain = new LatexExporter(LatexStyle.PLAIN, false);

        String latex = plain.export(ast);
        AstNode reparsed = new ExpressionParser(new ExpressionTokenizer(latex).tokenize()).parse();

        assertEquals(ast, reparsed, latex);
    }

    @ParameterizedTest
    @DisplayName("Plain LaTeX of intermediate trees keeps its value without normalizing")
    @ValueSource(strings = {"(1-4)*2", "2^(1-3)", "(2-5)^2", "-(1-4)", "10-(2-7)", "2^(0-1)"})
    void plainDerivationTokenizesDirectly(String expression) {
        ExpressionResult result = evaluator.evaluate(ArithmeticExpressionParser.parse(expression));
        LatexExporter plain = new LatexExporter(LatexStyle.PLAIN, false);

        for (EvaluationStep step : result.steps()) {
            String latex = plain.export(step.resultingTree());
            AstNode reparsed = new ExpressionParser(new ExpressionTokenizer(latex).tokenize()).parse();

            assertEquals(0, result.finalValue().compareTo(evaluator.evaluate(reparsed).finalValue()), latex);
        }
    }

    @ParameterizedTest
    @DisplayName("Intermediate trees with negative values keep their value through LaTeX")
    @ValueSource(strings = {"(1-4)*2", "2^(1-3)", "(2-5)^2", "-(1-4)", "10-(2-7)"})
    void derivationRoundTrip(String expression) {
        ExpressionResult result = evaluator.evaluate(ArithmeticExpressionParser.parse(expression));
        LatexExporter exporter = new LatexExporter();

        for (EvaluationStep step : result.steps()) {
            String latex = exporter.export(step.resultingTree());
            AstNode reparsed = ArithmeticExpressionParser.parse(LatexNormalizer.normalize(latex));

            assertEquals(0, result.finalValue().compareTo(evaluator.evaluate(reparsed).finalValue()), latex);
        }
    }
}
