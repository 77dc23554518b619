package com.exprsolver.export;

import com.exprsolver.evaluator.ExpressionResult;
import com.exprsolver.evaluator.StepEvaluator;
import com.exprsolver.parser.ArithmeticExpressionParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LatexExporter.
 */
class LatexExporterTest {

    private final LatexExporter exporter = new LatexExporter();

    @ParameterizedTest
    @DisplayName("Should render symbolic LaTeX with grouping only where needed")
    @CsvSource(delimiter = '|', value = {
            "2+3*4|2 + 3 \\times 4",
            "(1+2)*3|\\left(1 + 2\\right) \\times 3",
            "8/(4/2)|8 \\div \\left(4 \\div 2\\right)",
            "2^3^2|2^{3^{2}}",
            "(2^3)^2|\\left(2^{3}\\right)^{2}",
            "-2^2|-2^{2}",
            "(-2)^2|\\left(-2\\right)^{2}",
            "2^(1+1)|2^{1 + 1}",
            "2^-1|2^{-1}",
            "1-(2-3)|1 - \\left(2 - 3\\right)",
            "-(1+2)|-\\left(1 + 2\\right)"
    })
    void shouldRenderSymbolic(String input, String expected) {
        assertEquals(expected, exporter.export(ArithmeticExpressionParser.parse(input)));
    }

    @Test
    @DisplayName("Should render bare operators inside math delimiters when configured")
    void shouldRenderPlainWithDelimiters() {
        LatexExporter plain = new LatexExporter(LatexStyle.PLAIN, true);

        assertEquals("$6 / 2 * 3$", plain.export(ArithmeticExpressionParser.parse("6/2*3")));
        assertEquals("$2^10$", plain.export(ArithmeticExpressionParser.parse("2^10")));
    }

    @ParameterizedTest
    @DisplayName("Plain style should use bare parentheses and exponents")
    @CsvSource(delimiter = '|', value = {
            "(1+2)*3^(1+1)|(1 + 2) * 3^(1 + 1)",
            "2^3^2|2^3^2",
            "(2^3)^2|(2^3)^2",
            "2^-1|2^(-1)",
            "-2^2|-2^2",
            "-(1+2)|-(1 + 2)",
            "8/(4/2)|8 / (4 / 2)"
    })
    void shouldRenderPlain(String input, String expected) {
        LatexExporter plain = new LatexExporter(LatexStyle.PLAIN, false);

        assertEquals(expected, plain.export(ArithmeticExpressionParser.parse(input)));
    }

    @Test
    @DisplayName("Should render the derivation in evaluation order")
    void shouldRenderDerivation() {
        ExpressionResult result = new StepEvaluator().evaluate(ArithmeticExpressionParser.parse("(1+2)*(3+4)"));

        List<DerivationLine> lines = exporter.exportDerivation(result);

        assertEquals(List.of(
                new DerivationLine("\\left(1 + 2\\right) \\times \\left(3 + 4\\right)", "3 \\times \\left(3 + 4\\right)"),
                new DerivationLine("3 \\times \\left(3 + 4\\right)", "3 \\times 7"),
                new DerivationLine("3 \\times 7", "21")
        ), lines);
    }

    @Test
    @DisplayName("Should group negative intermediate values in the derivation")
    void shouldGroupNegativeIntermediates() {
        ExpressionResult result = new StepEvaluator().evaluate(ArithmeticExpressionParser.parse("(1-4)*2"));

        List<DerivationLine> lines = exporter.exportDerivation(result);

        assertEquals("\\left(-3\\right) \\times 2", lines.get(0).after());
        assertEquals("-6", lines.get(1).after());
    }
}
