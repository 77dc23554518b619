package com.exprsolver.ast;

import com.exprsolver.parser.ArithmeticExpressionParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionPrinter and the shared grouping rules.
 */
class ExpressionPrinterTest {

    @ParameterizedTest
    @DisplayName("Should print normalized infix with parentheses only where needed")
    @CsvSource(delimiter = '|', value = {
            "2+3*4|2 + 3 * 4",
            "(1+2)*3|(1 + 2) * 3",
            "((1+2))|1 + 2",
            "2^3^2|2^3^2",
            "(2^3)^2|(2^3)^2",
            "1-(2-3)|1 - (2 - 3)",
            "1-2-3|1 - 2 - 3",
            "1+(2+3)|1 + (2 + 3)",
            "8/(4/2)|8 / (4 / 2)",
            "8/4/2|8 / 4 / 2",
            "-(2^2)|-2^2",
            "(-2)^2|(-2)^2",
            "-(1+2)|-(1 + 2)",
            "--2|-(-2)",
            "2*-3|2 * -3",
            "2^-1|2^(-1)",
            "2^(1+1)|2^(1 + 1)",
            "3.140|3.140"
    })
    void shouldPrint(String input, String expected) {
        assertEquals(expected, ExpressionPrinter.print(ArithmeticExpressionParser.parse(input)));
    }

    @ParameterizedTest
    @DisplayName("Printed text re-parses to the identical tree")
    @CsvSource(delimiter = '|', value = {"2^3^2", "(2^3)^2", "1-(2-3)", "-(1+2)*3", "--2", "2^-1", "8/(4/2)*2"})
    void printedTextReparses(String input) {
        AstNode ast = ArithmeticExpressionParser.parse(input);

        assertEquals(ast, ArithmeticExpressionParser.parse(ExpressionPrinter.print(ast)));
    }

    @Test
    @DisplayName("Negative literals from reductions are grouped as operands")
    void shouldGroupNegativeLiterals() {
        AstNode product = new AstNode.BinaryOp(Operator.MULTIPLY, new AstNode.Literal("-3"), new AstNode.Literal("4"));
        AstNode power = new AstNode.BinaryOp(Operator.POWER, new AstNode.Literal("2"), new AstNode.Literal("-2"));

        assertEquals("(-3) * 4", ExpressionPrinter.print(product));
        assertEquals("2^(-2)", ExpressionPrinter.print(power));
        assertEquals("-3", ExpressionPrinter.print(new AstNode.Literal("-3")));
    }

    @Test
    @DisplayName("Computed literals use canonical plain form")
    void shouldCanonicalizeComputedLiterals() {
        assertEquals("12", AstNode.Literal.of(new java.math.BigDecimal("12.000")).lexeme());
        assertEquals("100", AstNode.Literal.of(new java.math.BigDecimal("1E+2")).lexeme());
        assertEquals("0", AstNode.Literal.of(new java.math.BigDecimal("0.00")).lexeme());
        assertEquals("-0.5", AstNode.Literal.of(new java.math.BigDecimal("-0.50")).lexeme());
    }
}
