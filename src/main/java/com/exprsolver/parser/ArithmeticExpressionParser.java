package com.exprsolver.parser;

import com.exprsolver.ast.AstNode;
import com.exprsolver.lexer.ExpressionTokenizer;
import com.exprsolver.lexer.Token;

import java.util.List;

/**
 * Facade for turning expression text into a tree in one call.
 */
public final class ArithmeticExpressionParser {

    private ArithmeticExpressionParser() {
    }

    /**
     * Tokenize and parse an expression.
     *
     * @param expression Expression string, e.g. {@code 12 + (5 * 4) - 1}
     * @return Root node
     */
    public static AstNode parse(String expression) {
        List<Token> tokens = new ExpressionTokenizer(expression).tokenize();
        return new ExpressionParser(tokens).parse();
    }
}
