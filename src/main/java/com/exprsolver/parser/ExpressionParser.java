package com.exprsolver.parser;

import com.exprsolver.ast.AstNode;
import com.exprsolver.ast.Operator;
import com.exprsolver.exception.SyntaxException;
import com.exprsolver.lexer.Token;
import com.exprsolver.lexer.TokenType;

import java.util.List;

/**
 * Parser for arithmetic expressions.
 * Converts tokens into an {@link AstNode} tree using recursive descent parsing.
 * <p>
 * Grammar (precedence: ^ > unary - > * / > + -):
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/') unary)*
 * unary      := '-' unary | power
 * power      := primary ('^' unary)?
 * primary    := NUMBER | '(' expression ')'
 * </pre>
 * '^' is right-associative and its exponent may be negated, so {@code 2^3^2 = 2^(3^2)},
 * {@code -2^2 = -(2^2)} and {@code 2^-1} is accepted. No error recovery is attempted.
 * <p>
 * Trees deeper than {@link #MAX_DEPTH} levels are rejected with a {@link SyntaxException}, so a
 * sum of more than {@code MAX_DEPTH} terms must be split with parentheses.
 */
public final class ExpressionParser {

    /**
     * Deepest tree, and deepest chain of nested parentheses, negations or exponents, accepted.
     */
    public static final int MAX_DEPTH = 500;

    static final String OPERAND = "number or '('";
    static final String OPERATOR = "operator or end of input";
    static final String CLOSING_PAREN = "')'";
    static final String SHALLOWER_NESTING = "at most " + MAX_DEPTH + " levels of nesting";

    private final List<Token> tokens;
    private int index;
    private int nesting;

    public ExpressionParser(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token sequence must end with EOF");
        }
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse the token stream into an expression tree.
     *
     * @return Root node
     * @throws SyntaxException on the first grammar violation, or when the expression nests
     *                         deeper than {@link #MAX_DEPTH}
     */
    public AstNode parse() {
        Subtree result = parseExpression();
        if (!check(TokenType.EOF)) {
            throw error(OPERATOR);
        }
        return result.node();
    }

    private Subtree parseExpression() {
        Subtree left = parseTerm();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = previous();
            Subtree right = parseTerm();
            left = binary(operator, left, right);
        }
        return left;
    }

    private Subtree parseTerm() {
        Subtree left = parseUnary();
        while (match(TokenType.STAR, TokenType.SLASH)) {
            Token operator = previous();
            Subtree right = parseUnary();
            left = binary(operator, left, right);
        }
        return left;
    }

    private Subtree parseUnary() {
        if (match(TokenType.MINUS)) {
            Token minus = previous();
            enter(minus);
            Subtree operand = parseUnary();
            nesting--;
            return wrap(minus, new AstNode.UnaryMinus(operand.node()), operand.depth() + 1);
        }
        return parsePower();
    }

    private Subtree parsePower() {
        Subtree base = parsePrimary();
        if (match(TokenType.CARET)) {
            Token caret = previous();
            // recursing through unary gives right associativity
            enter(caret);
            Subtree exponent = parseUnary();
            nesting--;
            return binary(caret, base, exponent);
        }
        return base;
    }

    private Subtree parsePrimary() {
        if (match(TokenType.NUMBER)) {
            return new Subtree(new AstNode.Literal(previous().text()), 1);
        }

        // Parenthesized expression
        if (match(TokenType.LPAREN)) {
            enter(previous());
            Subtree expr = parseExpression();
            expect(TokenType.RPAREN, CLOSING_PAREN);
            nesting--;
            return expr;
        }

        throw error(OPERAND);
    }

    private Subtree binary(Token operator, Subtree left, Subtree right) {
        AstNode node = new AstNode.BinaryOp(Operator.fromToken(operator.type()), left.node(), right.node());
        return wrap(operator, node, Math.max(left.depth(), right.depth()) + 1);
    }

    private static Subtree wrap(Token at, AstNode node, int depth) {
        if (depth > MAX_DEPTH) {
            throw new SyntaxException(at.position(), SHALLOWER_NESTING, describe(at));
        }
        return new Subtree(node, depth);
    }

    private void enter(Token at) {
        if (++nesting > MAX_DEPTH) {
            throw new SyntaxException(at.position(), SHALLOWER_NESTING, describe(at));
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private void expect(TokenType type, String expected) {
        if (!check(type)) {
            throw error(expected);
        }
        advance();
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private SyntaxException error(String expected) {
        Token found = peek();
        return new SyntaxException(found.position(), expected, describe(found));
    }

    static String describe(Token token) {
        return token.type() == TokenType.EOF ? "end of input" : "'" + token.text() + "'";
    }

    /** Node with the height of the tree below it. */
    private record Subtree(AstNode node, int depth) {
    }
}
