package com.exprsolver.parser;

import com.exprsolver.exception.SyntaxException;
import com.exprsolver.lexer.Token;
import com.exprsolver.lexer.TokenType;

import java.util.List;

import static com.exprsolver.parser.ExpressionParser.*;

/**
 * Single-pass structural check of a token sequence, run before parsing.
 * <p>
 * Rejects:
 * <ul>
 *   <li>Unbalanced parentheses</li>
 *   <li>Two adjacent numbers, or a number directly after ')'</li>
 *   <li>A binary operator followed by a binary operator or ')' (a following '-' is a negation)</li>
 *   <li>'(' directly after a number or ')'</li>
 *   <li>An empty sequence or a trailing operator</li>
 * </ul>
 */
public final class TokenSequenceValidator {

    private TokenSequenceValidator() {
    }

    /**
     * @throws SyntaxException at the first offending token
     */
    public static void validate(List<Token> tokens) {
        int depth = 0;
        Token prev = null;

        for (Token token : tokens) {
            TokenType type = token.type();

            if (type == TokenType.EOF) {
                if (prev == null || prev.type().isOperator() || prev.type() == TokenType.LPAREN) {
                    throw error(token, OPERAND);
                }
                if (depth > 0) {
                    throw error(token, CLOSING_PAREN);
                }
                break;
            }

            if (expectsOperand(prev)) {
                if (type != TokenType.NUMBER && type != TokenType.LPAREN && type != TokenType.MINUS) {
                    throw error(token, OPERAND);
                }
            } else if (type == TokenType.NUMBER || type == TokenType.LPAREN) {
                throw error(token, OPERATOR);
            }

            if (type == TokenType.LPAREN) {
                depth++;
            } else if (type == TokenType.RPAREN) {
                depth--;
                if (depth < 0) {
                    throw error(token, OPERATOR);
                }
            }
            prev = token;
        }
    }

    /**
     * At the start, after an operator and after '(' an operand must follow.
     */
    private static boolean expectsOperand(Token prev) {
        return prev == null || prev.type().isOperator() || prev.type() == TokenType.LPAREN;
    }

    private static SyntaxException error(Token token, String expected) {
        return new SyntaxException(token.position(), expected, describe(token));
    }
}
