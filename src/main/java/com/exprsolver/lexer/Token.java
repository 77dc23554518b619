package com.exprsolver.lexer;

/**
 * Represents a token in an expression.
 *
 * @param type     Token type
 * @param text     Exact source text (numbers are not parsed here)
 * @param position Position in the input string
 */
public record Token(TokenType type, String text, int position) {

    @Override
    public String toString() {
        if (type == TokenType.EOF) {
            return "EOF";
        }
        return type + "(" + text + ")@" + position;
    }
}
