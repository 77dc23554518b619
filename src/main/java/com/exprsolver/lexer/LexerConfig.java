package com.exprsolver.lexer;

import java.util.Map;

/**
 * Symbols recognised by the tokenizer.
 */
public final class LexerConfig {

    private LexerConfig() {
    }

    /**
     * Single-character operators and delimiters mapped to token types.
     */
    public static final Map<Character, TokenType> SINGLE_CHAR_TOKENS = Map.of(
            Operators.PLUS, TokenType.PLUS,
            Operators.MINUS, TokenType.MINUS,
            Operators.STAR, TokenType.STAR,
            Operators.SLASH, TokenType.SLASH,
            Operators.CARET, TokenType.CARET,
            Operators.LEFT_PAREN, TokenType.LPAREN,
            Operators.RIGHT_PAREN, TokenType.RPAREN
    );

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char PLUS = '+';
        public static final char MINUS = '-';
        public static final char STAR = '*';
        public static final char SLASH = '/';
        public static final char CARET = '^';
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char DOT = '.';

        private Operators() {
        }
    }
}
