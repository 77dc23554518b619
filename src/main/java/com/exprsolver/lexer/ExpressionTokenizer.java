package com.exprsolver.lexer;

import com.exprsolver.exception.LexicalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.exprsolver.lexer.LexerConfig.*;

/**
 * Tokenizer for arithmetic expressions.
 * <p>
 * Numbers are recognised by a small deterministic automaton:
 * <pre>
 * START         --digit--> INTEGER_PART
 * START         --'.'----> DECIMAL_POINT
 * INTEGER_PART  --digit--> INTEGER_PART
 * INTEGER_PART  --'.'----> FRACTION_PART
 * DECIMAL_POINT --digit--> FRACTION_PART
 * FRACTION_PART --digit--> FRACTION_PART
 * </pre>
 * INTEGER_PART and FRACTION_PART accept. A second '.' is rejected at its own position.
 */
public final class ExpressionTokenizer {

    private static final Logger log = LoggerFactory.getLogger(ExpressionTokenizer.class);

    private enum NumberState {
        START,
        INTEGER_PART,
        DECIMAL_POINT,
        FRACTION_PART;

        boolean isAccepting() {
            return this == INTEGER_PART || this == FRACTION_PART;
        }
    }

    private final String input;
    private final int length;
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input == null ? "" : input;
        this.length = this.input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens terminated by exactly one EOF token
     * @throws LexicalException on an unknown character, a malformed number or blank input
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            // Skip whitespace
            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;
            TokenType single = SINGLE_CHAR_TOKENS.get(c);
            if (single != null) {
                advance();
                tokens.add(new Token(single, String.valueOf(c), start));
            } else if (isNumberStart(c)) {
                tokens.add(readNumber());
            } else {
                throw new LexicalException(start, c);
            }
        }

        if (tokens.isEmpty()) {
            throw new LexicalException(0, null);
        }

        tokens.add(new Token(TokenType.EOF, "", pos));
        log.debug("Tokenized '{}' into {} tokens", input, tokens.size());
        return tokens;
    }

    private Token readNumber() {
        int start = pos;
        NumberState state = NumberState.START;

        while (!isAtEnd()) {
            char c = peek();
            NumberState next = transition(state, c);
            if (next == null) {
                break;
            }
            state = next;
            advance();
        }

        if (!state.isAccepting()) {
            // lone '.' with no digits on either side
            throw new LexicalException(start, input.charAt(start));
        }
        return new Token(TokenType.NUMBER, input.substring(start, pos), start);
    }

    /**
     * @return next state, or null when the character ends the number
     * @throws LexicalException when the character is a second decimal point
     */
    private NumberState transition(NumberState state, char c) {
        boolean digit = c >= '0' && c <= '9';
        boolean dot = c == Operators.DOT;

        return switch (state) {
            case START -> digit ? NumberState.INTEGER_PART : dot ? NumberState.DECIMAL_POINT : null;
            case INTEGER_PART -> digit ? NumberState.INTEGER_PART : dot ? NumberState.FRACTION_PART : null;
            case DECIMAL_POINT, FRACTION_PART -> {
                if (dot) {
                    throw new LexicalException(pos, c);
                }
                yield digit ? NumberState.FRACTION_PART : null;
            }
        };
    }

    private boolean isNumberStart(char c) {
        return (c >= '0' && c <= '9') || c == Operators.DOT;
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
