package com.exprsolver.lexer;

import com.exprsolver.exception.LexicalException;

import java.util.Map;

/**
 * Rewrites math-mode LaTeX into the plain operator syntax accepted by {@link ExpressionTokenizer}.
 * <p>
 * Supports:
 * <ul>
 *   <li>Delimiters: $...$, $$...$$, \(...\), \[...\]</li>
 *   <li>Operators: \times, \cdot, \ast, \div</li>
 *   <li>Grouping: {...}, \left( ... \right), \frac{a}{b} (also \dfrac, \tfrac)</li>
 *   <li>Decimal comma written as {,}</li>
 *   <li>Spacing commands: \, \; \: \! and "\ "</li>
 * </ul>
 * Positions reported by later stages refer to the normalized text.
 */
public final class LatexNormalizer {

    private static final Map<String, String> COMMANDS = Map.of(
            "times", "*",
            "cdot", "*",
            "ast", "*",
            "div", "/"
    );

    /** Deepest brace nesting accepted; matches the parser's nesting limit. */
    private static final int MAX_NESTING = 500;

    private final String input;
    private int pos;
    private int depth;

    private LatexNormalizer(String input) {
        this.input = input;
        this.pos = 0;
    }

    /**
     * Normalize a LaTeX expression.
     *
     * @param latex LaTeX source, with or without math delimiters
     * @return Plain expression text
     * @throws LexicalException on an unsupported control word, unbalanced braces or braces
     *                          nested deeper than the parser accepts
     */
    public static String normalize(String latex) {
        if (latex == null) {
            return "";
        }
        String body = stripDelimiters(latex.strip()).replace("{,}", ".");
        LatexNormalizer normalizer = new LatexNormalizer(body);
        String result = normalizer.readUntil('\0', 0);
        return result.strip();
    }

    private static String stripDelimiters(String text) {
        String[][] pairs = {{"$$", "$$"}, {"$", "$"}, {"\\(", "\\)"}, {"\\[", "\\]"}};
        for (String[] pair : pairs) {
            if (text.length() >= pair[0].length() + pair[1].length()
                    && text.startsWith(pair[0]) && text.endsWith(pair[1])) {
                return text.substring(pair[0].length(), text.length() - pair[1].length());
            }
        }
        return text;
    }

    /**
     * Read until the given closing character (consumed) or end of input when {@code closing} is '\0'.
     *
     * @param openedAt position of the opening brace, reported when it is never closed
     */
    private String readUntil(char closing, int openedAt) {
        if (closing != '\0' && ++depth > MAX_NESTING) {
            throw new LexicalException(openedAt, '{');
        }
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == closing) {
                pos++;
                depth--;
                return sb.toString();
            }
            switch (c) {
                case '{' -> {
                    int open = pos++;
                    sb.append('(').append(readUntil('}', open)).append(')');
                }
                case '}' -> throw new LexicalException(pos, c);
                case '~' -> {
                    pos++;
                    sb.append(' ');
                }
                case '\\' -> sb.append(readCommand());
                default -> {
                    pos++;
                    sb.append(c);
                }
            }
        }
        if (closing != '\0') {
            throw new LexicalException(openedAt, '{');
        }
        return sb.toString();
    }

    private String readCommand() {
        int start = pos;
        pos++; // backslash
        if (pos >= input.length()) {
            throw new LexicalException(start, '\\');
        }

        char first = input.charAt(pos);
        if (!Character.isLetter(first)) {
            pos++;
            return switch (first) {
                case ',', ';', ':', '!', ' ' -> " ";
                default -> throw new LexicalException(start, '\\');
            };
        }

        int nameStart = pos;
        while (pos < input.length() && Character.isLetter(input.charAt(pos))) {
            pos++;
        }
        String name = input.substring(nameStart, pos);

        String mapped = COMMANDS.get(name);
        if (mapped != null) {
            return mapped;
        }
        return switch (name) {
            case "left", "right" -> readSizedDelimiter(start);
            case "frac", "dfrac", "tfrac" -> readFraction(start);
            default -> throw new LexicalException(start, '\\');
        };
    }

    private String readSizedDelimiter(int commandStart) {
        skipSpaces();
        if (pos >= input.length()) {
            throw new LexicalException(commandStart, '\\');
        }
        char delimiter = input.charAt(pos);
        pos++;
        return switch (delimiter) {
            case '(', '[' -> "(";
            case ')', ']' -> ")";
            default -> throw new LexicalException(pos - 1, delimiter);
        };
    }

    private String readFraction(int commandStart) {
        String numerator = readGroup(commandStart);
        String denominator = readGroup(commandStart);
        return "((" + numerator + ")/(" + denominator + "))";
    }

    private String readGroup(int commandStart) {
        skipSpaces();
        if (pos >= input.length() || input.charAt(pos) != '{') {
            throw new LexicalException(commandStart, '\\');
        }
        int open = pos++;
        return readUntil('}', open);
    }

    private void skipSpaces() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }
}
