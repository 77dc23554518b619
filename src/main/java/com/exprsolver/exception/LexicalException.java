package com.exprsolver.exception;

/**
 * Exception thrown when the input contains a character or number the tokenizer cannot classify.
 */
public class LexicalException extends ExprSolverException {

    private final int position;
    private final Character character;

    /**
     * @param position  Offset of the offending character in the source
     * @param character Offending character, or null when the input is empty
     */
    public LexicalException(int position, Character character) {
        super(character == null
                ? "Empty expression at position " + position
                : "Unexpected character '" + character + "' at position " + position);
        this.position = position;
        this.character = character;
    }

    public int getPosition() {
        return position;
    }

    /**
     * Get the offending character, or null for empty input.
     */
    public Character getCharacter() {
        return character;
    }
}
