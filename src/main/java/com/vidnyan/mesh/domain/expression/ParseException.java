package com.vidnyan.mesh.domain.expression;

/**
 * A formula could not be parsed. {@code position} is the 0-based character offset.
 */
public class ParseException extends RuntimeException {

    private final int position;

    public ParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
