package com.mathc;

/**
 * A lexing or parsing failure: what went wrong and where.
 *
 * @param offset character offset into the input, or {@link #NO_OFFSET}
 */
public record SyntaxError(ErrorKind kind, String message, int offset) {
    public static final int NO_OFFSET = -1;

    public boolean hasOffset() {
        return offset >= 0;
    }

    @Override
    public String toString() {
        return hasOffset() ? message + " (at offset " + offset + ")" : message;
    }
}
