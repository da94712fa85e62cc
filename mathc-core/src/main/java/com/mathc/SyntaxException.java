package com.mathc;

/**
 * Base class for failures raised while tokenizing or parsing.
 */
public abstract class SyntaxException extends RuntimeException {
    private final SyntaxError error;

    protected SyntaxException(ErrorKind kind, String message, int offset) {
        super(offset >= 0 ? message + " at offset " + offset : message);
        this.error = new SyntaxError(kind, message, offset);
    }

    public SyntaxError error() {
        return error;
    }

    public ErrorKind kind() {
        return error.kind();
    }

    public int offset() {
        return error.offset();
    }
}
