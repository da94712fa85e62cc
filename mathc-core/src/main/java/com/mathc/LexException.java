package com.mathc;

public class LexException extends SyntaxException {
    public LexException(ErrorKind kind, String message, int offset) {
        super(kind, message, offset);
    }
}
