package com.mathc;

public class ParseException extends SyntaxException {
    private final Token token;

    public ParseException(ErrorKind kind, String message, Token token) {
        super(kind, message, token != null ? token.position() : SyntaxError.NO_OFFSET);
        this.token = token;
    }

    /**
     * The offending token, or null when the failure is not tied to one.
     */
    public Token token() {
        return token;
    }
}
