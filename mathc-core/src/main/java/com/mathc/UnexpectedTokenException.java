package com.mathc;

/**
 * A token that cannot start an expression appeared where one was required.
 */
public class UnexpectedTokenException extends ParseException {
    public UnexpectedTokenException(Token token, String context) {
        super(ErrorKind.UNEXPECTED_TOKEN, "Unexpected " + token.describe() + " in " + context, token);
    }
}
