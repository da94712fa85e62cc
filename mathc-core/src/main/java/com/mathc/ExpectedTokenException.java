package com.mathc;

/**
 * A required token (closing delimiter, brace, argument list) was not found.
 */
public class ExpectedTokenException extends ParseException {
    public ExpectedTokenException(String expected, Token actual) {
        super(ErrorKind.MISSING_DELIMITER, "Expected " + expected + " but found " + actual.describe(), actual);
    }
}
