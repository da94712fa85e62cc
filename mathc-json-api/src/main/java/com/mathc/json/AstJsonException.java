package com.mathc.json;

/**
 * Exception thrown when an AST or token list cannot be converted to or from JSON.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
