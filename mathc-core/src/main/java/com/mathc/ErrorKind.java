package com.mathc;

public enum ErrorKind {
    // Lexer
    UNRECOGNIZED_CHARACTER,
    MALFORMED_NUMBER,
    NUMBER_OUT_OF_RANGE,

    // Parser
    UNEXPECTED_TOKEN,
    UNKNOWN_COMMAND,
    UNKNOWN_OPERATOR_NAME,
    WRONG_ARGUMENT_COUNT,
    MISSING_DELIMITER,
    TRAILING_INPUT,
    NESTING_TOO_DEEP;

    public boolean isLexical() {
        return this == UNRECOGNIZED_CHARACTER || this == MALFORMED_NUMBER || this == NUMBER_OUT_OF_RANGE;
    }
}
