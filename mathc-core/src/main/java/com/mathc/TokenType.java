package com.mathc;

public enum TokenType {
    NUMBER,
    IDENTIFIER,
    COMMAND,

    LBRACE, RBRACE,
    LPAREN, RPAREN,
    LBRACKET, RBRACKET,
    COMMA,
    PLUS, MINUS, STAR, SLASH,
    CARET, UNDERSCORE,
    EQUALS,
    BANG,

    END
}
