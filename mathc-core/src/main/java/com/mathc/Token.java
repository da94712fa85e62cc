package com.mathc;

/**
 * A lexeme together with its kind and its character offset in the input.
 * Only {@link TokenType#NUMBER} tokens carry a {@link NumericValue}.
 */
public record Token(
    TokenType type,
    String lexeme,
    int position,
    NumericValue number
) {
    public Token(TokenType type, String lexeme, int position) {
        this(type, lexeme, position, null);
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isInteger() {
        return number != null && number.isInteger();
    }

    /**
     * Command name without the leading backslash, e.g. {@code frac} for
     * {@code \frac}. Empty for non-command tokens.
     */
    public String commandName() {
        return type == TokenType.COMMAND ? lexeme.substring(1) : "";
    }

    public boolean isCommand(String name) {
        return type == TokenType.COMMAND && commandName().equals(name);
    }

    /**
     * Human-readable form used in error messages.
     */
    public String describe() {
        return type == TokenType.END ? "end of input" : "'" + lexeme + "'";
    }
}
