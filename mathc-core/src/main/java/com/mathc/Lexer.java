package com.mathc;

import java.util.ArrayList;
import java.util.List;

/**
 * Character-level state machine turning a LaTeX math string into tokens.
 *
 * <p>The input is read once, left to right, followed by a virtual end
 * character. A token that ends on a character it does not own (a number
 * followed by {@code +}, an identifier followed by {@code (}) commits and
 * hands that character back to {@link State#START}. The token list always
 * ends with a single {@link TokenType#END} token positioned at
 * {@code input.length()}.</p>
 *
 * <p>Numbers stay exact ({@code long}) only while they are a bare run of
 * digits. Passing through a fractional mark or an exponent makes the literal
 * a {@code double}.</p>
 */
public class Lexer {

    private static final int EOF = -1;

    private enum State {
        START,
        NUMBER,
        NUMBER_FRAC_MARK,
        NUMBER_FRAC,
        NUMBER_EXP_MARK,
        NUMBER_EXP_SIGN,
        NUMBER_EXP,
        IDENTIFIER,
        COMMAND
    }

    private final String source;
    private final int length;
    private final List<Token> tokens = new ArrayList<>();
    private final StringBuilder buffer = new StringBuilder();

    private State state = State.START;
    private int tokenStart = 0;
    private boolean finished = false;

    public Lexer(String source) {
        this.source = source;
        this.length = source.length();
    }

    /**
     * Tokenizes the whole input.
     *
     * @throws LexException on an unrecognized character or a malformed
     *         numeric literal
     */
    public List<Token> tokenize() {
        if (finished) {
            return tokens;
        }
        int i = 0;
        while (!finished) {
            int c = i < length ? source.charAt(i) : EOF;
            if (step(c, i)) {
                i++;
            }
        }
        return tokens;
    }

    /**
     * Tokenizes {@code source}, reporting failure as a value.
     */
    public static Result<List<Token>> tryTokenize(String source) {
        try {
            return Result.ok(List.copyOf(new Lexer(source).tokenize()));
        } catch (LexException e) {
            return Result.err(e.error());
        }
    }

    // Returns true when c was consumed, false when it must be read again from START
    private boolean step(int c, int i) {
        switch (state) {
            case START:
                return start(c, i);

            case NUMBER:
                if (isDigit(c)) {
                    buffer.append((char) c);
                    return true;
                }
                if (c == '.') {
                    buffer.append('.');
                    state = State.NUMBER_FRAC_MARK;
                    return true;
                }
                if (c == 'e' || c == 'E') {
                    buffer.append((char) c);
                    state = State.NUMBER_EXP_MARK;
                    return true;
                }
                commitInteger();
                return false;

            case NUMBER_FRAC_MARK:
                if (isDigit(c)) {
                    buffer.append((char) c);
                    state = State.NUMBER_FRAC;
                    return true;
                }
                throw malformed("Expected a digit after '.' in numeric literal", c, i);

            case NUMBER_FRAC:
                if (isDigit(c)) {
                    buffer.append((char) c);
                    return true;
                }
                if (c == 'e' || c == 'E') {
                    buffer.append((char) c);
                    state = State.NUMBER_EXP_MARK;
                    return true;
                }
                commitReal();
                return false;

            case NUMBER_EXP_MARK:
                if (isDigit(c)) {
                    buffer.append((char) c);
                    state = State.NUMBER_EXP;
                    return true;
                }
                if (c == '-') {
                    buffer.append('-');
                    state = State.NUMBER_EXP_SIGN;
                    return true;
                }
                throw malformed("Expected a digit or '-' after exponent mark in numeric literal", c, i);

            case NUMBER_EXP_SIGN:
                if (isDigit(c)) {
                    buffer.append((char) c);
                    state = State.NUMBER_EXP;
                    return true;
                }
                throw malformed("Expected a digit after exponent sign in numeric literal", c, i);

            case NUMBER_EXP:
                if (isDigit(c)) {
                    buffer.append((char) c);
                    return true;
                }
                commitReal();
                return false;

            case IDENTIFIER:
                if (isAlphanumeric(c)) {
                    buffer.append((char) c);
                    return true;
                }
                commit(TokenType.IDENTIFIER);
                return false;

            case COMMAND:
                if (isAlphanumeric(c)) {
                    buffer.append((char) c);
                    return true;
                }
                // Control symbol such as \% or \, : one non-letter right after the backslash
                if (buffer.length() == 1 && c != EOF && !isSpace(c)) {
                    buffer.append((char) c);
                    commit(TokenType.COMMAND);
                    return true;
                }
                commit(TokenType.COMMAND);
                return false;

            default:
                throw new IllegalStateException("Unknown lexer state " + state);
        }
    }

    private boolean start(int c, int i) {
        if (c == EOF) {
            tokens.add(new Token(TokenType.END, "", length));
            finished = true;
            return true;
        }

        // ignore whitespace between tokens
        if (isSpace(c)) {
            return true;
        }

        if (isDigit(c)) {
            begin(State.NUMBER, i, c);
            return true;
        }
        if (c == '.') {
            begin(State.NUMBER_FRAC_MARK, i, c);
            return true;
        }
        if (c == '\\') {
            begin(State.COMMAND, i, c);
            return true;
        }
        if (isLetter(c)) {
            begin(State.IDENTIFIER, i, c);
            return true;
        }

        TokenType single = switch (c) {
            case '{' -> TokenType.LBRACE;
            case '}' -> TokenType.RBRACE;
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case ',' -> TokenType.COMMA;
            case '+' -> TokenType.PLUS;
            case '-' -> TokenType.MINUS;
            case '*' -> TokenType.STAR;
            case '/' -> TokenType.SLASH;
            case '^' -> TokenType.CARET;
            case '_' -> TokenType.UNDERSCORE;
            case '=' -> TokenType.EQUALS;
            case '!' -> TokenType.BANG;
            default -> null;
        };
        if (single == null) {
            throw new LexException(ErrorKind.UNRECOGNIZED_CHARACTER,
                "Unrecognized character '" + (char) c + "'", i);
        }
        tokens.add(new Token(single, String.valueOf((char) c), i));
        return true;
    }

    private void begin(State next, int position, int first) {
        state = next;
        tokenStart = position;
        buffer.setLength(0);
        buffer.append((char) first);
    }

    private void commit(TokenType type) {
        tokens.add(new Token(type, buffer.toString(), tokenStart));
        state = State.START;
    }

    private void commitInteger() {
        String lexeme = buffer.toString();
        long value;
        try {
            value = Long.parseLong(lexeme);
        } catch (NumberFormatException e) {
            throw new LexException(ErrorKind.NUMBER_OUT_OF_RANGE,
                "Integer literal " + lexeme + " does not fit in 64 bits", tokenStart);
        }
        tokens.add(new Token(TokenType.NUMBER, lexeme, tokenStart, NumericValue.ofInteger(value)));
        state = State.START;
    }

    private void commitReal() {
        String lexeme = buffer.toString();
        tokens.add(new Token(TokenType.NUMBER, lexeme, tokenStart, NumericValue.ofReal(Double.parseDouble(lexeme))));
        state = State.START;
    }

    private LexException malformed(String message, int c, int i) {
        String found = c == EOF ? "end of input" : "'" + (char) c + "'";
        return new LexException(ErrorKind.MALFORMED_NUMBER,
            message + ", found " + found + " after '" + buffer + "'", i);
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAlphanumeric(int c) {
        return isLetter(c) || isDigit(c);
    }

    private static boolean isSpace(int c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == 0x0B;
    }
}
