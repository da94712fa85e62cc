package com.mathc;

import com.mathc.ast.BinaryOpKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Binding powers for the Pratt parser.
 *
 * <p>Higher binding power binds tighter. Each infix operator has a left and a
 * right power; when the right power is lower than the left the operator is
 * right-associative.</p>
 */
public record BindingPower(int left, int right, BinaryOpKind kind) {

    public static final int BP_NONE = 0;          // top-level minimum
    public static final int BP_PREFIX = 9;        // unary minus, tight function arguments
    public static final int BP_POSTFIX = 13;      // ! and \% bind tightest

    public static final BindingPower EQUALS = new BindingPower(1, 2, BinaryOpKind.EQUALS);
    public static final BindingPower ADD = new BindingPower(3, 4, BinaryOpKind.ADD);
    public static final BindingPower SUBTRACT = new BindingPower(3, 4, BinaryOpKind.SUBTRACT);
    public static final BindingPower MULTIPLY = new BindingPower(5, 6, BinaryOpKind.MULTIPLY);
    public static final BindingPower DIVIDE = new BindingPower(5, 6, BinaryOpKind.DIVIDE);
    public static final BindingPower POWER = new BindingPower(12, 11, BinaryOpKind.POWER);

    // Implicit multiplication uses the same precedence as explicit '*'
    public static final BindingPower IMPLICIT_MULTIPLY = MULTIPLY;

    private static final Map<TokenType, BindingPower> INFIX_OPS = new EnumMap<>(TokenType.class);
    private static final Map<String, BindingPower> INFIX_COMMAND_OPS = Map.of(
        "cdot", MULTIPLY,
        "times", MULTIPLY,
        "div", DIVIDE
    );

    static {
        INFIX_OPS.put(TokenType.EQUALS, EQUALS);
        INFIX_OPS.put(TokenType.PLUS, ADD);
        INFIX_OPS.put(TokenType.MINUS, SUBTRACT);
        INFIX_OPS.put(TokenType.STAR, MULTIPLY);
        INFIX_OPS.put(TokenType.SLASH, DIVIDE);
        INFIX_OPS.put(TokenType.CARET, POWER);
    }

    /**
     * Looks up the infix binding of a token: a table operator or one of the
     * infix commands {@code \cdot}, {@code \times}, {@code \div}.
     */
    public static Optional<BindingPower> infix(Token token) {
        if (token.is(TokenType.COMMAND)) {
            return Optional.ofNullable(INFIX_COMMAND_OPS.get(token.commandName()));
        }
        return Optional.ofNullable(INFIX_OPS.get(token.type()));
    }
}
