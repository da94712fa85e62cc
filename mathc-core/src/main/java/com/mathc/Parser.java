package com.mathc;

import com.mathc.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import static com.mathc.BindingPower.BP_NONE;
import static com.mathc.BindingPower.BP_POSTFIX;
import static com.mathc.BindingPower.BP_PREFIX;

/**
 * Pratt parser from a token list to an arena {@link Ast}.
 *
 * <p>{@link #parseExpression(int)} parses one prefix term, then keeps
 * extending it with postfix operators, infix operators and implicit
 * multiplication for as long as their left binding power is at least the
 * requested minimum. See {@link BindingPower} for the table.</p>
 *
 * <p>Parsing fails fast: the first structural problem throws a
 * {@link ParseException} and the partially built arena is discarded.</p>
 */
public class Parser {

    private final List<Token> tokens;
    private final ParserOptions options;
    private final Ast ast;
    private int current = 0;
    private int depth = 0;
    private boolean parsed = false;

    public Parser(List<Token> tokens) {
        this(tokens, ParserOptions.DEFAULTS);
    }

    public Parser(List<Token> tokens, ParserOptions options) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.END)) {
            throw new IllegalArgumentException("Token list must end with an END token");
        }
        this.tokens = tokens;
        this.options = options;
        this.ast = new Ast(tokens.size());
    }

    public static Ast parse(String source) {
        return parse(source, ParserOptions.DEFAULTS);
    }

    /**
     * Tokenizes and parses {@code source}.
     *
     * @throws LexException if the input cannot be tokenized
     * @throws ParseException if the tokens do not form one expression
     */
    public static Ast parse(String source, ParserOptions options) {
        return new Parser(new Lexer(source).tokenize(), options).parse();
    }

    public static Result<Ast> tryParse(String source) {
        return tryParse(source, ParserOptions.DEFAULTS);
    }

    public static Result<Ast> tryParse(String source, ParserOptions options) {
        try {
            return Result.ok(parse(source, options));
        } catch (SyntaxException e) {
            return Result.err(e.error());
        }
    }

    /**
     * Parses the whole token list as a single expression.
     *
     * @throws ParseException on the first structural problem, including
     *         tokens left over after a complete expression
     */
    public Ast parse() {
        if (parsed) {
            throw new IllegalStateException("Parser has already been used");
        }
        parsed = true;

        NodeId root = parseExpression(BP_NONE);
        if (!peek().is(TokenType.END)) {
            throw new ParseException(ErrorKind.TRAILING_INPUT,
                "Trailing " + peek().describe() + " after a complete expression", peek());
        }
        ast.setRoot(root);
        return ast;
    }

    // ========================================================================
    // Pratt loop
    // ========================================================================

    private NodeId parseExpression(int minBp) {
        enter();
        try {
            NodeId left = parsePrefix();

            while (true) {
                Token token = peek();

                // Postfix: ! and \%
                if (token.is(TokenType.BANG) || token.isCommand(Commands.PERCENT)) {
                    if (BP_POSTFIX < minBp) break;
                    advance();
                    UnaryOpKind kind = token.is(TokenType.BANG) ? UnaryOpKind.FACTORIAL : UnaryOpKind.PERCENT;
                    left = ast.addUnaryOp(kind, left, token.position());
                    continue;
                }

                // Infix: table operators and \cdot, \times, \div
                Optional<BindingPower> infix = BindingPower.infix(token);
                if (infix.isPresent()) {
                    BindingPower bp = infix.get();
                    if (bp.left() < minBp) break;
                    advance();
                    NodeId right = parseExpression(bp.right());
                    left = ast.addBinaryOp(bp.kind(), left, right, token.position());
                    continue;
                }

                // Implicit multiplication: no operator token is consumed
                if (canImplicitMultiply()) {
                    BindingPower bp = BindingPower.IMPLICIT_MULTIPLY;
                    if (bp.left() < minBp) break;
                    NodeId right = parseExpression(bp.right());
                    left = ast.addBinaryOp(bp.kind(), left, right, token.position());
                    continue;
                }

                break;
            }

            return left;
        } finally {
            depth--;
        }
    }

    private void enter() {
        if (++depth > options.maxDepth()) {
            throw new ParseException(ErrorKind.NESTING_TOO_DEEP,
                "Expression nests deeper than " + options.maxDepth() + " levels", peek());
        }
    }

    private boolean canImplicitMultiply() {
        Token token = peek();
        return switch (token.type()) {
            case NUMBER, LPAREN, LBRACE -> true;
            case IDENTIFIER -> options.implicitIdentifierProducts();
            case COMMAND -> Commands.PREFIX_COMMANDS.contains(token.commandName());
            default -> false;
        };
    }

    // ========================================================================
    // Prefix terms
    // ========================================================================

    private NodeId parsePrefix() {
        Token token = peek();
        return switch (token.type()) {
            case NUMBER -> prefixNumber();
            case IDENTIFIER -> prefixIdentifier();
            case MINUS -> prefixNegate();
            case LPAREN -> prefixGroup();
            case LBRACE -> parseBraceGroup();
            case COMMAND -> parseCommand();
            default -> throw new UnexpectedTokenException(token, "expression");
        };
    }

    private NodeId prefixNumber() {
        Token token = advance();
        NumericValue number = token.number();
        if (number.isInteger()) {
            return ast.addRational(number.longValue(), 1, token.position());
        }
        if (options.rationalizeReals()) {
            Optional<RationalApproximation.Fraction> fraction = RationalApproximation.approximate(
                number.doubleValue(), options.maxDenominator(), options.tolerance());
            if (fraction.isPresent()) {
                return ast.addRational(fraction.get().numerator(), fraction.get().denominator(), token.position());
            }
        }
        return ast.addReal(number.doubleValue(), token.position());
    }

    private NodeId prefixIdentifier() {
        Token token = advance();
        return ast.addIdentifier(token.lexeme(), token.position());
    }

    private NodeId prefixNegate() {
        Token minus = advance();
        NodeId inner = parseExpression(BP_PREFIX);
        return ast.addUnaryOp(UnaryOpKind.NEGATE, inner, minus.position());
    }

    private NodeId prefixGroup() {
        advance();
        NodeId inner = parseExpression(BP_NONE);
        consume(TokenType.RPAREN, "')'");
        return inner;
    }

    // {expr}, used for every brace-delimited command argument
    private NodeId parseBraceGroup() {
        consume(TokenType.LBRACE, "'{'");
        NodeId inner = parseExpression(BP_NONE);
        consume(TokenType.RBRACE, "'}'");
        return inner;
    }

    // ========================================================================
    // Commands
    // ========================================================================

    private NodeId parseCommand() {
        Token token = peek();
        String name = token.commandName();

        ConstantKind constant = Commands.CONSTANTS.get(name);
        if (constant != null) {
            advance();
            return ast.addConstant(constant, token.position());
        }

        FunctionKind function = Commands.SINGLE_ARG_FUNCTIONS.get(name);
        if (function != null) {
            return parseSingleArgFunction(function);
        }

        return switch (name) {
            case Commands.OPERATORNAME -> parseOperatorName();
            case Commands.FRAC -> parseFraction();
            case Commands.SQRT -> parseSqrt();
            case Commands.LEFT -> parseLeftRight();
            case Commands.RIGHT, Commands.PERCENT, "cdot", "times", "div" ->
                throw new UnexpectedTokenException(token, "expression");
            default -> throw new ParseException(ErrorKind.UNKNOWN_COMMAND,
                "Unknown command '" + token.lexeme() + "'", token);
        };
    }

    // \sin{x}, \sin(x + 1) or \sin x
    private NodeId parseSingleArgFunction(FunctionKind function) {
        Token name = advance();

        NodeId argument;
        if (check(TokenType.LBRACE)) {
            argument = parseBraceGroup();
        } else if (check(TokenType.LPAREN)) {
            advance();
            argument = parseExpression(BP_NONE);
            consume(TokenType.RPAREN, "')' after argument of '" + name.lexeme() + "'");
        } else {
            argument = parseExpression(BP_PREFIX);
        }

        return ast.addCall(function, List.of(argument), name.position());
    }

    // \operatorname{name}(arg, arg, ...)
    private NodeId parseOperatorName() {
        Token operator = advance();

        consume(TokenType.LBRACE, "'{' after '\\operatorname'");
        Token name = consume(TokenType.IDENTIFIER, "operator name");
        consume(TokenType.RBRACE, "'}' after operator name");

        FunctionKind function = Commands.OPERATOR_NAMES.get(name.lexeme());
        if (function == null) {
            throw new ParseException(ErrorKind.UNKNOWN_OPERATOR_NAME,
                "Unknown operator name '" + name.lexeme() + "'", name);
        }

        consume(TokenType.LPAREN, "'(' after '\\operatorname{" + name.lexeme() + "}'");
        List<NodeId> arguments = parseArgumentList();
        consume(TokenType.RPAREN, "')' after arguments of '" + name.lexeme() + "'");

        if (!function.acceptsArity(arguments.size())) {
            String expected = function.maxArity() < 0
                ? "at least " + function.minArity()
                : String.valueOf(function.minArity());
            throw new ParseException(ErrorKind.WRONG_ARGUMENT_COUNT,
                "'" + name.lexeme() + "' expects " + expected + " argument(s) but got " + arguments.size(), name);
        }

        return ast.addCall(function, arguments, operator.position());
    }

    private List<NodeId> parseArgumentList() {
        List<NodeId> arguments = new ArrayList<>();
        arguments.add(parseExpression(BP_NONE));
        while (match(TokenType.COMMA)) {
            arguments.add(parseExpression(BP_NONE));
        }
        return arguments;
    }

    // \frac{n}{d}
    private NodeId parseFraction() {
        Token frac = advance();

        // Fast path: {±int}{±int} becomes a single exact rational
        int savedCurrent = current;
        OptionalLong numerator = tryBracedInteger();
        if (numerator.isPresent()) {
            OptionalLong denominator = tryBracedInteger();
            if (denominator.isPresent() && denominator.getAsLong() != 0) {
                return ast.addRational(numerator.getAsLong(), denominator.getAsLong(), frac.position());
            }
        }
        current = savedCurrent;

        NodeId top = parseBraceGroup();
        NodeId bottom = parseBraceGroup();
        return ast.addBinaryOp(BinaryOpKind.DIVIDE, top, bottom, frac.position());
    }

    // Matches {int} or {-int}. The cursor is left wherever matching stopped.
    private OptionalLong tryBracedInteger() {
        if (!match(TokenType.LBRACE)) return OptionalLong.empty();
        boolean negative = match(TokenType.MINUS);
        if (!peek().isInteger()) return OptionalLong.empty();
        long value = advance().number().longValue();
        if (!match(TokenType.RBRACE)) return OptionalLong.empty();
        return OptionalLong.of(negative ? -value : value);
    }

    // \sqrt{x} is x^(1/2), \sqrt[n]{x} is x^(1/n)
    private NodeId parseSqrt() {
        Token sqrt = advance();

        if (!match(TokenType.LBRACKET)) {
            NodeId radicand = parseBraceGroup();
            NodeId half = ast.addRational(1, 2, sqrt.position());
            return ast.addBinaryOp(BinaryOpKind.POWER, radicand, half, sqrt.position());
        }

        Token indexToken = peek();
        if (indexToken.isInteger() && indexToken.number().longValue() != 0 && checkAhead(1, TokenType.RBRACKET)) {
            advance();
            advance();
            NodeId radicand = parseBraceGroup();
            NodeId exponent = ast.addRational(1, indexToken.number().longValue(), indexToken.position());
            return ast.addBinaryOp(BinaryOpKind.POWER, radicand, exponent, sqrt.position());
        }

        NodeId index = parseExpression(BP_NONE);
        consume(TokenType.RBRACKET, "']' after root index");
        NodeId radicand = parseBraceGroup();
        NodeId one = ast.addRational(1, 1, sqrt.position());
        NodeId exponent = ast.addBinaryOp(BinaryOpKind.DIVIDE, one, index, indexToken.position());
        return ast.addBinaryOp(BinaryOpKind.POWER, radicand, exponent, sqrt.position());
    }

    // \left( expr \right)
    private NodeId parseLeftRight() {
        advance();
        consume(TokenType.LPAREN, "'(' after '\\left'");
        NodeId inner = parseExpression(BP_NONE);
        if (!peek().isCommand(Commands.RIGHT)) {
            throw new ExpectedTokenException("'\\right'", peek());
        }
        advance();
        consume(TokenType.RPAREN, "')' after '\\right'");
        return inner;
    }

    // ========================================================================
    // Helper methods
    // ========================================================================

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkAhead(int offset, TokenType type) {
        int pos = current + offset;
        if (pos >= tokens.size()) return false;
        return tokens.get(pos).type() == type;
    }

    // Never moves past END
    private Token advance() {
        Token token = tokens.get(current);
        if (!token.is(TokenType.END)) current++;
        return token;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token consume(TokenType type, String expected) {
        if (check(type)) {
            return advance();
        }
        throw new ExpectedTokenException(expected, peek());
    }
}
