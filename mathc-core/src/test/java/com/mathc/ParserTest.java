package com.mathc;

import com.mathc.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static String sexp(String source) {
        return AstPrinter.print(Parser.parse(source));
    }

    private static String sexp(String source, ParserOptions options) {
        return AstPrinter.print(Parser.parse(source, options));
    }

    @Test
    @DisplayName("Integer literal becomes Rational(n, 1)")
    void testIntegerLiteral() {
        Ast ast = Parser.parse("42");
        Rational rational = assertInstanceOf(Rational.class, ast.rootNode());
        assertEquals(42, rational.numerator());
        assertEquals(1, rational.denominator());
        assertEquals(0, rational.position());
    }

    @Test
    void testDecimalLiteralBecomesReal() {
        Real real = assertInstanceOf(Real.class, Parser.parse("2.5").rootNode());
        assertEquals(2.5, real.value());
    }

    @Test
    @DisplayName("Multiplication binds tighter than addition")
    void testPrecedence() {
        Ast ast = Parser.parse("1+2*3");
        BinaryOp add = assertInstanceOf(BinaryOp.class, ast.rootNode());
        assertEquals(BinaryOpKind.ADD, add.kind());
        Rational one = assertInstanceOf(Rational.class, ast.at(add.left()));
        assertEquals(1, one.numerator());
        BinaryOp mul = assertInstanceOf(BinaryOp.class, ast.at(add.right()));
        assertEquals(BinaryOpKind.MULTIPLY, mul.kind());
        assertEquals("(+ 1 (* 2 3))", AstPrinter.print(ast));
    }

    @Test
    void testLeftAssociativity() {
        assertEquals("(- (- 1 2) 3)", sexp("1-2-3"));
        assertEquals("(/ (/ 8 4) 2)", sexp("8/4/2"));
    }

    @Test
    @DisplayName("Power is right-associative")
    void testPowerRightAssociative() {
        assertEquals("(^ 2 (^ 3 2))", sexp("2^3^2"));
    }

    @Test
    void testEqualsBindsLoosest() {
        assertEquals("(= y (+ (* 2 x) 1))", sexp("y = 2*x + 1"));
    }

    @Test
    void testUnaryMinus() {
        assertEquals("(neg (^ x 2))", sexp("-x^2"));
        assertEquals("(* (neg 2) 3)", sexp("-2*3"));
        assertEquals("(- 1 (neg 2))", sexp("1--2"));
    }

    @Test
    void testFactorialBindsTightest() {
        assertEquals("(^ 2 (! 3))", sexp("2^3!"));
        assertEquals("(neg (! x))", sexp("-x!"));
        assertEquals("(! (! 3))", sexp("3!!"));
    }

    @Test
    void testPercent() {
        Ast ast = Parser.parse("50\\%");
        UnaryOp percent = assertInstanceOf(UnaryOp.class, ast.rootNode());
        assertEquals(UnaryOpKind.PERCENT, percent.kind());
        assertEquals("(% 50)", AstPrinter.print(ast));
    }

    @Test
    void testParentheses() {
        assertEquals("(* (+ 1 2) 3)", sexp("(1+2)*3"));
    }

    @Test
    void testBraceGroupAtPrefixPosition() {
        assertEquals("(* (+ 1 2) 3)", sexp("{1+2}*3"));
    }

    @Test
    @DisplayName("2(3+4) parses identically to 2*(3+4)")
    void testImplicitMultiplication() {
        assertEquals(sexp("2*(3+4)"), sexp("2(3+4)"));
        assertEquals("(* 2 (+ 3 4))", sexp("2(3+4)"));
    }

    @Test
    void testImplicitMultiplicationPrecedence() {
        assertEquals("(+ (* 2 pi) 1)", sexp("2\\pi + 1"));
        assertEquals("(* (* 2 pi) (sin x))", sexp("2\\pi\\sin x"));
        assertEquals("(* 2 (^ 3 2))", sexp("2 3^2"));
    }

    @Test
    void testImplicitMultiplicationNodeUsesNextTokenPosition() {
        Ast ast = Parser.parse("2(3)");
        BinaryOp mul = assertInstanceOf(BinaryOp.class, ast.rootNode());
        assertEquals(BinaryOpKind.MULTIPLY, mul.kind());
        assertEquals(1, mul.position());
    }

    @Test
    void testImplicitIdentifierProductsOption() {
        ParserOptions options = ParserOptions.DEFAULTS.withImplicitIdentifierProducts(true);
        assertEquals("(* 2 x)", sexp("2x", options));
        assertEquals("(* (* x y) z)", sexp("x y z", options));
    }

    @Test
    void testConstants() {
        Ast ast = Parser.parse("\\pi");
        Constant pi = assertInstanceOf(Constant.class, ast.rootNode());
        assertEquals(ConstantKind.PI, pi.kind());
        assertEquals("(* e i)", sexp("\\e\\imath"));
    }

    @Test
    void testIdentifier() {
        Identifier id = assertInstanceOf(Identifier.class, Parser.parse("theta").rootNode());
        assertEquals("theta", id.name());
    }

    @Test
    void testSingleArgFunctionForms() {
        assertEquals("(sin x)", sexp("\\sin{x}"));
        assertEquals("(sin (+ x 1))", sexp("\\sin(x+1)"));
        assertEquals("(+ (sin x) 1)", sexp("\\sin x + 1"));
        assertEquals("(cos (^ x 2))", sexp("\\cos x^2"));
        assertEquals("(ln (* 2 x))", sexp("\\ln{2*x}"));
    }

    @Test
    void testAllSingleArgFunctionsAreKnown() {
        for (String name : Commands.SINGLE_ARG_FUNCTIONS.keySet()) {
            Ast ast = Parser.parse("\\" + name + "{1}");
            Call call = assertInstanceOf(Call.class, ast.rootNode(), name);
            assertEquals(Commands.SINGLE_ARG_FUNCTIONS.get(name), call.function());
            assertEquals(1, call.arguments().size());
        }
    }

    @Test
    void testOperatorName() {
        Ast ast = Parser.parse("\\operatorname{max}(1, x, 3)");
        Call call = assertInstanceOf(Call.class, ast.rootNode());
        assertEquals(FunctionKind.MAX, call.function());
        assertEquals(3, call.arguments().size());
        assertEquals("(max 1 x 3)", AstPrinter.print(ast));
        assertEquals("(atan2 y x)", sexp("\\operatorname{atan2}(y, x)"));
        assertEquals("(abs (neg 3))", sexp("\\operatorname{abs}(-3)"));
    }

    @Test
    @DisplayName("\\frac{1}{2} is a single Rational node")
    void testFractionFastPath() {
        Ast ast = Parser.parse("\\frac{1}{2}");
        assertEquals(1, ast.size());
        Rational half = assertInstanceOf(Rational.class, ast.rootNode());
        assertEquals(1, half.numerator());
        assertEquals(2, half.denominator());
    }

    @Test
    void testFractionFastPathReducesAndFoldsSigns() {
        Rational r = assertInstanceOf(Rational.class, Parser.parse("\\frac{4}{-6}").rootNode());
        assertEquals(-2, r.numerator());
        assertEquals(3, r.denominator());

        r = assertInstanceOf(Rational.class, Parser.parse("\\frac{-3}{-9}").rootNode());
        assertEquals(1, r.numerator());
        assertEquals(3, r.denominator());
    }

    @Test
    @DisplayName("\\frac{1+1}{2} falls back to a Divide node")
    void testFractionGeneralPath() {
        Ast ast = Parser.parse("\\frac{1+1}{2}");
        BinaryOp div = assertInstanceOf(BinaryOp.class, ast.rootNode());
        assertEquals(BinaryOpKind.DIVIDE, div.kind());
        BinaryOp add = assertInstanceOf(BinaryOp.class, ast.at(div.left()));
        assertEquals(BinaryOpKind.ADD, add.kind());
        Rational two = assertInstanceOf(Rational.class, ast.at(div.right()));
        assertEquals(2, two.numerator());
        assertEquals(1, two.denominator());
    }

    @Test
    void testFractionPartialMatchRewinds() {
        assertEquals("(/ 1 (+ 2 x))", sexp("\\frac{1}{2+x}"));
        assertEquals("(/ x 2)", sexp("\\frac{x}{2}"));
        assertEquals("(/ 1.5 2)", sexp("\\frac{1.5}{2}"));
    }

    @Test
    @DisplayName("Division by a literal zero is accepted syntactically")
    void testFractionWithZeroDenominator() {
        assertEquals("(/ 1 0)", sexp("\\frac{1}{0}"));
        assertEquals("(/ 1 0)", sexp("1/0"));
    }

    @Test
    @DisplayName("\\sqrt{4} is Power(4, 1/2)")
    void testSqrt() {
        Ast ast = Parser.parse("\\sqrt{4}");
        BinaryOp pow = assertInstanceOf(BinaryOp.class, ast.rootNode());
        assertEquals(BinaryOpKind.POWER, pow.kind());
        Rational four = assertInstanceOf(Rational.class, ast.at(pow.left()));
        assertEquals(4, four.numerator());
        Rational half = assertInstanceOf(Rational.class, ast.at(pow.right()));
        assertEquals(1, half.numerator());
        assertEquals(2, half.denominator());
    }

    @Test
    void testNthRoot() {
        assertEquals("(^ 8 1/3)", sexp("\\sqrt[3]{8}"));
        assertEquals("(^ x (/ 1 n))", sexp("\\sqrt[n]{x}"));
    }

    @Test
    void testLeftRight() {
        assertEquals("(* (+ 1 2) 3)", sexp("\\left(1+2\\right)3"));
    }

    @Test
    void testInfixCommands() {
        assertEquals("(* 2 3)", sexp("2\\cdot 3"));
        assertEquals("(* 2 3)", sexp("2\\times 3"));
        assertEquals("(+ 1 (/ 6 3))", sexp("1+6\\div 3"));
    }

    @Test
    void testRationalizeRealsOption() {
        ParserOptions options = ParserOptions.DEFAULTS.withRationalizeReals(true);
        Rational half = assertInstanceOf(Rational.class, Parser.parse("0.5", options).rootNode());
        assertEquals(1, half.numerator());
        assertEquals(2, half.denominator());

        // no small denominator is close enough to pi
        assertInstanceOf(Real.class, Parser.parse("3.14159265358979", options).rootNode());
    }

    @Test
    @DisplayName("Every child has a smaller arena index than its parent")
    void testArenaOrdering() {
        Ast ast = Parser.parse("\\frac{x+1}{2}\\sqrt{y} - \\operatorname{max}(a, b!, -c)^2 = 3");
        List<AstNode> nodes = ast.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            for (NodeId child : children(nodes.get(i))) {
                assertTrue(child.index() < i, "child " + child + " of node #" + i);
            }
        }
        assertEquals(nodes.size() - 1, ast.root().index());
    }

    @Test
    void testTryParse() {
        Result<Ast> ok = Parser.tryParse("1+1");
        assertTrue(ok.isOk());
        assertEquals("(+ 1 1)", AstPrinter.print(ok.value()));

        Result<Ast> lexFailure = Parser.tryParse("3.");
        assertEquals(ErrorKind.MALFORMED_NUMBER, lexFailure.error().kind());

        Result<Ast> parseFailure = Parser.tryParse("1+");
        assertEquals(ErrorKind.UNEXPECTED_TOKEN, parseFailure.error().kind());
        assertEquals(2, parseFailure.error().offset());
    }

    @Test
    void testParserCannotBeReused() {
        Parser parser = new Parser(new Lexer("1").tokenize());
        parser.parse();
        assertThrows(IllegalStateException.class, parser::parse);
    }

    @Test
    void testTokenListMustEndWithEnd() {
        assertThrows(IllegalArgumentException.class, () -> new Parser(List.of()));
        assertThrows(IllegalArgumentException.class,
            () -> new Parser(List.of(new Token(TokenType.IDENTIFIER, "x", 0))));
    }

    private static List<NodeId> children(AstNode node) {
        if (node instanceof BinaryOp b) return List.of(b.left(), b.right());
        if (node instanceof UnaryOp u) return List.of(u.inner());
        if (node instanceof Call c) return c.arguments();
        return List.of();
    }
}
