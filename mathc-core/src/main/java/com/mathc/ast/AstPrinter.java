package com.mathc.ast;

/**
 * Renders a tree as an S-expression, e.g. {@code (+ 1 (* 2 3))}.
 *
 * Integer rationals print without a denominator, other rationals as
 * {@code n/d}. Constants print as {@code pi}, {@code e} and {@code i}.
 */
public final class AstPrinter implements AstVisitor<String> {

    private final Ast ast;

    public AstPrinter(Ast ast) {
        this.ast = ast;
    }

    public static String print(Ast ast) {
        return print(ast, ast.root());
    }

    public static String print(Ast ast, NodeId id) {
        return ast.accept(id, new AstPrinter(ast));
    }

    private String child(NodeId id) {
        return ast.accept(id, this);
    }

    @Override
    public String visitConstant(Constant node) {
        return switch (node.kind()) {
            case PI -> "pi";
            case E -> "e";
            case I -> "i";
        };
    }

    @Override
    public String visitReal(Real node) {
        return Double.toString(node.value());
    }

    @Override
    public String visitRational(Rational node) {
        if (node.isInteger()) {
            return Long.toString(node.numerator());
        }
        return node.numerator() + "/" + node.denominator();
    }

    @Override
    public String visitIdentifier(Identifier node) {
        return node.name();
    }

    @Override
    public String visitBinaryOp(BinaryOp node) {
        return "(" + node.kind().symbol() + " " + child(node.left()) + " " + child(node.right()) + ")";
    }

    @Override
    public String visitUnaryOp(UnaryOp node) {
        return "(" + node.kind().symbol() + " " + child(node.inner()) + ")";
    }

    @Override
    public String visitCall(Call node) {
        StringBuilder sb = new StringBuilder("(").append(node.function().displayName());
        for (NodeId argument : node.arguments()) {
            sb.append(' ').append(child(argument));
        }
        return sb.append(')').toString();
    }
}
