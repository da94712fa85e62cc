package com.mathc.ast;

/**
 * Inexact numeric leaf.
 */
public record Real(
    int position,
    double value
) implements AstNode {

    @Override
    public String type() {
        return "Real";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitReal(this);
    }
}
