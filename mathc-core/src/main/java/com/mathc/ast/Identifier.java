package com.mathc.ast;

public record Identifier(
    int position,
    String name
) implements AstNode {

    @Override
    public String type() {
        return "Identifier";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
