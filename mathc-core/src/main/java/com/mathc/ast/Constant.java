package com.mathc.ast;

public record Constant(
    int position,
    ConstantKind kind
) implements AstNode {

    @Override
    public String type() {
        return "Constant";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }
}
