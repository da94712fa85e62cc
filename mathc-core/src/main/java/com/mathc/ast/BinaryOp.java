package com.mathc.ast;

public record BinaryOp(
    int position,
    BinaryOpKind kind,
    NodeId left,
    NodeId right
) implements AstNode {

    @Override
    public String type() {
        return "BinaryOp";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }
}
