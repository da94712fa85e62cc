package com.mathc.ast;

public record UnaryOp(
    int position,
    UnaryOpKind kind,
    NodeId inner
) implements AstNode {

    @Override
    public String type() {
        return "UnaryOp";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }
}
