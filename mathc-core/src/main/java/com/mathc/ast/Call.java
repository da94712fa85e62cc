package com.mathc.ast;

import java.util.List;

public record Call(
    int position,
    FunctionKind function,
    List<NodeId> arguments
) implements AstNode {

    public Call {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String type() {
        return "Call";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
