package com.mathc.ast;

/**
 * Base interface for the seven node variants stored in an {@link Ast}.
 */
public sealed interface AstNode permits
    Constant,
    Real,
    Rational,
    Identifier,
    BinaryOp,
    UnaryOp,
    Call {

    String type();
    int position();

    <R> R accept(AstVisitor<R> visitor);
}
