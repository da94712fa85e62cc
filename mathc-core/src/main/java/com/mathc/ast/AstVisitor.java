package com.mathc.ast;

/**
 * One method per node variant. Implementations are forced by the compiler
 * to handle every variant.
 */
public interface AstVisitor<R> {
    R visitConstant(Constant node);
    R visitReal(Real node);
    R visitRational(Rational node);
    R visitIdentifier(Identifier node);
    R visitBinaryOp(BinaryOp node);
    R visitUnaryOp(UnaryOp node);
    R visitCall(Call node);
}
