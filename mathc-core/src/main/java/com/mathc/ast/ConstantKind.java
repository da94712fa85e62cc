package com.mathc.ast;

public enum ConstantKind {
    PI,
    E,
    I
}
