package com.mathc.ast;

public enum UnaryOpKind {
    NEGATE("neg"),
    FACTORIAL("!"),
    PERCENT("%");

    private final String symbol;

    UnaryOpKind(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
