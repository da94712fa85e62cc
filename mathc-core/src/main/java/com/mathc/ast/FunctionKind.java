package com.mathc.ast;

/**
 * Functions a {@link Call} node can name, with the number of arguments each
 * accepts. {@code maxArity} of -1 means unbounded.
 */
public enum FunctionKind {
    SINE("sin", 1, 1),
    COSINE("cos", 1, 1),
    TANGENT("tan", 1, 1),
    COSECANT("csc", 1, 1),
    SECANT("sec", 1, 1),
    COTANGENT("cot", 1, 1),
    ARCSINE("arcsin", 1, 1),
    ARCCOSINE("arccos", 1, 1),
    ARCTANGENT("arctan", 1, 1),
    ATAN2("atan2", 2, 2),

    ABSOLUTE_VALUE("abs", 1, 1),
    EXPONENTIAL("exp", 1, 1),
    NATURAL_LOGARITHM("ln", 1, 1),
    LOGARITHM("log", 1, 1),
    HYPOTENUSE("hypot", 2, 2),
    MAX("max", 1, -1),
    MIN("min", 1, -1);

    private final String displayName;
    private final int minArity;
    private final int maxArity;

    FunctionKind(String displayName, int minArity, int maxArity) {
        this.displayName = displayName;
        this.minArity = minArity;
        this.maxArity = maxArity;
    }

    public String displayName() {
        return displayName;
    }

    public int minArity() {
        return minArity;
    }

    public int maxArity() {
        return maxArity;
    }

    public boolean acceptsArity(int count) {
        return count >= minArity && (maxArity < 0 || count <= maxArity);
    }
}
