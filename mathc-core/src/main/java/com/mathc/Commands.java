package com.mathc;

import com.mathc.ast.ConstantKind;
import com.mathc.ast.FunctionKind;

import java.util.Map;
import java.util.Set;

/**
 * Name tables for LaTeX commands. Built once, never modified.
 */
public final class Commands {

    private Commands() {
        // Utility class
    }

    public static final String FRAC = "frac";
    public static final String SQRT = "sqrt";
    public static final String LEFT = "left";
    public static final String RIGHT = "right";
    public static final String OPERATORNAME = "operatorname";
    public static final String PERCENT = "%";

    /** Commands naming a constant. */
    public static final Map<String, ConstantKind> CONSTANTS = Map.of(
        "pi", ConstantKind.PI,
        "e", ConstantKind.E,
        "imath", ConstantKind.I
    );

    /** Commands naming a function of one argument: {@code \sin x}, {@code \ln(x)}. */
    public static final Map<String, FunctionKind> SINGLE_ARG_FUNCTIONS = Map.ofEntries(
        Map.entry("sin", FunctionKind.SINE),
        Map.entry("cos", FunctionKind.COSINE),
        Map.entry("tan", FunctionKind.TANGENT),
        Map.entry("csc", FunctionKind.COSECANT),
        Map.entry("sec", FunctionKind.SECANT),
        Map.entry("cot", FunctionKind.COTANGENT),
        Map.entry("arcsin", FunctionKind.ARCSINE),
        Map.entry("arccos", FunctionKind.ARCCOSINE),
        Map.entry("arctan", FunctionKind.ARCTANGENT),
        Map.entry("ln", FunctionKind.NATURAL_LOGARITHM),
        Map.entry("log", FunctionKind.LOGARITHM),
        Map.entry("exp", FunctionKind.EXPONENTIAL)
    );

    /** Names accepted inside {@code \operatorname{...}}. */
    public static final Map<String, FunctionKind> OPERATOR_NAMES = Map.of(
        "max", FunctionKind.MAX,
        "min", FunctionKind.MIN,
        "atan2", FunctionKind.ATAN2,
        "hypot", FunctionKind.HYPOTENUSE,
        "abs", FunctionKind.ABSOLUTE_VALUE
    );

    /** Commands that may start the right operand of an implicit multiplication. */
    public static final Set<String> PREFIX_COMMANDS = Set.of(
        "sin", "cos", "tan",
        "csc", "sec", "cot",
        "ln", "log", "exp",
        "pi", "e", "imath",
        SQRT, FRAC,
        LEFT, OPERATORNAME,
        "arcsin", "arccos", "arctan"
    );
}
