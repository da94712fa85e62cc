package com.mathc;

/**
 * Knobs for a single {@link Parser}.
 *
 * @param maxDepth deepest nesting of sub-expressions before parsing fails
 *        with {@link ErrorKind#NESTING_TOO_DEEP}
 * @param rationalizeReals replace decimal literals with an exact fraction
 *        when {@link RationalApproximation} finds one
 * @param maxDenominator largest denominator the approximation may use
 * @param tolerance largest absolute error the approximation may have
 * @param implicitIdentifierProducts let identifiers start the right operand
 *        of an implicit multiplication ({@code 2x}, {@code x y})
 */
public record ParserOptions(
    int maxDepth,
    boolean rationalizeReals,
    long maxDenominator,
    double tolerance,
    boolean implicitIdentifierProducts
) {
    public static final int DEFAULT_MAX_DEPTH = 256;
    public static final long DEFAULT_MAX_DENOMINATOR = 1000;
    public static final double DEFAULT_TOLERANCE = 1e-12;

    public static final ParserOptions DEFAULTS = new ParserOptions(
        DEFAULT_MAX_DEPTH, false, DEFAULT_MAX_DENOMINATOR, DEFAULT_TOLERANCE, false);

    public ParserOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        if (maxDenominator < 1) {
            throw new IllegalArgumentException("maxDenominator must be positive, got " + maxDenominator);
        }
        if (!(tolerance >= 0)) {
            throw new IllegalArgumentException("tolerance must be non-negative, got " + tolerance);
        }
    }

    public ParserOptions withMaxDepth(int maxDepth) {
        return new ParserOptions(maxDepth, rationalizeReals, maxDenominator, tolerance, implicitIdentifierProducts);
    }

    public ParserOptions withRationalizeReals(boolean rationalizeReals) {
        return new ParserOptions(maxDepth, rationalizeReals, maxDenominator, tolerance, implicitIdentifierProducts);
    }

    public ParserOptions withApproximation(long maxDenominator, double tolerance) {
        return new ParserOptions(maxDepth, rationalizeReals, maxDenominator, tolerance, implicitIdentifierProducts);
    }

    public ParserOptions withImplicitIdentifierProducts(boolean implicitIdentifierProducts) {
        return new ParserOptions(maxDepth, rationalizeReals, maxDenominator, tolerance, implicitIdentifierProducts);
    }
}
