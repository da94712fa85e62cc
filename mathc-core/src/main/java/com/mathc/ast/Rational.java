package com.mathc.ast;

/**
 * Exact numeric leaf, always in lowest terms with the sign on the numerator.
 *
 * The canonical constructor only accepts already-normalized pairs; use
 * {@link #of(int, long, long)} to reduce arbitrary input.
 */
public record Rational(
    int position,
    long numerator,
    long denominator
) implements AstNode {

    public Rational {
        if (denominator <= 0) {
            throw new IllegalArgumentException("Rational denominator must be positive, got " + denominator);
        }
        if (gcd(Math.abs(numerator), denominator) != 1) {
            throw new IllegalArgumentException(
                "Rational " + numerator + "/" + denominator + " is not in lowest terms");
        }
    }

    /**
     * Builds a rational from any numerator/denominator pair, reducing it and
     * moving the sign onto the numerator.
     *
     * @throws IllegalArgumentException if the denominator is zero, or if a
     *         component is {@link Long#MIN_VALUE} and cannot be negated
     */
    public static Rational of(int position, long numerator, long denominator) {
        if (denominator == 0) {
            throw new IllegalArgumentException("Rational denominator must not be zero");
        }
        try {
            if (denominator < 0) {
                numerator = Math.negateExact(numerator);
                denominator = Math.negateExact(denominator);
            }
            long divisor = gcd(Math.absExact(numerator), denominator);
            return new Rational(position, numerator / divisor, denominator / divisor);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                "Rational " + numerator + "/" + denominator + " is out of range", e);
        }
    }

    public static Rational ofInteger(int position, long value) {
        return new Rational(position, value, 1);
    }

    public boolean isInteger() {
        return denominator == 1;
    }

    public double doubleValue() {
        return (double) numerator / denominator;
    }

    // gcd(0, d) == d, so zero numerators normalize to 0/1
    static long gcd(long a, long b) {
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    @Override
    public String type() {
        return "Rational";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRational(this);
    }
}
