package com.mathc;

import java.util.Optional;

/**
 * Finds the simplest fraction close to a double by Stern-Brocot mediant search.
 *
 * <p>The whole part is split off first and the search runs on the fractional
 * part in [0, 1), starting from the bounds 0/1 and 1/1. Each step replaces one
 * bound with the mediant of the two, so denominators grow strictly and the
 * search ends once they pass the limit. The first mediant within tolerance is
 * the one with the smallest denominator.</p>
 */
public final class RationalApproximation {

    // Beyond this the whole part no longer fits comfortably in a long
    private static final double MAX_MAGNITUDE = 0x1p62;

    private RationalApproximation() {
        // Utility class
    }

    public record Fraction(long numerator, long denominator) {}

    public static Optional<Fraction> approximate(double value, long maxDenominator, double tolerance) {
        if (!Double.isFinite(value) || Math.abs(value) >= MAX_MAGNITUDE || maxDenominator < 1) {
            return Optional.empty();
        }

        long whole = (long) Math.floor(value);
        double fraction = value - whole;

        if (fraction <= tolerance) {
            return Optional.of(new Fraction(whole, 1));
        }
        if (1.0 - fraction <= tolerance) {
            return Optional.of(new Fraction(whole + 1, 1));
        }

        long leftNum = 0, leftDen = 1;
        long rightNum = 1, rightDen = 1;

        while (true) {
            long num = leftNum + rightNum;
            long den = leftDen + rightDen;
            if (den > maxDenominator) {
                return Optional.empty();
            }

            double mediant = (double) num / den;
            if (Math.abs(fraction - mediant) <= tolerance) {
                return combine(whole, num, den);
            }

            if (mediant < fraction) {
                leftNum = num;
                leftDen = den;
            } else {
                rightNum = num;
                rightDen = den;
            }
        }
    }

    private static Optional<Fraction> combine(long whole, long num, long den) {
        try {
            return Optional.of(new Fraction(Math.addExact(Math.multiplyExact(whole, den), num), den));
        } catch (ArithmeticException e) {
            return Optional.empty();
        }
    }
}
