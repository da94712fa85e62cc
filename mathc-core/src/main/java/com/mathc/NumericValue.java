package com.mathc;

/**
 * Value of a numeric literal: an exact {@code long} or an approximate
 * {@code double}. {@link #isInteger()} says which one is authoritative.
 */
public record NumericValue(long longValue, double doubleValue, boolean isInteger) {

    public static NumericValue ofInteger(long value) {
        return new NumericValue(value, (double) value, true);
    }

    public static NumericValue ofReal(double value) {
        return new NumericValue(0L, value, false);
    }

    @Override
    public String toString() {
        return isInteger ? Long.toString(longValue) : Double.toString(doubleValue);
    }
}
