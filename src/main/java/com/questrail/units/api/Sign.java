package com.questrail.units.api;

/**
 * Sign
 * -----------------------------------------------------------------------------
 * The sign of a quantity's scalar, as rendered in formatted output.
 *
 * <p>Zero (including negative zero) and NaN are {@link #POSITIVE}. Only a
 * scalar strictly below zero is {@link #NEGATIVE}.</p>
 */
public enum Sign
{
    POSITIVE('+'),
    NEGATIVE('-');

    private final char symbol;

    Sign(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the sign of the given scalar.
     */
    public static Sign of(double scalar) {
        return scalar < 0 ? NEGATIVE : POSITIVE;
    }

    /**
     * Returns {@code '+'} or {@code '-'}.
     */
    public char symbol() {
        return symbol;
    }

    public boolean isNegative() {
        return this == NEGATIVE;
    }

    /**
     * Applies this sign to a magnitude.
     */
    public double apply(double magnitude) {
        return this == NEGATIVE ? -magnitude : magnitude;
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
