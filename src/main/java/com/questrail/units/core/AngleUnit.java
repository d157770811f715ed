package com.questrail.units.core;

import com.questrail.units.api.InvalidPropertyException;

import java.util.Objects;

/**
 * Units in which an {@link Angle} can be created and viewed.
 *
 * <p>Each unit is defined by the exact ratio {@code numerator / denominator}
 * of arcseconds per unit, so that conversions between the sexagesimal units
 * stay exact for integral inputs.</p>
 */
public enum AngleUnit
{
    DEGREES("deg", 3600, 1),
    ARCMINUTES("amin", 60, 1),
    ARCSECONDS("asec", 1, 1),
    MILLIARCSECONDS("mas", 1, 1000),
    RADIANS("rad", 648000, Math.PI);

    private final String symbol;
    private final double numerator;
    private final double denominator;

    AngleUnit(String symbol, double numerator, double denominator) {
        this.symbol = symbol;
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Converts a value in this unit to arcseconds.
     */
    public double toArcseconds(double value) {
        return value * numerator / denominator;
    }

    /**
     * Converts arcseconds to a value in this unit.
     */
    public double fromArcseconds(double arcseconds) {
        return arcseconds * denominator / numerator;
    }

    /**
     * Looks up a unit by its symbol ({@code deg}, {@code amin}, {@code asec},
     * {@code mas} or {@code rad}).
     *
     * @throws InvalidPropertyException if no unit has that symbol
     */
    public static AngleUnit forSymbol(String symbol) {
        Objects.requireNonNull(symbol, "symbol");
        for (AngleUnit unit : values()) {
            if (unit.symbol.equals(symbol)) {
                return unit;
            }
        }
        throw new InvalidPropertyException(symbol + " is not a valid angle unit");
    }
}
