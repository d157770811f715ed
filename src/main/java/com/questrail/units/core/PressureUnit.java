package com.questrail.units.core;

import com.questrail.units.api.InvalidPropertyException;

import java.util.Objects;

/**
 * Units of {@link Pressure}.
 */
public enum PressureUnit
{
    PASCALS("Pa", 1),
    MILLIBARS("mbar", 100),
    INCHES_OF_MERCURY("inHg", 3386);

    private final String symbol;
    private final double pascals;

    PressureUnit(String symbol, double pascals) {
        this.symbol = symbol;
        this.pascals = pascals;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Pascals in one of this unit.
     */
    public double pascals() {
        return pascals;
    }

    /**
     * @throws InvalidPropertyException if no unit has that symbol
     */
    public static PressureUnit forSymbol(String symbol) {
        Objects.requireNonNull(symbol, "symbol");
        final String key = symbol.trim();
        for (PressureUnit unit : values()) {
            if (unit.symbol.equals(key)) {
                return unit;
            }
        }
        throw new InvalidPropertyException(symbol + " is not a valid pressure unit");
    }
}
