package com.questrail.units.core;

import com.questrail.units.api.Quantity;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * An atmospheric pressure, held in pascals.
 */
public final class Pressure implements Quantity<Pressure>, Comparable<Pressure>
{
    private final double pascals;
    private final PressureUnit displayUnit;

    private Pressure(double pascals, PressureUnit displayUnit) {
        this.pascals = pascals;
        this.displayUnit = Objects.requireNonNull(displayUnit, "displayUnit");
    }

    public static Pressure of(double value, PressureUnit unit) {
        Objects.requireNonNull(unit, "unit");
        return new Pressure(value * unit.pascals(), unit);
    }

    /**
     * @throws com.questrail.units.api.InvalidPropertyException for an unknown unit
     */
    public static Pressure of(double value, String symbol) {
        return of(value, PressureUnit.forSymbol(symbol));
    }

    public static Pressure fromPa(double pa) {
        return of(pa, PressureUnit.PASCALS);
    }

    public static Pressure fromMbar(double mbar) {
        return of(mbar, PressureUnit.MILLIBARS);
    }

    public static Pressure fromInHg(double inHg) {
        return of(inHg, PressureUnit.INCHES_OF_MERCURY);
    }

    /**
     * Pascals.
     */
    @Override
    public double scalar() {
        return pascals;
    }

    public double to(PressureUnit unit) {
        return pascals / unit.pascals();
    }

    public double pa() {
        return pascals;
    }

    public double mbar() {
        return to(PressureUnit.MILLIBARS);
    }

    public double inHg() {
        return to(PressureUnit.INCHES_OF_MERCURY);
    }

    @Override
    public Pressure add(Pressure other) {
        return new Pressure(pascals + other.pascals, displayUnit);
    }

    @Override
    public Pressure subtract(Pressure other) {
        return new Pressure(pascals - other.pascals, displayUnit);
    }

    @Override
    public Pressure negate() {
        return new Pressure(-pascals, displayUnit);
    }

    @Override
    public int compareTo(Pressure other) {
        return Double.compare(pascals, other.pascals);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pressure that)) return false;
        return Double.compare(pascals, that.pascals) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(pascals);
    }

    /**
     * The value in the unit it was created with, e.g. {@code 1013.25 mbar}.
     */
    @Override
    public String toString() {
        return plain(to(displayUnit)) + " " + displayUnit.symbol();
    }

    private static String plain(double value) {
        BigDecimal d = BigDecimal.valueOf(value);
        return d.signum() == 0 ? "0" : d.stripTrailingZeros().toPlainString();
    }
}
