package com.questrail.units.core;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * A thermodynamic temperature, held in kelvin and displayed in a chosen
 * {@link TemperatureUnit}.
 *
 * <p>Temperatures are not a {@link com.questrail.units.api.Quantity}: adding
 * two absolute temperatures has no physical meaning on the Celsius or
 * Fahrenheit scales.</p>
 */
public final class Temperature implements Comparable<Temperature>
{
    public static final int DEFAULT_DECIMAL_PLACES = 3;

    private final double kelvin;
    private final TemperatureUnit displayUnit;
    private final int decimalPlaces;

    private Temperature(double kelvin, TemperatureUnit displayUnit, int decimalPlaces) {
        if (!Double.isFinite(kelvin)) {
            throw new IllegalArgumentException("temperature must be finite (was " + kelvin + " K)");
        }
        if (decimalPlaces < 0) {
            throw new IllegalArgumentException("decimalPlaces must be non-negative (was " + decimalPlaces + ")");
        }
        this.kelvin = kelvin;
        this.displayUnit = Objects.requireNonNull(displayUnit, "displayUnit");
        this.decimalPlaces = decimalPlaces;
    }

    public static Temperature of(double value, TemperatureUnit unit) {
        Objects.requireNonNull(unit, "unit");
        return new Temperature(unit.toKelvin(value), unit, DEFAULT_DECIMAL_PLACES);
    }

    /**
     * @throws com.questrail.units.api.InvalidPropertyException for an unknown unit
     */
    public static Temperature of(double value, String symbol) {
        return of(value, TemperatureUnit.forSymbol(symbol));
    }

    public static Temperature kelvin(double k) {
        return of(k, TemperatureUnit.KELVIN);
    }

    public static Temperature celsius(double c) {
        return of(c, TemperatureUnit.CELSIUS);
    }

    public static Temperature fahrenheit(double f) {
        return of(f, TemperatureUnit.FAHRENHEIT);
    }

    public double to(TemperatureUnit unit) {
        return unit.fromKelvin(kelvin);
    }

    public double kelvin() {
        return kelvin;
    }

    public double celsius() {
        return to(TemperatureUnit.CELSIUS);
    }

    public double fahrenheit() {
        return to(TemperatureUnit.FAHRENHEIT);
    }

    public TemperatureUnit displayUnit() {
        return displayUnit;
    }

    public int decimalPlaces() {
        return decimalPlaces;
    }

    public Temperature withUnit(TemperatureUnit unit) {
        return new Temperature(kelvin, unit, decimalPlaces);
    }

    public Temperature withDecimalPlaces(int places) {
        return new Temperature(kelvin, displayUnit, places);
    }

    @Override
    public int compareTo(Temperature other) {
        return Double.compare(kelvin, other.kelvin);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Temperature that)) return false;
        return Double.compare(kelvin, that.kelvin) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(kelvin);
    }

    /**
     * The value in the display unit, rounded half-up to the decimal places
     * with trailing zeros removed, e.g. {@code 373.15 K} or {@code 100°C}.
     */
    @Override
    public String toString() {
        BigDecimal value = BigDecimal.valueOf(to(displayUnit)).setScale(decimalPlaces, RoundingMode.HALF_UP);
        String number = value.signum() == 0 ? "0" : value.stripTrailingZeros().toPlainString();
        return number + displayUnit.suffix();
    }
}
