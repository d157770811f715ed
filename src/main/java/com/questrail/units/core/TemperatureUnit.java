package com.questrail.units.core;

import com.questrail.units.api.InvalidPropertyException;

import java.util.Objects;

/**
 * Temperature scales, each converting to and from kelvin.
 */
public enum TemperatureUnit
{
    KELVIN(" K", "K") {
        @Override
        public double toKelvin(double value) {
            return value;
        }

        @Override
        public double fromKelvin(double kelvin) {
            return kelvin;
        }
    },
    CELSIUS("°C", "C") {
        @Override
        public double toKelvin(double value) {
            return value + ZERO_CELSIUS;
        }

        @Override
        public double fromKelvin(double kelvin) {
            return kelvin - ZERO_CELSIUS;
        }
    },
    FAHRENHEIT("°F", "F") {
        @Override
        public double toKelvin(double value) {
            return (value + RANKINE_OFFSET) * 5 / 9;
        }

        @Override
        public double fromKelvin(double kelvin) {
            return kelvin * 9 / 5 - RANKINE_OFFSET;
        }
    };

    /**
     * Kelvin at 0 °C.
     */
    static final double ZERO_CELSIUS = 273.15;

    /**
     * Fahrenheit degrees between absolute zero and 0 °F.
     */
    static final double RANKINE_OFFSET = 459.67;

    private final String suffix;
    private final String letter;

    TemperatureUnit(String suffix, String letter) {
        this.suffix = suffix;
        this.letter = letter;
    }

    /**
     * Text appended to a value rendered in this unit, e.g. {@code °C}.
     */
    public String suffix() {
        return suffix;
    }

    public abstract double toKelvin(double value);

    public abstract double fromKelvin(double kelvin);

    /**
     * Looks up a unit by letter ({@code K}, {@code C}, {@code F}), with or
     * without the degree sign.
     *
     * @throws InvalidPropertyException if no unit matches
     */
    public static TemperatureUnit forSymbol(String symbol) {
        Objects.requireNonNull(symbol, "symbol");
        String key = symbol.trim();
        if (key.startsWith("°")) {
            key = key.substring(1);
        }
        for (TemperatureUnit unit : values()) {
            if (unit.letter.equalsIgnoreCase(key)) {
                return unit;
            }
        }
        throw new InvalidPropertyException(symbol + " is not a valid temperature unit");
    }
}
