package com.questrail.units.core;

import com.questrail.units.api.InvalidPropertyException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Units in which a {@link Distance} can be created and viewed, with their
 * exact length in metres.
 */
public enum DistanceUnit
{
    // SI
    KILOMETERS("1E3", "km"),
    HECTOMETERS("1E2", "hm"),
    DECAMETERS("1E1", "dam"),
    METERS("1", "m"),
    DECIMETERS("1E-1", "dm"),
    CENTIMETERS("1E-2", "cm"),
    MILLIMETERS("1E-3", "mm"),
    MICROMETERS("1E-6", "μm", "µm", "um"),
    NANOMETERS("1E-9", "nm"),
    PICOMETERS("1E-12", "pm"),

    // Imperial
    MILES("1609.344", "mi"),
    YARDS("0.9144", "yd"),
    FEET("0.3048", "ft"),
    INCHES("0.0254", "in"),

    // Astronomy
    ASTRONOMICAL_UNITS("149597870700", "au"),
    LIGHT_YEARS("9460730472580800", "ly"),
    PARSECS("30856776376340067", "pc");

    private final BigDecimal meters;
    private final List<String> symbols;

    DistanceUnit(String meters, String... symbols) {
        this.meters = new BigDecimal(meters);
        this.symbols = List.of(symbols);
    }

    public String symbol() {
        return symbols.get(0);
    }

    /**
     * Metres in one of this unit.
     */
    public BigDecimal meters() {
        return meters;
    }

    /**
     * Looks up a unit by symbol, e.g. {@code km} or {@code au}. Symbols are
     * case-sensitive: {@code Mm} is not {@code mm}.
     *
     * @throws InvalidPropertyException if no unit has that symbol
     */
    public static DistanceUnit forSymbol(String symbol) {
        Objects.requireNonNull(symbol, "symbol");
        for (DistanceUnit unit : values()) {
            if (unit.symbols.contains(symbol)) {
                return unit;
            }
        }
        throw new InvalidPropertyException(symbol + " is not a valid distance unit");
    }
}
