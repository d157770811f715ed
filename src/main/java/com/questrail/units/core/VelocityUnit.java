package com.questrail.units.core;

import com.questrail.units.api.InvalidPropertyException;

import java.util.Objects;

/**
 * A velocity unit: a distance unit over a time unit, written
 * {@code <distance>/<time>} ({@code km/s}, {@code au/d}, {@code pc/yr}) or
 * {@code mph}.
 *
 * @param distanceUnit the numerator
 * @param durationUnit the denominator
 * @param symbol       the text the unit was written as
 */
public record VelocityUnit(DistanceUnit distanceUnit, DurationUnit durationUnit, String symbol)
{
    public static final VelocityUnit METERS_PER_SECOND = parse("m/s");
    public static final VelocityUnit KILOMETERS_PER_SECOND = parse("km/s");
    public static final VelocityUnit KILOMETERS_PER_HOUR = parse("km/h");
    public static final VelocityUnit KILOMETERS_PER_DAY = parse("km/d");
    public static final VelocityUnit FEET_PER_SECOND = parse("ft/s");
    public static final VelocityUnit AU_PER_DAY = parse("au/d");
    public static final VelocityUnit PARSECS_PER_YEAR = parse("pc/y");
    public static final VelocityUnit MILES_PER_HOUR = parse("mph");

    public VelocityUnit {
        Objects.requireNonNull(distanceUnit, "distanceUnit");
        Objects.requireNonNull(durationUnit, "durationUnit");
        Objects.requireNonNull(symbol, "symbol");
    }

    /**
     * Parses a velocity unit.
     *
     * @throws InvalidPropertyException if either part is not a known unit or
     *                                  the text is not {@code a/b} or {@code mph}
     */
    public static VelocityUnit parse(String units) {
        Objects.requireNonNull(units, "units");
        final String text = units.trim();

        if (text.equals("mph")) {
            return new VelocityUnit(DistanceUnit.MILES, DurationUnit.HOURS, text);
        }

        final String[] parts = text.split("/", -1);
        if (parts.length != 2) {
            throw new InvalidPropertyException(units + " is not a valid velocity unit");
        }
        return new VelocityUnit(
                DistanceUnit.forSymbol(parts[0].trim()),
                DurationUnit.forSymbol(parts[1]),
                text);
    }
}
