package com.questrail.units.core;

import com.questrail.units.api.InvalidPropertyException;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Units in which a {@link Time} can be created and viewed.
 *
 * <p>A year is the Julian year of 365.25 days.</p>
 */
public enum DurationUnit
{
    SECONDS(1, "s", "sec", "second", "seconds"),
    MINUTES(60, "m", "min", "minute", "minutes"),
    HOURS(Time.SEC_IN_HOUR, "h", "hr", "hour", "hours"),
    DAYS(Time.SEC_IN_DAY, "d", "day", "days"),
    WEEKS(7 * Time.SEC_IN_DAY, "w", "wk", "week", "weeks"),
    YEARS(Time.JULIAN_YEAR_DAYS * Time.SEC_IN_DAY, "y", "yr", "year", "years");

    private final double seconds;
    private final List<String> aliases;

    DurationUnit(double seconds, String... aliases) {
        this.seconds = seconds;
        this.aliases = List.of(aliases);
    }

    /**
     * The short symbol of this unit, as used in velocity units ({@code km/s}).
     */
    public String symbol() {
        return aliases.get(0);
    }

    /**
     * Seconds in one of this unit.
     */
    public double seconds() {
        return seconds;
    }

    public double toSeconds(double value) {
        return value * seconds;
    }

    public double fromSeconds(double sec) {
        return sec / seconds;
    }

    /**
     * Looks up a unit by symbol or alias, ignoring case: {@code s}, {@code sec},
     * {@code min}, {@code hours}, {@code d}, {@code wk}, {@code yr}, ...
     *
     * @throws InvalidPropertyException if no unit has that symbol
     */
    public static DurationUnit forSymbol(String symbol) {
        Objects.requireNonNull(symbol, "symbol");
        final String key = symbol.trim().toLowerCase(Locale.ROOT);
        for (DurationUnit unit : values()) {
            if (unit.aliases.contains(key)) {
                return unit;
            }
        }
        throw new InvalidPropertyException(symbol + " is not a valid time unit");
    }
}
