package com.questrail.units.core;

import com.questrail.units.api.NonFiniteValueException;
import com.questrail.units.api.Quantity;
import com.questrail.units.format.FormatEngine;
import com.questrail.units.format.FormatOptions;
import com.questrail.units.format.Formattable;
import com.questrail.units.format.TemplateDialect;
import com.questrail.units.format.impl.DefaultFormatEngine;
import com.questrail.units.sexagesimal.SexagesimalCodec;
import com.questrail.units.sexagesimal.SexagesimalComponents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * An interval of time.
 *
 * <p>Held as a single number of seconds, from which the decimal views (minutes
 * through Julian years) and the hour / minute / second components are derived.
 * Arithmetic returns new instances; only the active format is mutable and it
 * does not take part in equality.</p>
 *
 * <p>Template components are {@code h m s}, the fraction is {@code Nf} and the
 * continuous units are {@code Y W D H M S}.</p>
 */
public final class Time implements Quantity<Time>, Formattable, Comparable<Time>
{
    private static final Logger log = LoggerFactory.getLogger(Time.class);

    /**
     * Number of days in a Julian year.
     */
    public static final double JULIAN_YEAR_DAYS = 365.25;

    public static final double SEC_IN_DAY = 86400;

    public static final double SEC_IN_HOUR = 3600;

    /**
     * Default format, 07:47:16.8
     */
    public static final String FORMAT_DEFAULT = "0h:0m:0s.3f";

    /**
     * HMS format, 07ʰ47ᵐ16ˢ.8
     */
    public static final String FORMAT_HMS = "0hʰ0mᵐ0sˢ.3f";

    /**
     * Spaced format, 7h 47m 16.8s
     */
    public static final String FORMAT_SPACED = "h\\h m\\m s.3f\\s";

    /**
     * Year format, 1.767 years
     */
    public static final String FORMAT_YEARS = "3Y year\\s";

    /**
     * Week format, 2.046 weeks
     */
    public static final String FORMAT_WEEKS = "3W week\\s";

    /**
     * Day format, 1.325 days
     */
    public static final String FORMAT_DAYS = "3D day\\s";

    /**
     * Hour format, 7.788 hours
     */
    public static final String FORMAT_HOURS = "3H \\hour\\s";

    /**
     * Minute format, 467.28 min
     */
    public static final String FORMAT_MIN = "3M \\min";

    /**
     * Second format, 86.4 sec
     */
    public static final String FORMAT_SEC = "3S \\sec";

    /**
     * Template letters of time intervals.
     */
    public static final TemplateDialect DIALECT = new TemplateDialect(
            "time", 'h', 'm', 's', 2, false,
            Map.<Character, DoubleUnaryOperator>of(
                    'Y', DurationUnit.YEARS::fromSeconds,
                    'W', DurationUnit.WEEKS::fromSeconds,
                    'D', DurationUnit.DAYS::fromSeconds,
                    'H', DurationUnit.HOURS::fromSeconds,
                    'M', DurationUnit.MINUTES::fromSeconds,
                    'S', DurationUnit.SECONDS::fromSeconds));

    private final double sec;
    private final int roundingPlace;
    private volatile String activeFormat = FORMAT_DEFAULT;

    private Time(double sec, int roundingPlace) {
        if (roundingPlace < 0) {
            throw new IllegalArgumentException("roundingPlace must be non-negative (was " + roundingPlace + ")");
        }
        this.sec = sec;
        this.roundingPlace = roundingPlace;
    }

    // -------------------------------------------------------------------------
    // Factories
    // -------------------------------------------------------------------------

    public static Time fromSec(double sec) {
        return new Time(sec, FormatOptions.DEFAULT_ROUNDING_PLACE);
    }

    public static Time fromMin(double min) {
        return of(min, DurationUnit.MINUTES);
    }

    public static Time fromHours(double hours) {
        return of(hours, DurationUnit.HOURS);
    }

    public static Time fromDays(double days) {
        return of(days, DurationUnit.DAYS);
    }

    public static Time fromWeeks(double weeks) {
        return of(weeks, DurationUnit.WEEKS);
    }

    public static Time fromYears(double years) {
        return fromYears(years, JULIAN_YEAR_DAYS);
    }

    /**
     * @param years       number of years
     * @param daysPerYear length of the year in days
     */
    public static Time fromYears(double years, double daysPerYear) {
        return fromSec(years * SEC_IN_DAY * daysPerYear);
    }

    public static Time of(double value, DurationUnit unit) {
        Objects.requireNonNull(unit, "unit");
        return fromSec(unit.toSeconds(value));
    }

    /**
     * @throws com.questrail.units.api.InvalidPropertyException for an unknown symbol
     */
    public static Time of(double value, String symbol) {
        return of(value, DurationUnit.forSymbol(symbol));
    }

    public static Time fromHMS(double h, double m) {
        return fromHMS(h, m, 0, 0);
    }

    public static Time fromHMS(double h, double m, double s) {
        return fromHMS(h, m, s, 0);
    }

    /**
     * Creates a time from hour, minute and second components. The first
     * non-zero component sets the sign.
     *
     * @param h hour component
     * @param m minute component
     * @param s second component
     * @param f fractional second component
     */
    public static Time fromHMS(double h, double m, double s, double f) {
        return fromSec(SexagesimalCodec.compose(h, m, s, f));
    }

    /**
     * The time represented by {@code angle} as a proportion of one day.
     */
    public static Time fromAngle(Angle angle) {
        return angle.toTime();
    }

    public static Time fromAngle(Angle angle, Time interval) {
        return angle.toTime(interval);
    }

    // -------------------------------------------------------------------------
    // Views
    // -------------------------------------------------------------------------

    /**
     * Seconds.
     */
    @Override
    public double scalar() {
        return sec;
    }

    @Override
    public TemplateDialect dialect() {
        return DIALECT;
    }

    public double to(DurationUnit unit) {
        return unit.fromSeconds(sec);
    }

    public double sec() {
        return sec;
    }

    public double min() {
        return to(DurationUnit.MINUTES);
    }

    public double hours() {
        return to(DurationUnit.HOURS);
    }

    public double days() {
        return to(DurationUnit.DAYS);
    }

    public double weeks() {
        return to(DurationUnit.WEEKS);
    }

    public double years() {
        return to(DurationUnit.YEARS);
    }

    public long h() {
        return components().major();
    }

    public long m() {
        return components().minor1();
    }

    public long s() {
        return components().minor2();
    }

    public String f() {
        return components().fraction();
    }

    /**
     * @throws NonFiniteValueException if this time is NaN or infinite
     */
    public SexagesimalComponents components() {
        requireFinite();
        return SexagesimalCodec.decompose(sec, roundingPlace);
    }

    public int roundingPlace() {
        return roundingPlace;
    }

    public Time withRoundingPlace(int place) {
        Time copy = new Time(sec, place);
        copy.activeFormat = activeFormat;
        return copy;
    }

    // -------------------------------------------------------------------------
    // Arithmetic
    // -------------------------------------------------------------------------

    @Override
    public Time add(Time other) {
        return fromSec(sec + other.sec);
    }

    @Override
    public Time subtract(Time other) {
        return fromSec(sec - other.sec);
    }

    @Override
    public Time negate() {
        return fromSec(-sec);
    }

    public Time multiply(Time other) {
        return fromSec(sec * other.sec);
    }

    public Time divide(Time other) {
        return fromSec(sec / other.sec);
    }

    public Time times(double factor) {
        return fromSec(sec * factor);
    }

    public Time dividedBy(double divisor) {
        return fromSec(sec / divisor);
    }

    // -------------------------------------------------------------------------
    // Formatting
    // -------------------------------------------------------------------------

    /**
     * Formats this time with the standard engine and makes {@code template}
     * the active format.
     *
     * @param template format template, e.g. {@code 0h:0m:0s.3f}
     * @throws NonFiniteValueException if this time is NaN or infinite
     */
    public String format(String template) {
        return format(template, DefaultFormatEngine.standard());
    }

    public String format(String template, FormatEngine engine) {
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(engine, "engine");
        requireFinite();

        String rendered = engine.render(template, this);
        activeFormat = template;
        return rendered;
    }

    public String activeFormat() {
        return activeFormat;
    }

    private void requireFinite() {
        if (!Double.isFinite(sec)) {
            throw new NonFiniteValueException("time is not finite: " + sec + " seconds");
        }
    }

    // -------------------------------------------------------------------------
    // Object
    // -------------------------------------------------------------------------

    @Override
    public int compareTo(Time other) {
        return Double.compare(sec, other.sec);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Time that)) return false;
        return Double.compare(sec, that.sec) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(sec);
    }

    @Override
    public String toString() {
        if (!Double.isFinite(sec)) {
            log.warn("Time {} is not finite; skipping template '{}'", sec, activeFormat);
            return sec + " s";
        }
        return format(activeFormat);
    }
}
