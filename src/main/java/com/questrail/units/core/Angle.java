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
 * A geometric angle.
 *
 * <h2>Representation</h2>
 * <p>
 * The angle is held as a single number of arcseconds. Every other view
 * (degrees, radians, arcminutes, milliarcseconds and the degree / arcminute /
 * arcsecond components) is derived from it on demand.
 * </p>
 *
 * <h2>Immutability</h2>
 * <p>
 * Arithmetic and normalization return new instances. The only mutable state
 * is the active format, which records the template last passed to
 * {@link #format(String)} and drives {@link #toString()}. It takes no part in
 * {@link #equals(Object)}.
 * </p>
 *
 * <h2>Format templates</h2>
 * <p>
 * Components are {@code d m s}, the fraction is {@code Nf}, continuous units
 * are {@code D} (degrees) and {@code R} (radians). See {@link FormatEngine}.
 * </p>
 */
public final class Angle implements Quantity<Angle>, Formattable, Comparable<Angle>
{
    private static final Logger log = LoggerFactory.getLogger(Angle.class);

    /**
     * Arcseconds in a full turn of 360 degrees.
     */
    public static final double FULL_TURN_ASEC = 360 * 3600;

    /**
     * Default format, -012°34'56".123
     */
    public static final String FORMAT_DEFAULT = "+0d°0m'0s\".3f";

    /**
     * Compact format, -12°34'56".1
     */
    public static final String FORMAT_COMPACT = "d°m's\".1f";

    /**
     * Spaced format, -012 34 56.123
     */
    public static final String FORMAT_SPACED = "+0d 0m 0s.3f";

    /**
     * Colon format, -012:34:56.123
     */
    public static final String FORMAT_COLON = "+0d:0m:0s.3f";

    /**
     * Decimal format, 12.5822565
     */
    public static final String FORMAT_DECIMAL = "9D";

    /**
     * Template letters of angles.
     */
    public static final TemplateDialect DIALECT = new TemplateDialect(
            "angle", 'd', 'm', 's', 3, true,
            Map.<Character, DoubleUnaryOperator>of(
                    'D', AngleUnit.DEGREES::fromArcseconds,
                    'R', AngleUnit.RADIANS::fromArcseconds));

    private final double asec;
    private final int roundingPlace;
    private volatile String activeFormat = FORMAT_DEFAULT;

    private Angle(double asec, int roundingPlace) {
        if (roundingPlace < 0) {
            throw new IllegalArgumentException("roundingPlace must be non-negative (was " + roundingPlace + ")");
        }
        this.asec = asec;
        this.roundingPlace = roundingPlace;
    }

    // -------------------------------------------------------------------------
    // Factories
    // -------------------------------------------------------------------------

    public static Angle fromAsec(double asec) {
        return new Angle(asec, FormatOptions.DEFAULT_ROUNDING_PLACE);
    }

    public static Angle fromDeg(double deg) {
        return of(deg, AngleUnit.DEGREES);
    }

    public static Angle fromRad(double rad) {
        return of(rad, AngleUnit.RADIANS);
    }

    public static Angle fromAmin(double amin) {
        return of(amin, AngleUnit.ARCMINUTES);
    }

    public static Angle fromMas(double mas) {
        return of(mas, AngleUnit.MILLIARCSECONDS);
    }

    public static Angle of(double value, AngleUnit unit) {
        Objects.requireNonNull(unit, "unit");
        return fromAsec(unit.toArcseconds(value));
    }

    /**
     * Creates an angle from a value and unit symbol, e.g. {@code of(12, "deg")}.
     *
     * @throws com.questrail.units.api.InvalidPropertyException for an unknown symbol
     */
    public static Angle of(double value, String symbol) {
        return of(value, AngleUnit.forSymbol(symbol));
    }

    public static Angle fromDMS(double d, double m) {
        return fromDMS(d, m, 0, 0);
    }

    public static Angle fromDMS(double d, double m, double s) {
        return fromDMS(d, m, s, 0);
    }

    /**
     * Creates an angle from degree, arcminute and arcsecond components.
     *
     * <p>The first non-zero component sets the sign: {@code (0, -30, 0, 0)} is
     * minus thirty arcminutes, {@code (12, -34, 56, 0)} is positive.</p>
     *
     * @param d degree component
     * @param m arcminute component
     * @param s arcsecond component
     * @param f fractional arcsecond component, e.g. {@code 0.123}
     */
    public static Angle fromDMS(double d, double m, double s, double f) {
        return fromAsec(SexagesimalCodec.compose(d, m, s, f));
    }

    /**
     * Creates the angle swept by {@code time} within one day, 360 degrees being
     * the whole day.
     */
    public static Angle fromTime(Time time) {
        return fromTime(time, Time.fromDays(1));
    }

    /**
     * Creates the angle swept by {@code time} within {@code interval}, 360
     * degrees being the whole interval.
     */
    public static Angle fromTime(Time time, Time interval) {
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(interval, "interval");
        return fromAsec(time.sec() / interval.sec() * FULL_TURN_ASEC);
    }

    public static Angle pi() {
        return fromRad(Math.PI);
    }

    /**
     * The arc tangent of {@code y / x}, both in radians, in the quadrant given
     * by their signs.
     */
    public static Angle atan2(double y, double x) {
        return fromRad(Math.atan2(y, x));
    }

    public static Angle atan2(Angle y, Angle x) {
        return atan2(y.rad(), x.rad());
    }

    // -------------------------------------------------------------------------
    // Views
    // -------------------------------------------------------------------------

    /**
     * Arcseconds.
     */
    @Override
    public double scalar() {
        return asec;
    }

    @Override
    public TemplateDialect dialect() {
        return DIALECT;
    }

    public double to(AngleUnit unit) {
        return unit.fromArcseconds(asec);
    }

    public double deg() {
        return to(AngleUnit.DEGREES);
    }

    public double rad() {
        return to(AngleUnit.RADIANS);
    }

    public double amin() {
        return to(AngleUnit.ARCMINUTES);
    }

    public double asec() {
        return asec;
    }

    public double mas() {
        return to(AngleUnit.MILLIARCSECONDS);
    }

    /**
     * Integer degree component, without sign.
     */
    public long d() {
        return components().major();
    }

    /**
     * Integer arcminute component, without sign.
     */
    public long m() {
        return components().minor1();
    }

    /**
     * Integer arcsecond component, without sign.
     */
    public long s() {
        return components().minor2();
    }

    /**
     * Fractional arcsecond digits, empty when the fraction is zero.
     */
    public String f() {
        return components().fraction();
    }

    /**
     * Decomposes this angle at its rounding place.
     *
     * @throws NonFiniteValueException if this angle is NaN or infinite
     */
    public SexagesimalComponents components() {
        requireFinite();
        return SexagesimalCodec.decompose(asec, roundingPlace);
    }

    public int roundingPlace() {
        return roundingPlace;
    }

    /**
     * Returns a copy of this angle that decomposes at {@code place} decimals.
     */
    public Angle withRoundingPlace(int place) {
        Angle copy = new Angle(asec, place);
        copy.activeFormat = activeFormat;
        return copy;
    }

    // -------------------------------------------------------------------------
    // Arithmetic
    // -------------------------------------------------------------------------

    @Override
    public Angle add(Angle other) {
        return fromAsec(asec + other.asec);
    }

    @Override
    public Angle subtract(Angle other) {
        return fromAsec(asec - other.asec);
    }

    @Override
    public Angle negate() {
        return fromAsec(-asec);
    }

    /**
     * Multiplies the arcsecond scalars of both angles.
     */
    public Angle multiply(Angle other) {
        return fromAsec(asec * other.asec);
    }

    /**
     * Divides the arcsecond scalar of this angle by that of {@code other}.
     * Division by a zero angle yields an infinite or NaN angle.
     */
    public Angle divide(Angle other) {
        return fromAsec(asec / other.asec);
    }

    public Angle times(double factor) {
        return fromAsec(asec * factor);
    }

    public Angle dividedBy(double divisor) {
        return fromAsec(asec / divisor);
    }

    /**
     * Normalizes this angle to {@code [0, 360)} degrees.
     */
    public Angle normalize() {
        return normalize(0, 360);
    }

    /**
     * Reduces this angle modulo the interval width into
     * {@code [lowerDeg, upperDeg)}.
     *
     * <p>When the reduced value is exactly zero the result is {@code 0} for a
     * non-negative input, but {@code upperDeg} for a negative one: -360° in
     * {@code [0, 360)} normalizes to 360°.</p>
     *
     * @throws IllegalArgumentException if {@code upperDeg <= lowerDeg}
     */
    public Angle normalize(double lowerDeg, double upperDeg) {
        if (!(upperDeg > lowerDeg)) {
            throw new IllegalArgumentException(
                    "normalization interval is empty: [" + lowerDeg + ", " + upperDeg + ")");
        }

        final double lower = AngleUnit.DEGREES.toArcseconds(lowerDeg);
        final double width = AngleUnit.DEGREES.toArcseconds(upperDeg) - lower;

        double r = (asec - lower) % width;
        if (r < 0) {
            r += width;
        }
        if (r >= width) {
            r = 0;
        }

        double result = r + lower;
        if (result == 0) {
            result = asec < 0 ? AngleUnit.DEGREES.toArcseconds(upperDeg) : 0;
        }
        return fromAsec(result);
    }

    /**
     * The time that passes while this angle is swept at one turn per day.
     */
    public Time toTime() {
        return toTime(Time.fromDays(1));
    }

    /**
     * The proportion of {@code interval} this angle represents, 360 degrees
     * being the whole interval.
     */
    public Time toTime(Time interval) {
        Objects.requireNonNull(interval, "interval");
        return Time.fromSec(deg() / 360 * interval.sec());
    }

    // -------------------------------------------------------------------------
    // Formatting
    // -------------------------------------------------------------------------

    /**
     * Formats this angle with the standard engine and makes {@code template}
     * the active format.
     *
     * @param template format template, e.g. {@code +0d°0m'0s".3f}
     * @throws NonFiniteValueException if this angle is NaN or infinite
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
        if (!Double.isFinite(asec)) {
            throw new NonFiniteValueException("angle is not finite: " + asec + " arcseconds");
        }
    }

    // -------------------------------------------------------------------------
    // Object
    // -------------------------------------------------------------------------

    @Override
    public int compareTo(Angle other) {
        return Double.compare(asec, other.asec);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Angle that)) return false;
        return Double.compare(asec, that.asec) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(asec);
    }

    /**
     * Renders this angle in its active format.
     */
    @Override
    public String toString() {
        if (!Double.isFinite(asec)) {
            log.warn("Angle {} is not finite; skipping template '{}'", asec, activeFormat);
            return deg() + "°";
        }
        return format(activeFormat);
    }
}
