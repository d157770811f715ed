package com.questrail.units.core;

import com.questrail.units.api.InvalidPropertyException;
import com.questrail.units.api.Quantity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * A distance.
 *
 * <p>The length is held in metres as a {@link BigDecimal}, so conversions
 * between units whose factors differ by many orders of magnitude (picometres
 * to parsecs) keep their precision. Views in a unit are available as exact
 * decimals ({@link #toDecimal(DistanceUnit)}) or as doubles.</p>
 *
 * <p>Formatting uses printf-style templates, see {@link #format(String)}.</p>
 */
public final class Distance implements Quantity<Distance>, Comparable<Distance>
{
    private static final Logger log = LoggerFactory.getLogger(Distance.class);

    /**
     * Precision of every division performed on distances.
     */
    static final MathContext PRECISION = new MathContext(64, RoundingMode.HALF_EVEN);

    /**
     * Number spec of the default format; the creation unit is appended.
     */
    public static final String FORMAT_DEFAULT = "%3.3f ";

    private final BigDecimal meters;
    private volatile String activeFormat;

    private Distance(BigDecimal meters, DistanceUnit displayUnit) {
        this.meters = Objects.requireNonNull(meters, "meters");
        this.activeFormat = FORMAT_DEFAULT + displayUnit.symbol();
    }

    // -------------------------------------------------------------------------
    // Factories
    // -------------------------------------------------------------------------

    public static Distance of(BigDecimal value, DistanceUnit unit) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(unit, "unit");
        return new Distance(value.multiply(unit.meters()), unit);
    }

    public static Distance of(double value, DistanceUnit unit) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("distance must be finite (was " + value + ")");
        }
        return of(BigDecimal.valueOf(value), unit);
    }

    /**
     * Creates a distance from a decimal string, for values that need more
     * precision than a double carries.
     *
     * @throws IllegalArgumentException if {@code value} is not a decimal number
     */
    public static Distance of(String value, DistanceUnit unit) {
        Objects.requireNonNull(value, "value");
        try {
            return of(new BigDecimal(value.trim()), unit);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a decimal number: '" + value + "'", e);
        }
    }

    /**
     * @throws InvalidPropertyException for an unknown unit symbol
     */
    public static Distance of(double value, String symbol) {
        return of(value, DistanceUnit.forSymbol(symbol));
    }

    public static Distance of(BigDecimal value, String symbol) {
        return of(value, DistanceUnit.forSymbol(symbol));
    }

    public static Distance of(String value, String symbol) {
        return of(value, DistanceUnit.forSymbol(symbol));
    }

    public static Distance fromKm(double km) {
        return of(km, DistanceUnit.KILOMETERS);
    }

    public static Distance fromHm(double hm) {
        return of(hm, DistanceUnit.HECTOMETERS);
    }

    public static Distance fromDam(double dam) {
        return of(dam, DistanceUnit.DECAMETERS);
    }

    public static Distance fromMeters(double m) {
        return of(m, DistanceUnit.METERS);
    }

    public static Distance fromDm(double dm) {
        return of(dm, DistanceUnit.DECIMETERS);
    }

    public static Distance fromCm(double cm) {
        return of(cm, DistanceUnit.CENTIMETERS);
    }

    public static Distance fromMm(double mm) {
        return of(mm, DistanceUnit.MILLIMETERS);
    }

    public static Distance fromUm(double um) {
        return of(um, DistanceUnit.MICROMETERS);
    }

    public static Distance fromNm(double nm) {
        return of(nm, DistanceUnit.NANOMETERS);
    }

    public static Distance fromPm(double pm) {
        return of(pm, DistanceUnit.PICOMETERS);
    }

    public static Distance fromMi(double mi) {
        return of(mi, DistanceUnit.MILES);
    }

    public static Distance fromYd(double yd) {
        return of(yd, DistanceUnit.YARDS);
    }

    public static Distance fromFt(double ft) {
        return of(ft, DistanceUnit.FEET);
    }

    public static Distance fromIn(double in) {
        return of(in, DistanceUnit.INCHES);
    }

    public static Distance fromAu(double au) {
        return of(au, DistanceUnit.ASTRONOMICAL_UNITS);
    }

    public static Distance fromLy(double ly) {
        return of(ly, DistanceUnit.LIGHT_YEARS);
    }

    public static Distance fromPc(double pc) {
        return of(pc, DistanceUnit.PARSECS);
    }

    /**
     * The distance of a star whose annual parallax is {@code parallax}:
     * one parsec over the parallax in arcseconds.
     *
     * @throws IllegalArgumentException if the parallax is zero or not finite
     */
    public static Distance fromParallax(Angle parallax) {
        Objects.requireNonNull(parallax, "parallax");
        double asec = parallax.asec();
        if (asec == 0 || !Double.isFinite(asec)) {
            throw new IllegalArgumentException("parallax must be finite and non-zero (was " + asec + "\")");
        }
        BigDecimal parsecs = BigDecimal.ONE.divide(BigDecimal.valueOf(asec), PRECISION);
        return of(parsecs, DistanceUnit.PARSECS);
    }

    // -------------------------------------------------------------------------
    // Views
    // -------------------------------------------------------------------------

    /**
     * Metres.
     */
    @Override
    public double scalar() {
        return meters.doubleValue();
    }

    /**
     * This distance in {@code unit}, exact to {@link #PRECISION}, trailing
     * zeros removed.
     */
    public BigDecimal toDecimal(DistanceUnit unit) {
        Objects.requireNonNull(unit, "unit");
        return meters.divide(unit.meters(), PRECISION).stripTrailingZeros();
    }

    public double to(DistanceUnit unit) {
        return toDecimal(unit).doubleValue();
    }

    /**
     * @throws InvalidPropertyException for an unknown unit symbol
     */
    public double to(String symbol) {
        return to(DistanceUnit.forSymbol(symbol));
    }

    public BigDecimal meters() {
        return meters;
    }

    public double km() {
        return to(DistanceUnit.KILOMETERS);
    }

    public double m() {
        return scalar();
    }

    public double cm() {
        return to(DistanceUnit.CENTIMETERS);
    }

    public double mm() {
        return to(DistanceUnit.MILLIMETERS);
    }

    public double mi() {
        return to(DistanceUnit.MILES);
    }

    public double yd() {
        return to(DistanceUnit.YARDS);
    }

    public double ft() {
        return to(DistanceUnit.FEET);
    }

    public double in() {
        return to(DistanceUnit.INCHES);
    }

    public double au() {
        return to(DistanceUnit.ASTRONOMICAL_UNITS);
    }

    public double ly() {
        return to(DistanceUnit.LIGHT_YEARS);
    }

    public double pc() {
        return to(DistanceUnit.PARSECS);
    }

    /**
     * The annual parallax of a star at this distance.
     */
    public Angle toParallax() {
        return Angle.fromAsec(1 / pc());
    }

    // -------------------------------------------------------------------------
    // Arithmetic
    // -------------------------------------------------------------------------

    @Override
    public Distance add(Distance other) {
        return new Distance(meters.add(other.meters), DistanceUnit.METERS);
    }

    @Override
    public Distance subtract(Distance other) {
        return new Distance(meters.subtract(other.meters), DistanceUnit.METERS);
    }

    @Override
    public Distance negate() {
        return new Distance(meters.negate(), DistanceUnit.METERS);
    }

    // -------------------------------------------------------------------------
    // Formatting
    // -------------------------------------------------------------------------

    /**
     * Formats this distance with a printf-style template such as
     * {@code %3.3f km} and makes it the active format.
     *
     * <p>A template that is only a unit symbol ({@code "au"}) reuses the number
     * spec of the active format.</p>
     *
     * @throws InvalidPropertyException if the template names an unknown unit
     */
    public String format(String template) {
        Objects.requireNonNull(template, "template");

        NumberTemplates.Parsed parsed = NumberTemplates.parse(template).orElse(null);
        if (parsed == null) {
            NumberTemplates.Parsed previous = NumberTemplates.parse(activeFormat)
                    .orElseThrow(() -> new IllegalStateException("active format is not a number template"));
            String spacing = previous.spacing().isEmpty() ? " " : previous.spacing();
            log.debug("'{}' has no number spec; reusing '{}'", template, previous.numberSpec());
            parsed = new NumberTemplates.Parsed(previous.numberSpec(), spacing, template.trim());
        }

        DistanceUnit unit = DistanceUnit.forSymbol(parsed.unit().trim());
        String rendered = NumberTemplates.number(parsed.numberSpec(), to(unit)) + parsed.spacing() + parsed.unit();
        activeFormat = parsed.template();
        return rendered;
    }

    public String activeFormat() {
        return activeFormat;
    }

    // -------------------------------------------------------------------------
    // Object
    // -------------------------------------------------------------------------

    @Override
    public int compareTo(Distance other) {
        return meters.compareTo(other.meters);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Distance that)) return false;
        return meters.compareTo(that.meters) == 0;
    }

    @Override
    public int hashCode() {
        return meters.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return format(activeFormat);
    }
}
