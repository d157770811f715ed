package com.questrail.units.core;

import com.questrail.units.api.Quantity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A velocity, held as the distance travelled during a (positive) time.
 *
 * <p>The canonical scalar is metres per second. Any other
 * {@link VelocityUnit} view divides the distance in that unit's distance unit
 * by the time in its time unit, in decimal arithmetic.</p>
 */
public final class Velocity implements Quantity<Velocity>, Comparable<Velocity>
{
    private static final Logger log = LoggerFactory.getLogger(Velocity.class);

    /**
     * Number spec of the default format; the creation unit is appended.
     */
    public static final String FORMAT_DEFAULT = "%1.3f ";

    /**
     * Speed of light in a vacuum, m/s.
     */
    public static final double SPEED_OF_LIGHT = 299792458;

    private final Distance distance;
    private final Time time;
    private volatile String activeFormat;

    /**
     * Creates the velocity of covering {@code distance} in {@code time}. A
     * negative time is taken by magnitude.
     *
     * @throws IllegalArgumentException if the time is zero or not finite
     */
    public Velocity(Distance distance, Time time) {
        this(distance, time, VelocityUnit.METERS_PER_SECOND);
    }

    private Velocity(Distance distance, Time time, VelocityUnit displayUnit) {
        Objects.requireNonNull(distance, "distance");
        Objects.requireNonNull(time, "time");
        if (time.sec() == 0 || !Double.isFinite(time.sec())) {
            throw new IllegalArgumentException("velocity time must be finite and non-zero (was " + time.sec() + " s)");
        }
        this.distance = distance;
        this.time = time.sec() < 0 ? time.negate() : time;
        this.activeFormat = FORMAT_DEFAULT + displayUnit.symbol();
    }

    // -------------------------------------------------------------------------
    // Factories
    // -------------------------------------------------------------------------

    public static Velocity of(double value, VelocityUnit unit) {
        Objects.requireNonNull(unit, "unit");
        return new Velocity(Distance.of(value, unit.distanceUnit()), Time.of(1, unit.durationUnit()), unit);
    }

    /**
     * @throws com.questrail.units.api.InvalidPropertyException for an unknown unit
     */
    public static Velocity of(double value, String units) {
        return of(value, VelocityUnit.parse(units));
    }

    public static Velocity fromMs(double ms) {
        return of(ms, VelocityUnit.METERS_PER_SECOND);
    }

    public static Velocity fromKms(double kms) {
        return of(kms, VelocityUnit.KILOMETERS_PER_SECOND);
    }

    public static Velocity fromKmh(double kmh) {
        return of(kmh, VelocityUnit.KILOMETERS_PER_HOUR);
    }

    public static Velocity fromKmd(double kmd) {
        return of(kmd, VelocityUnit.KILOMETERS_PER_DAY);
    }

    public static Velocity fromFts(double fts) {
        return of(fts, VelocityUnit.FEET_PER_SECOND);
    }

    public static Velocity fromAud(double aud) {
        return of(aud, VelocityUnit.AU_PER_DAY);
    }

    public static Velocity fromPcy(double pcy) {
        return of(pcy, VelocityUnit.PARSECS_PER_YEAR);
    }

    public static Velocity fromMph(double mph) {
        return of(mph, VelocityUnit.MILES_PER_HOUR);
    }

    /**
     * The speed of light in a vacuum.
     */
    public static Velocity c() {
        return fromMs(SPEED_OF_LIGHT);
    }

    // -------------------------------------------------------------------------
    // Views
    // -------------------------------------------------------------------------

    /**
     * Metres per second.
     */
    @Override
    public double scalar() {
        return to(VelocityUnit.METERS_PER_SECOND);
    }

    public BigDecimal toDecimal(VelocityUnit unit) {
        Objects.requireNonNull(unit, "unit");
        BigDecimal d = distance.toDecimal(unit.distanceUnit());
        BigDecimal t = BigDecimal.valueOf(time.to(unit.durationUnit()));
        return d.divide(t, Distance.PRECISION).stripTrailingZeros();
    }

    /**
     * @throws com.questrail.units.api.InvalidPropertyException for an unknown unit
     */
    public BigDecimal toDecimal(String units) {
        return toDecimal(VelocityUnit.parse(units));
    }

    public double to(VelocityUnit unit) {
        return toDecimal(unit).doubleValue();
    }

    /**
     * @throws com.questrail.units.api.InvalidPropertyException for an unknown unit
     */
    public double to(String units) {
        return to(VelocityUnit.parse(units));
    }

    public double ms() {
        return scalar();
    }

    public double kms() {
        return to(VelocityUnit.KILOMETERS_PER_SECOND);
    }

    public double kmh() {
        return to(VelocityUnit.KILOMETERS_PER_HOUR);
    }

    public double kmd() {
        return to(VelocityUnit.KILOMETERS_PER_DAY);
    }

    public double fts() {
        return to(VelocityUnit.FEET_PER_SECOND);
    }

    public double aud() {
        return to(VelocityUnit.AU_PER_DAY);
    }

    public double pcy() {
        return to(VelocityUnit.PARSECS_PER_YEAR);
    }

    public double mph() {
        return to(VelocityUnit.MILES_PER_HOUR);
    }

    public Distance distance() {
        return distance;
    }

    public Time time() {
        return time;
    }

    public Velocity withDistance(Distance distance) {
        return new Velocity(distance, time);
    }

    public Velocity withTime(Time time) {
        return new Velocity(distance, time);
    }

    // -------------------------------------------------------------------------
    // Arithmetic
    // -------------------------------------------------------------------------

    /**
     * Sums two velocities. {@code other} is first expressed over this
     * velocity's time so that the distances can be added.
     */
    @Override
    public Velocity add(Velocity other) {
        return new Velocity(distance.add(other.distanceOver(time)), time);
    }

    @Override
    public Velocity subtract(Velocity other) {
        return new Velocity(distance.subtract(other.distanceOver(time)), time);
    }

    @Override
    public Velocity negate() {
        return new Velocity(distance.negate(), time);
    }

    /**
     * The time needed to cover {@code distance} at this velocity.
     */
    public Time timeFor(Distance distance) {
        Objects.requireNonNull(distance, "distance");
        return Time.fromSec(distance.scalar() / this.distance.scalar() * time.sec());
    }

    /**
     * The distance covered in {@code time} at this velocity.
     */
    public Distance distanceIn(Time time) {
        Objects.requireNonNull(time, "time");
        return Distance.fromMeters(distance.scalar() * time.sec() / this.time.sec());
    }

    private Distance distanceOver(Time other) {
        BigDecimal ms = toDecimal(VelocityUnit.METERS_PER_SECOND);
        return Distance.of(ms.multiply(BigDecimal.valueOf(other.sec())), DistanceUnit.METERS);
    }

    // -------------------------------------------------------------------------
    // Formatting
    // -------------------------------------------------------------------------

    /**
     * Formats this velocity with a printf-style template such as
     * {@code %1.3f mph} and makes it the active format. A template that is
     * only a unit reuses the number spec of the active format.
     *
     * @throws com.questrail.units.api.InvalidPropertyException if the template
     *         names an unknown unit
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

        VelocityUnit unit = VelocityUnit.parse(parsed.unit());
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
    public int compareTo(Velocity other) {
        return toDecimal(VelocityUnit.METERS_PER_SECOND).compareTo(other.toDecimal(VelocityUnit.METERS_PER_SECOND));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Velocity that)) return false;
        return compareTo(that) == 0;
    }

    @Override
    public int hashCode() {
        return toDecimal(VelocityUnit.METERS_PER_SECOND).hashCode();
    }

    @Override
    public String toString() {
        return format(activeFormat);
    }
}
