package com.questrail.units.sexagesimal;

import com.questrail.units.api.Sign;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * SexagesimalCodec
 * -----------------------------------------------------------------------------
 * Converts between a signed decimal scalar (arcseconds or seconds) and its
 * sexagesimal components.
 *
 * <p>Angles (degree, arcminute, arcsecond) and time (hour, minute, second) use
 * the same nesting: 3600 second units per major unit, 60 per first minor unit.
 * This codec is therefore unit-agnostic.</p>
 *
 * <pre>
 *   scalar  ── decompose(scalar, place) ──▶  (sign, major, minor1, minor2, fraction)
 *   (major, minor1, minor2, fraction)  ── compose ──▶  scalar
 * </pre>
 */
public final class SexagesimalCodec
{
    private static final Logger log = LoggerFactory.getLogger(SexagesimalCodec.class);

    /**
     * Second units in one major unit.
     */
    public static final long PER_MAJOR = 3600;

    /**
     * Second units in one first-minor unit.
     */
    public static final long PER_MINOR1 = 60;

    private static final BigInteger BIG_PER_MAJOR = BigInteger.valueOf(PER_MAJOR);
    private static final BigInteger BIG_PER_MINOR1 = BigInteger.valueOf(PER_MINOR1);

    private SexagesimalCodec() {}

    /**
     * Decomposes a scalar into its components.
     *
     * <p>The scalar is rounded half away from zero to {@code roundPlace}
     * decimals first, so the integer components and the fraction digits are
     * taken from the same rounded value (59.9999999999 at place 9 becomes one
     * whole minute, not 59 seconds and an empty fraction).</p>
     *
     * @param scalar     the scalar to decompose; must be finite
     * @param roundPlace number of decimal places kept, {@code >= 0}
     * @return the components; integer parts non-negative, sign separate
     * @throws IllegalArgumentException if {@code roundPlace} is negative, the
     *                                  scalar is not finite, or its major
     *                                  component does not fit in a {@code long}
     */
    public static SexagesimalComponents decompose(double scalar, int roundPlace)
    {
        if (roundPlace < 0) {
            throw new IllegalArgumentException("roundPlace must be >= 0 (was " + roundPlace + ")");
        }
        if (!Double.isFinite(scalar)) {
            throw new IllegalArgumentException("cannot decompose non-finite scalar " + scalar);
        }

        final BigDecimal rounded = BigDecimal.valueOf(scalar).setScale(roundPlace, RoundingMode.HALF_UP);
        final BigDecimal magnitude = rounded.abs();
        final BigInteger[] majorAndRest = magnitude.toBigInteger().divideAndRemainder(BIG_PER_MAJOR);
        final BigInteger[] minors = majorAndRest[1].divideAndRemainder(BIG_PER_MINOR1);

        final long major;
        try {
            major = majorAndRest[0].longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("scalar " + scalar + " has more major units than a long holds", e);
        }

        return new SexagesimalComponents(
                Sign.of(scalar),
                major,
                minors[0].longValue(),
                minors[1].longValue(),
                fractionDigits(magnitude));
    }

    /**
     * Composes components into a scalar.
     *
     * <p>Each component may carry its own sign. The first non-zero component,
     * scanning major, minor1, minor2, fraction, decides the sign of the
     * result; the magnitudes of all components are then summed. This lets a
     * caller write {@code (0, 0, -5, 0)} for minus five second units.</p>
     *
     * <p>The major and first minor components are truncated to integers. When
     * a non-zero fraction is given, the second minor is truncated as well and
     * the fraction supplies the sub-unit part.</p>
     *
     * <p>A fraction whose magnitude is 1 or more is read as the digits of a
     * decimal fraction: {@code 1234} becomes {@code 0.1234}.</p>
     *
     * <p>NaN and infinite inputs are not guarded and propagate into the
     * result.</p>
     */
    public static double compose(double major, double minor1, double minor2, double fraction)
    {
        final Sign sign = signOf(major, minor1, minor2, fraction);

        final double m0 = truncate(major);
        final double m1 = truncate(minor1);
        double m2 = minor2;
        double f = fraction;

        if (f != 0) {
            m2 = truncate(m2);
            if (Math.abs(f) >= 1 && Double.isFinite(f)) {
                f = asDecimalDigits(f);
            }
        }

        final double magnitude = Math.abs(m0) * PER_MAJOR
                + Math.abs(m1) * PER_MINOR1
                + Math.abs(m2)
                + Math.abs(f);

        return sign.apply(magnitude);
    }

    /**
     * Finds the sign of a set of components: the sign of the first non-zero
     * component, or {@link Sign#POSITIVE} when all are zero.
     */
    public static Sign signOf(double major, double minor1, double minor2, double fraction)
    {
        for (double component : new double[] { major, minor1, minor2, fraction }) {
            if (component != 0) {
                return Sign.of(component);
            }
        }
        return Sign.POSITIVE;
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private static String fractionDigits(BigDecimal magnitude)
    {
        // setScale() guarantees a plain representation with exactly
        // roundPlace digits after the point (none when roundPlace == 0).
        final String plain = magnitude.toPlainString();
        final int point = plain.indexOf('.');
        if (point < 0) {
            return "";
        }

        int end = plain.length();
        while (end > point + 1 && plain.charAt(end - 1) == '0') {
            end--;
        }
        return plain.substring(point + 1, end);
    }

    private static double truncate(double value)
    {
        return value < 0 ? Math.ceil(value) : Math.floor(value);
    }

    private static double asDecimalDigits(double fraction)
    {
        final long digits = (long) Math.abs(fraction);
        final double reinterpreted = Double.parseDouble("0." + digits);

        log.debug("Fraction {} given as whole digits; reading it as {}", fraction, reinterpreted);

        return fraction < 0 ? -reinterpreted : reinterpreted;
    }
}
