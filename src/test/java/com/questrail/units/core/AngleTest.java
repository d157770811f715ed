package com.questrail.units.core;

import com.questrail.units.api.InvalidPropertyException;
import com.questrail.units.api.NonFiniteValueException;
import com.questrail.units.api.Sign;
import com.questrail.units.sexagesimal.SexagesimalComponents;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AngleTest
{
    private static final double EPS = 1e-9;

    // ---------------------------------------------------------------------
    // Construction and views
    // ---------------------------------------------------------------------

    @Test
    void fromDmsTakesSignFromFirstNonZeroComponent() {
        assertEquals(12.5822565, Angle.fromDMS(12, -34, 56, 0.1234).deg(), EPS);
        assertEquals(-0.5, Angle.fromDMS(0, -30).deg(), EPS);
        assertEquals(-5, Angle.fromDMS(0, 0, -5).asec(), EPS);
    }

    @Test
    void unitViewsShareOneScalar() {
        Angle a = Angle.fromDeg(1);
        assertEquals(3600, a.asec(), EPS);
        assertEquals(60, a.amin(), EPS);
        assertEquals(3_600_000, a.mas(), 1e-6);
        assertEquals(Math.PI / 180, a.rad(), 1e-15);
        assertEquals(3600, a.scalar(), EPS);
    }

    @Test
    void unitConversionRoundTrips() {
        double[] degrees = { 0, 1e-6, 0.5, -12.5822565, 90, 359.999, -720, 1e5 };
        for (AngleUnit unit : AngleUnit.values()) {
            for (double deg : degrees) {
                Angle a = Angle.fromDeg(deg);
                double back = Angle.of(a.to(unit), unit).asec();
                assertEquals(a.asec(), back, Math.abs(a.asec()) * 1e-9, unit + " " + deg);
            }
        }
    }

    @Test
    void factoriesBySymbol() {
        assertEquals(Angle.fromRad(1), Angle.of(1, "rad"));
        assertEquals(Angle.fromMas(5), Angle.of(5, AngleUnit.MILLIARCSECONDS));
        assertThrows(InvalidPropertyException.class, () -> Angle.of(1, "grad"));
    }

    @Test
    void piAndAtan2() {
        assertEquals(180, Angle.pi().deg(), EPS);
        assertEquals(45, Angle.atan2(1, 1).deg(), EPS);
        assertEquals(135, Angle.atan2(Angle.fromRad(1), Angle.fromRad(-1)).deg(), EPS);
    }

    @Test
    void componentsAreUnsignedWithSeparateSign() {
        Angle a = Angle.fromDMS(-12, 34, 56, 0.5);
        SexagesimalComponents c = a.components();

        assertEquals(Sign.NEGATIVE, c.sign());
        assertEquals(Sign.NEGATIVE, a.sign());
        assertEquals(12, a.d());
        assertEquals(34, a.m());
        assertEquals(56, a.s());
        assertEquals("5", a.f());
    }

    @Test
    void roundingPlaceControlsFractionDigits() {
        Angle a = Angle.fromAsec(1.234).withRoundingPlace(2);
        assertEquals(2, a.roundingPlace());
        assertEquals("23", a.f());
        assertThrows(IllegalArgumentException.class, () -> a.withRoundingPlace(-1));
    }

    // ---------------------------------------------------------------------
    // Arithmetic
    // ---------------------------------------------------------------------

    @Test
    void arithmeticActsOnArcseconds() {
        Angle two = Angle.fromAsec(2);
        Angle three = Angle.fromAsec(3);

        assertEquals(5, two.add(three).asec(), EPS);
        assertEquals(-1, two.subtract(three).asec(), EPS);
        assertEquals(-2, two.negate().asec(), EPS);
        assertEquals(6, two.multiply(three).asec(), EPS);
        assertEquals(1.5, three.divide(two).asec(), EPS);
        assertEquals(20, Angle.fromDeg(10).times(2).deg(), EPS);
        assertEquals(5, Angle.fromDeg(10).dividedBy(2).deg(), EPS);
    }

    @Test
    void addingNegationGivesZero() {
        double[] degrees = { 0, 1, -1, 12.5822565, -359.999, 1e6, Math.PI };
        for (double deg : degrees) {
            Angle q = Angle.fromDeg(deg);
            assertEquals(0.0, q.add(q.negate()).scalar(), "q + -q for " + deg);
        }
    }

    @Test
    void divisionByZeroAngleIsNotFinite() {
        assertTrue(Double.isInfinite(Angle.fromAsec(1).divide(Angle.fromAsec(0)).asec()));
    }

    // ---------------------------------------------------------------------
    // Normalization
    // ---------------------------------------------------------------------

    @Test
    void normalizeIntoDefaultInterval() {
        assertEquals(10, Angle.fromDeg(370).normalize(0, 360).deg(), EPS);
        assertEquals(270, Angle.fromDeg(-90).normalize().deg(), EPS);
        assertEquals(0, Angle.fromDeg(0).normalize().deg(), EPS);
        assertEquals(0, Angle.fromDeg(720).normalize().deg(), EPS);
    }

    @Test
    void normalizeIntoCustomIntervals() {
        assertEquals(120, Angle.fromDeg(480).normalize(0, 360).deg(), EPS);
        assertEquals(140, Angle.fromDeg(500).normalize(0, 180).deg(), EPS);
        assertEquals(-170, Angle.fromDeg(190).normalize(-180, 180).deg(), EPS);
    }

    /**
     * A negative exact multiple of the interval width lands on the upper
     * bound rather than zero.
     */
    @Test
    void negativeMultipleOfWidthMapsToUpperBound() {
        assertEquals(360, Angle.fromDeg(-360).normalize(0, 360).deg(), EPS);
    }

    @Test
    void normalizeIsIdempotent() {
        double[] degrees = { 0, 10, 350, 359.5, 370, 725.5, -10, -359.5, -370, 1e4 + 0.25, -1e4 - 0.25 };
        for (double deg : degrees) {
            Angle once = Angle.fromDeg(deg).normalize();
            assertEquals(once.deg(), once.normalize().deg(), EPS, "normalize twice " + deg);
            assertTrue(once.deg() >= 0 && once.deg() < 360, "in [0, 360): " + deg);

            Angle signed = Angle.fromDeg(deg).normalize(-180, 180);
            assertEquals(signed.deg(), signed.normalize(-180, 180).deg(), EPS, "signed twice " + deg);
        }
    }

    /**
     * The one exception to idempotence: a negative exact multiple of the
     * width goes to the upper bound, which then reduces to the lower bound.
     */
    @Test
    void negativeMultipleIsNotIdempotent() {
        Angle once = Angle.fromDeg(-720).normalize();
        assertEquals(360, once.deg(), EPS);
        assertEquals(0, once.normalize().deg(), EPS);
    }

    @Test
    void emptyIntervalIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Angle.fromDeg(1).normalize(10, 10));
        assertThrows(IllegalArgumentException.class, () -> Angle.fromDeg(1).normalize(20, 10));
    }

    // ---------------------------------------------------------------------
    // Time
    // ---------------------------------------------------------------------

    @Test
    void angleTimeConversions() {
        assertEquals(90, Angle.fromTime(Time.fromSec(21600)).deg(), EPS);
        assertEquals(270, Angle.fromTime(Time.fromSec(2700), Time.fromHours(1)).deg(), EPS);
        assertEquals(21600, Angle.fromDeg(90).toTime().sec(), EPS);
        assertEquals(30, Angle.fromDeg(180).toTime(Time.fromMin(60)).min(), EPS);
    }

    // ---------------------------------------------------------------------
    // Formatting and identity
    // ---------------------------------------------------------------------

    @Test
    void defaultToStringUsesDefaultFormat() {
        assertEquals("+012°34'56\".123", Angle.fromDMS(12, 34, 56, 0.123).toString());
    }

    @Test
    void formatBecomesActiveFormat() {
        Angle a = Angle.fromDeg(1.5);
        assertEquals("1.5", a.format("1D"));
        assertEquals("1D", a.activeFormat());
        assertEquals("1.5", a.toString());
        assertEquals("1°30'", a.format("d°m'"));
    }

    @Test
    void equalityIgnoresActiveFormat() {
        Angle a = Angle.fromDeg(10);
        Angle b = Angle.fromDeg(10);
        b.format(Angle.FORMAT_DECIMAL);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(0, a.compareTo(b));
        assertTrue(Angle.fromDeg(1).compareTo(Angle.fromDeg(2)) < 0);
    }

    @Test
    void hugeAnglesFormatWithoutWrapping() {
        assertEquals("27777777777777777 46 40", Angle.fromAsec(1e20).format("d m s"));
        assertThrows(IllegalArgumentException.class, () -> Angle.fromAsec(1e300).format("d m s"));
    }

    @Test
    void nonFiniteAnglesCannotBeFormatted() {
        Angle nan = Angle.fromDeg(Double.NaN);
        assertThrows(NonFiniteValueException.class, () -> nan.format(Angle.FORMAT_DEFAULT));
        assertThrows(NonFiniteValueException.class, nan::components);
        assertEquals("NaN°", nan.toString());
    }
}
