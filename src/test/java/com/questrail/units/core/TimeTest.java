package com.questrail.units.core;

import com.questrail.units.api.InvalidPropertyException;
import com.questrail.units.api.NonFiniteValueException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TimeTest
{
    private static final double EPS = 1e-9;

    @Test
    void fromHmsComposesComponents() {
        assertEquals(3661.1, Time.fromHMS(1, 1, 1, 0.1).scalar(), EPS);
        assertEquals(-1800, Time.fromHMS(0, -30).sec(), EPS);
        assertEquals(7200, Time.fromHMS(2, 0).sec(), EPS);
    }

    @Test
    void decimalViews() {
        Time day = Time.fromDays(1);
        assertEquals(86400, day.sec(), EPS);
        assertEquals(1440, day.min(), EPS);
        assertEquals(24, day.hours(), EPS);
        assertEquals(1.0 / 7, day.weeks(), EPS);
        assertEquals(365.25, Time.fromYears(1).days(), EPS);
        assertEquals(365, Time.fromYears(1, 365).days(), EPS);
        assertEquals(14, Time.fromWeeks(2).days(), EPS);
    }

    @Test
    void unitsBySymbol() {
        assertEquals(7200, Time.of(2, "hours").sec(), EPS);
        assertEquals(120, Time.of(2, DurationUnit.MINUTES).sec(), EPS);
        assertEquals(2, Time.fromHours(2).to(DurationUnit.HOURS), EPS);
        assertThrows(InvalidPropertyException.class, () -> Time.of(1, "fortnight"));
    }

    @Test
    void components() {
        Time t = Time.fromSec(28036.8);
        assertEquals(7, t.h());
        assertEquals(47, t.m());
        assertEquals(16, t.s());
        assertEquals("8", t.f());
    }

    @Test
    void arithmetic() {
        assertEquals(90, Time.fromHours(1).add(Time.fromMin(30)).min(), EPS);
        assertEquals(30, Time.fromHours(1).subtract(Time.fromMin(30)).min(), EPS);
        assertEquals(-60, Time.fromSec(60).negate().sec(), EPS);
        assertEquals(6, Time.fromSec(2).multiply(Time.fromSec(3)).sec(), EPS);
        assertEquals(2, Time.fromSec(6).divide(Time.fromSec(3)).sec(), EPS);
        assertEquals(3, Time.fromHours(1.5).times(2).hours(), EPS);
        assertEquals(0.75, Time.fromHours(1.5).dividedBy(2).hours(), EPS);
    }

    @Test
    void addingNegationGivesZero() {
        double[] seconds = { 0, 1, -1, 3661.1, -28036.8, 1e9 };
        for (double sec : seconds) {
            Time q = Time.fromSec(sec);
            assertEquals(0.0, q.add(q.negate()).scalar(), "q + -q for " + sec);
        }
    }

    @Test
    void unitConversionRoundTrips() {
        double[] seconds = { 0, 1e-3, 1, -59.5, 3661.1, 86400, -31557600, 1e10 };
        for (DurationUnit unit : DurationUnit.values()) {
            for (double sec : seconds) {
                Time t = Time.fromSec(sec);
                double back = Time.of(t.to(unit), unit).sec();
                assertEquals(sec, back, Math.abs(sec) * 1e-9, unit + " " + sec);
            }
        }
    }

    /**
     * Named views, continuous template letters and units all agree.
     */
    @Test
    void viewsMatchDurationUnits() {
        Time t = Time.fromDays(400.5);
        assertEquals(t.to(DurationUnit.MINUTES), t.min());
        assertEquals(t.to(DurationUnit.HOURS), t.hours());
        assertEquals(t.to(DurationUnit.DAYS), t.days());
        assertEquals(t.to(DurationUnit.WEEKS), t.weeks());
        assertEquals(t.to(DurationUnit.YEARS), t.years());
        assertEquals(t.years(), Time.DIALECT.continuousValue('Y', t.sec()));
        assertEquals(t.weeks(), Time.DIALECT.continuousValue('W', t.sec()));
        assertEquals(t.min(), Time.DIALECT.continuousValue('M', t.sec()));
    }

    @Test
    void angleConversion() {
        assertEquals(6, Time.fromAngle(Angle.fromDeg(90)).hours(), EPS);
        assertEquals(45, Time.fromAngle(Angle.fromDeg(270), Time.fromHours(1)).min(), EPS);
    }

    @Test
    void namedFormats() {
        Time t = Time.fromHMS(7, 47, 16, 0.8);
        assertEquals("07:47:16.8", t.toString());
        assertEquals("07ʰ47ᵐ16ˢ.8", t.format(Time.FORMAT_HMS));
        assertEquals("07ʰ47ᵐ16ˢ.8", t.toString());
        assertEquals("7h 47m 16.8s", t.format(Time.FORMAT_SPACED));
        assertEquals("86.4 sec", Time.fromSec(86.4).format(Time.FORMAT_SEC));
        assertEquals("2 weeks", Time.fromWeeks(2).format(Time.FORMAT_WEEKS));
        assertEquals("1 years", Time.fromYears(1).format(Time.FORMAT_YEARS));
    }

    @Test
    void wholeHoursDropFraction() {
        assertEquals("01:00:00", Time.fromHMS(1, 0, 0).format("0h:0m:0s.3f"));
        assertEquals("07:47:16.8", Time.fromDays(0.3245).toString());
    }

    @Test
    void equalityAndOrdering() {
        assertEquals(Time.fromMin(60), Time.fromHours(1));
        assertEquals(Time.fromMin(60).hashCode(), Time.fromHours(1).hashCode());
        assertTrue(Time.fromSec(1).compareTo(Time.fromSec(2)) < 0);
    }

    @Test
    void nonFiniteTime() {
        Time inf = Time.fromSec(Double.POSITIVE_INFINITY);
        assertThrows(NonFiniteValueException.class, () -> inf.format(Time.FORMAT_DEFAULT));
        assertEquals("Infinity s", inf.toString());
    }
}
