package com.questrail.units.core;

import com.questrail.units.api.InvalidPropertyException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class VelocityTest
{
    private static final double EPS = 1e-9;

    @Test
    void conversions() {
        assertEquals(53.6448, Velocity.fromMph(120).ms(), EPS);
        assertEquals(0.115741, Velocity.fromKmd(10).ms(), 1e-6);
        assertEquals(149597870.7, Velocity.fromAud(1).kmd(), 1e-3);
        assertEquals(36, Velocity.fromMs(10).kmh(), EPS);
        assertEquals(0.3048, Velocity.fromFts(1).ms(), EPS);
        assertEquals(1, Velocity.fromPcy(1).pcy(), 1e-12);
        assertEquals(299792.458, Velocity.c().kms(), 1e-6);
    }

    @Test
    void unitStrings() {
        assertEquals(Velocity.fromKms(1), Velocity.of(1, "km/s"));
        assertEquals(3.6, Velocity.fromMs(1).to("km/h"), EPS);
        assertEquals(VelocityUnit.MILES_PER_HOUR, VelocityUnit.parse("mph"));
        assertThrows(InvalidPropertyException.class, () -> Velocity.of(1, "km/s/h"));
        assertThrows(InvalidPropertyException.class, () -> Velocity.of(1, "km"));
        assertThrows(InvalidPropertyException.class, () -> Velocity.of(1, "furlong/s"));
        assertThrows(InvalidPropertyException.class, () -> Velocity.of(1, "km/fortnight"));
    }

    @Test
    void travelTimeAndDistance() {
        Velocity v = Velocity.fromMph(70);
        assertEquals(8.5714285714, v.timeFor(Distance.fromMi(600)).hours(), 1e-9);
        assertEquals(35, v.distanceIn(Time.fromMin(30)).mi(), EPS);
    }

    /**
     * Operands over different time bases are summed as rates, not as raw
     * distances.
     */
    @Test
    void additionRebasesOntoReceiverTime() {
        Velocity sum = Velocity.fromKmh(36).add(Velocity.fromMs(5));
        assertEquals(15, sum.ms(), EPS);
        assertEquals(3600, sum.time().sec(), EPS);
        assertEquals(5, Velocity.fromKmh(36).subtract(Velocity.fromMs(5)).ms(), EPS);
        assertEquals(-10, Velocity.fromMs(10).negate().ms(), EPS);
    }

    @Test
    void distanceOverTime() {
        assertEquals(5, new Velocity(Distance.fromMeters(10), Time.fromSec(2)).ms(), EPS);
        assertEquals(5, new Velocity(Distance.fromMeters(10), Time.fromSec(-2)).ms(), EPS);
        assertEquals(2, new Velocity(Distance.fromMeters(10), Time.fromSec(2))
                .withTime(Time.fromSec(5)).ms(), EPS);
        assertEquals(10, Velocity.fromMs(5).withDistance(Distance.fromMeters(10)).ms(), EPS);
        assertThrows(IllegalArgumentException.class,
                () -> new Velocity(Distance.fromMeters(10), Time.fromSec(0)));
    }

    @Test
    void equalityAcrossUnits() {
        assertEquals(Velocity.fromKmh(3.6), Velocity.fromMs(1));
        assertTrue(Velocity.fromMs(2).compareTo(Velocity.fromMs(1)) > 0);
    }

    @Test
    void formatting() {
        Velocity v = Velocity.fromMph(60);
        assertEquals("60.000 mph", v.toString());
        assertEquals("96.6 km/h", v.format("%1.1f km/h"));
        assertEquals("96.6 km/h", v.toString());
        assertEquals("26.8 m/s", v.format("m/s"));
        assertThrows(InvalidPropertyException.class, () -> v.format("%1.1f km/fortnight"));
    }
}
