package com.questrail.units.format;

import com.questrail.units.core.Angle;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FormatOptionsTest
{
    @Test
    void defaultsRoundAtNinePlacesWithoutPadding() {
        FormatOptions options = FormatOptions.defaults();
        assertEquals(FormatOptions.DEFAULT_ROUNDING_PLACE, options.defaultRoundingPlace());
        assertEquals(9, options.defaultRoundingPlace());
        assertFalse(options.padFractions());
    }

    @Test
    void builderOverridesEachField() {
        FormatOptions options = FormatOptions.builder()
                .withDefaultRoundingPlace(4)
                .withPadFractions(true)
                .build();

        assertEquals(4, options.defaultRoundingPlace());
        assertTrue(options.padFractions());
    }

    @Test
    void negativeRoundingPlaceIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> FormatOptions.builder().withDefaultRoundingPlace(-1).build());
    }

    @Test
    void dialectRejectsUnknownContinuousLetter() {
        assertThrows(IllegalArgumentException.class, () -> Angle.DIALECT.continuousValue('Q', 1));
        assertEquals(1.0, Angle.DIALECT.continuousValue('D', 3600), 1e-12);
    }
}
