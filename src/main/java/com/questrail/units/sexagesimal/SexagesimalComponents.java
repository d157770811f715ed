package com.questrail.units.sexagesimal;

import com.questrail.units.api.Sign;

import java.util.Objects;

/**
 * SexagesimalComponents
 * -----------------------------------------------------------------------------
 * The decomposed form of a signed scalar: one major unit, two nested base-60
 * minor units and the decimal digits below the second minor unit.
 *
 * <p>For angles the components are degrees, arcminutes and arcseconds; for
 * time they are hours, minutes and seconds.</p>
 *
 * <h2>Sign</h2>
 * <p>The integer components are always non-negative magnitudes. The sign of
 * the decomposed scalar is carried separately in {@link #sign()}.</p>
 *
 * <h2>Fraction</h2>
 * <p>{@link #fraction()} holds the digits after the decimal point of the
 * second minor unit, trailing zeros removed. An empty string means the
 * fraction is exactly zero at the rounding place used, never "unknown".</p>
 */
public record SexagesimalComponents(
        Sign sign,
        long major,
        long minor1,
        long minor2,
        String fraction
) {
    public SexagesimalComponents {
        Objects.requireNonNull(sign, "sign");
        Objects.requireNonNull(fraction, "fraction");
        if (major < 0 || minor1 < 0 || minor2 < 0) {
            throw new IllegalArgumentException("components must be non-negative magnitudes");
        }
    }

    /**
     * Returns true if no non-zero digit remains below the second minor unit.
     */
    public boolean isWholeMinor2() {
        return fraction.isEmpty();
    }
}
