package com.questrail.units.format;

/**
 * Configuration for a {@link FormatEngine}.
 *
 * <ul>
 *   <li><b>defaultRoundingPlace</b> — decimal place used to decompose the scalar
 *       when a template has no {@code Nf} token. Defaults to 9.</li>
 *   <li><b>padFractions</b> — when true, {@code Nf} is right-padded with zeros
 *       to exactly N digits and a zero fraction is rendered instead of being
 *       removed. Defaults to false.</li>
 * </ul>
 */
public record FormatOptions(
    int defaultRoundingPlace,
    boolean padFractions
) {
    /**
     * Rounding place applied when nothing else asks for one.
     */
    public static final int DEFAULT_ROUNDING_PLACE = 9;

    public FormatOptions {
        if (defaultRoundingPlace < 0) {
            throw new IllegalArgumentException("defaultRoundingPlace must be non-negative");
        }
    }

    public static FormatOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int defaultRoundingPlace = DEFAULT_ROUNDING_PLACE;
        private boolean padFractions = false;

        public Builder withDefaultRoundingPlace(int defaultRoundingPlace) {
            this.defaultRoundingPlace = defaultRoundingPlace;
            return this;
        }

        public Builder withPadFractions(boolean padFractions) {
            this.padFractions = padFractions;
            return this;
        }

        public FormatOptions build() {
            return new FormatOptions(defaultRoundingPlace, padFractions);
        }
    }
}
