package com.questrail.units.format.impl;

import java.util.Objects;

/**
 * One piece of a tokenized format template.
 *
 * <p>A template is split once into a sequence of segments; rendering then
 * walks that sequence and substitutes each placeholder exactly once. Values
 * inserted for one placeholder are never re-scanned, so a rendered number can
 * not be mistaken for another token.</p>
 */
sealed interface TemplateSegment
        permits TemplateSegment.Literal,
                TemplateSegment.SignToken,
                TemplateSegment.ComponentToken,
                TemplateSegment.ContinuousToken,
                TemplateSegment.FractionToken
{
    /**
     * Which sexagesimal component a {@link ComponentToken} stands for.
     */
    enum Component { MAJOR, MINOR1, MINOR2 }

    /**
     * Text copied to the output unchanged.
     */
    record Literal(String text) implements TemplateSegment {
        public Literal {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * {@code +}: the sign of the scalar.
     */
    record SignToken() implements TemplateSegment {}

    /**
     * {@code X} or {@code 0X}: an integer component.
     */
    record ComponentToken(Component component, boolean zeroPadded) implements TemplateSegment {
        public ComponentToken {
            Objects.requireNonNull(component, "component");
        }
    }

    /**
     * {@code NU}: a continuous unit rounded to {@code precision} decimals.
     */
    record ContinuousToken(char unit, int precision) implements TemplateSegment {}

    /**
     * {@code Nf}: the first {@code digits} digits of the fraction.
     */
    record FractionToken(int digits) implements TemplateSegment {}
}
