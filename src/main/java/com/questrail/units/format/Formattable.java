package com.questrail.units.format;

/**
 * Formattable
 * -----------------------------------------------------------------------------
 * A quantity that can be rendered by a {@link FormatEngine}.
 *
 * <p>The engine needs only two things: the canonical scalar, from which it
 * derives sexagesimal components and continuous unit values, and the dialect
 * naming the template letters that apply to this kind of quantity.</p>
 */
public interface Formattable
{
    /**
     * Canonical scalar in second units (arcseconds or seconds).
     */
    double scalar();

    /**
     * The template dialect of this quantity.
     */
    TemplateDialect dialect();
}
