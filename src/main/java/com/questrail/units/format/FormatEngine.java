package com.questrail.units.format;

/**
 * FormatEngine
 * -----------------------------------------------------------------------------
 * Renders a {@link Formattable} through a compact letter template.
 *
 * <h2>Template language</h2>
 * <ul>
 *   <li>{@code +} : the sign of the scalar, always emitted</li>
 *   <li>{@code 0X} : a component letter X zero-padded (major to the dialect's
 *       width, minors to 2 digits)</li>
 *   <li>{@code X} : an unpadded component; the major carries {@code -} for
 *       negative values when the template has no {@code +}</li>
 *   <li>{@code NU} : continuous unit U rounded to N decimals</li>
 *   <li>{@code Nf} : first N fraction digits; an all-zero fraction removes the
 *       token and one preceding {@code .}</li>
 *   <li>{@code \X} : the literal character X, for any reserved X</li>
 * </ul>
 *
 * <p>Letters that the dialect does not reserve pass through verbatim.
 * Implementations never fail on an unrecognised template.</p>
 *
 * <p>The engine does not validate the scalar. Callers reject NaN and
 * infinities before rendering.</p>
 */
public interface FormatEngine
{
    /**
     * Render {@code quantity} according to {@code template}.
     *
     * @param template the format template, e.g. {@code +0d°0m'0s".3f}
     * @param quantity the quantity to render; its scalar must be finite
     * @return the rendered string
     */
    String render(String template, Formattable quantity);
}
