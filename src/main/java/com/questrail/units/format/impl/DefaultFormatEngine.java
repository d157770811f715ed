package com.questrail.units.format.impl;

import com.questrail.units.api.Sign;
import com.questrail.units.format.FormatEngine;
import com.questrail.units.format.FormatOptions;
import com.questrail.units.format.Formattable;
import com.questrail.units.format.TemplateDialect;
import com.questrail.units.format.impl.TemplateSegment.ComponentToken;
import com.questrail.units.format.impl.TemplateSegment.ContinuousToken;
import com.questrail.units.format.impl.TemplateSegment.FractionToken;
import com.questrail.units.format.impl.TemplateSegment.Literal;
import com.questrail.units.format.impl.TemplateSegment.SignToken;
import com.questrail.units.sexagesimal.SexagesimalCodec;
import com.questrail.units.sexagesimal.SexagesimalComponents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * DefaultFormatEngine
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link FormatEngine}.
 *
 * <p>Rendering performs the following steps, in order:</p>
 * <ol>
 *   <li>Tokenize the template ({@link TemplateTokenizer})</li>
 *   <li>Resolve the rounding place: the largest {@code Nf} digit count, or
 *       {@link FormatOptions#defaultRoundingPlace()} when there is none</li>
 *   <li>Decompose the scalar once at that place ({@link SexagesimalCodec})</li>
 *   <li>Substitute every segment in a single pass</li>
 * </ol>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public final class DefaultFormatEngine implements FormatEngine
{
    private static final Logger log = LoggerFactory.getLogger(DefaultFormatEngine.class);

    private static final DefaultFormatEngine STANDARD = new DefaultFormatEngine(FormatOptions.defaults());

    private final FormatOptions options;

    public DefaultFormatEngine(FormatOptions options)
    {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Shared engine configured with {@link FormatOptions#defaults()}.
     */
    public static DefaultFormatEngine standard()
    {
        return STANDARD;
    }

    public FormatOptions options()
    {
        return options;
    }

    @Override
    public String render(String template, Formattable quantity)
    {
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(quantity, "quantity");

        final TemplateDialect dialect = quantity.dialect();
        final double scalar = quantity.scalar();
        final List<TemplateSegment> segments = TemplateTokenizer.tokenize(template, dialect);

        final int roundPlace = roundingPlace(segments);
        final boolean explicitSign = segments.stream().anyMatch(s -> s instanceof SignToken);
        final Sign sign = Sign.of(scalar);
        final SexagesimalComponents components = SexagesimalCodec.decompose(scalar, roundPlace);

        log.debug("Rendering '{}' ({}) at rounding place {}", template, dialect.name(), roundPlace);

        final StringBuilder out = new StringBuilder(template.length() + 16);
        TemplateSegment previous = null;

        for (TemplateSegment segment : segments) {
            if (segment instanceof Literal literal) {
                out.append(literal.text());
            }
            else if (segment instanceof SignToken) {
                out.append(sign.symbol());
            }
            else if (segment instanceof ContinuousToken continuous) {
                out.append(decimal(dialect.continuousValue(continuous.unit(), scalar), continuous.precision()));
            }
            else if (segment instanceof ComponentToken component) {
                appendComponent(out, component, components, dialect, sign, explicitSign);
            }
            else if (segment instanceof FractionToken fraction) {
                appendFraction(out, fraction, components.fraction(), previous);
            }
            previous = segment;
        }

        return out.toString();
    }

    // -------------------------------------------------------------------------
    // Substitution
    // -------------------------------------------------------------------------

    private int roundingPlace(List<TemplateSegment> segments)
    {
        int max = -1;
        for (TemplateSegment segment : segments) {
            if (segment instanceof FractionToken fraction) {
                max = Math.max(max, fraction.digits());
            }
        }
        return max < 0 ? options.defaultRoundingPlace() : max;
    }

    private static void appendComponent(StringBuilder out,
                                        ComponentToken token,
                                        SexagesimalComponents components,
                                        TemplateDialect dialect,
                                        Sign sign,
                                        boolean explicitSign)
    {
        switch (token.component()) {
            case MAJOR -> {
                if (!explicitSign) {
                    if (sign.isNegative()) {
                        out.append(sign.symbol());
                    } else if (token.zeroPadded() && dialect.blankForPositiveMajor()) {
                        out.append(' ');
                    }
                }
                out.append(integer(components.major(), token.zeroPadded() ? dialect.majorPadWidth() : 0));
            }
            case MINOR1 -> out.append(integer(components.minor1(), token.zeroPadded() ? 2 : 0));
            case MINOR2 -> out.append(integer(components.minor2(), token.zeroPadded() ? 2 : 0));
        }
    }

    private void appendFraction(StringBuilder out,
                                FractionToken token,
                                String fraction,
                                TemplateSegment previous)
    {
        final int digits = token.digits();
        String f = fraction.length() > digits ? fraction.substring(0, digits) : fraction;

        if (options.padFractions()) {
            out.append(f);
            for (int i = f.length(); i < digits; i++) {
                out.append('0');
            }
            return;
        }

        if (isZero(f)) {
            // Drop a decimal point written right before the token
            if (previous instanceof Literal && out.length() > 0 && out.charAt(out.length() - 1) == '.') {
                out.setLength(out.length() - 1);
            }
            return;
        }

        out.append(f);
    }

    private static boolean isZero(String digits)
    {
        for (int i = 0; i < digits.length(); i++) {
            if (digits.charAt(i) != '0') {
                return false;
            }
        }
        return true;
    }

    private static String integer(long value, int width)
    {
        return width > 0 ? String.format(Locale.ROOT, "%0" + width + "d", value) : Long.toString(value);
    }

    /**
     * Rounds half away from zero and drops trailing zeros: 1.50 at place 3
     * renders {@code 1.5}, 2.0 renders {@code 2}.
     */
    static String decimal(double value, int precision)
    {
        if (!Double.isFinite(value)) {
            return Double.toString(value);
        }
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(precision, RoundingMode.HALF_UP);
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.stripTrailingZeros().toPlainString();
    }
}
