package com.questrail.units.core;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * NumberTemplates
 * -----------------------------------------------------------------------------
 * printf-style templates of the form {@code <number spec><spacing><unit>},
 * e.g. {@code %3.3f km} or {@code %1.2e au/d}, used by decimal quantities.
 *
 * <p>A value that renders as zero in fixed notation, or that exceeds 1e10,
 * is rendered in scientific notation instead so that it stays readable.</p>
 */
final class NumberTemplates
{
    private static final Pattern TEMPLATE =
            Pattern.compile("(%[-+ 0#]*\\d*(?:\\.\\d+)?[eEfgG])(\\s*)(.*)", Pattern.DOTALL);

    private static final double SCIENTIFIC_ABOVE = 10e9;

    private NumberTemplates() {}

    /**
     * A parsed template.
     *
     * @param numberSpec the printf conversion, e.g. {@code %3.3f}
     * @param spacing    whitespace between number and unit, kept verbatim
     * @param unit       the unit text
     */
    record Parsed(String numberSpec, String spacing, String unit) {
        String template() {
            return numberSpec + spacing + unit;
        }
    }

    static Optional<Parsed> parse(String template)
    {
        Matcher m = TEMPLATE.matcher(template);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new Parsed(m.group(1), m.group(2), m.group(3)));
    }

    /**
     * Renders {@code value} with {@code numberSpec}, switching to scientific
     * notation when fixed notation would hide the value.
     */
    static String number(String numberSpec, double value)
    {
        String fixed = String.format(Locale.ROOT, numberSpec, value);
        if (value != 0 && (rendersAsZero(fixed) || Math.abs(value) > SCIENTIFIC_ABOVE)) {
            String scientific = numberSpec.substring(0, numberSpec.length() - 1) + 'e';
            return String.format(Locale.ROOT, scientific, value);
        }
        return fixed;
    }

    private static boolean rendersAsZero(String rendered)
    {
        for (int i = 0; i < rendered.length(); i++) {
            char c = rendered.charAt(i);
            if (c >= '1' && c <= '9') {
                return false;
            }
        }
        return true;
    }
}
