package com.questrail.units.format.impl;

import com.questrail.units.format.TemplateDialect;
import com.questrail.units.format.impl.TemplateSegment.Component;
import com.questrail.units.format.impl.TemplateSegment.ComponentToken;
import com.questrail.units.format.impl.TemplateSegment.ContinuousToken;
import com.questrail.units.format.impl.TemplateSegment.FractionToken;
import com.questrail.units.format.impl.TemplateSegment.Literal;
import com.questrail.units.format.impl.TemplateSegment.SignToken;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * TemplateTokenizer
 * -----------------------------------------------------------------------------
 * Splits a format template into {@link TemplateSegment}s in a single left to
 * right pass.
 *
 * <p>At each position the first matching rule wins:</p>
 * <ol>
 *   <li>{@code \} followed by a reserved letter: that letter as a literal.
 *       A backslash before any other character is kept as written.</li>
 *   <li>{@code +}: sign token</li>
 *   <li>digit followed by a continuous-unit letter: continuous token with
 *       that precision</li>
 *   <li>digit followed by {@code f}: fraction token with that many digits</li>
 *   <li>{@code 0} followed by a component letter: zero-padded component</li>
 *   <li>continuous-unit letter alone: continuous token, precision 0</li>
 *   <li>component letter alone: unpadded component</li>
 *   <li>anything else: literal</li>
 * </ol>
 *
 * <p>Adjacent literal characters are merged into one {@link Literal}.</p>
 */
final class TemplateTokenizer
{
    private TemplateTokenizer() {}

    static List<TemplateSegment> tokenize(String template, TemplateDialect dialect)
    {
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(dialect, "dialect");

        final List<TemplateSegment> out = new ArrayList<>();
        final StringBuilder literal = new StringBuilder();
        final int n = template.length();

        for (int i = 0; i < n; i++) {
            final char c = template.charAt(i);
            final char next = (i + 1 < n) ? template.charAt(i + 1) : '\0';

            if (c == TemplateDialect.ESCAPE) {
                if (i + 1 < n && dialect.isReserved(next)) {
                    literal.append(next);
                    i++;
                } else {
                    literal.append(c);
                }
                continue;
            }

            TemplateSegment token = null;
            int consumed = 1;

            if (c == TemplateDialect.SIGN_LETTER) {
                token = new SignToken();
            }
            else if (isDigit(c) && i + 1 < n && dialect.isContinuousLetter(next)) {
                token = new ContinuousToken(next, c - '0');
                consumed = 2;
            }
            else if (isDigit(c) && next == TemplateDialect.FRACTION_LETTER) {
                token = new FractionToken(c - '0');
                consumed = 2;
            }
            else if (c == '0' && i + 1 < n && dialect.isComponentLetter(next)) {
                token = new ComponentToken(componentOf(next, dialect), true);
                consumed = 2;
            }
            else if (dialect.isContinuousLetter(c)) {
                token = new ContinuousToken(c, 0);
            }
            else if (dialect.isComponentLetter(c)) {
                token = new ComponentToken(componentOf(c, dialect), false);
            }

            if (token == null) {
                literal.append(c);
                continue;
            }

            flush(literal, out);
            out.add(token);
            i += consumed - 1;
        }

        flush(literal, out);
        return out;
    }

    private static boolean isDigit(char c)
    {
        return c >= '0' && c <= '9';
    }

    private static Component componentOf(char letter, TemplateDialect dialect)
    {
        if (letter == dialect.majorLetter()) {
            return Component.MAJOR;
        }
        if (letter == dialect.minor1Letter()) {
            return Component.MINOR1;
        }
        return Component.MINOR2;
    }

    private static void flush(StringBuilder literal, List<TemplateSegment> out)
    {
        if (literal.length() > 0) {
            out.add(new Literal(literal.toString()));
            literal.setLength(0);
        }
    }
}
