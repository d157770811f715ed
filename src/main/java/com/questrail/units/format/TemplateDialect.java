package com.questrail.units.format;

import java.util.Map;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * TemplateDialect
 * -----------------------------------------------------------------------------
 * The letters a kind of quantity reserves in its format templates.
 *
 * <p>Angles and time share one template grammar but name their components
 * differently ({@code d m s} versus {@code h m s}) and expose different
 * continuous units ({@code D R} versus {@code Y W D H M S}). A dialect
 * captures exactly those differences; the grammar itself lives in the engine.</p>
 *
 * <h2>Fields</h2>
 * <ul>
 *   <li><b>majorLetter, minor1Letter, minor2Letter</b> — component letters</li>
 *   <li><b>majorPadWidth</b> — digits of a zero-padded major component</li>
 *   <li><b>blankForPositiveMajor</b> — whether a zero-padded major carries a
 *       leading space for non-negative values when the template has no
 *       {@code +}, so that columns of mixed signs align</li>
 *   <li><b>continuousUnits</b> — letter to a function converting the scalar
 *       into that unit</li>
 * </ul>
 */
public record TemplateDialect(
        String name,
        char majorLetter,
        char minor1Letter,
        char minor2Letter,
        int majorPadWidth,
        boolean blankForPositiveMajor,
        Map<Character, DoubleUnaryOperator> continuousUnits
) {
    /**
     * Letter of the fractional token.
     */
    public static final char FRACTION_LETTER = 'f';

    /**
     * Letter of the sign token.
     */
    public static final char SIGN_LETTER = '+';

    /**
     * Escape character protecting a reserved letter.
     */
    public static final char ESCAPE = '\\';

    public TemplateDialect {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(continuousUnits, "continuousUnits");
        if (majorPadWidth < 1) {
            throw new IllegalArgumentException("majorPadWidth must be positive");
        }
        continuousUnits = Map.copyOf(continuousUnits);
    }

    /**
     * Returns true if {@code c} names a sexagesimal component.
     */
    public boolean isComponentLetter(char c) {
        return c == majorLetter || c == minor1Letter || c == minor2Letter;
    }

    /**
     * Returns true if {@code c} names a continuous unit.
     */
    public boolean isContinuousLetter(char c) {
        return continuousUnits.containsKey(c);
    }

    /**
     * Returns true if {@code c} has meaning in a template and therefore needs
     * an escape to appear literally.
     */
    public boolean isReserved(char c) {
        return isComponentLetter(c)
                || isContinuousLetter(c)
                || c == FRACTION_LETTER
                || c == SIGN_LETTER;
    }

    /**
     * Converts a scalar to the continuous unit named by {@code letter}.
     *
     * @throws IllegalArgumentException if the letter is not a continuous unit
     */
    public double continuousValue(char letter, double scalar) {
        DoubleUnaryOperator view = continuousUnits.get(letter);
        if (view == null) {
            throw new IllegalArgumentException(name + " has no continuous unit '" + letter + "'");
        }
        return view.applyAsDouble(scalar);
    }
}
