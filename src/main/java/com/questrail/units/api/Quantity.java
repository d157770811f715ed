package com.questrail.units.api;

/**
 * Quantity
 * -----------------------------------------------------------------------------
 * A physical quantity held as a single canonical scalar.
 *
 * <h2>Value semantics</h2>
 * <ul>
 *   <li>The canonical scalar is the only state that defines a quantity's value;
 *       every unit view is a pure function of it</li>
 *   <li>Arithmetic never mutates the receiver, it returns a new instance</li>
 *   <li>Operands must be of the same dimension, enforced by the type parameter</li>
 * </ul>
 *
 * <p>Instances are safe to share between threads.</p>
 *
 * @param <Q> the concrete quantity type
 */
public interface Quantity<Q extends Quantity<Q>>
{
    /**
     * Returns the canonical scalar of this quantity, expressed in the
     * implementation's canonical unit (arcseconds for angles, seconds for
     * time, metres for distances, ...).
     */
    double scalar();

    /**
     * Returns the sign of {@link #scalar()}.
     */
    default Sign sign() {
        return Sign.of(scalar());
    }

    Q add(Q other);

    Q subtract(Q other);

    Q negate();
}
