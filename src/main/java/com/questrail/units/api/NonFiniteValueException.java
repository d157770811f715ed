package com.questrail.units.api;

/**
 * Indicates that a quantity holding a NaN or infinite scalar was asked to
 * render itself through a format template.
 *
 * <p>Arithmetic never raises this exception; non-finite values propagate
 * silently until they reach the formatting boundary.</p>
 */
public final class NonFiniteValueException extends RuntimeException
{
    public NonFiniteValueException(String message) {
        super(message);
    }
}
