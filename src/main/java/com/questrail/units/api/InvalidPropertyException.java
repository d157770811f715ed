package com.questrail.units.api;

/**
 * Indicates that a named unit or view was requested that the quantity does not
 * support.
 *
 * This typically reflects:
 * <ul>
 *   <li>An unknown unit symbol passed to a {@code forSymbol} lookup</li>
 *   <li>A velocity unit string whose distance or time part is unknown</li>
 *   <li>A number template naming a unit the quantity cannot express</li>
 * </ul>
 */
public final class InvalidPropertyException extends RuntimeException
{
    public InvalidPropertyException(String message) {
        super(message);
    }

    public InvalidPropertyException(String message, Throwable cause) {
        super(message, cause);
    }
}
