package com.questrail.gatt.error;

/**
 * Raised by encode-side operations when an identifier has no known
 * characteristic. Lookups themselves return an empty optional instead.
 */
public final class UnresolvedIdentifierException extends GattException
{
    public UnresolvedIdentifierException(String identifier) {
        super(ErrorKind.UUID_RESOLUTION, "no characteristic registered for '" + identifier + "'");
    }
}
