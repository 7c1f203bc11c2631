package com.questrail.gatt.error;

/**
 * Raised when a custom registration targets an identifier that already exists
 * and override was not requested.
 */
public final class RegistrationCollisionException extends GattException
{
    public RegistrationCollisionException(String identifier, String existingName) {
        super(ErrorKind.COLLISION,
                "identifier " + identifier + " already registered as '" + existingName
                        + "'; pass override=true to replace it");
    }
}
