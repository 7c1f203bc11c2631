package com.questrail.gatt.error;

/**
 * Raised when medical float bits map neither to a finite value nor to a
 * defined sentinel.
 */
public final class SpecialFloatFormatException extends GattException
{
    public SpecialFloatFormatException(String message) {
        super(ErrorKind.SPECIAL_FLOAT_FORMAT, message);
    }
}
