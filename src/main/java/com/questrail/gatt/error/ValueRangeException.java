package com.questrail.gatt.error;

/**
 * Raised when a numeric value falls outside its declared bounds, on decode
 * or on encode.
 */
public final class ValueRangeException extends GattException
{
    public ValueRangeException(String message) {
        super(ErrorKind.VALUE_RANGE, message);
    }

    public ValueRangeException(String subject, Object value, Object min, Object max) {
        this(subject + " value " + value + " outside range [" + min + ", " + max + "]");
    }
}
