package com.questrail.gatt.error;

/**
 * Raised when a wire code is not a member of the target enumeration.
 */
public final class EnumValueException extends GattException
{
    private final long code;

    public EnumValueException(String enumeration, long code) {
        super(ErrorKind.ENUM_VALUE, code + " is not a valid " + enumeration + " code");
        this.code = code;
    }

    public long code() {
        return code;
    }
}
