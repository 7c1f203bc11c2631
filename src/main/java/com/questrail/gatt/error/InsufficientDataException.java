package com.questrail.gatt.error;

/**
 * Raised when a buffer is shorter than a characteristic or field requires.
 */
public final class InsufficientDataException extends GattException
{
    private final int required;
    private final int actual;

    public InsufficientDataException(int required, int actual) {
        this(null, required, actual);
    }

    public InsufficientDataException(String subject, int required, int actual) {
        super(ErrorKind.INSUFFICIENT_DATA,
                (subject == null ? "" : subject + ": ")
                        + "need " + required + " bytes, got " + actual);
        this.required = required;
        this.actual = actual;
    }

    public int required() {
        return required;
    }

    public int actual() {
        return actual;
    }
}
