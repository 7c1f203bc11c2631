package com.questrail.gatt.error;

/**
 * Raised when a buffer is longer than its declared fixed or maximum length.
 */
public final class LengthMismatchException extends GattException
{
    private final int limit;
    private final int actual;

    private LengthMismatchException(String message, int limit, int actual) {
        super(ErrorKind.LENGTH_MISMATCH, message);
        this.limit = limit;
        this.actual = actual;
    }

    public static LengthMismatchException exact(int expected, int actual) {
        return new LengthMismatchException(
                "expected exactly " + expected + " bytes, got " + actual, expected, actual);
    }

    public static LengthMismatchException atMost(int maximum, int actual) {
        return new LengthMismatchException(
                "expected at most " + maximum + " bytes, got " + actual, maximum, actual);
    }

    public int limit() {
        return limit;
    }

    public int actual() {
        return actual;
    }
}
