package com.questrail.gatt.error;

/**
 * Raised when a value does not have the runtime type a characteristic declares.
 */
public final class TypeMismatchException extends GattException
{
    public TypeMismatchException(Class<?> expected, Object actual) {
        super(ErrorKind.TYPE_MISMATCH,
                "expected " + expected.getSimpleName() + ", got "
                        + (actual == null ? "null" : actual.getClass().getSimpleName()));
    }
}
