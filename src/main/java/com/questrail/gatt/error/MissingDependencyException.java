package com.questrail.gatt.error;

import java.util.List;

/**
 * Raised when a required other characteristic is unavailable during decode.
 */
public final class MissingDependencyException extends GattException
{
    private final List<String> missing;

    public MissingDependencyException(String dependent, List<String> missing) {
        super(ErrorKind.MISSING_DEPENDENCY,
                dependent + " requires unavailable characteristic(s) " + missing);
        this.missing = List.copyOf(missing);
    }

    public List<String> missing() {
        return missing;
    }
}
