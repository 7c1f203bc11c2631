package com.questrail.gatt.error;

import java.util.Objects;

/**
 * Base type of every structured codec failure.
 *
 * <p>
 * Codecs and concrete decoders throw subclasses of this exception; the parse
 * pipeline converts them into failed results so that callers of
 * {@code parse} never see them raw. Each subclass is bound to exactly one
 * {@link ErrorKind}.
 * </p>
 */
public class GattException extends RuntimeException
{
    private final ErrorKind kind;

    public GattException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public GattException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
