package com.questrail.gatt.observability;

import java.time.Instant;

/**
 * Record representing an error absorbed by the codec.
 */
public record GattErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
