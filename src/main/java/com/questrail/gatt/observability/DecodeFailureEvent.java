package com.questrail.gatt.observability;

import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.error.ErrorKind;

import java.time.Instant;

/**
 * A parse that produced a failed result.
 */
public record DecodeFailureEvent(
    Instant timestamp,
    CharacteristicUuid uuid,
    String name,
    ErrorKind kind,
    String message
) {
}
