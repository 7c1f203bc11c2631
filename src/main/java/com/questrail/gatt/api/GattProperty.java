package com.questrail.gatt.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Characteristic properties as declared by the specification dataset.
 */
public enum GattProperty
{
    BROADCAST,
    READ,
    WRITE_WITHOUT_RESPONSE,
    WRITE,
    NOTIFY,
    INDICATE,
    AUTHENTICATED_SIGNED_WRITES,
    EXTENDED_PROPERTIES;

    /**
     * Parses dataset spellings such as {@code read}, {@code Notify} or
     * {@code write-without-response}.
     */
    public static Optional<GattProperty> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (GattProperty p : values()) {
            if (p.name().equals(normalized)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }
}
