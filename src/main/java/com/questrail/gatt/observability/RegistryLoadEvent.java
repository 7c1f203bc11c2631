package com.questrail.gatt.observability;

import java.time.Instant;

/**
 * Summary of a completed registry load.
 *
 * @param degraded {@code true} if the specification source could not be read
 *                 and the registry continued without it
 */
public record RegistryLoadEvent(
    Instant timestamp,
    String source,
    int metadataEntries,
    int decoders,
    int aliases,
    boolean degraded
) {
}
