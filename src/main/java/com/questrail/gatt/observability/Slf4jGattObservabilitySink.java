package com.questrail.gatt.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of GattObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jGattObservabilitySink implements GattObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jGattObservabilitySink.class);

    @Override
    public void onRegistryLoaded(RegistryLoadEvent event) {
        if (event.degraded()) {
            log.warn("GATT registry loaded WITHOUT specification data from {}: {} decoders, {} aliases",
                event.source(), event.decoders(), event.aliases());
        } else {
            log.info("GATT registry loaded from {}: {} characteristics, {} decoders, {} aliases",
                event.source(), event.metadataEntries(), event.decoders(), event.aliases());
        }
    }

    @Override
    public void onDecodeFailure(DecodeFailureEvent event) {
        log.warn("GATT decode failed for {} ({}): {} {}",
            event.uuid(), event.name(), event.kind(), event.message());
    }

    @Override
    public void onError(GattErrorEvent event) {
        log.error("GATT Error: {}", event.message(), event.cause());
    }
}
