package com.questrail.gatt.observability;

/**
 * Receives codec observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface GattObservabilitySink {
    /**
     * Called once when the registry finishes its one-time load.
     * @param event load summary
     */
    void onRegistryLoaded(RegistryLoadEvent event);

    /**
     * Called when a parse produces a failed result.
     * @param event the failure details
     */
    void onDecodeFailure(DecodeFailureEvent event);

    /**
     * Called when an unexpected error is absorbed (for example an unreadable
     * specification source).
     * @param event the error event
     */
    void onError(GattErrorEvent event);
}
