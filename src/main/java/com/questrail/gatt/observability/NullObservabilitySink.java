package com.questrail.gatt.observability;

/**
 * No-op implementation of GattObservabilitySink.
 */
public final class NullObservabilitySink implements GattObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onRegistryLoaded(RegistryLoadEvent event) {}

    @Override
    public void onDecodeFailure(DecodeFailureEvent event) {}

    @Override
    public void onError(GattErrorEvent event) {}
}
