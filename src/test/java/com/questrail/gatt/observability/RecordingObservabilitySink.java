package com.questrail.gatt.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements GattObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onRegistryLoaded(RegistryLoadEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onDecodeFailure(DecodeFailureEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(GattErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<RegistryLoadEvent> getRegistryLoads() {
        return eventsOfType(RegistryLoadEvent.class);
    }

    public synchronized List<DecodeFailureEvent> getDecodeFailures() {
        return eventsOfType(DecodeFailureEvent.class);
    }

    public synchronized List<GattErrorEvent> getErrors() {
        return eventsOfType(GattErrorEvent.class);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    private <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
