package com.questrail.echosrv.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements EchoObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onConnectionEvent(ConnectionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onDatagramEvent(DatagramEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onServerEvent(ServerLifecycleEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(EchoErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<ConnectionEvent> connectionEvents(ConnectionEvent.Type type) {
        return events.stream()
            .filter(e -> e instanceof ConnectionEvent)
            .map(e -> (ConnectionEvent) e)
            .filter(e -> e.type() == type)
            .collect(Collectors.toList());
    }

    public synchronized List<DatagramEvent> datagramEvents(DatagramEvent.Type type) {
        return events.stream()
            .filter(e -> e instanceof DatagramEvent)
            .map(e -> (DatagramEvent) e)
            .filter(e -> e.type() == type)
            .collect(Collectors.toList());
    }

    public synchronized List<ServerLifecycleEvent> serverEvents(ServerLifecycleEvent.Type type) {
        return events.stream()
            .filter(e -> e instanceof ServerLifecycleEvent)
            .map(e -> (ServerLifecycleEvent) e)
            .filter(e -> e.type() == type)
            .collect(Collectors.toList());
    }

    public synchronized List<EchoErrorEvent> errorEvents() {
        return events.stream()
            .filter(e -> e instanceof EchoErrorEvent)
            .map(e -> (EchoErrorEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized boolean hasServerEvent(ServerLifecycleEvent.Type type) {
        return events.stream()
            .anyMatch(e -> e instanceof ServerLifecycleEvent s && s.type() == type);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
