package com.questrail.echosrv.observability;

/**
 * Receives the engine's observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Called from server loop and event loop threads; implementations must be
 * thread-safe and must not block.</p>
 */
public interface EchoObservabilitySink {
    /**
     * Called as a stream connection is admitted, refused, serviced and closed.
     * @param event the connection event
     */
    void onConnectionEvent(ConnectionEvent event);

    /**
     * Called for each datagram received or echoed, and on receive timeouts.
     * @param event the datagram event
     */
    void onDatagramEvent(DatagramEvent event);

    /**
     * Called when a server starts, is asked to stop, and has stopped.
     * @param event the lifecycle event
     */
    void onServerEvent(ServerLifecycleEvent event);

    /**
     * Called when an I/O or accept failure occurs.
     * @param event the error event
     */
    void onError(EchoErrorEvent event);
}
