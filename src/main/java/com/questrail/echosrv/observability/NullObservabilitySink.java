package com.questrail.echosrv.observability;

/**
 * No-op implementation of EchoObservabilitySink.
 */
public final class NullObservabilitySink implements EchoObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onConnectionEvent(ConnectionEvent event) {}

    @Override
    public void onDatagramEvent(DatagramEvent event) {}

    @Override
    public void onServerEvent(ServerLifecycleEvent event) {}

    @Override
    public void onError(EchoErrorEvent event) {}
}
