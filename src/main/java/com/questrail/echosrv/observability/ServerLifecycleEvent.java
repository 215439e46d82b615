package com.questrail.echosrv.observability;

import java.net.SocketAddress;
import java.time.Instant;

public record ServerLifecycleEvent(
    Instant timestamp,
    Type type,
    String transport,
    SocketAddress localAddress
) {
    public enum Type {
        STARTED,
        SHUTDOWN_REQUESTED,
        STOPPED
    }
}
