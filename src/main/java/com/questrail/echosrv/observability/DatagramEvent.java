package com.questrail.echosrv.observability;

import java.net.SocketAddress;
import java.time.Instant;

public record DatagramEvent(
    Instant timestamp,
    Type type,
    String transport,
    SocketAddress peer,
    int bytes
) {
    public enum Type {
        RECEIVED,
        ECHOED,
        RECEIVE_TIMEOUT,
        /** The sender has no address to reply to. */
        UNADDRESSABLE
    }
}
