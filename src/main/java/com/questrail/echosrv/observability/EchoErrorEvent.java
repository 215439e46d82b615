package com.questrail.echosrv.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a failure in the server or one of its sessions.
 * {@code peer} is {@code null} for failures not tied to one peer.
 */
public record EchoErrorEvent(
    Instant timestamp,
    String transport,
    SocketAddress peer,
    String message,
    Throwable cause
) {
}
