package com.questrail.echosrv.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Something happened on one stream connection.
 *
 * <p>{@code activeConnections} is the server's live count right after the event;
 * {@code bytes} is zero unless the event moved data.</p>
 */
public record ConnectionEvent(
    Instant timestamp,
    Type type,
    String transport,
    SocketAddress peer,
    int activeConnections,
    int bytes,
    String detail
) {
    public enum Type {
        ACCEPTED,
        REJECTED,
        RECEIVED,
        ECHOED,
        TIMED_OUT,
        CLOSED
    }
}
