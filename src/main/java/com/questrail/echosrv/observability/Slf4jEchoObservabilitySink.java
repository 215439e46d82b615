package com.questrail.echosrv.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;

/**
 * Production implementation of EchoObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jEchoObservabilitySink implements EchoObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jEchoObservabilitySink.class);

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        switch (event.type()) {
            case ACCEPTED -> log.info("[{}] Accepted connection from {} (active: {})",
                    event.transport(), peerName(event.peer()), event.activeConnections());
            case REJECTED -> log.warn("[{}] Connection limit reached, rejecting {} (active: {})",
                    event.transport(), peerName(event.peer()), event.activeConnections());
            case RECEIVED -> log.debug("[{}] Received {} bytes from {}",
                    event.transport(), event.bytes(), peerName(event.peer()));
            case ECHOED -> log.debug("[{}] Echoed {} bytes to {}",
                    event.transport(), event.bytes(), peerName(event.peer()));
            case TIMED_OUT -> log.warn("[{}] Connection {} timed out: {}",
                    event.transport(), peerName(event.peer()), event.detail());
            case CLOSED -> log.info("[{}] Connection {} closed: {} (active: {})",
                    event.transport(), peerName(event.peer()), event.detail(), event.activeConnections());
        }
    }

    @Override
    public void onDatagramEvent(DatagramEvent event) {
        switch (event.type()) {
            case RECEIVED -> log.debug("[{}] Received {} bytes from {}",
                    event.transport(), event.bytes(), peerName(event.peer()));
            case ECHOED -> log.debug("[{}] Echoed {} bytes to {}",
                    event.transport(), event.bytes(), peerName(event.peer()));
            case RECEIVE_TIMEOUT -> log.debug("[{}] Receive timed out, continuing", event.transport());
            case UNADDRESSABLE -> log.warn("[{}] Dropped {} bytes from an unnamed sender; cannot reply",
                    event.transport(), event.bytes());
        }
    }

    /** Unnamed Unix-domain peers have no address. */
    static String peerName(SocketAddress peer) {
        return peer == null ? "unnamed" : peer.toString();
    }

    @Override
    public void onServerEvent(ServerLifecycleEvent event) {
        log.info("[{}] Server {} on {}", event.transport(), event.type(), event.localAddress());
    }

    @Override
    public void onError(EchoErrorEvent event) {
        if (event.peer() != null) {
            log.error("[{}] {} (peer {})", event.transport(), event.message(), event.peer(), event.cause());
        }
        else {
            log.error("[{}] {}", event.transport(), event.message(), event.cause());
        }
    }
}
