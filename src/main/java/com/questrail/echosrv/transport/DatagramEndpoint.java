package com.questrail.echosrv.transport;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * A bound datagram socket.
 *
 * <p>At most one receive may be pending at a time.</p>
 */
public interface DatagramEndpoint extends AutoCloseable
{
    /**
     * Receives the next datagram into {@code buffer}. A datagram longer than the buffer
     * is truncated.
     */
    CompletableFuture<ReceivedDatagram> receive(byte[] buffer, Duration timeout);

    /** Sends {@code data[0, length)} as one datagram. */
    CompletableFuture<Void> send(byte[] data, int length, SocketAddress target, Duration timeout);

    SocketAddress localAddress();

    boolean isOpen();

    @Override
    void close();
}
