package com.questrail.echosrv.transport;

import java.net.SocketAddress;
import java.util.concurrent.CompletableFuture;

/**
 * A bound, listening stream socket.
 */
public interface StreamListener extends AutoCloseable
{
    /**
     * Completes with the next inbound connection. At most one accept may be pending.
     * After {@link #close()} the returned future fails with
     * {@link com.questrail.echosrv.error.EchoIoException}.
     */
    CompletableFuture<StreamConnection> accept();

    SocketAddress localAddress();

    boolean isOpen();

    /** Stops listening. Already accepted connections are unaffected. Idempotent. */
    @Override
    void close();
}
