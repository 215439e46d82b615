package com.questrail.echosrv;

import com.questrail.echosrv.server.ShutdownSignal;

import java.net.SocketAddress;
import java.util.concurrent.CompletableFuture;

/**
 * A running service over one transport.
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} binds synchronously (bind failures are thrown from it) and returns a
 * future that completes once the accept or receive loop has stopped. The loop stops when
 * {@link #shutdownSignal()} or the process interrupt signal fires. Stream sessions that
 * are already running are not cancelled; they finish on their own.
 */
public interface EchoServer extends AutoCloseable
{
    CompletableFuture<Void> start();

    /** Starts the server and blocks until its loop stops. */
    default void run()
    {
        start().join();
    }

    ShutdownSignal shutdownSignal();

    /** The bound address; only valid once {@link #start()} has returned. */
    SocketAddress localAddress();

    /** Fires the shutdown signal and waits for the loop to stop. */
    @Override
    void close();
}
