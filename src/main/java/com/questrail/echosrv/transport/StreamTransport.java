package com.questrail.echosrv.transport;

import com.questrail.echosrv.config.StreamServerConfig;
import com.questrail.echosrv.net.BindTarget;
import com.questrail.echosrv.net.InheritanceConfig;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * A connection-oriented socket family (TCP, Unix stream).
 */
public interface StreamTransport
{
    /** Short identifier used in logs and events, e.g. {@code "tcp"}. */
    String name();

    /**
     * Binds using the process environment for descriptor inheritance.
     *
     * @throws com.questrail.echosrv.error.BindFailedException if a fresh bind fails
     * @throws com.questrail.echosrv.error.FdInheritanceException if a required inherited
     *         descriptor is invalid
     */
    default StreamListener bind(StreamServerConfig config)
    {
        return bind(config, InheritanceConfig.fromEnvironment());
    }

    StreamListener bind(StreamServerConfig config, InheritanceConfig inheritance);

    /**
     * Opens a connection to {@code target}. The future fails with
     * {@link com.questrail.echosrv.error.EchoTimeoutException} if the connection is not
     * established within {@code timeout}.
     */
    CompletableFuture<StreamConnection> connect(BindTarget target, Duration timeout);
}
