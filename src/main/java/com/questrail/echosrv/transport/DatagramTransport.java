package com.questrail.echosrv.transport;

import com.questrail.echosrv.config.DatagramServerConfig;
import com.questrail.echosrv.net.BindTarget;
import com.questrail.echosrv.net.InheritanceConfig;

/**
 * A connectionless socket family (UDP, Unix datagram).
 */
public interface DatagramTransport
{
    String name();

    default DatagramEndpoint bind(DatagramServerConfig config)
    {
        return bind(config, InheritanceConfig.fromEnvironment());
    }

    DatagramEndpoint bind(DatagramServerConfig config, InheritanceConfig inheritance);

    /**
     * Opens an ephemeral local endpoint from which {@code server} can be reached and
     * which {@code server} can reply to. Network transports bind the wildcard address
     * on port 0; path transports bind a private temporary socket file that is removed
     * on close.
     */
    DatagramEndpoint openClient(BindTarget server);
}
