package com.questrail.echosrv.client;

import com.questrail.echosrv.EchoClient;
import com.questrail.echosrv.config.ClientConfig;
import com.questrail.echosrv.error.EchoConfigException;
import com.questrail.echosrv.net.BindTarget;
import com.questrail.echosrv.transport.DatagramEndpoint;
import com.questrail.echosrv.transport.DatagramTransport;
import com.questrail.echosrv.transport.ReceivedDatagram;

import java.net.SocketAddress;
import java.net.UnixDomainSocketAddress;
import java.util.Arrays;
import java.util.Objects;

/**
 * Blocking client for a datagram server: one datagram out, one datagram back.
 */
public final class DatagramEchoClient implements EchoClient
{
    // Largest UDP payload.
    private static final int MAX_DATAGRAM = 65_507;

    private final DatagramEndpoint endpoint;
    private final SocketAddress server;
    private final ClientConfig config;

    private DatagramEchoClient(DatagramEndpoint endpoint, SocketAddress server, ClientConfig config) {
        this.endpoint = endpoint;
        this.server = server;
        this.config = config;
    }

    public static DatagramEchoClient connect(DatagramTransport transport, BindTarget server, ClientConfig config) {
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(server, "server");
        Objects.requireNonNull(config, "config");
        DatagramEndpoint endpoint = transport.openClient(server);
        return new DatagramEchoClient(endpoint, toSocketAddress(server), config);
    }

    private static SocketAddress toSocketAddress(BindTarget target) {
        if (target instanceof BindTarget.UnixPath unix) {
            return UnixDomainSocketAddress.of(unix.path());
        }
        return ((BindTarget.Network) target).address();
    }

    @Override
    public byte[] echo(byte[] request) {
        Objects.requireNonNull(request, "request");
        if (request.length == 0) {
            return new byte[0];
        }
        if (request.length > config.maxResponseSize()) {
            throw new EchoConfigException("Request of " + request.length
                    + " bytes exceeds the maximum response size of " + config.maxResponseSize() + " bytes");
        }

        Await.result(endpoint.send(request, request.length, server, config.writeTimeout()));
        byte[] buffer = new byte[Math.min(config.maxResponseSize(), MAX_DATAGRAM)];
        ReceivedDatagram reply = Await.result(endpoint.receive(buffer, config.readTimeout()));
        return Arrays.copyOf(buffer, reply.length());
    }

    public SocketAddress localAddress() {
        return endpoint.localAddress();
    }

    public ClientConfig config() {
        return config;
    }

    @Override
    public void close() {
        endpoint.close();
    }
}
