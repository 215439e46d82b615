package com.questrail.echosrv.transport.netty;

import com.questrail.echosrv.config.DatagramServerConfig;
import com.questrail.echosrv.config.StreamServerConfig;
import com.questrail.echosrv.error.FdInheritanceException;
import com.questrail.echosrv.net.BindStrategy;
import com.questrail.echosrv.net.BindTarget;
import com.questrail.echosrv.net.InheritanceConfig;
import com.questrail.echosrv.net.SocketDescriptors;
import com.questrail.echosrv.transport.DatagramEndpoint;
import com.questrail.echosrv.transport.StreamConnection;
import com.questrail.echosrv.transport.StreamListener;

import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollDatagramChannel;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.unix.Socket;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Adoption of already-bound descriptors, as a socket-activating supervisor would pass them.
 * An unregistered Netty channel supplies a real socket fd, which is duplicated so the
 * transport owns its own copy.
 */
final class InheritedDescriptorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @BeforeEach
    void requireEpoll() {
        assumeTrue(Epoll.isAvailable(), "descriptor adoption needs the native epoll transport");
    }

    private static int boundStreamSocket(InetSocketAddress[] boundTo) throws Exception {
        Socket socket = (Socket) new EpollServerSocketChannel().fd();
        socket.bind(new InetSocketAddress("127.0.0.1", 0));
        socket.listen(50);
        boundTo[0] = new InetSocketAddress("127.0.0.1", ((InetSocketAddress) socket.localAddress()).getPort());
        int copy = SocketDescriptors.duplicate(socket.intValue());
        socket.close();
        return copy;
    }

    @Test
    void namedStreamDescriptorIsAdoptedAndServesConnections() throws Exception {
        InetSocketAddress[] address = new InetSocketAddress[1];
        int fd = boundStreamSocket(address);
        InheritanceConfig inheritance = InheritanceConfig.of(Map.of("echo", fd));
        StreamServerConfig config = StreamServerConfig.builder()
                .withBindStrategy(BindStrategy.inheritOrBind(BindTarget.network(new InetSocketAddress("127.0.0.1", 0))))
                .withServiceName("echo")
                .build();

        TcpTransport transport = new TcpTransport();
        try (StreamListener listener = transport.bind(config, inheritance)) {
            assertEquals(address[0].getPort(), ((InetSocketAddress) listener.localAddress()).getPort());

            CompletableFuture<StreamConnection> accepted = listener.accept();
            StreamConnection client = transport.connect(BindTarget.network(address[0]), TIMEOUT).get(10, TimeUnit.SECONDS);
            StreamConnection server = accepted.get(10, TimeUnit.SECONDS);

            byte[] hello = "inherited".getBytes(StandardCharsets.UTF_8);
            client.write(hello, hello.length, TIMEOUT).get(10, TimeUnit.SECONDS);
            byte[] buffer = new byte[32];
            int n = server.read(buffer, TIMEOUT).get(10, TimeUnit.SECONDS);
            assertEquals("inherited", new String(buffer, 0, n, StandardCharsets.UTF_8));

            client.close();
            server.close();
        }
    }

    @Test
    void datagramDescriptorHandedToStreamTransportFallsBackToBinding() throws Exception {
        EpollDatagramChannel donor = new EpollDatagramChannel();
        int fd = donor.fd().intValue();
        try {
            StreamServerConfig config = StreamServerConfig.builder()
                    .withBindStrategy(BindStrategy.inheritOrBind(fd,
                            BindTarget.network(new InetSocketAddress("127.0.0.1", 0))))
                    .build();

            try (StreamListener listener = new TcpTransport().bind(config, InheritanceConfig.disabled())) {
                assertNotEquals(0, ((InetSocketAddress) listener.localAddress()).getPort());
            }
        } finally {
            donor.fd().close();
        }
    }

    @Test
    void datagramDescriptorHandedToStreamTransportFailsWithoutFallback() throws Exception {
        EpollDatagramChannel donor = new EpollDatagramChannel();
        int fd = donor.fd().intValue();
        try {
            StreamServerConfig config = StreamServerConfig.builder()
                    .withBindStrategy(BindStrategy.inherit(fd))
                    .build();

            FdInheritanceException e = assertThrows(FdInheritanceException.class,
                    () -> new TcpTransport().bind(config, InheritanceConfig.disabled()));
            assertEquals(fd, e.descriptor());
        } finally {
            donor.fd().close();
        }
    }

    @Test
    void datagramDescriptorIsAdoptedByUdpTransport() throws Exception {
        UdpTransport transport = new UdpTransport();
        DatagramEndpoint seed = transport.bind(DatagramServerConfig.defaults(), InheritanceConfig.disabled());
        InetSocketAddress address = (InetSocketAddress) seed.localAddress();
        seed.close();

        EpollDatagramChannel donor = new EpollDatagramChannel();
        Socket socket = (Socket) donor.fd();
        socket.bind(address);
        int fd = SocketDescriptors.duplicate(socket.intValue());
        donor.fd().close();

        DatagramServerConfig config = DatagramServerConfig.builder()
                .withBindStrategy(BindStrategy.inherit(fd))
                .build();
        try (DatagramEndpoint server = transport.bind(config, InheritanceConfig.disabled());
             DatagramEndpoint client = transport.openClient(BindTarget.network(address))) {
            client.send(new byte[]{1, 2, 3}, 3, address, TIMEOUT).get(10, TimeUnit.SECONDS);
            assertEquals(3, server.receive(new byte[16], TIMEOUT).get(10, TimeUnit.SECONDS).length());
        }
    }
}
