package com.questrail.echosrv.transport.netty;

import com.questrail.echosrv.config.DatagramServerConfig;
import com.questrail.echosrv.config.StreamServerConfig;
import com.questrail.echosrv.error.BindFailedException;
import com.questrail.echosrv.net.BindTarget;
import com.questrail.echosrv.net.InheritanceConfig;
import com.questrail.echosrv.transport.DatagramEndpoint;
import com.questrail.echosrv.transport.ReceivedDatagram;
import com.questrail.echosrv.transport.StreamConnection;
import com.questrail.echosrv.transport.StreamListener;

import io.netty.channel.epoll.Epoll;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.InetSocketAddress;
import java.net.UnixDomainSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

final class UnixTransportTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @TempDir
    Path dir;

    @BeforeEach
    void requireEpoll() {
        assumeTrue(Epoll.isAvailable(), "Unix-domain sockets need the native epoll transport");
    }

    @Test
    void streamSocketFileLivesAsLongAsTheListener() throws Exception {
        UnixStreamTransport transport = new UnixStreamTransport();
        Path path = dir.resolve("echo.sock");
        StreamServerConfig config = StreamServerConfig.builder().withBindTarget(BindTarget.unix(path)).build();

        StreamListener listener = transport.bind(config, InheritanceConfig.disabled());
        assertTrue(Files.exists(path));
        assertEquals(UnixDomainSocketAddress.of(path.toString()), listener.localAddress());

        CompletableFuture<StreamConnection> accepted = listener.accept();
        StreamConnection client = transport.connect(BindTarget.unix(path), TIMEOUT).get(10, TimeUnit.SECONDS);
        StreamConnection server = accepted.get(10, TimeUnit.SECONDS);

        byte[] hello = "hello".getBytes(StandardCharsets.UTF_8);
        client.write(hello, hello.length, TIMEOUT).get(10, TimeUnit.SECONDS);
        byte[] buffer = new byte[16];
        int n = server.read(buffer, TIMEOUT).get(10, TimeUnit.SECONDS);
        assertEquals("hello", new String(buffer, 0, n, StandardCharsets.UTF_8));

        client.close();
        server.close();
        listener.close();

        Thread.sleep(100);
        assertFalse(Files.exists(path));
    }

    @Test
    void datagramReplyReachesTheClientPath() throws Exception {
        UnixDatagramTransport transport = new UnixDatagramTransport();
        Path path = dir.resolve("echo-dgram.sock");
        DatagramServerConfig config = DatagramServerConfig.builder().withBindTarget(BindTarget.unix(path)).build();

        try (DatagramEndpoint server = transport.bind(config, InheritanceConfig.disabled())) {
            DatagramEndpoint client = transport.openClient(BindTarget.unix(path));
            UnixDomainSocketAddress clientAddress = assertInstanceOf(UnixDomainSocketAddress.class, client.localAddress());

            byte[] ping = "ping".getBytes(StandardCharsets.UTF_8);
            client.send(ping, ping.length, server.localAddress(), TIMEOUT).get(10, TimeUnit.SECONDS);

            byte[] buffer = new byte[64];
            ReceivedDatagram received = server.receive(buffer, TIMEOUT).get(10, TimeUnit.SECONDS);
            assertEquals(clientAddress, received.sender());

            server.send(buffer, received.length(), received.sender(), TIMEOUT).get(10, TimeUnit.SECONDS);
            byte[] reply = new byte[64];
            ReceivedDatagram back = client.receive(reply, TIMEOUT).get(10, TimeUnit.SECONDS);
            assertEquals("ping", new String(reply, 0, back.length(), StandardCharsets.UTF_8));

            client.close();
            Thread.sleep(100);
            assertFalse(Files.exists(clientAddress.getPath()));
        }
    }

    @Test
    void networkTargetIsRejected() {
        StreamServerConfig config = StreamServerConfig.builder()
                .withBindTarget(BindTarget.network(new InetSocketAddress("127.0.0.1", 0)))
                .build();

        assertThrows(BindFailedException.class,
                () -> new UnixStreamTransport().bind(config, InheritanceConfig.disabled()));
    }
}
