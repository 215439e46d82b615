package com.questrail.echosrv.net;

import com.questrail.echosrv.error.EchoConfigException;

import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class BindTargetTest {

    @Test
    void parsesIpv4HostAndPort() {
        BindTarget target = BindTarget.parse("127.0.0.1:8080");

        BindTarget.Network network = assertInstanceOf(BindTarget.Network.class, target);
        assertEquals(new InetSocketAddress("127.0.0.1", 8080), network.address());
        assertEquals("127.0.0.1:8080", target.toString());
    }

    @Test
    void parsesBracketedIpv6() {
        BindTarget target = BindTarget.parse("[::1]:9000");

        BindTarget.Network network = assertInstanceOf(BindTarget.Network.class, target);
        assertEquals(9000, network.address().getPort());
        assertTrue(target.toString().startsWith("["));
        assertTrue(target.toString().endsWith("]:9000"));
    }

    @Test
    void parsesUnixPath() {
        BindTarget target = BindTarget.parse("unix:/run/echo.sock");

        assertEquals(new BindTarget.UnixPath(Path.of("/run/echo.sock")), target);
        assertTrue(target.isUnix());
        assertFalse(target.isNetwork());
        assertEquals("unix:/run/echo.sock", target.toString());
    }

    @Test
    void rejectsMalformedAddresses() {
        assertThrows(EchoConfigException.class, () -> BindTarget.parse("localhost"));
        assertThrows(EchoConfigException.class, () -> BindTarget.parse("127.0.0.1:"));
        assertThrows(EchoConfigException.class, () -> BindTarget.parse("127.0.0.1:http"));
        assertThrows(EchoConfigException.class, () -> BindTarget.parse("127.0.0.1:70000"));
        assertThrows(EchoConfigException.class, () -> BindTarget.parse("::1:80"));
        assertThrows(EchoConfigException.class, () -> BindTarget.parse("unix:"));
    }

    @Test
    void bindStrategyRejectsNegativeDescriptors() {
        assertThrows(IllegalArgumentException.class, () -> BindStrategy.inherit(-1));
        assertThrows(IllegalArgumentException.class,
                () -> BindStrategy.inheritOrBind(-3, BindTarget.network("127.0.0.1", 0)));
    }
}
