package com.questrail.echosrv.config;

import com.questrail.echosrv.error.EchoConfigException;
import com.questrail.echosrv.net.BindStrategy;
import com.questrail.echosrv.net.BindTarget;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class ServerConfigTest {

    @Test
    void streamDefaults() {
        StreamServerConfig config = StreamServerConfig.defaults();

        assertEquals(BindStrategy.bind(BindTarget.network("127.0.0.1", 0)), config.bindStrategy());
        assertNull(config.serviceName());
        assertEquals(1024, config.bufferSize());
        assertEquals(Duration.ofSeconds(30), config.readTimeout());
        assertEquals(Duration.ofSeconds(30), config.writeTimeout());
        assertEquals(100, config.maxConnections());
    }

    @Test
    void toBuilderKeepsEveryField() {
        StreamServerConfig config = StreamServerConfig.builder()
                .withBindStrategy(BindStrategy.inheritOrBind(BindTarget.network("127.0.0.1", 7)))
                .withServiceName("echo")
                .withBufferSize(4096)
                .withReadTimeout(Duration.ofSeconds(2))
                .withWriteTimeout(Duration.ofSeconds(3))
                .withMaxConnections(5)
                .build();

        assertEquals(config, config.toBuilder().build());
        assertEquals(6, config.toBuilder().withMaxConnections(6).build().maxConnections());
    }

    @Test
    void streamConfigRejectsNonsense() {
        assertThrows(EchoConfigException.class, () -> StreamServerConfig.builder().withBufferSize(0).build());
        assertThrows(EchoConfigException.class, () -> StreamServerConfig.builder().withMaxConnections(0).build());
        assertThrows(EchoConfigException.class,
                () -> StreamServerConfig.builder().withReadTimeout(Duration.ZERO).build());
        assertThrows(EchoConfigException.class,
                () -> StreamServerConfig.builder().withWriteTimeout(Duration.ofMillis(-1)).build());
        assertThrows(EchoConfigException.class,
                () -> StreamServerConfig.builder().withBindStrategy(null).build());
    }

    @Test
    void datagramDefaultsAndValidation() {
        DatagramServerConfig config = DatagramServerConfig.defaults();

        assertEquals(1024, config.bufferSize());
        assertEquals(Duration.ofSeconds(30), config.readTimeout());
        assertThrows(EchoConfigException.class, () -> DatagramServerConfig.builder().withBufferSize(-5).build());
        assertThrows(EchoConfigException.class, () -> DatagramServerConfig.builder().withReadTimeout(null).build());
    }

    @Test
    void clientDefaultsAndValidation() {
        ClientConfig config = ClientConfig.defaults();

        assertEquals(Duration.ofSeconds(10), config.connectTimeout());
        assertEquals(10 * 1024 * 1024, config.maxResponseSize());
        assertThrows(EchoConfigException.class, () -> ClientConfig.builder().withMaxResponseSize(0).build());
        assertThrows(EchoConfigException.class,
                () -> ClientConfig.builder().withConnectTimeout(Duration.ZERO).build());
    }
}
