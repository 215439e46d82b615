package com.questrail.echosrv.observability;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class Slf4jEchoObservabilitySinkTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger(Slf4jEchoObservabilitySink.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private final Slf4jEchoObservabilitySink sink = new Slf4jEchoObservabilitySink();

    @BeforeEach
    void attach() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
    }

    @Test
    void unnamedPeerIsLoggedAsUnnamed() {
        sink.onConnectionEvent(new ConnectionEvent(Instant.EPOCH, ConnectionEvent.Type.ACCEPTED,
                "unix-stream", null, 1, 0, null));

        assertEquals("[unix-stream] Accepted connection from unnamed (active: 1)",
                appender.list.get(0).getFormattedMessage());
    }

    @Test
    void namedPeerIsLoggedByAddress() {
        InetSocketAddress peer = new InetSocketAddress("127.0.0.1", 4242);

        sink.onConnectionEvent(new ConnectionEvent(Instant.EPOCH, ConnectionEvent.Type.CLOSED,
                "tcp", peer, 0, 0, "peer closed"));

        String message = appender.list.get(0).getFormattedMessage();
        assertTrue(message.contains(peer.toString()), message);
        assertFalse(message.contains("null"), message);
    }

    @Test
    void peerNameHandlesNull() {
        assertEquals("unnamed", Slf4jEchoObservabilitySink.peerName(null));
    }
}
