package com.questrail.echosrv.net;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

final class InheritanceConfigTest {

    private static final long PID = 4242;

    @Test
    void namedDescriptorStartsAtThree() {
        InheritanceConfig config = InheritanceConfig.fromEnvironment(Map.of(
                "LISTEN_FDS", "1",
                "LISTEN_PID", "4242",
                "LISTEN_FDNAMES", "tcp-echo"), PID);

        assertTrue(config.enabled());
        assertEquals(Map.of("tcp-echo", 3), config.descriptors());
        assertEquals(OptionalInt.of(3), config.descriptorFor("tcp-echo"));
        assertTrue(config.hasInheritedDescriptors());
    }

    @Test
    void foreignPidDisablesInheritance() {
        InheritanceConfig config = InheritanceConfig.fromEnvironment(Map.of(
                "LISTEN_FDS", "2",
                "LISTEN_PID", "1"), PID);

        assertFalse(config.enabled());
        assertTrue(config.descriptors().isEmpty());
        assertFalse(config.hasInheritedDescriptors());
        assertEquals(OptionalInt.empty(), config.descriptorFor("fd_0"));
    }

    @Test
    void missingZeroOrGarbageCountDisablesInheritance() {
        assertFalse(InheritanceConfig.fromEnvironment(Map.of(), PID).enabled());
        assertFalse(InheritanceConfig.fromEnvironment(Map.of("LISTEN_FDS", "0"), PID).enabled());
        assertFalse(InheritanceConfig.fromEnvironment(Map.of("LISTEN_FDS", "many"), PID).enabled());
    }

    @Test
    void absentPidIsAccepted() {
        InheritanceConfig config = InheritanceConfig.fromEnvironment(Map.of("LISTEN_FDS", "1"), PID);

        assertTrue(config.enabled());
        assertEquals(OptionalInt.of(3), config.descriptorFor("fd_0"));
    }

    @Test
    void shortOrEmptyNamesFallBackToIndexNames() {
        InheritanceConfig config = InheritanceConfig.fromEnvironment(Map.of(
                "LISTEN_FDS", "4",
                "LISTEN_PID", "4242",
                "LISTEN_FDNAMES", "web::dns"), PID);

        assertEquals(OptionalInt.of(3), config.descriptorFor("web"));
        assertEquals(OptionalInt.of(4), config.descriptorFor("fd_1"));
        assertEquals(OptionalInt.of(5), config.descriptorFor("dns"));
        assertEquals(OptionalInt.of(6), config.descriptorFor("fd_3"));
        assertEquals(List.of("web", "fd_1", "dns", "fd_3"), List.copyOf(config.serviceNames()));
    }

    @Test
    void explicitTableIsEnabled() {
        InheritanceConfig config = InheritanceConfig.of(Map.of("udp-echo", 7));

        assertTrue(config.enabled());
        assertEquals(OptionalInt.of(7), config.descriptorFor("udp-echo"));
        assertThrows(IllegalArgumentException.class, () -> InheritanceConfig.of(Map.of("bad", -1)));
    }

    @Test
    void disabledHasNoDescriptors() {
        InheritanceConfig config = InheritanceConfig.disabled();

        assertFalse(config.enabled());
        assertFalse(config.hasInheritedDescriptors());
        assertTrue(config.serviceNames().isEmpty());
    }
}
