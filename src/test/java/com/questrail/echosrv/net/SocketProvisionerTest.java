package com.questrail.echosrv.net;

import com.questrail.echosrv.error.BindFailedException;
import com.questrail.echosrv.error.FdInheritanceException;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SocketProvisionerTest {

    private static final BindTarget FALLBACK = BindTarget.network("127.0.0.1", 0);

    private final InheritanceConfig inherited = InheritanceConfig.of(Map.of("tcp-echo", 3));

    // --- resolve -------------------------------------------------------------

    @Test
    void bindIgnoresInheritance() {
        SocketSource source = SocketProvisioner.resolve(BindStrategy.bind(FALLBACK), "tcp-echo", inherited);

        assertEquals(new SocketSource.Bind(FALLBACK), source);
    }

    @Test
    void inheritUsesTheGivenDescriptor() {
        SocketSource source = SocketProvisioner.resolve(BindStrategy.inherit(9), "tcp-echo", inherited);

        assertEquals(new SocketSource.Inherit(9), source);
    }

    @Test
    void inheritOrBindPrefersExplicitThenNamedThenFallback() {
        assertEquals(new SocketSource.Inherit(5),
                SocketProvisioner.resolve(BindStrategy.inheritOrBind(5, FALLBACK), "tcp-echo", inherited));
        assertEquals(new SocketSource.Inherit(3),
                SocketProvisioner.resolve(BindStrategy.inheritOrBind(FALLBACK), "tcp-echo", inherited));
        assertEquals(new SocketSource.Bind(FALLBACK),
                SocketProvisioner.resolve(BindStrategy.inheritOrBind(FALLBACK), "other", inherited));
        assertEquals(new SocketSource.Bind(FALLBACK),
                SocketProvisioner.resolve(BindStrategy.inheritOrBind(FALLBACK), null, inherited));
        assertEquals(new SocketSource.Bind(FALLBACK),
                SocketProvisioner.resolve(BindStrategy.inheritOrBind(FALLBACK), "tcp-echo", InheritanceConfig.disabled()));
    }

    // --- build ---------------------------------------------------------------

    @Test
    void validDescriptorIsAdopted() {
        FakeDescriptorValidator validator = new FakeDescriptorValidator().with(3, SocketKind.STREAM, AddressFamily.INET6);
        FakeSocketFactory factory = new FakeSocketFactory(SocketKind.STREAM, AddressFamily.NETWORK);

        String handle = new SocketProvisioner(validator)
                .build(factory, BindStrategy.inheritOrBind(FALLBACK), "tcp-echo", inherited);

        assertEquals("adopt:3:INET6", handle);
        assertEquals(List.of("kind:3:STREAM", "family:3:INET", "family:3:INET6"), validator.queries());
    }

    @Test
    void inheritOrBindFallsBackWhenValidationFails() {
        FakeDescriptorValidator validator = new FakeDescriptorValidator().with(3, SocketKind.DATAGRAM, AddressFamily.INET);
        FakeSocketFactory factory = new FakeSocketFactory(SocketKind.STREAM, AddressFamily.NETWORK);

        String handle = new SocketProvisioner(validator)
                .build(factory, BindStrategy.inheritOrBind(FALLBACK), "tcp-echo", inherited);

        assertEquals("bind:" + FALLBACK, handle);
        assertEquals(List.of("bind:" + FALLBACK), factory.calls);
    }

    @Test
    void inheritPropagatesValidationFailure() {
        FakeDescriptorValidator validator = new FakeDescriptorValidator().with(3, SocketKind.DATAGRAM, AddressFamily.INET);
        FakeSocketFactory factory = new FakeSocketFactory(SocketKind.STREAM, AddressFamily.NETWORK);

        FdInheritanceException e = assertThrows(FdInheritanceException.class, () ->
                new SocketProvisioner(validator).build(factory, BindStrategy.inherit(3), "tcp-echo", inherited));

        assertEquals(3, e.descriptor());
        assertTrue(e.getMessage().contains("type mismatch"));
        assertTrue(factory.calls.isEmpty());
    }

    @Test
    void kindMismatchStopsBeforeFamilyChecks() {
        FakeDescriptorValidator validator = new FakeDescriptorValidator().with(4, SocketKind.DATAGRAM, AddressFamily.INET);

        assertThrows(FdInheritanceException.class,
                () -> validator.validate(4, SocketKind.STREAM, AddressFamily.NETWORK));
        assertEquals(List.of("kind:4:STREAM"), validator.queries());
    }

    @Test
    void lastFamilyFailureIsReported() {
        FakeDescriptorValidator validator = new FakeDescriptorValidator().with(4, SocketKind.STREAM, AddressFamily.UNIX);

        FdInheritanceException e = assertThrows(FdInheritanceException.class,
                () -> validator.validate(4, SocketKind.STREAM, AddressFamily.NETWORK));

        assertTrue(e.getMessage().contains("expected INET6"), e.getMessage());
    }

    @Test
    void emptyFamilyListIsRejected() {
        FakeDescriptorValidator validator = new FakeDescriptorValidator().with(4, SocketKind.STREAM, AddressFamily.INET);

        FdInheritanceException e = assertThrows(FdInheritanceException.class,
                () -> validator.validate(4, SocketKind.STREAM, List.of()));

        assertEquals("No valid socket families configured", e.getMessage());
    }

    @Test
    void targetKindMustMatchTransport() {
        FakeSocketFactory network = new FakeSocketFactory(SocketKind.STREAM, AddressFamily.NETWORK);
        FakeSocketFactory local = new FakeSocketFactory(SocketKind.DATAGRAM, AddressFamily.LOCAL);
        SocketProvisioner provisioner = new SocketProvisioner(new FakeDescriptorValidator());
        BindTarget path = BindTarget.unix(Path.of("/tmp/echo.sock"));

        assertThrows(BindFailedException.class,
                () -> provisioner.build(network, BindStrategy.bind(path), null, InheritanceConfig.disabled()));
        assertThrows(BindFailedException.class,
                () -> provisioner.build(local, BindStrategy.bind(FALLBACK), null, InheritanceConfig.disabled()));
        assertEquals("bind:" + path,
                provisioner.build(local, BindStrategy.bind(path), null, InheritanceConfig.disabled()));
    }
}
