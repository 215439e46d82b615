package com.questrail.echosrv.net;

import jnr.constants.platform.Sock;

/**
 * Socket type as reported by {@code getsockopt(SOL_SOCKET, SO_TYPE)}.
 */
public enum SocketKind {
    STREAM(Sock.SOCK_STREAM),
    DATAGRAM(Sock.SOCK_DGRAM);

    private final Sock nativeType;

    SocketKind(Sock nativeType) {
        this.nativeType = nativeType;
    }

    public int nativeValue() {
        return nativeType.intValue();
    }

    /** Human-readable name used in diagnostics, e.g. {@code SOCK_STREAM}. */
    public String nativeName() {
        return nativeType.name();
    }
}
