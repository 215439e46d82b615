package com.questrail.echosrv.transport.netty;

import com.questrail.echosrv.net.BindTarget;

import io.netty.channel.unix.DomainSocketAddress;

import java.net.SocketAddress;
import java.net.UnixDomainSocketAddress;

/**
 * Converts between the JDK address types the ports expose and Netty's own.
 */
final class SocketAddresses
{
    private SocketAddresses()
    {
    }

    static SocketAddress toNetty(BindTarget target)
    {
        if (target instanceof BindTarget.UnixPath unix) {
            return new DomainSocketAddress(unix.path().toString());
        }
        return ((BindTarget.Network) target).address();
    }

    static SocketAddress toNetty(SocketAddress address)
    {
        if (address instanceof UnixDomainSocketAddress unix) {
            return new DomainSocketAddress(unix.getPath().toString());
        }
        return address;
    }

    /** Returns {@code null} for unnamed Unix-domain peers. */
    static SocketAddress fromNetty(SocketAddress address)
    {
        if (address instanceof DomainSocketAddress domain) {
            String path = domain.path();
            return path == null || path.isEmpty() ? null : UnixDomainSocketAddress.of(path);
        }
        return address;
    }
}
