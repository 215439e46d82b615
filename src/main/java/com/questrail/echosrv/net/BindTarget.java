package com.questrail.echosrv.net;

import com.questrail.echosrv.error.EchoConfigException;

import java.net.Inet6Address;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Where a fresh socket is bound (server side) or which peer to reach (client side).
 *
 * <p>Either a network address ({@code host:port}) or a Unix-domain socket path.</p>
 */
public sealed interface BindTarget permits BindTarget.Network, BindTarget.UnixPath {

    String UNIX_PREFIX = "unix:";

    /** IPv4 or IPv6 address and port. */
    record Network(InetSocketAddress address) implements BindTarget {
        public Network {
            Objects.requireNonNull(address, "address");
        }

        @Override
        public String toString() {
            if (address.isUnresolved()) {
                return address.getHostString() + ":" + address.getPort();
            }
            String host = address.getAddress().getHostAddress();
            if (address.getAddress() instanceof Inet6Address) {
                host = "[" + host + "]";
            }
            return host + ":" + address.getPort();
        }
    }

    /** Filesystem path of a Unix-domain socket. */
    record UnixPath(Path path) implements BindTarget {
        public UnixPath {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public String toString() {
            return UNIX_PREFIX + path;
        }
    }

    static BindTarget network(InetSocketAddress address) {
        return new Network(address);
    }

    static BindTarget network(String host, int port) {
        return new Network(new InetSocketAddress(host, port));
    }

    static BindTarget unix(Path path) {
        return new UnixPath(path);
    }

    default boolean isNetwork() {
        return this instanceof Network;
    }

    default boolean isUnix() {
        return this instanceof UnixPath;
    }

    /**
     * Parses {@code unix:/some/path}, {@code host:port} or {@code [v6]:port}.
     *
     * @throws EchoConfigException if the text is not a valid address
     */
    static BindTarget parse(String text) {
        Objects.requireNonNull(text, "text");
        String s = text.trim();
        if (s.startsWith(UNIX_PREFIX)) {
            String path = s.substring(UNIX_PREFIX.length());
            if (path.isEmpty()) {
                throw new EchoConfigException("Invalid socket address: empty unix path in '" + text + "'");
            }
            return new UnixPath(Path.of(path));
        }

        int colon = s.lastIndexOf(':');
        if (colon <= 0 || colon == s.length() - 1) {
            throw new EchoConfigException("Invalid socket address: '" + text + "' (expected host:port or unix:/path)");
        }

        String host = s.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        else if (host.indexOf(':') >= 0) {
            throw new EchoConfigException("Invalid socket address: '" + text + "' (IPv6 hosts must be bracketed)");
        }

        int port;
        try {
            port = Integer.parseInt(s.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new EchoConfigException("Invalid socket address: bad port in '" + text + "'", e);
        }
        if (port < 0 || port > 0xFFFF) {
            throw new EchoConfigException("Invalid socket address: port out of range in '" + text + "'");
        }

        InetSocketAddress address = new InetSocketAddress(host, port);
        if (address.isUnresolved()) {
            throw new EchoConfigException("Invalid socket address: cannot resolve host '" + host + "'");
        }
        return new Network(address);
    }
}
