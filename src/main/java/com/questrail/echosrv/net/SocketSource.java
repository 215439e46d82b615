package com.questrail.echosrv.net;

import java.util.Objects;

/**
 * Outcome of resolving a {@link BindStrategy}: the concrete way the socket is created.
 */
public sealed interface SocketSource permits SocketSource.Bind, SocketSource.Inherit {

    record Bind(BindTarget target) implements SocketSource {
        public Bind {
            Objects.requireNonNull(target, "target");
        }
    }

    record Inherit(int descriptor) implements SocketSource {
    }
}
