package com.questrail.echosrv.net;

import java.util.List;

/**
 * Creates the typed socket handle {@code H} for one transport, either from a validated
 * inherited descriptor or by binding a fresh socket.
 *
 * @param <H> the transport's listener or endpoint type
 */
public interface SocketFactory<H>
{
    /** Short name used in diagnostics, e.g. {@code "TCP listener"}. */
    String description();

    SocketKind socketKind();

    /** Families an inherited descriptor may have; network transports accept two. */
    List<AddressFamily> acceptedFamilies();

    /**
     * Wraps an inherited descriptor. Implementations must reject a descriptor whose
     * validated kind is not {@link #socketKind()}.
     */
    H adopt(ValidatedDescriptor descriptor);

    H bind(BindTarget target);
}
