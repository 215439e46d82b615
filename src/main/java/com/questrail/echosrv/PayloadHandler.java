package com.questrail.echosrv;

/**
 * Turns one received unit of bytes (a stream read or a datagram) into the bytes sent
 * back to the same peer.
 *
 * <p>Called on event loop and server loop threads; implementations must not block.</p>
 */
@FunctionalInterface
public interface PayloadHandler
{
    /** Sends every unit back unchanged. */
    PayloadHandler ECHO = request -> request;

    /**
     * @param request the received bytes; owned by the handler
     * @return the response, possibly {@code request} itself; never {@code null}
     */
    byte[] respond(byte[] request);
}
