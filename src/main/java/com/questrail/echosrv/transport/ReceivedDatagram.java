package com.questrail.echosrv.transport;

import java.net.SocketAddress;

/**
 * Length and sender of one received datagram. {@code sender} is {@code null} when the
 * peer socket has no address (an unbound Unix-domain client).
 */
public record ReceivedDatagram(int length, SocketAddress sender) {
}
