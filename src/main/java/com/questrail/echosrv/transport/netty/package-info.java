/**
 * Netty Transport Adapters
 * =============================================================================
 * Netty-backed implementations of the stream and datagram transport ports.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf},
 * {@code DomainSocketAddress}) MUST NOT escape this package. Unix-domain peers are
 * surfaced as {@link java.net.UnixDomainSocketAddress}; payloads are copied into
 * caller-owned {@code byte[]} and every reference-counted buffer is released here.
 *
 * <h2>Event loops</h2>
 * Channels run on the native epoll transport when it is available and on NIO
 * otherwise. Unix-domain sockets and adoption of inherited descriptors need epoll;
 * without it those operations fail with {@code BindFailedException} and
 * {@code FdInheritanceException} respectively.
 *
 * <h2>Read model</h2>
 * Channels are created with {@code AUTO_READ} off. A read or receive request is what
 * asks the kernel for more data, so an idle session never buffers unbounded input.
 */
package com.questrail.echosrv.transport.netty;
