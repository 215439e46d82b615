/**
 * Transport Ports
 * =============================================================================
 *
 * The boundary between the connection engine and a concrete socket implementation.
 *
 * <p>Everything above the transport sees only:</p>
 * <ul>
 *   <li>payloads as {@code byte[]} plus a length</li>
 *   <li>peers as standard {@link java.net.SocketAddress}</li>
 *   <li>completion as {@link java.util.concurrent.CompletableFuture}</li>
 * </ul>
 *
 * <h2>Contract</h2>
 * Every operation that waits on the network takes a deadline and fails with
 * {@link com.questrail.echosrv.error.EchoTimeoutException} once it lapses. All other
 * failures are mapped to the {@link com.questrail.echosrv.error.EchoException}
 * hierarchy, so callers never branch on which transport they hold.
 */
package com.questrail.echosrv.transport;
