package com.questrail.echosrv.transport;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * One established, bidirectional byte stream.
 *
 * <p>At most one read may be pending at a time. Writes may be issued while a read is
 * pending.</p>
 */
public interface StreamConnection extends AutoCloseable
{
    /** Peer address; may be unnamed for Unix-domain clients. */
    SocketAddress remoteAddress();

    SocketAddress localAddress();

    /**
     * Reads up to {@code buffer.length} bytes. Completes with {@code 0} once the peer has
     * closed its side and all buffered bytes were consumed.
     */
    CompletableFuture<Integer> read(byte[] buffer, Duration timeout);

    /** Writes {@code data[0, length)} in full. */
    CompletableFuture<Void> write(byte[] data, int length, Duration timeout);

    /** Completes once every previously written byte has been handed to the OS. */
    CompletableFuture<Void> flush(Duration timeout);

    boolean isOpen();

    /** Idempotent. A pending read fails with {@link com.questrail.echosrv.error.EchoIoException}. */
    @Override
    void close();
}
