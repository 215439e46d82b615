package com.questrail.echosrv.transport.netty;

import com.questrail.echosrv.error.EchoIoException;
import com.questrail.echosrv.transport.StreamConnection;
import com.questrail.echosrv.transport.StreamListener;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;

import java.net.SocketAddress;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link StreamListener} over a Netty server channel with {@code AUTO_READ} off.
 *
 * <p>Accepted child channels land in an {@link AcceptQueue}; {@link #accept()} asks the
 * server channel to accept only while a caller is waiting.</p>
 */
final class NettyStreamListener implements StreamListener
{
    private final Channel channel;
    private final AcceptQueue queue;
    private final Runnable onClosed;
    private final AtomicBoolean closed = new AtomicBoolean();

    NettyStreamListener(Channel channel, AcceptQueue queue, Runnable onClosed)
    {
        this.channel = channel;
        this.queue = queue;
        this.onClosed = onClosed;
        channel.closeFuture().addListener(f -> queue.close());
    }

    @Override
    public CompletableFuture<StreamConnection> accept()
    {
        CompletableFuture<StreamConnection> next = queue.take();
        if (!next.isDone()) {
            channel.read();
        }
        return next;
    }

    @Override
    public SocketAddress localAddress()
    {
        return SocketAddresses.fromNetty(channel.localAddress());
    }

    @Override
    public boolean isOpen()
    {
        return !closed.get() && channel.isOpen();
    }

    @Override
    public void close()
    {
        if (closed.compareAndSet(false, true)) {
            queue.close();
            ChannelFuture closing = channel.close().addListener(f -> onClosed.run());
            // The port must be released by the time close returns.
            if (!channel.eventLoop().inEventLoop()) {
                closing.awaitUninterruptibly();
            }
        }
    }

    /**
     * Hand-off point between the child channel initializer (event loop threads) and the
     * accepting caller.
     */
    static final class AcceptQueue
    {
        private final Object lock = new Object();
        private final ArrayDeque<NettyStreamConnection> ready = new ArrayDeque<>();
        private CompletableFuture<StreamConnection> waiter;
        private boolean closed;

        void offer(NettyStreamConnection connection)
        {
            CompletableFuture<StreamConnection> w;
            synchronized (lock) {
                if (closed) {
                    w = null;
                }
                else if (waiter != null) {
                    w = waiter;
                    waiter = null;
                }
                else {
                    ready.add(connection);
                    return;
                }
            }
            if (w == null) {
                connection.close();
            }
            else {
                w.complete(connection);
            }
        }

        CompletableFuture<StreamConnection> take()
        {
            synchronized (lock) {
                if (closed) {
                    return CompletableFuture.failedFuture(new EchoIoException("accept failed: listener closed"));
                }
                NettyStreamConnection next = ready.poll();
                if (next != null) {
                    return CompletableFuture.completedFuture(next);
                }
                if (waiter != null) {
                    return CompletableFuture.failedFuture(new IllegalStateException("an accept is already pending"));
                }
                waiter = new CompletableFuture<>();
                return waiter;
            }
        }

        void close()
        {
            CompletableFuture<StreamConnection> w;
            List<NettyStreamConnection> orphans;
            synchronized (lock) {
                if (closed) {
                    return;
                }
                closed = true;
                w = waiter;
                waiter = null;
                orphans = new ArrayList<>(ready);
                ready.clear();
            }
            if (w != null) {
                w.completeExceptionally(new EchoIoException("accept failed: listener closed"));
            }
            orphans.forEach(NettyStreamConnection::close);
        }
    }
}
