package com.questrail.echosrv.transport.netty;

import com.questrail.echosrv.error.EchoIoException;
import com.questrail.echosrv.transport.StreamConnection;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import io.netty.util.ReferenceCountUtil;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * NettyStreamConnection
 * =============================================================================
 * {@link StreamConnection} over a Netty stream channel with {@code AUTO_READ} off.
 *
 * <p>All read-side state is confined to the channel's event loop. {@link #read} hops
 * onto the loop, serves buffered bytes if there are any, and otherwise parks a single
 * pending read and asks the channel for more data.</p>
 *
 * <p>Peer half-close (input shutdown) and full close both end the read side: once
 * buffered bytes are drained, reads complete with {@code 0}.</p>
 */
final class NettyStreamConnection implements StreamConnection
{
    private final Channel channel;

    // Event-loop confined.
    private final ArrayDeque<ByteBuf> inbound = new ArrayDeque<>();
    private boolean inputClosed;
    private Throwable failure;
    private PendingRead pending;

    private volatile boolean closedLocally;

    private NettyStreamConnection(Channel channel)
    {
        this.channel = channel;
    }

    /** Wraps {@code channel} and installs the inbound handler that feeds it. */
    static NettyStreamConnection attach(Channel channel)
    {
        NettyStreamConnection connection = new NettyStreamConnection(channel);
        channel.pipeline().addLast(connection.new InboundHandler());
        return connection;
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return SocketAddresses.fromNetty(channel.remoteAddress());
    }

    @Override
    public SocketAddress localAddress()
    {
        return SocketAddresses.fromNetty(channel.localAddress());
    }

    @Override
    public CompletableFuture<Integer> read(byte[] buffer, Duration timeout)
    {
        Objects.requireNonNull(buffer, "buffer");
        Objects.requireNonNull(timeout, "timeout");
        if (buffer.length == 0) {
            throw new IllegalArgumentException("buffer must not be empty");
        }

        CompletableFuture<Integer> result = new CompletableFuture<>();
        try {
            channel.eventLoop().execute(() -> startRead(buffer, timeout, result));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new EchoIoException("read failed: event loop shut down", e));
        }
        return result;
    }

    private void startRead(byte[] buffer, Duration timeout, CompletableFuture<Integer> result)
    {
        if (pending != null) {
            result.completeExceptionally(new IllegalStateException("a read is already pending"));
            return;
        }
        if (!inbound.isEmpty()) {
            result.complete(drainInto(buffer));
            return;
        }
        if (closedLocally) {
            result.completeExceptionally(new EchoIoException("read failed: connection closed"));
            return;
        }
        if (failure != null) {
            result.completeExceptionally(NettyFutures.translate(failure, "read"));
            return;
        }
        if (inputClosed) {
            result.complete(0);
            return;
        }

        PendingRead read = new PendingRead(buffer, result);
        pending = read;
        read.timer = channel.eventLoop().schedule(() -> {
            if (pending == read) {
                pending = null;
                read.result.completeExceptionally(NettyFutures.timedOut("read", timeout));
            }
        }, timeout.toNanos(), TimeUnit.NANOSECONDS);
        channel.read();
    }

    private int drainInto(byte[] buffer)
    {
        int written = 0;
        while (written < buffer.length && !inbound.isEmpty()) {
            ByteBuf head = inbound.peek();
            int n = Math.min(head.readableBytes(), buffer.length - written);
            head.readBytes(buffer, written, n);
            written += n;
            if (!head.isReadable()) {
                inbound.poll().release();
            }
        }
        return written;
    }

    private PendingRead takePending()
    {
        PendingRead read = pending;
        pending = null;
        if (read != null && read.timer != null) {
            read.timer.cancel(false);
        }
        return read;
    }

    private void onData(ByteBuf data)
    {
        if (closedLocally || !data.isReadable()) {
            data.release();
            return;
        }
        inbound.add(data);
        PendingRead read = takePending();
        if (read != null) {
            read.result.complete(drainInto(read.buffer));
        }
    }

    private void onInputClosed()
    {
        inputClosed = true;
        PendingRead read = takePending();
        if (read == null) {
            return;
        }
        if (closedLocally) {
            read.result.completeExceptionally(new EchoIoException("read failed: connection closed"));
        }
        else {
            read.result.complete(0);
        }
    }

    private void onFailure(Throwable cause)
    {
        if (failure == null) {
            failure = cause;
        }
        PendingRead read = takePending();
        if (read != null) {
            read.result.completeExceptionally(NettyFutures.translate(cause, "read"));
        }
    }

    private void releaseInbound()
    {
        ByteBuf buf;
        while ((buf = inbound.poll()) != null) {
            buf.release();
        }
    }

    @Override
    public CompletableFuture<Void> write(byte[] data, int length, Duration timeout)
    {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(timeout, "timeout");
        if (length < 0 || length > data.length) {
            throw new IllegalArgumentException("length out of range: " + length);
        }
        ByteBuf buf = Unpooled.copiedBuffer(data, 0, length);
        return NettyFutures.withDeadline(
                NettyFutures.toCompletable(channel.writeAndFlush(buf), "write"),
                channel.eventLoop(), timeout, "write");
    }

    @Override
    public CompletableFuture<Void> flush(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        // Completes after every earlier write, since writes are ordered.
        return NettyFutures.withDeadline(
                NettyFutures.toCompletable(channel.writeAndFlush(Unpooled.EMPTY_BUFFER), "flush"),
                channel.eventLoop(), timeout, "flush");
    }

    @Override
    public boolean isOpen()
    {
        return !closedLocally && channel.isOpen();
    }

    @Override
    public void close()
    {
        closedLocally = true;
        channel.close().addListener(f -> releaseInbound());
    }

    @Override
    public String toString()
    {
        return "NettyStreamConnection{" + remoteAddress() + "}";
    }

    private static final class PendingRead
    {
        final byte[] buffer;
        final CompletableFuture<Integer> result;
        ScheduledFuture<?> timer;

        PendingRead(byte[] buffer, CompletableFuture<Integer> result)
        {
            this.buffer = buffer;
            this.result = result;
        }
    }

    private final class InboundHandler extends ChannelInboundHandlerAdapter
    {
        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            if (msg instanceof ByteBuf buf) {
                onData(buf);
            }
            else {
                ReferenceCountUtil.release(msg);
            }
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt)
        {
            if (evt instanceof ChannelInputShutdownEvent) {
                onInputClosed();
            }
            ctx.fireUserEventTriggered(evt);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            onInputClosed();
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            onFailure(cause);
        }
    }
}
