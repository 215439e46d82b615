package com.questrail.echosrv.transport.netty;

import com.questrail.echosrv.error.EchoIoException;
import com.questrail.echosrv.transport.DatagramEndpoint;
import com.questrail.echosrv.transport.ReceivedDatagram;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.AddressedEnvelope;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;

/**
 * NettyDatagramEndpoint
 * =============================================================================
 * {@link DatagramEndpoint} over a Netty datagram channel with {@code AUTO_READ} off.
 *
 * <p>Inbound payloads are copied into {@code byte[]} as they arrive and the envelope is
 * released immediately. Outbound packets are built by the transport-specific
 * {@code packetFactory} (UDP and Unix-domain packets are different Netty types).</p>
 */
final class NettyDatagramEndpoint implements DatagramEndpoint
{
    private final Channel channel;
    private final BiFunction<ByteBuf, SocketAddress, Object> packetFactory;
    private final Runnable onClosed;
    private final AtomicBoolean closed = new AtomicBoolean();

    // Event-loop confined.
    private final ArrayDeque<Inbound> inbound = new ArrayDeque<>();
    private PendingReceive pending;

    private NettyDatagramEndpoint(Channel channel,
                                  BiFunction<ByteBuf, SocketAddress, Object> packetFactory,
                                  Runnable onClosed)
    {
        this.channel = channel;
        this.packetFactory = packetFactory;
        this.onClosed = onClosed;
    }

    static NettyDatagramEndpoint attach(Channel channel,
                                        BiFunction<ByteBuf, SocketAddress, Object> packetFactory,
                                        Runnable onClosed)
    {
        NettyDatagramEndpoint endpoint = new NettyDatagramEndpoint(channel, packetFactory, onClosed);
        channel.pipeline().addLast(endpoint.new InboundHandler());
        channel.closeFuture().addListener(f -> endpoint.onChannelClosed());
        return endpoint;
    }

    @Override
    public CompletableFuture<ReceivedDatagram> receive(byte[] buffer, Duration timeout)
    {
        Objects.requireNonNull(buffer, "buffer");
        Objects.requireNonNull(timeout, "timeout");

        CompletableFuture<ReceivedDatagram> result = new CompletableFuture<>();
        try {
            channel.eventLoop().execute(() -> startReceive(buffer, timeout, result));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new EchoIoException("receive failed: event loop shut down", e));
        }
        return result;
    }

    private void startReceive(byte[] buffer, Duration timeout, CompletableFuture<ReceivedDatagram> result)
    {
        if (pending != null) {
            result.completeExceptionally(new IllegalStateException("a receive is already pending"));
            return;
        }
        Inbound next = inbound.poll();
        if (next != null) {
            result.complete(next.copyInto(buffer));
            return;
        }
        if (!channel.isOpen()) {
            result.completeExceptionally(new EchoIoException("receive failed: endpoint closed"));
            return;
        }

        PendingReceive receive = new PendingReceive(buffer, result);
        pending = receive;
        receive.timer = channel.eventLoop().schedule(() -> {
            if (pending == receive) {
                pending = null;
                receive.result.completeExceptionally(NettyFutures.timedOut("receive", timeout));
            }
        }, timeout.toNanos(), TimeUnit.NANOSECONDS);
        channel.read();
    }

    private PendingReceive takePending()
    {
        PendingReceive receive = pending;
        pending = null;
        if (receive != null && receive.timer != null) {
            receive.timer.cancel(false);
        }
        return receive;
    }

    private void onDatagram(Inbound datagram)
    {
        PendingReceive receive = takePending();
        if (receive != null) {
            receive.result.complete(datagram.copyInto(receive.buffer));
        }
        else {
            inbound.add(datagram);
        }
    }

    private void onFailure(Throwable cause)
    {
        PendingReceive receive = takePending();
        if (receive != null) {
            receive.result.completeExceptionally(NettyFutures.translate(cause, "receive"));
        }
    }

    private void onChannelClosed()
    {
        PendingReceive receive = takePending();
        if (receive != null) {
            receive.result.completeExceptionally(new EchoIoException("receive failed: endpoint closed"));
        }
        inbound.clear();
    }

    @Override
    public CompletableFuture<Void> send(byte[] data, int length, SocketAddress target, Duration timeout)
    {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(timeout, "timeout");
        if (length < 0 || length > data.length) {
            throw new IllegalArgumentException("length out of range: " + length);
        }

        ByteBuf buf = Unpooled.copiedBuffer(data, 0, length);
        Object packet;
        try {
            packet = packetFactory.apply(buf, SocketAddresses.toNetty(target));
        } catch (RuntimeException e) {
            buf.release();
            return CompletableFuture.failedFuture(NettyFutures.translate(e, "send to " + target));
        }
        return NettyFutures.withDeadline(
                NettyFutures.toCompletable(channel.writeAndFlush(packet), "send to " + target),
                channel.eventLoop(), timeout, "send");
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
            ChannelFuture closing = channel.close().addListener(f -> onClosed.run());
            if (!channel.eventLoop().inEventLoop()) {
                closing.awaitUninterruptibly();
            }
        }
    }

    private record Inbound(byte[] payload, SocketAddress sender)
    {
        ReceivedDatagram copyInto(byte[] buffer)
        {
            int n = Math.min(payload.length, buffer.length);
            System.arraycopy(payload, 0, buffer, 0, n);
            return new ReceivedDatagram(n, sender);
        }
    }

    private static final class PendingReceive
    {
        final byte[] buffer;
        final CompletableFuture<ReceivedDatagram> result;
        ScheduledFuture<?> timer;

        PendingReceive(byte[] buffer, CompletableFuture<ReceivedDatagram> result)
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
            try {
                if (msg instanceof AddressedEnvelope<?, ?> envelope && envelope.content() instanceof ByteBuf buf) {
                    byte[] payload = new byte[buf.readableBytes()];
                    buf.getBytes(buf.readerIndex(), payload);
                    onDatagram(new Inbound(payload, SocketAddresses.fromNetty(envelope.sender())));
                }
            } finally {
                ReferenceCountUtil.release(msg);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            onFailure(cause);
        }
    }
}
