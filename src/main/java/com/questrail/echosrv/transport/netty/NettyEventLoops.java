package com.questrail.echosrv.transport.netty;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * The I/O event loop group shared by the transports built on it.
 *
 * <p>{@link #shared()} is a process-wide group of daemon threads that lives as long as
 * the JVM. Groups made with {@link #create(String, int)} belong to the caller and are
 * shut down by {@link #close()}.</p>
 */
public final class NettyEventLoops implements AutoCloseable
{
    private static final class Shared {
        static final NettyEventLoops INSTANCE = new NettyEventLoops("echosrv-io", 0, false);
    }

    private final EventLoopGroup group;
    private final boolean nativeTransport;
    private final boolean owned;

    private NettyEventLoops(String name, int threads, boolean owned)
    {
        this.nativeTransport = Epoll.isAvailable();
        ThreadFactory threadFactory = new DefaultThreadFactory(name, true);
        this.group = nativeTransport
                ? new EpollEventLoopGroup(threads, threadFactory)
                : new NioEventLoopGroup(threads, threadFactory);
        this.owned = owned;
    }

    public static NettyEventLoops shared()
    {
        return Shared.INSTANCE;
    }

    /**
     * @param threads number of event loop threads; {@code 0} selects Netty's default
     */
    public static NettyEventLoops create(String name, int threads)
    {
        if (threads < 0) {
            throw new IllegalArgumentException("threads must be >= 0");
        }
        return new NettyEventLoops(name, threads, true);
    }

    /** True when the native epoll transport loaded on this platform. */
    public static boolean nativeTransportAvailable()
    {
        return Epoll.isAvailable();
    }

    public boolean isNative()
    {
        return nativeTransport;
    }

    EventLoopGroup group()
    {
        return group;
    }

    @Override
    public void close()
    {
        if (owned) {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        }
    }
}
