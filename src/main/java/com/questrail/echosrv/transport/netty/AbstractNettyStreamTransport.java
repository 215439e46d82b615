package com.questrail.echosrv.transport.netty;

import com.questrail.echosrv.config.StreamServerConfig;
import com.questrail.echosrv.error.BindFailedException;
import com.questrail.echosrv.error.EchoConfigException;
import com.questrail.echosrv.error.FdInheritanceException;
import com.questrail.echosrv.net.AddressFamily;
import com.questrail.echosrv.net.BindTarget;
import com.questrail.echosrv.net.InheritanceConfig;
import com.questrail.echosrv.net.SocketDescriptors;
import com.questrail.echosrv.net.SocketFactory;
import com.questrail.echosrv.net.SocketKind;
import com.questrail.echosrv.net.SocketProvisioner;
import com.questrail.echosrv.net.ValidatedDescriptor;
import com.questrail.echosrv.transport.StreamConnection;
import com.questrail.echosrv.transport.StreamListener;
import com.questrail.echosrv.transport.StreamTransport;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ServerChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * AbstractNettyStreamTransport
 * =============================================================================
 * Shared Netty plumbing for connection-oriented transports.
 *
 * <p>Subclasses only name their channel types and address families. Listener creation
 * goes through {@link SocketProvisioner}, so fresh binds and inherited descriptors
 * produce the same {@link StreamListener}.</p>
 */
public abstract class AbstractNettyStreamTransport implements StreamTransport
{
    private static final Logger log = LoggerFactory.getLogger(AbstractNettyStreamTransport.class);

    protected final NettyEventLoops loops;
    private final SocketProvisioner provisioner;

    protected AbstractNettyStreamTransport(NettyEventLoops loops, SocketProvisioner provisioner)
    {
        this.loops = Objects.requireNonNull(loops, "loops");
        this.provisioner = Objects.requireNonNull(provisioner, "provisioner");
    }

    protected abstract List<AddressFamily> acceptedFamilies();

    protected abstract Class<? extends ServerChannel> serverChannelType();

    protected abstract Class<? extends Channel> clientChannelType();

    /** Wraps an inherited listening descriptor. Only called on the native transport. */
    protected abstract ServerChannel inheritedServerChannel(int descriptor);

    /** True when this transport cannot run on the NIO fallback. */
    protected boolean requiresNativeTransport()
    {
        return false;
    }

    /** Runs after a freshly bound listener has closed. */
    protected void afterClose(BindTarget target)
    {
    }

    @Override
    public StreamListener bind(StreamServerConfig config, InheritanceConfig inheritance)
    {
        Objects.requireNonNull(config, "config");
        return provisioner.build(new ListenerFactory(), config.bindStrategy(), config.serviceName(), inheritance);
    }

    @Override
    public CompletableFuture<StreamConnection> connect(BindTarget target, Duration timeout)
    {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(timeout, "timeout");

        if (acceptedFamilies().contains(AddressFamily.UNIX) != target.isUnix()) {
            return CompletableFuture.failedFuture(
                    new EchoConfigException("Cannot connect " + name() + " transport to " + target));
        }
        if (requiresNativeTransport() && !loops.isNative()) {
            return CompletableFuture.failedFuture(
                    new EchoConfigException(name() + " connections require the native epoll transport"));
        }

        CompletableFuture<NettyStreamConnection> attached = new CompletableFuture<>();
        Bootstrap bootstrap = new Bootstrap()
                .group(loops.group())
                .channel(clientChannelType())
                .option(ChannelOption.AUTO_READ, false)
                .option(ChannelOption.ALLOW_HALF_CLOSURE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMillis(timeout))
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch)
                    {
                        attached.complete(NettyStreamConnection.attach(ch));
                    }
                });

        String operation = "connect to " + target;
        return NettyFutures.toCompletable(bootstrap.connect(SocketAddresses.toNetty(target)), operation)
                .thenApply(ignored -> attached.join());
    }

    private static int timeoutMillis(Duration timeout)
    {
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
    }

    private ServerBootstrap serverBootstrap(NettyStreamListener.AcceptQueue queue)
    {
        return new ServerBootstrap()
                .group(loops.group())
                .option(ChannelOption.AUTO_READ, false)
                .childOption(ChannelOption.AUTO_READ, false)
                .childOption(ChannelOption.ALLOW_HALF_CLOSURE, true)
                .childHandler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch)
                    {
                        queue.offer(NettyStreamConnection.attach(ch));
                    }
                });
    }

    private final class ListenerFactory implements SocketFactory<StreamListener>
    {
        @Override
        public String description()
        {
            return name() + " listener";
        }

        @Override
        public SocketKind socketKind()
        {
            return SocketKind.STREAM;
        }

        @Override
        public List<AddressFamily> acceptedFamilies()
        {
            return AbstractNettyStreamTransport.this.acceptedFamilies();
        }

        @Override
        public StreamListener adopt(ValidatedDescriptor descriptor)
        {
            int fd = descriptor.descriptor();
            if (descriptor.kind() != SocketKind.STREAM) {
                throw new FdInheritanceException(fd, "fd " + fd + " was validated as " + descriptor.kind()
                        + " but " + description() + " needs STREAM");
            }
            if (!loops.isNative()) {
                throw new FdInheritanceException(fd, "Adopting fd " + fd + " requires the native epoll transport");
            }

            SocketDescriptors.setNonBlocking(fd);
            ServerChannel channel = inheritedServerChannel(fd);
            NettyStreamListener.AcceptQueue queue = new NettyStreamListener.AcceptQueue();
            ChannelFuture registered = serverBootstrap(queue)
                    .channelFactory((io.netty.channel.ChannelFactory<ServerChannel>) () -> channel)
                    .register()
                    .awaitUninterruptibly();
            if (!registered.isSuccess()) {
                throw new FdInheritanceException(fd, "Failed to register inherited fd " + fd + ": "
                        + registered.cause().getMessage(), registered.cause());
            }
            // Inherited sockets belong to the parent; nothing to clean up on close.
            return new NettyStreamListener(registered.channel(), queue, () -> { });
        }

        @Override
        public StreamListener bind(BindTarget target)
        {
            if (requiresNativeTransport() && !loops.isNative()) {
                throw new BindFailedException("Cannot bind " + description() + " to " + target
                        + ": the native epoll transport is not available");
            }

            NettyStreamListener.AcceptQueue queue = new NettyStreamListener.AcceptQueue();
            ChannelFuture bound = serverBootstrap(queue)
                    .channel(serverChannelType())
                    .bind(SocketAddresses.toNetty(target))
                    .awaitUninterruptibly();
            if (!bound.isSuccess()) {
                throw new BindFailedException("Failed to bind " + description() + " to " + target + ": "
                        + bound.cause().getMessage(), bound.cause());
            }
            log.debug("Bound {} to {}", description(), bound.channel().localAddress());
            return new NettyStreamListener(bound.channel(), queue, () -> afterClose(target));
        }
    }
}
