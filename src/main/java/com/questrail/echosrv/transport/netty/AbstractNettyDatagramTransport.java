package com.questrail.echosrv.transport.netty;

import com.questrail.echosrv.config.DatagramServerConfig;
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
import com.questrail.echosrv.transport.DatagramEndpoint;
import com.questrail.echosrv.transport.DatagramTransport;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.FixedRecvByteBufAllocator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Shared Netty plumbing for connectionless transports.
 */
public abstract class AbstractNettyDatagramTransport implements DatagramTransport
{
    private static final Logger log = LoggerFactory.getLogger(AbstractNettyDatagramTransport.class);

    /** Receive buffer for client endpoints: the largest UDP payload. */
    static final int CLIENT_RECEIVE_BUFFER = 65_535;

    protected final NettyEventLoops loops;
    private final SocketProvisioner provisioner;

    protected AbstractNettyDatagramTransport(NettyEventLoops loops, SocketProvisioner provisioner)
    {
        this.loops = Objects.requireNonNull(loops, "loops");
        this.provisioner = Objects.requireNonNull(provisioner, "provisioner");
    }

    protected abstract List<AddressFamily> acceptedFamilies();

    protected abstract Class<? extends Channel> channelType();

    protected abstract Channel inheritedChannel(int descriptor);

    /** Builds the outbound packet for {@code recipient}, which is already a Netty address. */
    protected abstract Object newPacket(ByteBuf content, SocketAddress recipient);

    /** Local address a client endpoint binds before talking to {@code server}. */
    protected abstract BindTarget clientTarget(BindTarget server);

    protected boolean requiresNativeTransport()
    {
        return false;
    }

    protected void afterClose(BindTarget target)
    {
    }

    @Override
    public DatagramEndpoint bind(DatagramServerConfig config, InheritanceConfig inheritance)
    {
        Objects.requireNonNull(config, "config");
        return provisioner.build(new EndpointFactory(config.bufferSize()),
                config.bindStrategy(), config.serviceName(), inheritance);
    }

    @Override
    public DatagramEndpoint openClient(BindTarget server)
    {
        Objects.requireNonNull(server, "server");
        if (acceptedFamilies().contains(AddressFamily.UNIX) != server.isUnix()) {
            throw new EchoConfigException("Cannot reach " + server + " over the " + name() + " transport");
        }
        return bindFresh(clientTarget(server), CLIENT_RECEIVE_BUFFER, name() + " client");
    }

    private Bootstrap bootstrap(int receiveBuffer, CompletableFuture<NettyDatagramEndpoint> attached, Runnable onClosed)
    {
        return new Bootstrap()
                .group(loops.group())
                .option(ChannelOption.AUTO_READ, false)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(receiveBuffer))
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch)
                    {
                        attached.complete(NettyDatagramEndpoint.attach(ch, AbstractNettyDatagramTransport.this::newPacket, onClosed));
                    }
                });
    }

    private DatagramEndpoint bindFresh(BindTarget target, int receiveBuffer, String description)
    {
        if (requiresNativeTransport() && !loops.isNative()) {
            throw new BindFailedException("Cannot bind " + description + " to " + target
                    + ": the native epoll transport is not available");
        }

        CompletableFuture<NettyDatagramEndpoint> attached = new CompletableFuture<>();
        ChannelFuture bound = bootstrap(receiveBuffer, attached, () -> afterClose(target))
                .channel(channelType())
                .bind(SocketAddresses.toNetty(target))
                .awaitUninterruptibly();
        if (!bound.isSuccess()) {
            throw new BindFailedException("Failed to bind " + description + " to " + target + ": "
                    + bound.cause().getMessage(), bound.cause());
        }
        log.debug("Bound {} to {}", description, bound.channel().localAddress());
        return attached.join();
    }

    private final class EndpointFactory implements SocketFactory<DatagramEndpoint>
    {
        private final int receiveBuffer;

        EndpointFactory(int receiveBuffer)
        {
            this.receiveBuffer = receiveBuffer;
        }

        @Override
        public String description()
        {
            return name() + " endpoint";
        }

        @Override
        public SocketKind socketKind()
        {
            return SocketKind.DATAGRAM;
        }

        @Override
        public List<AddressFamily> acceptedFamilies()
        {
            return AbstractNettyDatagramTransport.this.acceptedFamilies();
        }

        @Override
        public DatagramEndpoint adopt(ValidatedDescriptor descriptor)
        {
            int fd = descriptor.descriptor();
            if (descriptor.kind() != SocketKind.DATAGRAM) {
                throw new FdInheritanceException(fd, "fd " + fd + " was validated as " + descriptor.kind()
                        + " but " + description() + " needs DATAGRAM");
            }
            if (!loops.isNative()) {
                throw new FdInheritanceException(fd, "Adopting fd " + fd + " requires the native epoll transport");
            }

            SocketDescriptors.setNonBlocking(fd);
            Channel channel = inheritedChannel(fd);
            CompletableFuture<NettyDatagramEndpoint> attached = new CompletableFuture<>();
            ChannelFuture registered = bootstrap(receiveBuffer, attached, () -> { })
                    .channelFactory((io.netty.channel.ChannelFactory<Channel>) () -> channel)
                    .register()
                    .awaitUninterruptibly();
            if (!registered.isSuccess()) {
                throw new FdInheritanceException(fd, "Failed to register inherited fd " + fd + ": "
                        + registered.cause().getMessage(), registered.cause());
            }
            return attached.join();
        }

        @Override
        public DatagramEndpoint bind(BindTarget target)
        {
            return bindFresh(target, receiveBuffer, description());
        }
    }
}
